package com.example.importer.header;

import lombok.Value;

@Value
public class HeaderDetectionConfig {
    KeywordExpression keywords;
    HeaderDetectionMode mode;
    KeywordMatchPolicy matchPolicy;

    public static HeaderDetectionConfig of(String headerKeywords, String mode, String matchPolicy) {
        return new HeaderDetectionConfig(
                KeywordExpression.parse(headerKeywords),
                HeaderDetectionMode.fromValue(mode),
                KeywordMatchPolicy.fromValue(matchPolicy));
    }

    public static HeaderDetectionConfig auto() {
        return new HeaderDetectionConfig(KeywordExpression.parse(""), HeaderDetectionMode.AUTO, KeywordMatchPolicy.EXACT);
    }
}
