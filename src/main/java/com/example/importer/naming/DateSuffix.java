package com.example.importer.naming;

import lombok.Value;

/**
 * Outcome of date-suffix analysis: the remaining base name, whether a suffix was recognized and its text.
 */
@Value
public class DateSuffix {

    public enum Shape {
        NONE,
        YEAR_MONTH_DAY,
        DELIMITED_DATE,
        YEAR_MONTH,
        EPOCH_SECONDS
    }

    String baseName;
    boolean suffixFound;
    String suffixText;
    Shape shape;

    static DateSuffix none(String stem) {
        return new DateSuffix(stem, false, "", Shape.NONE);
    }
}
