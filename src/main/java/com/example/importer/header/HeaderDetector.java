package com.example.importer.header;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether the first row of a file names its columns.
 * <p>
 * Forced modes win over content. In {@code auto} mode a configured keyword expression is evaluated against the
 * row; without keywords the row counts as a header only when every cell is a non-blank label, meaning it is
 * neither numeric nor date-like.
 */
public class HeaderDetector {

    private static final Pattern DATE_LIKE = Pattern.compile(
            "^\\d{4}[-/.]\\d{1,2}[-/.]\\d{1,2}([ T].*)?$|^\\d{1,2}[-/.]\\d{1,2}[-/.]\\d{4}([ T].*)?$");

    public HeaderDecision detect(List<String> firstRow, HeaderDetectionConfig config) {
        switch (config.getMode()) {
            case FORCE_HEADER:
                return HeaderDecision.HEADER_PRESENT;
            case FORCE_NO_HEADER:
                return HeaderDecision.HEADER_ABSENT;
            default:
                break;
        }
        if (!config.getKeywords().isEmpty()) {
            return config.getKeywords().evaluate(firstRow, config.getMatchPolicy())
                    ? HeaderDecision.HEADER_PRESENT
                    : HeaderDecision.HEADER_ABSENT;
        }
        return looksLikeLabels(firstRow) ? HeaderDecision.HEADER_PRESENT : HeaderDecision.HEADER_ABSENT;
    }

    private boolean looksLikeLabels(List<String> row) {
        if (row.isEmpty()) {
            return false;
        }
        for (String cell : row) {
            if (cell == null || cell.isBlank() || isNumeric(cell.trim()) || DATE_LIKE.matcher(cell.trim()).matches()) {
                return false;
            }
        }
        return true;
    }

    static boolean isNumeric(String value) {
        String candidate = value.replace(",", "");
        if (candidate.endsWith("%")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        try {
            new BigDecimal(candidate);
            return true;
        } catch (NumberFormatException ignored) {
            return false;
        }
    }
}
