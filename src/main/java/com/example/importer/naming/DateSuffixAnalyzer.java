package com.example.importer.naming;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes a calendar-like token at the end of a file stem.
 * <p>
 * Accepted shapes, longest first: {@code YYYY-MM-DD} / {@code YYYY_MM_DD}, a 10-digit epoch timestamp,
 * {@code YYYYMMDD} and {@code YYYYMM}. The token may be preceded by {@code _} or {@code -} and followed by a
 * {@code _NNN} sequence number; both are stripped with it. Only the whole trailing digit run is considered, so a
 * 9-digit or 7-digit run is never cut down to a shorter shape. A strip that would leave fewer than two
 * meaningful characters is not applied.
 */
public class DateSuffixAnalyzer {

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2099;
    private static final long MIN_EPOCH = 1_000_000_000L;
    private static final long MAX_EPOCH = 4_102_444_799L;

    private static final Pattern SEQUENCE = Pattern.compile("^(.*\\d)_(\\d{1,4})$");
    private static final Pattern DELIMITED = Pattern.compile("^(.*?)(\\d{4})([-_])(\\d{2})\\3(\\d{2})$");
    private static final Pattern DIGIT_RUN = Pattern.compile("^(.*?)(\\d+)$");

    public DateSuffix strip(String stem) {
        if (stem == null || stem.isEmpty()) {
            return DateSuffix.none(stem == null ? "" : stem);
        }
        DateSuffix direct = match(stem, "");
        if (direct.isSuffixFound()) {
            return direct;
        }
        Matcher sequence = SEQUENCE.matcher(stem);
        if (sequence.matches()) {
            DateSuffix withSequence = match(sequence.group(1), "_" + sequence.group(2));
            if (withSequence.isSuffixFound()) {
                return new DateSuffix(withSequence.getBaseName(), true, withSequence.getSuffixText(),
                        withSequence.getShape());
            }
        }
        return DateSuffix.none(stem);
    }

    private DateSuffix match(String value, String sequenceSuffix) {
        Matcher delimited = DELIMITED.matcher(value);
        if (delimited.matches() && !endsWithDigit(delimited.group(1))
                && plausibleDate(delimited.group(2), delimited.group(4), delimited.group(5))) {
            return build(value, delimited.group(1), DateSuffix.Shape.DELIMITED_DATE, sequenceSuffix);
        }
        Matcher run = DIGIT_RUN.matcher(value);
        if (!run.matches()) {
            return DateSuffix.none(value);
        }
        String digits = run.group(2);
        String prefix = run.group(1);
        switch (digits.length()) {
            case 10:
                long epoch = Long.parseLong(digits);
                if (epoch >= MIN_EPOCH && epoch <= MAX_EPOCH) {
                    return build(value, prefix, DateSuffix.Shape.EPOCH_SECONDS, sequenceSuffix);
                }
                break;
            case 8:
                if (plausibleDate(digits.substring(0, 4), digits.substring(4, 6), digits.substring(6, 8))) {
                    return build(value, prefix, DateSuffix.Shape.YEAR_MONTH_DAY, sequenceSuffix);
                }
                break;
            case 6:
                if (plausibleYear(digits.substring(0, 4)) && plausibleMonth(digits.substring(4, 6))) {
                    return build(value, prefix, DateSuffix.Shape.YEAR_MONTH, sequenceSuffix);
                }
                break;
            default:
                break;
        }
        return DateSuffix.none(value);
    }

    private DateSuffix build(String value, String prefix, DateSuffix.Shape shape, String sequenceSuffix) {
        String base = prefix;
        if (base.endsWith("_") || base.endsWith("-")) {
            base = base.substring(0, base.length() - 1);
        }
        if (meaningfulLength(base) < 2) {
            return DateSuffix.none(value);
        }
        return new DateSuffix(base, true, value.substring(base.length()) + sequenceSuffix, shape);
    }

    private static int meaningfulLength(String base) {
        return base.replaceAll("[_\\-\\s]", "").length();
    }

    private static boolean endsWithDigit(String value) {
        return !value.isEmpty() && Character.isDigit(value.charAt(value.length() - 1));
    }

    private static boolean plausibleDate(String year, String month, String day) {
        int d = Integer.parseInt(day);
        return plausibleYear(year) && plausibleMonth(month) && d >= 1 && d <= 31;
    }

    private static boolean plausibleYear(String year) {
        int y = Integer.parseInt(year);
        return y >= MIN_YEAR && y <= MAX_YEAR;
    }

    private static boolean plausibleMonth(String month) {
        int m = Integer.parseInt(month);
        return m >= 1 && m <= 12;
    }
}
