package com.bsm.hypergraph.core;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Set;

/**
 * Numeric helpers shared by the analytics modules.
 */
public final class Scores {

    public static final long HOUR_MS = 60L * 60 * 1000;
    public static final long DAY_MS = 24 * HOUR_MS;

    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private Scores() {
    }

    /**
     * Divide every value by the map maximum, in place. All-zero maps stay zero.
     */
    public static <K> Map<K, Double> normalize(Map<K, Double> scores) {
        double max = 0;
        for (double v : scores.values()) {
            if (v > max)
                max = v;
        }
        if (max > 0) {
            final double m = max;
            scores.replaceAll((k, v) -> v / m);
        }
        return scores;
    }

    public static double ratio(double value, double max) {
        return max > 0 ? value / max : 0;
    }

    public static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    /**
     * Canonical key of an unordered pair: smaller uid first.
     */
    public static String pairKey(String a, String b) {
        return a.compareTo(b) < 0 ? a + "|" + b : b + "|" + a;
    }

    public static String[] splitPairKey(String key) {
        int sep = key.indexOf('|');
        return new String[] { key.substring(0, sep), key.substring(sep + 1) };
    }

    public static <T> double jaccard(Set<T> a, Set<T> b) {
        int intersection = intersectionSize(a, b);
        int union = a.size() + b.size() - intersection;
        return union > 0 ? (double) intersection / union : 0;
    }

    public static <T> int intersectionSize(Set<T> a, Set<T> b) {
        Set<T> small = a.size() <= b.size() ? a : b;
        Set<T> large = small == a ? b : a;
        int count = 0;
        for (T t : small) {
            if (large.contains(t))
                count++;
        }
        return count;
    }

    /**
     * Parse an ISO-8601 date to epoch millis. Returns 0 when absent or unparseable.
     * Zone-less values are read as UTC; a space may stand in for the 'T' separator.
     */
    public static long parseTimestamp(String text) {
        if (text == null || text.isBlank())
            return 0;
        String s = text.trim().replace(' ', 'T');
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(s,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime)
                return ((OffsetDateTime) parsed).toInstant().toEpochMilli();
            if (parsed instanceof LocalDateTime)
                return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeException | ArithmeticException e) {
            return 0;
        }
    }

    /**
     * Risk level multiplier: Critical 4, High 3, Medium 2, anything else 1.
     */
    public static int riskWeight(String risk) {
        if (risk == null)
            return 1;
        return switch (risk) {
            case "Critical" -> 4;
            case "High" -> 3;
            case "Medium" -> 2;
            default -> 1;
        };
    }
}
