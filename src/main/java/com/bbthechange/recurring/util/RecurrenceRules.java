package com.bbthechange.recurring.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String-level helpers for RFC 5545 RRULE values ("FREQ=WEEKLY;BYDAY=MO,WE;COUNT=10").
 */
public final class RecurrenceRules {

    private static final Pattern FREQ_PATTERN = Pattern.compile("FREQ=([A-Z]+)");
    private static final DateTimeFormatter UNTIL_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private RecurrenceRules() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Trim and upper-case a rule and drop a leading "RRULE:" if present.
     */
    public static String normalize(String rule) {
        if (rule == null) {
            return null;
        }
        String normalized = rule.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("RRULE:")) {
            normalized = normalized.substring("RRULE:".length());
        }
        return normalized;
    }

    /**
     * The FREQ token, or null if the rule has none.
     */
    public static String frequency(String rule) {
        if (rule == null) {
            return null;
        }
        Matcher matcher = FREQ_PATTERN.matcher(rule);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Split a rule into its NAME=VALUE parts, in order. Parts without '=' map to an empty value.
     */
    public static Map<String, String> parts(String rule) {
        Map<String, String> parts = new LinkedHashMap<>();
        if (rule == null || rule.isBlank()) {
            return parts;
        }
        for (String part : rule.split(";")) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq < 0) {
                parts.put(part.trim(), "");
            } else {
                parts.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
            }
        }
        return parts;
    }

    /**
     * Replace any COUNT or UNTIL clause with UNTIL at the last second of {@code lastDay}, UTC.
     */
    public static String withUntil(String rule, LocalDate lastDay) {
        String bounded = parts(rule).entrySet().stream()
            .filter(e -> !e.getKey().equals("UNTIL") && !e.getKey().equals("COUNT"))
            .map(e -> e.getValue().isEmpty() ? e.getKey() : e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(";"));
        String until = "UNTIL=" + lastDay.format(UNTIL_DATE) + "T235959Z";
        return bounded.isEmpty() ? until : bounded + ";" + until;
    }
}
