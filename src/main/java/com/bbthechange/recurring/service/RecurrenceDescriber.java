package com.bbthechange.recurring.service;

import com.bbthechange.recurring.util.RecurrenceRules;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a recurrence rule as short English text for list and summary views,
 * e.g. "Weekly on Monday, Wednesday, 12 times".
 */
@Component
public class RecurrenceDescriber {

    private static final DateTimeFormatter UNTIL_DISPLAY = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter UNTIL_BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    public String describe(String rule) {
        Map<String, String> parts = RecurrenceRules.parts(RecurrenceRules.normalize(rule));
        int interval = parseInt(parts.get("INTERVAL"), 1);
        List<String> byDay = split(parts.get("BYDAY"));
        List<String> byMonthDay = split(parts.get("BYMONTHDAY"));

        String description;
        String frequency = parts.getOrDefault("FREQ", "");
        switch (frequency) {
            case "HOURLY" -> description = interval == 1 ? "Every hour" : "Every " + interval + " hours";
            case "DAILY" -> description = interval == 1 ? "Every day" : "Every " + interval + " days";
            case "WEEKLY" -> {
                if (!byDay.isEmpty()) {
                    String days = joinDays(byDay);
                    description = interval == 1 ? "Weekly on " + days : "Every " + interval + " weeks on " + days;
                } else {
                    description = interval == 1 ? "Every week" : "Every " + interval + " weeks";
                }
            }
            case "MONTHLY" -> {
                if (byDay.size() == 1 && ordinalOf(byDay.get(0)) != 0) {
                    String day = byDay.get(0);
                    String position = positionName(ordinalOf(day)) + " " + dayName(day.substring(day.length() - 2));
                    description = interval == 1
                        ? "Monthly on the " + position
                        : "Every " + interval + " months on the " + position;
                } else if (!byMonthDay.isEmpty()) {
                    String days = String.join(", ", byMonthDay);
                    description = interval == 1 ? "Monthly on day " + days : "Every " + interval + " months on day " + days;
                } else {
                    description = interval == 1 ? "Every month" : "Every " + interval + " months";
                }
            }
            case "YEARLY" -> description = interval == 1 ? "Every year" : "Every " + interval + " years";
            default -> description = "Recurring";
        }

        if (parts.containsKey("COUNT")) {
            description += ", " + parts.get("COUNT") + " times";
        } else if (parts.containsKey("UNTIL")) {
            description += ", until " + formatUntil(parts.get("UNTIL"));
        }
        return description;
    }

    private static String joinDays(List<String> codes) {
        List<String> names = new ArrayList<>();
        for (String code : codes) {
            names.add(dayName(code.length() > 2 ? code.substring(code.length() - 2) : code));
        }
        return String.join(", ", names);
    }

    private static String dayName(String code) {
        return switch (code) {
            case "MO" -> "Monday";
            case "TU" -> "Tuesday";
            case "WE" -> "Wednesday";
            case "TH" -> "Thursday";
            case "FR" -> "Friday";
            case "SA" -> "Saturday";
            case "SU" -> "Sunday";
            default -> code;
        };
    }

    private static String positionName(int position) {
        return switch (position) {
            case 1 -> "first";
            case 2 -> "second";
            case 3 -> "third";
            case 4 -> "fourth";
            case -1 -> "last";
            case -2 -> "second to last";
            default -> position + "th";
        };
    }

    /** "2TU" -> 2, "-1FR" -> -1, "MO" -> 0 */
    private static int ordinalOf(String byDay) {
        if (byDay.length() <= 2) {
            return 0;
        }
        return parseInt(byDay.substring(0, byDay.length() - 2).replace("+", ""), 0);
    }

    private static String formatUntil(String until) {
        String datePart = until.length() >= 8 ? until.substring(0, 8) : until;
        try {
            return LocalDate.parse(datePart, UNTIL_BASIC).format(UNTIL_DISPLAY);
        } catch (DateTimeParseException e) {
            return until;
        }
    }

    private static List<String> split(String value) {
        List<String> values = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return values;
        }
        for (String v : value.split(",")) {
            if (!v.isBlank()) {
                values.add(v.trim());
            }
        }
        return values;
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
