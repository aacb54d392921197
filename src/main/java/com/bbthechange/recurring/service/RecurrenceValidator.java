package com.bbthechange.recurring.service;

import com.bbthechange.recurring.exception.InvalidRuleException;
import com.bbthechange.recurring.exception.UnsupportedFrequencyException;
import com.bbthechange.recurring.util.RecurrenceRules;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Rejects recurrence rules that are malformed or whose expansion cost is unbounded.
 */
@Component
public class RecurrenceValidator {

    private static final Set<String> ALLOWED_FREQUENCIES = Set.of("HOURLY", "DAILY", "WEEKLY", "MONTHLY", "YEARLY");
    private static final Set<String> BLOCKED_FREQUENCIES = Set.of("SECONDLY", "MINUTELY");
    private static final Set<String> KNOWN_PARTS = Set.of(
        "FREQ", "INTERVAL", "COUNT", "UNTIL", "BYSECOND", "BYMINUTE", "BYHOUR",
        "BYDAY", "BYMONTHDAY", "BYYEARDAY", "BYWEEKNO", "BYMONTH", "WKST");

    /**
     * @throws InvalidRuleException if FREQ is missing or unknown, or another part is malformed
     * @throws UnsupportedFrequencyException if FREQ is SECONDLY or MINUTELY
     */
    public void validate(String rule) {
        String normalized = RecurrenceRules.normalize(rule);
        if (normalized == null || normalized.isEmpty()) {
            throw new InvalidRuleException("Invalid RRULE: rule is empty");
        }

        String frequency = RecurrenceRules.frequency(normalized);
        if (frequency == null) {
            throw new InvalidRuleException("Invalid RRULE: missing FREQ parameter");
        }
        if (BLOCKED_FREQUENCIES.contains(frequency)) {
            throw new UnsupportedFrequencyException(frequency);
        }
        if (!ALLOWED_FREQUENCIES.contains(frequency)) {
            throw new InvalidRuleException("Invalid RRULE: unknown frequency " + frequency);
        }

        Map<String, String> parts = RecurrenceRules.parts(normalized);
        for (Map.Entry<String, String> part : parts.entrySet()) {
            if (part.getKey().equals("BYSETPOS")) {
                throw new InvalidRuleException("Invalid RRULE: BYSETPOS is not supported");
            }
            if (!KNOWN_PARTS.contains(part.getKey())) {
                throw new InvalidRuleException("Invalid RRULE: unknown part " + part.getKey());
            }
            if (part.getValue().isEmpty()) {
                throw new InvalidRuleException("Invalid RRULE: " + part.getKey() + " has no value");
            }
        }
        if (parts.containsKey("COUNT") && parts.containsKey("UNTIL")) {
            throw new InvalidRuleException("Invalid RRULE: COUNT and UNTIL cannot both be set");
        }
        requirePositiveInteger(parts, "COUNT");
        requirePositiveInteger(parts, "INTERVAL");
    }

    private static void requirePositiveInteger(Map<String, String> parts, String name) {
        String value = parts.get(name);
        if (value == null) {
            return;
        }
        try {
            if (Integer.parseInt(value) < 1) {
                throw new InvalidRuleException("Invalid RRULE: " + name + " must be at least 1");
            }
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Invalid RRULE: " + name + " must be a number", e);
        }
    }
}
