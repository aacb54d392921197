package com.bbthechange.recurring.service;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VEvent;
import biweekly.property.RecurrenceRule;
import biweekly.util.Recurrence;
import biweekly.util.com.google.ical.compat.javautil.DateIterator;
import com.bbthechange.recurring.exception.InvalidRuleException;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.util.RecurrenceRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

/**
 * Expands a recurrence rule into concrete occurrence ranges.
 *
 * Iteration happens in the series' zone, so a "every Monday 09:00" rule stays at 09:00 local time
 * across daylight-saving changes. The result is a pure function of the inputs; a later window end
 * returns the same leading occurrences plus new ones.
 */
@Component
public class RecurrenceExpander {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceExpander.class);

    /** Hard stop for a single expansion call. An hourly rule over a year stays well below this. */
    static final int MAX_OCCURRENCES = 10_000;

    /**
     * Expand {@code rule} from {@code anchor} up to and including {@code windowEnd}.
     *
     * @return ordered half-open ranges {@code [start, start + duration)}
     */
    public List<TimeRange> expand(String rule, Instant anchor, Duration duration, String timezone, Instant windowEnd) {
        return expand(rule, anchor, duration, timezone, null, windowEnd);
    }

    /**
     * As {@link #expand(String, Instant, Duration, String, Instant)} but dropping occurrences that start
     * before {@code windowStart}. Occurrence identity still derives from the anchor, so skipping a prefix
     * never shifts later occurrences.
     */
    public List<TimeRange> expand(String rule, Instant anchor, Duration duration, String timezone,
                                  Instant windowStart, Instant windowEnd) {
        if (anchor == null || duration == null || windowEnd == null) {
            throw new IllegalArgumentException("anchor, duration and windowEnd are required");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive");
        }

        ZoneId zone = resolveZone(timezone);
        Recurrence recurrence = parse(rule);
        DateIterator iterator = recurrence.getDateIterator(Date.from(anchor), TimeZone.getTimeZone(zone));

        List<TimeRange> occurrences = new ArrayList<>();
        while (iterator.hasNext()) {
            Instant start = iterator.next().toInstant();
            if (start.isAfter(windowEnd)) {
                break;
            }
            if (windowStart != null && start.isBefore(windowStart)) {
                continue;
            }
            occurrences.add(TimeRange.of(start, duration));
            if (occurrences.size() >= MAX_OCCURRENCES) {
                logger.warn("Expansion of rule {} stopped at {} occurrences before reaching {}",
                    rule, MAX_OCCURRENCES, windowEnd);
                break;
            }
        }
        return occurrences;
    }

    /**
     * Calendar date of an occurrence in the series zone.
     */
    public LocalDate occurrenceDate(TimeRange occurrence, String timezone) {
        return occurrence.getStart().atZone(resolveZone(timezone)).toLocalDate();
    }

    /**
     * Resolve an IANA zone id; unknown or blank ids fall back to UTC.
     */
    public ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            logger.warn("Invalid timezone '{}', falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    private Recurrence parse(String rule) {
        String normalized = RecurrenceRules.normalize(rule);
        String calendar = "BEGIN:VCALENDAR\r\n"
            + "VERSION:2.0\r\n"
            + "BEGIN:VEVENT\r\n"
            + "RRULE:" + normalized + "\r\n"
            + "END:VEVENT\r\n"
            + "END:VCALENDAR\r\n";

        ICalendar ical = Biweekly.parse(calendar).first();
        if (ical == null || ical.getEvents().isEmpty()) {
            throw new InvalidRuleException("Invalid RRULE: " + rule);
        }
        VEvent event = ical.getEvents().get(0);
        RecurrenceRule recurrenceRule = event.getRecurrenceRule();
        if (recurrenceRule == null || recurrenceRule.getValue() == null
                || recurrenceRule.getValue().getFrequency() == null) {
            throw new InvalidRuleException("Invalid RRULE: " + rule);
        }
        return recurrenceRule.getValue();
    }
}
