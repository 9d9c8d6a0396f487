package com.affiliate.autopilot.pipeline.schedule;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads stored posting days. Campaign forms save them as numbers with 0 = Sunday through
 * 6 = Saturday; names such as {@code "monday"} are accepted as well.
 */
final class ScheduleDays {

    private ScheduleDays() {
    }

    static List<DayOfWeek> parse(List<?> values) {
        if (values == null) {
            return List.of();
        }
        List<DayOfWeek> days = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null) {
                days.add(parseDay(value));
            }
        }
        return days;
    }

    static DayOfWeek parseDay(Object value) {
        if (value instanceof DayOfWeek day) {
            return day;
        }
        if (value instanceof Number number) {
            return fromSundayIndex(number.intValue());
        }
        String text = value.toString().trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            return fromSundayIndex(Integer.parseInt(text));
        }
        try {
            return DayOfWeek.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid day of week: " + value, e);
        }
    }

    private static DayOfWeek fromSundayIndex(int index) {
        if (index < 0 || index > 6) {
            throw new IllegalArgumentException("Day of week index out of range 0-6: " + index);
        }
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }
}
