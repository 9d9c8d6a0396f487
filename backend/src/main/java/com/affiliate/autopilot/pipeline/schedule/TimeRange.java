package com.affiliate.autopilot.pipeline.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * A posting window written as {@code HH:mm-HH:mm}; single-digit hours are accepted. Slots are placed at the window start.
 */
public record TimeRange(LocalTime start, LocalTime end) {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter PARSE_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public TimeRange {
        if (start == null) {
            throw new IllegalArgumentException("Time range start is required");
        }
        if (end == null) {
            end = start;
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TimeRange parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Time range is required");
        }
        String[] parts = value.trim().split("-", 2);
        try {
            LocalTime start = LocalTime.parse(parts[0].trim(), PARSE_FORMAT);
            LocalTime end = parts.length > 1 && !parts[1].isBlank()
                ? LocalTime.parse(parts[1].trim(), PARSE_FORMAT)
                : start;
            return new TimeRange(start, end);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time range: " + value, e);
        }
    }

    @JsonValue
    public String format() {
        return FORMAT.format(start) + "-" + FORMAT.format(end);
    }
}
