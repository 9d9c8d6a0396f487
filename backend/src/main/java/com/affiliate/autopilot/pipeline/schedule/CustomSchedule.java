package com.affiliate.autopilot.pipeline.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Cycles through every (day, time range) pair in listing order; each full cycle moves
 * one week ahead.
 */
public record CustomSchedule(List<DayOfWeek> daysOfWeek, List<TimeRange> timeRanges) implements PostingSchedule {

    public CustomSchedule {
        daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
        timeRanges = timeRanges == null ? List.of() : List.copyOf(timeRanges);
    }

    @JsonCreator
    public static CustomSchedule fromJson(
        @JsonProperty("daysOfWeek") List<Object> daysOfWeek,
        @JsonProperty("timeRanges") List<TimeRange> timeRanges
    ) {
        return new CustomSchedule(ScheduleDays.parse(daysOfWeek), timeRanges);
    }

    @Override
    public ZonedDateTime nextSlot(ZonedDateTime start, int offset) {
        int safeOffset = Math.max(0, offset);
        if (daysOfWeek.isEmpty()) {
            return new DailySchedule(timeRanges).nextSlot(start, safeOffset);
        }
        int ranges = rangeCount();
        int slotsPerCycle = daysOfWeek.size() * ranges;
        int slot = safeOffset % slotsPerCycle;
        DayOfWeek target = daysOfWeek.get(slot / ranges);
        int daysToAdd = Math.floorMod(target.getValue() - start.getDayOfWeek().getValue(), 7)
            + (safeOffset / slotsPerCycle) * 7;
        ZonedDateTime candidate = start.toLocalDate()
            .plusDays(daysToAdd)
            .atTime(timeFor(slot % ranges))
            .atZone(start.getZone());
        if (candidate.isBefore(start)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate;
    }
}
