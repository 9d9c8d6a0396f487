package com.affiliate.autopilot.pipeline.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Posts on the first listed weekday after the start day, moving one week ahead for
 * every full pass over the time ranges.
 */
public record WeeklySchedule(List<DayOfWeek> daysOfWeek, List<TimeRange> timeRanges) implements PostingSchedule {

    public WeeklySchedule {
        daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
        timeRanges = timeRanges == null ? List.of() : List.copyOf(timeRanges);
    }

    @JsonCreator
    public static WeeklySchedule fromJson(
        @JsonProperty("daysOfWeek") List<Object> daysOfWeek,
        @JsonProperty("timeRanges") List<TimeRange> timeRanges
    ) {
        return new WeeklySchedule(ScheduleDays.parse(daysOfWeek), timeRanges);
    }

    @Override
    public ZonedDateTime nextSlot(ZonedDateTime start, int offset) {
        int safeOffset = Math.max(0, offset);
        if (daysOfWeek.isEmpty()) {
            return new DailySchedule(timeRanges).nextSlot(start, safeOffset);
        }
        DayOfWeek target = nextListedDay(start.getDayOfWeek());
        int daysToAdd = Math.floorMod(target.getValue() - start.getDayOfWeek().getValue(), 7);
        if (daysToAdd == 0) {
            daysToAdd = 7;
        }
        daysToAdd += (safeOffset / rangeCount()) * 7;
        ZonedDateTime slot = start.toLocalDate()
            .plusDays(daysToAdd)
            .atTime(timeFor(safeOffset))
            .atZone(start.getZone());
        if (slot.isBefore(start)) {
            slot = slot.plusWeeks(1);
        }
        return slot;
    }

    private DayOfWeek nextListedDay(DayOfWeek current) {
        DayOfWeek best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (DayOfWeek day : daysOfWeek) {
            int distance = Math.floorMod(day.getValue() - current.getValue(), 7);
            if (distance == 0) {
                distance = 7;
            }
            if (distance < bestDistance) {
                bestDistance = distance;
                best = day;
            }
        }
        return best;
    }
}
