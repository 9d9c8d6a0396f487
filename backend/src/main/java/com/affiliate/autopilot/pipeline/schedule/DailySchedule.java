package com.affiliate.autopilot.pipeline.schedule;

import java.time.ZonedDateTime;
import java.util.List;

public record DailySchedule(List<TimeRange> timeRanges) implements PostingSchedule {

    public DailySchedule {
        timeRanges = timeRanges == null ? List.of() : List.copyOf(timeRanges);
    }

    @Override
    public ZonedDateTime nextSlot(ZonedDateTime start, int offset) {
        int safeOffset = Math.max(0, offset);
        ZonedDateTime slot = start.toLocalDate()
            .plusDays(safeOffset)
            .atTime(timeFor(safeOffset))
            .atZone(start.getZone());
        if (slot.isBefore(start)) {
            slot = slot.plusDays(1);
        }
        return slot;
    }
}
