package com.affiliate.autopilot.pipeline.schedule;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * When a campaign is allowed to post. The JSON form carries a {@code frequency}
 * discriminator: {@code daily}, {@code weekly} or {@code custom}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "frequency")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DailySchedule.class, name = "daily"),
    @JsonSubTypes.Type(value = WeeklySchedule.class, name = "weekly"),
    @JsonSubTypes.Type(value = CustomSchedule.class, name = "custom")
})
public interface PostingSchedule {
    LocalTime DEFAULT_TIME = LocalTime.of(14, 0);

    List<TimeRange> timeRanges();

    /**
     * Computes the {@code offset}-th slot at or after {@code start}, in the zone of
     * {@code start}.
     */
    ZonedDateTime nextSlot(ZonedDateTime start, int offset);

    default LocalTime timeFor(int offset) {
        List<TimeRange> ranges = timeRanges();
        if (ranges == null || ranges.isEmpty()) {
            return DEFAULT_TIME;
        }
        return ranges.get(Math.floorMod(offset, ranges.size())).start();
    }

    default int rangeCount() {
        List<TimeRange> ranges = timeRanges();
        return ranges == null || ranges.isEmpty() ? 1 : ranges.size();
    }
}
