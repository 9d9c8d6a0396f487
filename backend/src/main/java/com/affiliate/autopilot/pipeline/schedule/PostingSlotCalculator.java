package com.affiliate.autopilot.pipeline.schedule;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.model.Campaign;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

@Component
public class PostingSlotCalculator {
    private final AutopilotProperties properties;
    private final Clock clock;

    public PostingSlotCalculator(AutopilotProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Next publish time for the {@code offset}-th item of a campaign. Campaigns without a
     * schedule post tomorrow at 14:00.
     */
    public Instant nextSlot(Campaign campaign, int offset) {
        ZoneId zone = properties.zoneId();
        Instant now = clock.instant();
        if (campaign == null || campaign.schedule() == null) {
            return defaultSlot(now, zone);
        }
        Instant start = now;
        if (campaign.startDate() != null && campaign.startDate().isAfter(now)) {
            start = campaign.startDate();
        }
        return campaign.schedule().nextSlot(start.atZone(zone), offset).toInstant();
    }

    static Instant defaultSlot(Instant now, ZoneId zone) {
        LocalDate tomorrow = now.atZone(zone).toLocalDate().plusDays(1);
        return ZonedDateTime.of(tomorrow, PostingSchedule.DEFAULT_TIME, zone).toInstant();
    }
}
