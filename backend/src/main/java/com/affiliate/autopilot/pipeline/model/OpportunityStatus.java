package com.affiliate.autopilot.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a discovered opportunity. {@code REJECTED}, {@code IGNORED} and
 * {@code COMPLETED} are terminal.
 */
public enum OpportunityStatus {
    NEW,
    QUEUED,
    PROCESSING,
    PROCESSED,
    REJECTED,
    IGNORED,
    COMPLETED;

    public Set<OpportunityStatus> allowedTargets() {
        switch (this) {
            case NEW:
                return EnumSet.of(QUEUED, IGNORED);
            case QUEUED:
                return EnumSet.of(PROCESSING, PROCESSED, REJECTED, IGNORED);
            case PROCESSING:
                return EnumSet.of(PROCESSED, REJECTED);
            case PROCESSED:
                return EnumSet.of(COMPLETED);
            default:
                return EnumSet.noneOf(OpportunityStatus.class);
        }
    }

    public boolean canTransitionTo(OpportunityStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OpportunityStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Opportunity status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
