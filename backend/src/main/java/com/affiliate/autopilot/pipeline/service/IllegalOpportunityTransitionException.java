package com.affiliate.autopilot.pipeline.service;

import com.affiliate.autopilot.pipeline.model.OpportunityStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalOpportunityTransitionException extends RuntimeException {
    private final long opportunityId;
    private final OpportunityStatus from;
    private final OpportunityStatus to;

    public IllegalOpportunityTransitionException(long opportunityId, OpportunityStatus from, OpportunityStatus to) {
        super("Opportunity " + opportunityId + " cannot move from " + from.dbValue() + " to " + to.dbValue());
        this.opportunityId = opportunityId;
        this.from = from;
        this.to = to;
    }

    public long getOpportunityId() {
        return opportunityId;
    }

    public OpportunityStatus getFrom() {
        return from;
    }

    public OpportunityStatus getTo() {
        return to;
    }
}
