package com.affiliate.autopilot.pipeline.model;

public record PublishResult(
    boolean success,
    String externalId,
    String errorCode,
    String error
) {
    public static PublishResult published(String externalId) {
        return new PublishResult(true, externalId, null, null);
    }

    public static PublishResult failure(String errorCode, String error) {
        return new PublishResult(false, null, errorCode, error);
    }
}
