package com.affiliate.autopilot.pipeline.http;

import java.time.Duration;
import java.time.Instant;

public record PlatformHttpResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    /**
     * Error code for a failed call: the transport error code, or {@code http_<status>}.
     */
    public String failureCode() {
        if (errorCode != null) {
            return errorCode;
        }
        return isSuccessful() ? null : "http_" + statusCode;
    }
}
