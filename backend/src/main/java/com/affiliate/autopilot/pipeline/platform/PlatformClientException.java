package com.affiliate.autopilot.pipeline.platform;

public class PlatformClientException extends RuntimeException {
    private final String errorCode;

    public PlatformClientException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
