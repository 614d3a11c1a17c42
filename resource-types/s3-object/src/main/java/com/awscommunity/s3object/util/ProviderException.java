package com.awscommunity.s3object.util;

import com.awscommunity.s3object.model.HandlerErrorCode;

/**
 * A failure with a known CloudFormation error code. Handlers throw it; the router turns it
 * into a FAILED progress event.
 */
public class ProviderException extends RuntimeException {
    private final HandlerErrorCode errorCode;

    public ProviderException(HandlerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ProviderException(HandlerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public HandlerErrorCode errorCode() {
        return errorCode;
    }
}
