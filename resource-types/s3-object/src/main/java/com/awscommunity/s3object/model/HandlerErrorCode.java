package com.awscommunity.s3object.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error codes CloudFormation understands in a FAILED progress event.
 * Serialized with their wire names ("NotFound", "InvalidRequest", ...).
 */
public enum HandlerErrorCode {
    NOT_UPDATABLE("NotUpdatable"),
    INVALID_REQUEST("InvalidRequest"),
    ACCESS_DENIED("AccessDenied"),
    INVALID_CREDENTIALS("InvalidCredentials"),
    ALREADY_EXISTS("AlreadyExists"),
    NOT_FOUND("NotFound"),
    RESOURCE_CONFLICT("ResourceConflict"),
    THROTTLING("Throttling"),
    SERVICE_LIMIT_EXCEEDED("ServiceLimitExceeded"),
    NOT_STABILIZED("NotStabilized"),
    GENERAL_SERVICE_EXCEPTION("GeneralServiceException"),
    SERVICE_INTERNAL_ERROR("ServiceInternalError"),
    NETWORK_FAILURE("NetworkFailure"),
    INTERNAL_FAILURE("InternalFailure");

    private final String wire;

    HandlerErrorCode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
