package com.awscommunity.s3object.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Context handed back to CloudFormation with an IN_PROGRESS event and returned on the next
 * invocation. A status of IN_PROGRESS marks that invocation as a stabilization callback.
 */
public record CallbackContext(OperationStatus status) {

    public static CallbackContext inProgress() {
        return new CallbackContext(OperationStatus.IN_PROGRESS);
    }

    @JsonIgnore
    public boolean isInProgress() {
        return status == OperationStatus.IN_PROGRESS;
    }
}
