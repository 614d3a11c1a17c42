package com.awscommunity.s3object.model;

public enum OperationStatus {
    IN_PROGRESS,
    SUCCESS,
    FAILED
}
