package com.awscommunity.s3object.model;

public enum Action {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LIST
}
