package com.awscommunity.s3object.core.store;

import java.util.Objects;

public record ObjectLocation(String bucket, String key) {
    public ObjectLocation {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(key, "key");
    }
}
