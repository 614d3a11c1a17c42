package com.awscommunity.s3object.core.store;

import java.util.List;
import java.util.Map;

/**
 * Object storage as the handlers need it. Service errors surface as the SDK's exceptions
 * ({@code AwsServiceException} / {@code SdkClientException}); callers translate them.
 */
public interface ObjectStore extends AutoCloseable {

    boolean exists(ObjectLocation location);

    /** Writes the object, replacing its body and its whole tag set. */
    PutResult put(ObjectLocation location, String contents, Map<String, String> tags);

    StoredObject get(ObjectLocation location);

    void delete(ObjectLocation location);

    ObjectPage list(String bucket, String continuationToken, int maxKeys);

    @Override
    default void close() {}

    record PutResult(ObjectLocation location, String etag, String versionId) {}

    record StoredObject(ObjectLocation location, String contents, Map<String, String> tags) {}

    record ObjectPage(List<String> keys, String nextToken) {}
}
