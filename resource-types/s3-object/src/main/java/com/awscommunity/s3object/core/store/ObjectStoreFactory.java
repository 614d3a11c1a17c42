package com.awscommunity.s3object.core.store;

import com.awscommunity.s3object.model.Credentials;

/**
 * Opens a store bound to one invocation's credentials and region.
 */
@FunctionalInterface
public interface ObjectStoreFactory {
    ObjectStore open(Credentials credentials, String region);
}
