package com.awscommunity.s3object.routing;

import java.util.Objects;

import com.awscommunity.s3object.core.store.ObjectStore;
import com.awscommunity.s3object.model.CallbackContext;
import com.awscommunity.s3object.model.ResourceHandlerRequest;

public record Invocation(
        ResourceHandlerRequest request,
        CallbackContext callbackContext,
        ObjectStore store
) {
    public Invocation {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(store, "store");
    }

    /** True when CloudFormation re-invokes after an IN_PROGRESS event. */
    public boolean isCallback() {
        return callbackContext != null && callbackContext.isInProgress();
    }
}
