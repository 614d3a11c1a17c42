package com.awscommunity.s3object.testutil;

import java.util.List;
import java.util.Map;

import com.awscommunity.s3object.core.store.ObjectStore;
import com.awscommunity.s3object.model.CallbackContext;
import com.awscommunity.s3object.model.ResourceHandlerRequest;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.model.Tag;
import com.awscommunity.s3object.routing.Invocation;

public final class Requests {
    public static final String BUCKET = "contract-bucket";
    public static final String KEY = "docs/readme.txt";
    public static final String ARN = "arn:aws:s3:::contract-bucket/docs/readme.txt";

    private Requests() {}

    public static ResourceModel model(String contents, Tag... tags) {
        return new ResourceModel(null, KEY, BUCKET, contents, tags.length == 0 ? null : List.of(tags));
    }

    public static ResourceHandlerRequest request(ResourceModel desired) {
        return request(desired, null, Map.of());
    }

    public static ResourceHandlerRequest request(ResourceModel desired, ResourceModel previous, Map<String, String> stackTags) {
        return new ResourceHandlerRequest(
                "token-1", desired, previous, stackTags, Map.of(),
                "MyObject", "123456789012", "us-east-1", "aws",
                "arn:aws:cloudformation:us-east-1:123456789012:stack/s/1", null);
    }

    public static Invocation first(ResourceHandlerRequest request, ObjectStore store) {
        return new Invocation(request, null, store);
    }

    public static Invocation callback(ResourceHandlerRequest request, ObjectStore store) {
        return new Invocation(request, CallbackContext.inProgress(), store);
    }
}
