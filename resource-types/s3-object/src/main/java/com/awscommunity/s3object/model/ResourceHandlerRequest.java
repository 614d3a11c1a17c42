package com.awscommunity.s3object.model;

import java.util.Map;

/**
 * What a single handler sees of an invocation, independent of which entry point received it.
 */
public record ResourceHandlerRequest(
        String clientRequestToken,
        ResourceModel desiredResourceState,
        ResourceModel previousResourceState,
        Map<String, String> desiredResourceTags,
        Map<String, String> previousResourceTags,
        String logicalResourceIdentifier,
        String awsAccountId,
        String region,
        String awsPartition,
        String stackId,
        String nextToken
) {
    public ResourceHandlerRequest {
        desiredResourceTags = desiredResourceTags == null ? Map.of() : Map.copyOf(desiredResourceTags);
        previousResourceTags = previousResourceTags == null ? Map.of() : Map.copyOf(previousResourceTags);
    }
}
