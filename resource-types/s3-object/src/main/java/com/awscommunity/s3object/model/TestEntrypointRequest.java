package com.awscommunity.s3object.model;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unwrapped payload used by {@code sam local invoke TestEntrypoint} and {@code cfn test}.
 */
public record TestEntrypointRequest(
        Credentials credentials,
        String action,
        String region,
        CallbackContext callbackContext,
        Request request
) {
    public record Request(
            String clientRequestToken,
            JsonNode desiredResourceState,
            JsonNode previousResourceState,
            Map<String, String> desiredResourceTags,
            Map<String, String> previousResourceTags,
            String logicalResourceIdentifier,
            String nextToken
    ) {}
}
