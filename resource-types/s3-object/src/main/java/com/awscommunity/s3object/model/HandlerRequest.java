package com.awscommunity.s3object.model;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload CloudFormation sends to a registered resource type's handler function.
 * Resource properties stay as raw JSON until validated, see {@link ResourceModels}.
 */
public record HandlerRequest(
        String awsAccountId,
        String bearerToken,
        String region,
        String action,
        String resourceType,
        String resourceTypeVersion,
        String stackId,
        String nextToken,
        CallbackContext callbackContext,
        RequestData requestData
) {
    public record RequestData(
            Credentials callerCredentials,
            Credentials providerCredentials,
            String providerLogGroupName,
            String logicalResourceId,
            JsonNode resourceProperties,
            JsonNode previousResourceProperties,
            Map<String, String> stackTags,
            Map<String, String> previousStackTags,
            Map<String, String> systemTags
    ) {}
}
