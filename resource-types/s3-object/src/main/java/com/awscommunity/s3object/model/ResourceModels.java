package com.awscommunity.s3object.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.awscommunity.s3object.util.ProviderException;

public final class ResourceModels {
    private ResourceModels() {}

    /**
     * Reads a resource model from raw properties. Missing or null JSON yields {@code null}.
     * A BucketName that is not a plain string (e.g. an unresolved intrinsic) is rejected.
     */
    public static ResourceModel read(ObjectMapper om, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (!node.isObject()) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST, "resource properties must be an object");
        }

        JsonNode bucket = node.get("BucketName");
        if (bucket != null && !bucket.isNull() && !bucket.isTextual()) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST,
                    "BucketName must resolve to a string, got " + bucket.getNodeType().name().toLowerCase());
        }

        try {
            return om.treeToValue(node, ResourceModel.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST,
                    "malformed resource properties: " + e.getOriginalMessage(), e);
        }
    }
}
