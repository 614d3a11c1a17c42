package com.awscommunity.s3object.core.resource;

import java.util.Map;
import java.util.regex.Pattern;

import com.awscommunity.s3object.core.store.ObjectLocation;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.util.ProviderException;

/**
 * Checks a desired model against the resource schema before any S3 call is made.
 */
public final class ModelValidator {
    public static final Pattern OBJECT_KEY = Pattern.compile("^[a-zA-Z0-9!_.*'()-]+(/[a-zA-Z0-9!_.*'()-]+)*$");

    // S3 object tagging limits
    static final int MAX_TAGS = 10;
    static final int MAX_TAG_KEY_LENGTH = 128;
    static final int MAX_TAG_VALUE_LENGTH = 256;

    public void validateForCreate(ResourceModel model) {
        validateForWrite(model);
        if (model.objectArn() != null) {
            throw invalid("ObjectArn is read-only and cannot be set");
        }
    }

    public void validateForWrite(ResourceModel model) {
        if (model == null) throw invalid("resource model is required");
        if (isBlank(model.bucketName())) throw invalid("BucketName is required");
        if (isBlank(model.objectKey())) throw invalid("ObjectKey is required");
        if (!OBJECT_KEY.matcher(model.objectKey()).matches()) {
            throw invalid("ObjectKey '" + model.objectKey() + "' does not match " + OBJECT_KEY.pattern());
        }
        if (model.objectContents() == null) throw invalid("ObjectContents is required");
    }

    public void validateTags(Map<String, String> tags) {
        if (tags.size() > MAX_TAGS) {
            throw invalid("an object can carry at most " + MAX_TAGS + " tags, got " + tags.size());
        }
        for (var e : tags.entrySet()) {
            String key = e.getKey();
            String value = e.getValue();
            if (key == null || key.isEmpty() || key.length() > MAX_TAG_KEY_LENGTH) {
                throw invalid("tag key must be 1-" + MAX_TAG_KEY_LENGTH + " characters: " + key);
            }
            if (value == null) throw invalid("tag '" + key + "' has no value");
            if (value.length() > MAX_TAG_VALUE_LENGTH) {
                throw invalid("tag '" + key + "' value exceeds " + MAX_TAG_VALUE_LENGTH + " characters");
            }
        }
    }

    /**
     * Where the object lives: BucketName/ObjectKey when both are present, otherwise parsed
     * from ObjectArn (Read, Delete and callbacks may only carry the primary identifier).
     */
    public ObjectLocation locate(ResourceModel model) {
        if (model == null) throw invalid("resource model is required");
        if (!isBlank(model.bucketName()) && !isBlank(model.objectKey())) {
            return new ObjectLocation(model.bucketName(), model.objectKey());
        }
        return ObjectArns.parse(model.objectArn())
                .orElseThrow(() -> invalid("BucketName and ObjectKey, or a valid ObjectArn, are required"));
    }

    private static ProviderException invalid(String message) {
        return new ProviderException(HandlerErrorCode.INVALID_REQUEST, message);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
