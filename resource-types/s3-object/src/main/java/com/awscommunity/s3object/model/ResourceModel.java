package com.awscommunity.s3object.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Properties of one {@code AwsCommunity::S3::Object}. Property names follow the resource schema.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceModel(
        @JsonProperty("ObjectArn") String objectArn,       // read-only, primary identifier
        @JsonProperty("ObjectKey") String objectKey,
        @JsonProperty("BucketName") String bucketName,
        @JsonProperty("ObjectContents") String objectContents,
        @JsonProperty("Tags") List<Tag> tags
) {
    public ResourceModel withObjectArn(String arn) {
        return new ResourceModel(arn, objectKey, bucketName, objectContents, tags);
    }

    public static ResourceModel identifier(String arn) {
        return new ResourceModel(arn, null, null, null, null);
    }
}
