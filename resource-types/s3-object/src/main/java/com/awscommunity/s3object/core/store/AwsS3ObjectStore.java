package com.awscommunity.s3object.core.store;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.utils.http.SdkHttpUtils;

public final class AwsS3ObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(AwsS3ObjectStore.class);

    private final S3Client s3;

    public AwsS3ObjectStore(S3Client s3) {
        this.s3 = Objects.requireNonNull(s3, "s3");
    }

    @Override
    public boolean exists(ObjectLocation location) {
        try {
            s3.headObject(HeadObjectRequest.builder()
                    .bucket(location.bucket())
                    .key(location.key())
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            // HEAD has no error body; a missing bucket only shows up as a bare 404
            if (e.statusCode() == 404) return false;
            throw e;
        }
    }

    @Override
    public PutResult put(ObjectLocation location, String contents, Map<String, String> tags) {
        PutObjectRequest.Builder req = PutObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key());

        if (tags != null && !tags.isEmpty()) {
            req.tagging(encodeTagging(tags));
        }

        var resp = s3.putObject(req.build(), RequestBody.fromString(contents, StandardCharsets.UTF_8));
        log.debug("put s3://{}/{} etag={}", location.bucket(), location.key(), resp.eTag());
        return new PutResult(location, resp.eTag(), resp.versionId());
    }

    @Override
    public StoredObject get(ObjectLocation location) {
        var bytes = s3.getObjectAsBytes(GetObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build());

        var tagging = s3.getObjectTagging(GetObjectTaggingRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build());

        Map<String, String> tags = new LinkedHashMap<>();
        tagging.tagSet().forEach(t -> tags.put(t.key(), t.value()));

        return new StoredObject(location, bytes.asUtf8String(), tags);
    }

    @Override
    public void delete(ObjectLocation location) {
        s3.deleteObject(DeleteObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build());
        log.debug("deleted s3://{}/{}", location.bucket(), location.key());
    }

    @Override
    public ObjectPage list(String bucket, String continuationToken, int maxKeys) {
        ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                .bucket(bucket)
                .maxKeys(maxKeys);
        if (continuationToken != null && !continuationToken.isBlank()) {
            req.continuationToken(continuationToken);
        }

        ListObjectsV2Response resp = s3.listObjectsV2(req.build());
        List<String> keys = resp.contents().stream().map(S3Object::key).collect(Collectors.toList());
        String next = Boolean.TRUE.equals(resp.isTruncated()) ? resp.nextContinuationToken() : null;
        return new ObjectPage(keys, next);
    }

    @Override
    public void close() {
        s3.close();
    }

    /** x-amz-tagging header value: RFC 3986 encoded {@code key=value} pairs joined by {@code &}. */
    static String encodeTagging(Map<String, String> tags) {
        return tags.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String s) {
        // space must be %20, never the form-encoded '+'
        return SdkHttpUtils.urlEncode(s == null ? "" : s);
    }
}
