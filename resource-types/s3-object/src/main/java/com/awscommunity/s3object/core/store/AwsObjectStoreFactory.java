package com.awscommunity.s3object.core.store;

import java.net.URI;

import com.awscommunity.s3object.model.Credentials;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Builds one S3 client per invocation from the caller credentials CloudFormation hands the
 * handler. Without credentials (local runs) the default provider chain applies.
 */
public final class AwsObjectStoreFactory implements ObjectStoreFactory {
    private final String endpointOverride;

    public AwsObjectStoreFactory(String endpointOverride) {
        this.endpointOverride = endpointOverride;
    }

    @Override
    public ObjectStore open(Credentials credentials, String region) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider(credentials));

        if (endpointOverride != null && !endpointOverride.isBlank()) {
            builder.endpointOverride(URI.create(endpointOverride))
                    .forcePathStyle(true);
        }
        return new AwsS3ObjectStore(builder.build());
    }

    static AwsCredentialsProvider credentialsProvider(Credentials c) {
        if (c == null || isBlank(c.accessKeyId()) || isBlank(c.secretAccessKey())) {
            return DefaultCredentialsProvider.create();
        }
        if (isBlank(c.sessionToken())) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(c.accessKeyId(), c.secretAccessKey()));
        }
        return StaticCredentialsProvider.create(
                AwsSessionCredentials.create(c.accessKeyId(), c.secretAccessKey(), c.sessionToken()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
