package com.awscommunity.s3object.core.resource;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.awscommunity.s3object.core.store.ObjectLocation;

/**
 * S3 object ARNs: {@code arn:<partition>:s3:::<bucket>/<key>}.
 */
public final class ObjectArns {
    private static final Pattern ARN = Pattern.compile("^arn:([a-z0-9-]+):s3:::([^/]+)/(.+)$");

    private ObjectArns() {}

    public static String of(String partition, ObjectLocation location) {
        String p = (partition == null || partition.isBlank()) ? "aws" : partition;
        return "arn:" + p + ":s3:::" + location.bucket() + "/" + location.key();
    }

    public static Optional<ObjectLocation> parse(String arn) {
        if (arn == null) return Optional.empty();
        Matcher m = ARN.matcher(arn.trim());
        if (!m.matches()) return Optional.empty();
        return Optional.of(new ObjectLocation(m.group(2), m.group(3)));
    }

    public static String partitionFor(String region) {
        if (region == null) return "aws";
        String r = region.trim().toLowerCase();
        if (r.startsWith("cn-")) return "aws-cn";
        if (r.startsWith("us-gov-")) return "aws-us-gov";
        return "aws";
    }
}
