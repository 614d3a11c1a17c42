package com.awscommunity.s3object.model;

public record Credentials(
        String accessKeyId,
        String secretAccessKey,
        String sessionToken
) {
    // never print secrets into CloudWatch
    @Override
    public String toString() {
        return "Credentials[accessKeyId=" + (accessKeyId == null ? "null" : "****") + "]";
    }
}
