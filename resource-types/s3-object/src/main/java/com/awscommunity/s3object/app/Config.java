package com.awscommunity.s3object.app;

public record Config(
        // used when the request carries no region (local runs)
        String defaultRegion,

        // handler behavior
        int callbackDelaySeconds,
        int listPageSize,

        // SAM local / LocalStack
        String s3EndpointOverride
) {
    public static Config fromEnv() {
        return new Config(
                env("AWS_REGION", "us-east-1"),
                intEnv("CALLBACK_DELAY_SECONDS", 5, 0),
                // S3 maxKeys=0 returns an empty page with no continuation token
                intEnv("LIST_PAGE_SIZE", 100, 1),
                env("S3_ENDPOINT_OVERRIDE", "")
        );
    }

    private static int intEnv(String key, int def, int min) {
        String v = env(key, "");
        if (v.isEmpty()) return def;
        try {
            int n = Integer.parseInt(v);
            if (n < min) throw new IllegalArgumentException(key + " must be at least " + min + ": " + v);
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }

    private static String env(String key, String def) {
        // Lambda uses env vars; unit tests can use System properties.
        String v = System.getenv(key);
        if (v == null) v = System.getProperty(key);
        if (v == null) return def;
        v = v.trim();
        return v.isEmpty() ? def : v;
    }
}
