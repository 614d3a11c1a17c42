package com.awscommunity.s3object.core.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.Test;

import com.awscommunity.s3object.model.Credentials;

import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

public class AwsObjectStoreFactoryTest {

    @Test
    void callerCredentials_withSessionToken() {
        var provider = AwsObjectStoreFactory.credentialsProvider(new Credentials("AKIA", "secret", "token"));

        assertInstanceOf(StaticCredentialsProvider.class, provider);
        var creds = assertInstanceOf(AwsSessionCredentials.class, provider.resolveCredentials());
        assertEquals("AKIA", creds.accessKeyId());
        assertEquals("token", creds.sessionToken());
    }

    @Test
    void callerCredentials_withoutSessionToken() {
        var provider = AwsObjectStoreFactory.credentialsProvider(new Credentials("AKIA", "secret", null));

        assertEquals("secret", provider.resolveCredentials().secretAccessKey());
    }

    @Test
    void noCredentials_fallsBackToDefaultChain() {
        assertInstanceOf(DefaultCredentialsProvider.class, AwsObjectStoreFactory.credentialsProvider(null));
        assertInstanceOf(DefaultCredentialsProvider.class,
                AwsObjectStoreFactory.credentialsProvider(new Credentials("", "", "")));
    }

    @Test
    void credentials_toStringHidesSecrets() {
        String s = new Credentials("AKIA", "secret", "token").toString();
        assertEquals(false, s.contains("secret"));
        assertEquals(false, s.contains("AKIA"));
    }
}
