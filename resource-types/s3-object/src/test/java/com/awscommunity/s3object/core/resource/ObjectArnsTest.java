package com.awscommunity.s3object.core.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.awscommunity.s3object.core.store.ObjectLocation;

public class ObjectArnsTest {

    @Test
    void arn_keepsSlashesInKey() {
        String arn = ObjectArns.of("aws", new ObjectLocation("b", "a/b/c.txt"));
        assertEquals("arn:aws:s3:::b/a/b/c.txt", arn);
        assertEquals(new ObjectLocation("b", "a/b/c.txt"), ObjectArns.parse(arn).orElseThrow());
    }

    @Test
    void partition_followsRegion() {
        assertEquals("aws", ObjectArns.partitionFor("eu-west-1"));
        assertEquals("aws-cn", ObjectArns.partitionFor("cn-north-1"));
        assertEquals("aws-us-gov", ObjectArns.partitionFor("us-gov-west-1"));
        assertEquals("aws", ObjectArns.partitionFor(null));
    }

    @Test
    void parse_rejectsBucketArnsAndOtherServices() {
        assertTrue(ObjectArns.parse("arn:aws:s3:::bucket-only").isEmpty());
        assertTrue(ObjectArns.parse("arn:aws:sqs:us-east-1:123:queue/x").isEmpty());
        assertTrue(ObjectArns.parse(null).isEmpty());
    }

    @Test
    void parse_chinaPartition() {
        var loc = ObjectArns.parse("arn:aws-cn:s3:::bucket/key.txt").orElseThrow();
        assertEquals("bucket", loc.bucket());
        assertEquals("key.txt", loc.key());
    }
}
