package com.awscommunity.s3object.core.resource;

import static com.awscommunity.s3object.testutil.Requests.ARN;
import static com.awscommunity.s3object.testutil.Requests.BUCKET;
import static com.awscommunity.s3object.testutil.Requests.KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.OperationStatus;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.model.Tag;
import com.awscommunity.s3object.testutil.InMemoryObjectStore;
import com.awscommunity.s3object.testutil.Requests;
import com.awscommunity.s3object.util.ProviderException;

public class CreateHandlerTest {

    private final ModelValidator validator = new ModelValidator();
    private final ErrorTranslator errors = new ErrorTranslator();
    private final Stabilizer stabilizer = new Stabilizer(new ReadHandler(validator), errors, 5);
    private final CreateHandler handler = new CreateHandler(validator, stabilizer, 5);

    @Test
    void create_putsObject_andAsksForCallback() {
        var store = new InMemoryObjectStore().withBucket(BUCKET);
        var req = Requests.request(Requests.model("hello", new Tag("team", "storage")));

        var out = handler.handle(Requests.first(req, store));

        assertEquals(OperationStatus.IN_PROGRESS, out.status());
        assertNotNull(out.callbackContext());
        assertTrue(out.callbackContext().isInProgress());
        assertEquals(5, out.callbackDelaySeconds());
        assertEquals(ARN, out.resourceModel().objectArn());

        var stored = store.stored(BUCKET, KEY);
        assertEquals("hello", stored.contents());
        assertEquals(Map.of("team", "storage"), stored.tags());
    }

    @Test
    void create_mergesStackTags_modelTagWinsOnSameKey() {
        var store = new InMemoryObjectStore().withBucket(BUCKET);
        var req = Requests.request(
                Requests.model("hello", new Tag("env", "model")),
                null,
                Map.of("env", "stack", "owner", "platform"));

        handler.handle(Requests.first(req, store));

        var tags = store.stored(BUCKET, KEY).tags();
        assertEquals("model", tags.get("env"));
        assertEquals("platform", tags.get("owner"));
        assertEquals(2, tags.size());
    }

    @Test
    void create_existingObject_isAlreadyExists() {
        var store = new InMemoryObjectStore().withObject(BUCKET, KEY, "old", Map.of());
        var req = Requests.request(Requests.model("new"));

        var e = assertThrows(ProviderException.class, () -> handler.handle(Requests.first(req, store)));

        assertEquals(HandlerErrorCode.ALREADY_EXISTS, e.errorCode());
        assertEquals("old", store.stored(BUCKET, KEY).contents());
    }

    @Test
    void create_invalidKey_neverTouchesS3() {
        var store = new InMemoryObjectStore().withBucket(BUCKET);
        var bad = new ResourceModel(null, "has space/and?", BUCKET, "x", null);

        var e = assertThrows(ProviderException.class,
                () -> handler.handle(Requests.first(Requests.request(bad), store)));

        assertEquals(HandlerErrorCode.INVALID_REQUEST, e.errorCode());
        assertTrue(store.calls.isEmpty());
    }

    @Test
    void create_withReadOnlyArn_isInvalid() {
        var store = new InMemoryObjectStore().withBucket(BUCKET);
        var model = Requests.model("x").withObjectArn(ARN);

        var e = assertThrows(ProviderException.class,
                () -> handler.handle(Requests.first(Requests.request(model), store)));

        assertEquals(HandlerErrorCode.INVALID_REQUEST, e.errorCode());
    }

    @Test
    void create_callback_succeedsOnceReadable() {
        var store = new InMemoryObjectStore().withObject(BUCKET, KEY, "hello", Map.of());
        var desired = Requests.model("hello").withObjectArn(ARN);

        var out = handler.handle(Requests.callback(Requests.request(desired), store));

        assertEquals(OperationStatus.SUCCESS, out.status());
        assertEquals(desired, out.resourceModel());
        assertNull(out.callbackContext());
        assertEquals(List.of("get"), store.calls);
    }

    @Test
    void create_callback_objectGone_isNotFound() {
        var store = new InMemoryObjectStore().withBucket(BUCKET);
        var desired = Requests.model("hello").withObjectArn(ARN);

        var out = handler.handle(Requests.callback(Requests.request(desired), store));

        assertEquals(OperationStatus.FAILED, out.status());
        assertEquals(HandlerErrorCode.NOT_FOUND, out.errorCode());
    }
}
