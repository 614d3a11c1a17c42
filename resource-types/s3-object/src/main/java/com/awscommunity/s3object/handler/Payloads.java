package com.awscommunity.s3object.handler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.awscommunity.s3object.app.App;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;

/**
 * Stream plumbing shared by the Lambda entry points: JSON in, progress event out.
 */
final class Payloads {
    private static final Logger log = LoggerFactory.getLogger(Payloads.class);

    private Payloads() {}

    // writes the failure event when no App could be built
    private static final ObjectMapper FALLBACK = new ObjectMapper();

    @FunctionalInterface
    interface Body<T> {
        ProgressEvent run(App app, T payload);
    }

    static <T> void handle(Supplier<App> apps, InputStream in, OutputStream out, Class<T> type, Body<T> body)
            throws IOException {
        App app;
        try {
            app = apps.get();
        } catch (RuntimeException e) {
            log.error("handler configuration failed", e);
            FALLBACK.writeValue(out, ProgressEvent.failed(HandlerErrorCode.INTERNAL_FAILURE,
                    "handler configuration failed: " + e.getMessage()));
            return;
        }

        ProgressEvent event;
        try {
            T payload = read(app.om, in, type);
            event = body.run(app, payload);
        } catch (JsonProcessingException e) {
            log.warn("malformed payload: {}", e.getOriginalMessage());
            event = ProgressEvent.failed(HandlerErrorCode.INVALID_REQUEST, "malformed payload: " + e.getOriginalMessage());
        } catch (Exception e) {
            event = app.errors.toFailure(e);
        }
        app.om.writeValue(out, event);
    }

    private static <T> T read(ObjectMapper om, InputStream in, Class<T> type) throws IOException {
        T payload = om.readValue(in, type);
        if (payload == null) throw new IllegalArgumentException("empty payload");
        return payload;
    }
}
