package com.awscommunity.s3object.core.resource;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.routing.Invocation;

/**
 * Callback step shared by Create, Update and Delete: confirms the previous write through Read.
 */
public final class Stabilizer {
    private static final Logger log = LoggerFactory.getLogger(Stabilizer.class);

    private final ReadHandler read;
    private final ErrorTranslator errors;
    private final int callbackDelaySeconds;

    public Stabilizer(ReadHandler read, ErrorTranslator errors, int callbackDelaySeconds) {
        this.read = Objects.requireNonNull(read, "read");
        this.errors = Objects.requireNonNull(errors, "errors");
        this.callbackDelaySeconds = callbackDelaySeconds;
    }

    /** After Create/Update: the object must be readable. Returns the desired model, not the stored one. */
    public ProgressEvent afterWrite(Invocation inv, ResourceModel desired) {
        ProgressEvent rh = readQuietly(inv);
        log.debug("callback read status={} errorCode={}", rh.status(), rh.errorCode());

        if (rh.isSuccess()) return ProgressEvent.success(desired);
        if (rh.isFailed()) return rh;
        return ProgressEvent.inProgress(desired, callbackDelaySeconds);
    }

    /** After Delete: NotFound means done; a readable object means keep waiting. */
    public ProgressEvent afterDelete(Invocation inv) {
        ProgressEvent rh = readQuietly(inv);
        log.debug("callback read status={} errorCode={}", rh.status(), rh.errorCode());

        if (rh.isFailed() && rh.errorCode() == HandlerErrorCode.NOT_FOUND) {
            return ProgressEvent.deleted();
        }
        if (rh.isFailed()) return rh;
        return ProgressEvent.inProgress(inv.request().desiredResourceState(), callbackDelaySeconds);
    }

    private ProgressEvent readQuietly(Invocation inv) {
        try {
            return read.handle(inv);
        } catch (Exception e) {
            return errors.toFailure(e);
        }
    }
}
