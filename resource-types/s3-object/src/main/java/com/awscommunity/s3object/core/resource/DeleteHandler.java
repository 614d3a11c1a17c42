package com.awscommunity.s3object.core.resource;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awscommunity.s3object.core.store.ObjectLocation;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.routing.Invocation;
import com.awscommunity.s3object.routing.Route;
import com.awscommunity.s3object.util.ProviderException;

public final class DeleteHandler implements Route {
    private static final Logger log = LoggerFactory.getLogger(DeleteHandler.class);

    private final ModelValidator validator;
    private final Stabilizer stabilizer;
    private final int callbackDelaySeconds;

    public DeleteHandler(ModelValidator validator, Stabilizer stabilizer, int callbackDelaySeconds) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.stabilizer = Objects.requireNonNull(stabilizer, "stabilizer");
        this.callbackDelaySeconds = callbackDelaySeconds;
    }

    @Override
    public ProgressEvent handle(Invocation inv) {
        if (inv.isCallback()) {
            return stabilizer.afterDelete(inv);
        }

        var req = inv.request();
        ObjectLocation loc = validator.locate(req.desiredResourceState());
        String arn = ObjectArns.of(req.awsPartition(), loc);

        if (!inv.store().exists(loc)) {
            throw new ProviderException(HandlerErrorCode.NOT_FOUND, "object not found: " + arn);
        }

        inv.store().delete(loc);
        log.info("deleted {}", arn);

        // the callback needs the identifier to confirm the object is gone
        return ProgressEvent.inProgress(ResourceModel.identifier(arn), callbackDelaySeconds);
    }
}
