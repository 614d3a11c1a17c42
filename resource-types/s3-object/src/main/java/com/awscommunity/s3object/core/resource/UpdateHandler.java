package com.awscommunity.s3object.core.resource;

import java.util.Map;
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

public final class UpdateHandler implements Route {
    private static final Logger log = LoggerFactory.getLogger(UpdateHandler.class);

    private final ModelValidator validator;
    private final Stabilizer stabilizer;
    private final int callbackDelaySeconds;

    public UpdateHandler(ModelValidator validator, Stabilizer stabilizer, int callbackDelaySeconds) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.stabilizer = Objects.requireNonNull(stabilizer, "stabilizer");
        this.callbackDelaySeconds = callbackDelaySeconds;
    }

    @Override
    public ProgressEvent handle(Invocation inv) {
        var req = inv.request();
        ResourceModel model = req.desiredResourceState();

        if (inv.isCallback()) {
            return stabilizer.afterWrite(inv, model);
        }

        validator.validateForWrite(model);
        ObjectLocation loc = new ObjectLocation(model.bucketName(), model.objectKey());

        // bucket and key make up the primary identifier
        ResourceModel previous = req.previousResourceState();
        if (previous != null) {
            ObjectLocation before = validator.locate(previous);
            if (!before.equals(loc)) {
                throw new ProviderException(HandlerErrorCode.NOT_UPDATABLE,
                        "BucketName and ObjectKey cannot change: s3://" + before.bucket() + "/" + before.key()
                                + " -> s3://" + loc.bucket() + "/" + loc.key());
            }
        }

        Map<String, String> tags = ResourceTags.merge(req.desiredResourceTags(), model.tags());
        validator.validateTags(tags);

        String arn = ObjectArns.of(req.awsPartition(), loc);
        if (!inv.store().exists(loc)) {
            throw new ProviderException(HandlerErrorCode.NOT_FOUND, "object not found: " + arn);
        }

        var put = inv.store().put(loc, model.objectContents(), tags);
        log.info("updated {} etag={}", arn, put.etag());

        return ProgressEvent.inProgress(model.withObjectArn(arn), callbackDelaySeconds);
    }
}
