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

public final class CreateHandler implements Route {
    private static final Logger log = LoggerFactory.getLogger(CreateHandler.class);

    private final ModelValidator validator;
    private final Stabilizer stabilizer;
    private final int callbackDelaySeconds;

    public CreateHandler(ModelValidator validator, Stabilizer stabilizer, int callbackDelaySeconds) {
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

        validator.validateForCreate(model);
        Map<String, String> tags = ResourceTags.merge(req.desiredResourceTags(), model.tags());
        validator.validateTags(tags);

        ObjectLocation loc = new ObjectLocation(model.bucketName(), model.objectKey());
        String arn = ObjectArns.of(req.awsPartition(), loc);

        // create never overwrites an object it does not own
        if (inv.store().exists(loc)) {
            throw new ProviderException(HandlerErrorCode.ALREADY_EXISTS, "object already exists: " + arn);
        }

        var put = inv.store().put(loc, model.objectContents(), tags);
        log.info("created {} etag={}", arn, put.etag());

        return ProgressEvent.inProgress(model.withObjectArn(arn), callbackDelaySeconds);
    }
}
