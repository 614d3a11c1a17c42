package com.awscommunity.s3object.core.resource;

import java.util.Objects;

import com.awscommunity.s3object.core.store.ObjectLocation;
import com.awscommunity.s3object.core.store.ObjectStore;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.routing.Invocation;
import com.awscommunity.s3object.routing.Route;

public final class ReadHandler implements Route {
    private final ModelValidator validator;

    public ReadHandler(ModelValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    @Override
    public ProgressEvent handle(Invocation inv) {
        var req = inv.request();
        ObjectLocation loc = validator.locate(req.desiredResourceState());

        ObjectStore.StoredObject obj = inv.store().get(loc);

        ResourceModel model = new ResourceModel(
                ObjectArns.of(req.awsPartition(), loc),
                loc.key(),
                loc.bucket(),
                obj.contents(),
                ResourceTags.toModelTags(obj.tags())
        );
        return ProgressEvent.success(model);
    }
}
