package com.awscommunity.s3object.core.resource;

import java.util.ArrayList;
import java.util.List;

import com.awscommunity.s3object.core.store.ObjectLocation;
import com.awscommunity.s3object.core.store.ObjectStore;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceModel;
import com.awscommunity.s3object.routing.Invocation;
import com.awscommunity.s3object.routing.Route;
import com.awscommunity.s3object.util.ProviderException;

/**
 * Lists objects of the bucket named in the desired state, one page per invocation.
 * Models carry identifiers only; contents and tags come from Read.
 */
public final class ListHandler implements Route {
    private final int pageSize;

    public ListHandler(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public ProgressEvent handle(Invocation inv) {
        var req = inv.request();
        ResourceModel filter = req.desiredResourceState();
        String bucket = filter == null ? null : filter.bucketName();
        if (bucket == null || bucket.isBlank()) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST, "BucketName is required to list objects");
        }

        ObjectStore.ObjectPage page = inv.store().list(bucket, req.nextToken(), pageSize);

        List<ResourceModel> models = new ArrayList<>(page.keys().size());
        for (String key : page.keys()) {
            ObjectLocation loc = new ObjectLocation(bucket, key);
            models.add(new ResourceModel(ObjectArns.of(req.awsPartition(), loc), key, bucket, null, null));
        }
        return ProgressEvent.listed(models, page.nextToken());
    }
}
