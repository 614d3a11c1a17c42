package com.awscommunity.s3object.handler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.function.Supplier;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.awscommunity.s3object.app.App;
import com.awscommunity.s3object.model.Action;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.HandlerRequest;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceHandlerRequest;
import com.awscommunity.s3object.model.ResourceModels;
import com.awscommunity.s3object.util.ProviderException;

/**
 * Lambda entry point CloudFormation invokes for the registered type
 * ({@code com.awscommunity.s3object.handler.ResourceHandler::handleRequest}).
 */
public class ResourceHandler implements RequestStreamHandler {
    // resolved inside handleRequest; config errors come back as a FAILED event
    private final Supplier<App> app;

    public ResourceHandler() {
        this.app = App::get;
    }

    public ResourceHandler(App app) {
        this(() -> app);
    }

    ResourceHandler(Supplier<App> app) {
        this.app = app;
    }

    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        Payloads.handle(app, input, output, HandlerRequest.class, this::process);
    }

    ProgressEvent process(App app, HandlerRequest req) {
        Action action = App.parseAction(req.action());
        var data = req.requestData();
        if (data == null) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST, "requestData is required");
        }

        String region = app.regionOr(req.region());
        var request = new ResourceHandlerRequest(
                null,
                ResourceModels.read(app.om, data.resourceProperties()),
                ResourceModels.read(app.om, data.previousResourceProperties()),
                data.stackTags(),
                data.previousStackTags(),
                data.logicalResourceId(),
                req.awsAccountId(),
                region,
                App.partitionFor(region),
                req.stackId(),
                req.nextToken()
        );
        return app.invoke(action, data.callerCredentials(), request, req.callbackContext());
    }
}
