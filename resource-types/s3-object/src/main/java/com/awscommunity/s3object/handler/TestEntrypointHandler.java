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
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceHandlerRequest;
import com.awscommunity.s3object.model.ResourceModels;
import com.awscommunity.s3object.model.TestEntrypointRequest;
import com.awscommunity.s3object.util.ProviderException;

/**
 * Entry point for {@code sam local invoke TestEntrypoint} and the contract tests: the request
 * arrives unwrapped, with credentials next to it.
 */
public class TestEntrypointHandler implements RequestStreamHandler {
    // resolved inside handleRequest; config errors come back as a FAILED event
    private final Supplier<App> app;

    public TestEntrypointHandler() {
        this.app = App::get;
    }

    public TestEntrypointHandler(App app) {
        this(() -> app);
    }

    TestEntrypointHandler(Supplier<App> app) {
        this.app = app;
    }

    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        Payloads.handle(app, input, output, TestEntrypointRequest.class, this::process);
    }

    ProgressEvent process(App app, TestEntrypointRequest payload) {
        Action action = App.parseAction(payload.action());
        var r = payload.request();
        if (r == null) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST, "request is required");
        }

        String region = app.regionOr(payload.region());
        var request = new ResourceHandlerRequest(
                r.clientRequestToken(),
                ResourceModels.read(app.om, r.desiredResourceState()),
                ResourceModels.read(app.om, r.previousResourceState()),
                r.desiredResourceTags(),
                r.previousResourceTags(),
                r.logicalResourceIdentifier(),
                null,
                region,
                App.partitionFor(region),
                null,
                r.nextToken()
        );
        return app.invoke(action, payload.credentials(), request, payload.callbackContext());
    }
}
