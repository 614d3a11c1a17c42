package com.awscommunity.s3object.app;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.awscommunity.s3object.core.resource.CreateHandler;
import com.awscommunity.s3object.core.resource.DeleteHandler;
import com.awscommunity.s3object.core.resource.ErrorTranslator;
import com.awscommunity.s3object.core.resource.ListHandler;
import com.awscommunity.s3object.core.resource.ModelValidator;
import com.awscommunity.s3object.core.resource.ObjectArns;
import com.awscommunity.s3object.core.resource.ReadHandler;
import com.awscommunity.s3object.core.resource.Stabilizer;
import com.awscommunity.s3object.core.resource.UpdateHandler;
import com.awscommunity.s3object.core.store.AwsObjectStoreFactory;
import com.awscommunity.s3object.core.store.ObjectStore;
import com.awscommunity.s3object.core.store.ObjectStoreFactory;
import com.awscommunity.s3object.model.Action;
import com.awscommunity.s3object.model.CallbackContext;
import com.awscommunity.s3object.model.Credentials;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.model.ResourceHandlerRequest;
import com.awscommunity.s3object.routing.Invocation;
import com.awscommunity.s3object.routing.Router;
import com.awscommunity.s3object.util.ProviderException;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static final String TYPE_NAME = "AwsCommunity::S3::Object";

    private static volatile App INSTANCE;

    public final Config config;
    public final ObjectMapper om;
    public final ErrorTranslator errors;
    public final ObjectStoreFactory stores;
    public final Router router;

    private App(Config config, ObjectStoreFactory stores) {
        this.config = Objects.requireNonNull(config, "config");
        this.stores = Objects.requireNonNull(stores, "stores");

        // CloudFormation adds protocol fields over time
        this.om = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.errors = new ErrorTranslator();

        ModelValidator validator = new ModelValidator();
        ReadHandler read = new ReadHandler(validator);
        Stabilizer stabilizer = new Stabilizer(read, errors, config.callbackDelaySeconds());

        this.router = new Router(errors)
                .add(Action.CREATE, new CreateHandler(validator, stabilizer, config.callbackDelaySeconds()))
                .add(Action.READ, read)
                .add(Action.UPDATE, new UpdateHandler(validator, stabilizer, config.callbackDelaySeconds()))
                .add(Action.DELETE, new DeleteHandler(validator, stabilizer, config.callbackDelaySeconds()))
                .add(Action.LIST, new ListHandler(config.listPageSize()));
    }

    public static App get() {
        if (INSTANCE == null) {
            synchronized (App.class) {
                if (INSTANCE == null) {
                    Config config = Config.fromEnv();
                    INSTANCE = new App(config, new AwsObjectStoreFactory(config.s3EndpointOverride()));
                }
            }
        }
        return INSTANCE;
    }

    public static App create(Config config, ObjectStoreFactory stores) {
        return new App(config, stores);
    }

    /**
     * Runs one handler invocation against a store opened for the caller's credentials.
     * Always returns a progress event.
     */
    public ProgressEvent invoke(Action action,
                                Credentials credentials,
                                ResourceHandlerRequest request,
                                CallbackContext callbackContext) {
        if (action == null) {
            return ProgressEvent.failed(HandlerErrorCode.INVALID_REQUEST, "action is required");
        }
        log.info("{} {} logicalId={} callback={}", TYPE_NAME, action,
                request.logicalResourceIdentifier(), callbackContext != null && callbackContext.isInProgress());

        try (ObjectStore store = stores.open(credentials, request.region())) {
            return router.dispatch(action, new Invocation(request, callbackContext, store));
        } catch (Exception e) {
            // opening or closing the client failed
            return errors.toFailure(e);
        }
    }

    public String regionOr(String region) {
        return (region == null || region.isBlank()) ? config.defaultRegion() : region.trim();
    }

    public static String partitionFor(String region) {
        return ObjectArns.partitionFor(region);
    }

    public static Action parseAction(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST, "action is required");
        }
        try {
            return Action.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ProviderException(HandlerErrorCode.INVALID_REQUEST, "unsupported action: " + raw, e);
        }
    }
}
