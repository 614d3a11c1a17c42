package com.awscommunity.s3object.routing;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awscommunity.s3object.core.resource.ErrorTranslator;
import com.awscommunity.s3object.model.Action;
import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;

/**
 * Dispatches a CRUDL action to its handler. Whatever the handler throws comes back as a
 * FAILED progress event; nothing escapes to the Lambda runtime.
 */
public final class Router {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final Map<Action, Route> routes = new EnumMap<>(Action.class);
    private final ErrorTranslator errors;

    public Router(ErrorTranslator errors) {
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    public Router add(Action action, Route handler) {
        routes.put(action, handler);
        return this;
    }

    public Route match(Action action) {
        return action == null ? null : routes.get(action);
    }

    public ProgressEvent dispatch(Action action, Invocation invocation) {
        Route route = match(action);
        if (route == null) {
            return ProgressEvent.failed(HandlerErrorCode.INVALID_REQUEST, "no handler for action " + action);
        }

        log.debug("dispatch {} callback={}", action, invocation.isCallback());
        try {
            ProgressEvent out = route.handle(invocation);
            if (out == null) {
                return ProgressEvent.failed(HandlerErrorCode.INTERNAL_FAILURE, "handler returned no progress event");
            }
            return out;
        } catch (Exception e) {
            return errors.toFailure(e);
        }
    }
}
