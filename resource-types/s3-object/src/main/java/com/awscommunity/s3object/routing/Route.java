package com.awscommunity.s3object.routing;

import com.awscommunity.s3object.model.ProgressEvent;

@FunctionalInterface
public interface Route {
    ProgressEvent handle(Invocation invocation) throws Exception;
}
