package com.awscommunity.s3object.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Handler response. CloudFormation keeps re-invoking the handler while {@code status} is
 * IN_PROGRESS, passing {@code callbackContext} and {@code resourceModel} back.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        OperationStatus status,
        HandlerErrorCode errorCode,
        String message,
        CallbackContext callbackContext,
        Integer callbackDelaySeconds,
        ResourceModel resourceModel,
        List<ResourceModel> resourceModels,
        String nextToken
) {
    public static ProgressEvent success(ResourceModel model) {
        return new ProgressEvent(OperationStatus.SUCCESS, null, null, null, null, model, null, null);
    }

    // Delete must not return a model.
    public static ProgressEvent deleted() {
        return new ProgressEvent(OperationStatus.SUCCESS, null, null, null, null, null, null, null);
    }

    public static ProgressEvent listed(List<ResourceModel> models, String nextToken) {
        return new ProgressEvent(OperationStatus.SUCCESS, null, null, null, null, null, List.copyOf(models), nextToken);
    }

    public static ProgressEvent inProgress(ResourceModel model, int callbackDelaySeconds) {
        return new ProgressEvent(OperationStatus.IN_PROGRESS, null, null,
                CallbackContext.inProgress(), callbackDelaySeconds, model, null, null);
    }

    public static ProgressEvent failed(HandlerErrorCode code, String message) {
        return new ProgressEvent(OperationStatus.FAILED, code, "Error: " + message, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == OperationStatus.FAILED;
    }
}
