package com.awscommunity.s3object.core.resource;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awscommunity.s3object.model.HandlerErrorCode;
import com.awscommunity.s3object.model.ProgressEvent;
import com.awscommunity.s3object.util.ProviderException;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Maps S3 / SDK failures onto CloudFormation handler error codes and builds the FAILED event.
 */
public final class ErrorTranslator {
    private static final Logger log = LoggerFactory.getLogger(ErrorTranslator.class);

    private static final Set<String> NOT_FOUND = Set.of("NoSuchKey", "NoSuchBucket");

    private static final Set<String> INVALID_REQUEST = Set.of(
            "InvalidParameter",
            "InvalidParameterCombination",
            "InvalidParameterValue",
            "InvalidTagKey.Malformed",
            "InvalidTag",
            "InvalidArgument",
            "InvalidBucketName",
            "MissingAction",
            "MissingParameter",
            "UnknownParameter",
            "ValidationError"
    );

    private static final Set<String> INVALID_CREDENTIALS = Set.of(
            "InvalidAccessKeyId",
            "ExpiredToken",
            "SignatureDoesNotMatch"
    );

    private static final Set<String> THROTTLING = Set.of("RequestLimitExceeded", "SlowDown", "Throttling");

    public HandlerErrorCode codeFor(Exception e) {
        if (e instanceof ProviderException pe) return pe.errorCode();
        if (e instanceof AwsServiceException ase) {
            String code = ase.awsErrorDetails() == null ? null : ase.awsErrorDetails().errorCode();
            return fromServiceError(code, ase.statusCode());
        }
        if (e instanceof SdkClientException) return HandlerErrorCode.NETWORK_FAILURE;
        return HandlerErrorCode.INTERNAL_FAILURE;
    }

    /** Error code first; the HTTP status only decides when the code is unknown or absent. */
    public static HandlerErrorCode fromServiceError(String apiErrorCode, int httpStatus) {
        if (apiErrorCode != null) {
            if (NOT_FOUND.contains(apiErrorCode)) return HandlerErrorCode.NOT_FOUND;
            if (INVALID_REQUEST.contains(apiErrorCode)) return HandlerErrorCode.INVALID_REQUEST;
            if ("AccessDenied".equals(apiErrorCode)) return HandlerErrorCode.ACCESS_DENIED;
            if (INVALID_CREDENTIALS.contains(apiErrorCode)) return HandlerErrorCode.INVALID_CREDENTIALS;
            if (THROTTLING.contains(apiErrorCode)) return HandlerErrorCode.THROTTLING;
            if ("InternalError".equals(apiErrorCode)) return HandlerErrorCode.SERVICE_INTERNAL_ERROR;
        }
        return switch (httpStatus) {
            case 403 -> HandlerErrorCode.ACCESS_DENIED;
            case 404 -> HandlerErrorCode.NOT_FOUND;
            case 429, 503 -> HandlerErrorCode.THROTTLING;
            default -> HandlerErrorCode.GENERAL_SERVICE_EXCEPTION;
        };
    }

    public ProgressEvent toFailure(Exception e) {
        HandlerErrorCode code = codeFor(e);
        String message = (e.getMessage() == null || e.getMessage().isBlank())
                ? e.getClass().getSimpleName()
                : e.getMessage();

        switch (code) {
            case INTERNAL_FAILURE -> log.error("handler failed: {}", message, e);
            case NOT_FOUND -> log.debug("not found: {}", message);
            default -> log.warn("{}: {}", code.wire(), message);
        }
        return ProgressEvent.failed(code, message);
    }
}
