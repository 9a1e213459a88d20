package com.priceintel.harvester.fetch;

import com.priceintel.harvester.model.ErrorCode;

/**
 * Transport failure classes. All but {@link #TOO_LARGE} and {@link #CONFIG} are worth retrying.
 */
public enum FetchFailureKind {
    TIMEOUT(ErrorCode.CONNECTION_TIMEOUT, true),
    CONNECTION(ErrorCode.CONNECTION_FAILED, true),
    NON_SUCCESS_STATUS(ErrorCode.HTTP_STATUS, true),
    INVALID_CONTENT_TYPE(ErrorCode.INVALID_CONTENT_TYPE, true),
    TOO_LARGE(ErrorCode.FILE_TOO_LARGE, false),
    CONFIG(ErrorCode.CONFIG_ERROR, false);

    private final ErrorCode errorCode;
    private final boolean retryable;

    FetchFailureKind(ErrorCode errorCode, boolean retryable) {
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
