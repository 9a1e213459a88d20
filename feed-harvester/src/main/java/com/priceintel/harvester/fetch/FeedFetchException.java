package com.priceintel.harvester.fetch;

import com.priceintel.harvester.model.ErrorCode;
import lombok.Getter;

@Getter
public class FeedFetchException extends RuntimeException {

    private final FetchFailureKind kind;
    private final ErrorCode errorCode;
    private final Integer statusCode;

    public FeedFetchException(FetchFailureKind kind, String message) {
        this(kind, kind.errorCode(), message, null, null);
    }

    public FeedFetchException(FetchFailureKind kind, String message, Throwable cause) {
        this(kind, kind.errorCode(), message, null, cause);
    }

    public FeedFetchException(FetchFailureKind kind, ErrorCode errorCode, String message,
                              Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }

    public static FeedFetchException status(int statusCode, String message) {
        return new FeedFetchException(FetchFailureKind.NON_SUCCESS_STATUS, ErrorCode.HTTP_STATUS,
                message, statusCode, null);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
