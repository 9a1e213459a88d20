package com.priceintel.harvester.parser;

import com.priceintel.harvester.model.ErrorCode;
import lombok.Getter;

/**
 * The file as a whole could not be read as the detected format.
 */
@Getter
public class FeedParseException extends RuntimeException {

    private final ErrorCode code;

    public FeedParseException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
