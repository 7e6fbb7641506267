package com.bbthechange.podfeed.exception;

import com.bbthechange.podfeed.model.SourceType;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a feed cannot be assembled. A build either returns a complete feed or
 * throws exactly one of these.
 */
public class FeedBuildException extends RuntimeException {

    private final ErrorType errorType;
    private final SourceType sourceType;
    private final String itemId;
    private final Integer upstreamStatus;

    public enum ErrorType {
        /**
         * The channel, group or user does not exist on Vimeo (HTTP 404).
         */
        SOURCE_NOT_FOUND(HttpStatus.NOT_FOUND),

        /**
         * The link is not a Vimeo channel, group or user (HTTP 400).
         */
        UNSUPPORTED_SOURCE(HttpStatus.BAD_REQUEST),

        /**
         * Vimeo failed or paging broke off; trying again later may work (HTTP 503).
         */
        TRANSIENT(HttpStatus.SERVICE_UNAVAILABLE);

        private final HttpStatus httpStatus;

        ErrorType(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus getHttpStatus() {
            return httpStatus;
        }
    }

    public FeedBuildException(ErrorType errorType, SourceType sourceType, String itemId,
                              Integer upstreamStatus, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.sourceType = sourceType;
        this.itemId = itemId;
        this.upstreamStatus = upstreamStatus;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public String getItemId() {
        return itemId;
    }

    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }

    public HttpStatus getHttpStatus() {
        return errorType.getHttpStatus();
    }

    public static FeedBuildException unsupportedLink(String url) {
        return new FeedBuildException(
                ErrorType.UNSUPPORTED_SOURCE,
                null,
                null,
                null,
                "Unsupported feed link: " + url,
                null
        );
    }

    public static FeedBuildException sourceNotFound(SourceType sourceType, String itemId, VimeoException cause) {
        return new FeedBuildException(
                ErrorType.SOURCE_NOT_FOUND,
                sourceType,
                itemId,
                cause.getStatusCode(),
                "Vimeo " + sourceType.name().toLowerCase() + " not found: " + itemId,
                cause
        );
    }

    public static FeedBuildException transientFailure(SourceType sourceType, String itemId,
                                                      String context, VimeoException cause) {
        return new FeedBuildException(
                ErrorType.TRANSIENT,
                sourceType,
                itemId,
                cause.getStatusCode(),
                context + ": " + cause.getMessage(),
                cause
        );
    }
}
