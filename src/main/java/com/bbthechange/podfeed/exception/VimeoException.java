package com.bbthechange.podfeed.exception;

/**
 * Failure talking to the Vimeo API.
 * Either the requested resource does not exist, or the call failed for any other reason.
 */
public class VimeoException extends RuntimeException {

    private final ErrorType errorType;
    private final Integer statusCode;

    public enum ErrorType {
        /**
         * Vimeo answered 404.
         */
        NOT_FOUND,

        /**
         * Any other status, transport error or unreadable body.
         */
        TRANSIENT
    }

    public VimeoException(ErrorType errorType, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * HTTP status Vimeo answered with, or null when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return errorType == ErrorType.NOT_FOUND;
    }

    /**
     * Single place deciding how an upstream failure is reported.
     *
     * @param statusCode status of the response, null if the request never got one
     * @param message what was being attempted
     * @param cause underlying exception, may be null
     */
    public static VimeoException classify(Integer statusCode, String message, Throwable cause) {
        if (statusCode != null && statusCode == 404) {
            return new VimeoException(ErrorType.NOT_FOUND, statusCode, message + ": not found", cause);
        }
        String detail = statusCode != null ? " (status " + statusCode + ")" : "";
        return new VimeoException(ErrorType.TRANSIENT, statusCode, message + detail, cause);
    }
}
