package com.bbthechange.podfeed.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FeedBuildException.class)
    public ResponseEntity<Map<String, Object>> handleFeedBuildException(FeedBuildException e) {
        if (e.getErrorType() == FeedBuildException.ErrorType.TRANSIENT) {
            logger.error("Feed build failed: {}", e.getMessage(), e);
        } else {
            logger.warn("Feed build rejected: {}", e.getMessage());
        }

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", e.getErrorType().name());
        errorResponse.put("message", e.getMessage());
        if (e.getUpstreamStatus() != null) {
            errorResponse.put("upstreamStatus", e.getUpstreamStatus());
        }

        return new ResponseEntity<>(errorResponse, e.getHttpStatus());
    }

    @ExceptionHandler(FeedNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleFeedNotFoundException(FeedNotFoundException e) {
        logger.debug("Feed not found: {}", e.getFeedId());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "FEED_NOT_FOUND");
        errorResponse.put("message", e.getMessage());

        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        logger.warn("Invalid feed request: {}", details);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "VALIDATION_ERROR");
        errorResponse.put("message", details);

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DynamoDbException.class)
    public ResponseEntity<Map<String, Object>> handleDynamoDbException(DynamoDbException e) {
        logger.error("DynamoDB error: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "Database error occurred");
        errorResponse.put("message", "Please try again later");

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "Internal server error");
        errorResponse.put("message", "An unexpected error occurred");

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
