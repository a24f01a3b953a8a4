package com.purchasingpower.prreview.api;

import com.purchasingpower.prreview.model.dto.ReviewResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps request errors to 400 and anything unexpected to 500, both in the report shape.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ReviewResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Rejected invalid request: {}", message);
        return ResponseEntity.badRequest().body(ReviewResponse.error("Invalid request: " + message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ReviewResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ReviewResponse.error("Invalid request: malformed JSON body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ReviewResponse> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // framework errors (unknown route, wrong method) keep their own status
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(ReviewResponse.error(errorResponse.getBody().getDetail()));
        }
        log.error("Unhandled error while serving request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ReviewResponse.error("Unexpected error: " + e.getMessage()));
    }
}
