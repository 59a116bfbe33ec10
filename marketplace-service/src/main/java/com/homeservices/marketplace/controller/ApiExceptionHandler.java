package com.homeservices.marketplace.controller;

import com.homeservices.marketplace.exception.DependencyUnavailableException;
import com.homeservices.marketplace.exception.MarketplaceException;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.exception.PreconditionFailedException;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps marketplace errors to HTTP statuses:
 *   ValidationException            400
 *   NotFoundException              404
 *   PreconditionFailedException    409, or 403 for NOT_AUTHORIZED
 *   DependencyUnavailableException 503
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<ApiResponse<Void>> handleMarketplaceException(MarketplaceException ex) {
        HttpStatus status = statusFor(ex);
        log.warn("Request failed [{} {}]: {}", status.value(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request body rejected: {}", message);
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }

    @ExceptionHandler({MissingRequestValueException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse<Void>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", ex.getMessage()));
    }

    static HttpStatus statusFor(MarketplaceException ex) {
        if (ex instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof PreconditionFailedException) {
            return ((PreconditionFailedException) ex).getReason() == PreconditionFailedException.Reason.NOT_AUTHORIZED
                    ? HttpStatus.FORBIDDEN
                    : HttpStatus.CONFLICT;
        }
        if (ex instanceof DependencyUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
