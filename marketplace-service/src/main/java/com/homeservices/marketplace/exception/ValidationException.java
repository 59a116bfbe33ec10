package com.homeservices.marketplace.exception;

public class ValidationException extends MarketplaceException {

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
