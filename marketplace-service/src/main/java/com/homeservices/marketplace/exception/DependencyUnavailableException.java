package com.homeservices.marketplace.exception;

/**
 * A collaborator (store, lock, geocoder) could not serve the request.
 * Safe to retry.
 */
public class DependencyUnavailableException extends MarketplaceException {

    public DependencyUnavailableException(String code, String message) {
        super(code, message);
    }

    public DependencyUnavailableException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
