package com.homeservices.marketplace.exception;

/**
 * Base for every error the marketplace surfaces to callers. The code is
 * stable and safe to show to clients; the message is for humans.
 */
public class MarketplaceException extends RuntimeException {

    private final String code;

    public MarketplaceException(String code, String message) {
        super(message);
        this.code = code;
    }

    public MarketplaceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
