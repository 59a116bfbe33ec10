package com.homeservices.marketplace.exception;

/**
 * A booking transition was refused. Nothing was changed.
 */
public class PreconditionFailedException extends MarketplaceException {

    public enum Reason {
        INVALID_STATE,
        NOT_AUTHORIZED,
        ALREADY_RATED,
        ALREADY_PAID,
        OFFERING_MISSING,
        SLOT_TAKEN
    }

    private final Reason reason;

    public PreconditionFailedException(Reason reason, String message) {
        super(reason.name(), message);
        this.reason = reason;
    }

    public PreconditionFailedException(Reason reason, String message, Throwable cause) {
        super(reason.name(), message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
