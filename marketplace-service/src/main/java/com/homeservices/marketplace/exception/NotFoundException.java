package com.homeservices.marketplace.exception;

public class NotFoundException extends MarketplaceException {

    public NotFoundException(String entity, Object id) {
        super(entity.toUpperCase() + "_NOT_FOUND", entity + " " + id + " not found");
    }
}
