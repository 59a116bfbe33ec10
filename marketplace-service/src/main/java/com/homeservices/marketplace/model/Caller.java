package com.homeservices.marketplace.model;

import com.homeservices.marketplace.entity.Booking;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.shared.enums.CallerRole;

/**
 * Identity of whoever invokes a booking operation, passed explicitly at
 * every call instead of being read from a session.
 */
public record Caller(CallerRole role, Long id) {

    public Caller {
        if (role == null || id == null) {
            throw new ValidationException("caller role and id are required");
        }
    }

    public static Caller customer(Long id) {
        return new Caller(CallerRole.CUSTOMER, id);
    }

    public static Caller provider(Long id) {
        return new Caller(CallerRole.PROVIDER, id);
    }

    public boolean isCustomerOf(Booking booking) {
        return role == CallerRole.CUSTOMER && id.equals(booking.getCustomerId());
    }

    public boolean isProviderOf(Booking booking) {
        return role == CallerRole.PROVIDER && id.equals(booking.getProviderId());
    }

    public boolean isPartyTo(Booking booking) {
        return isCustomerOf(booking) || isProviderOf(booking);
    }
}
