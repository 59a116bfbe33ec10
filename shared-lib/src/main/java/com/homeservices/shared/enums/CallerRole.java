package com.homeservices.shared.enums;

/**
 * Which side of a booking the caller acts for.
 */
public enum CallerRole {
    CUSTOMER,
    PROVIDER
}
