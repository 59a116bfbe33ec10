package com.homeservices.shared.enums;

public enum PaymentStatus {
    PENDING,
    SUCCESSFUL,
    FAILED,
    REFUNDED
}
