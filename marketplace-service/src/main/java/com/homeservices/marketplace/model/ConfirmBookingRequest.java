package com.homeservices.marketplace.model;

import com.homeservices.shared.enums.PaymentMethod;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConfirmBookingRequest {

    @NotNull
    private PaymentMethod paymentMethod;
}
