package com.homeservices.marketplace.model;

import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBookingRequest {

    @NotNull
    private Long customerId;

    @NotNull
    private Long providerId;

    @NotNull
    private Long categoryId;

    @NotNull
    private Long addressId;

    @NotNull
    @Future
    private LocalDate bookingDate;

    @NotBlank
    @Size(max = 20)
    private String timeSlot;
}
