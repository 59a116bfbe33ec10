package com.homeservices.marketplace.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exactly one of customerId / providerId must be set. Coordinates are
 * optional; when omitted the address text is geocoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAddressRequest {

    private Long customerId;

    private Long providerId;

    @NotBlank
    private String addressLine;

    @NotBlank
    private String city;

    private String state;

    private String postalCode;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double latitude;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double longitude;
}
