package com.homeservices.marketplace.model;

import com.homeservices.marketplace.entity.ProviderProfile;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * An eligible provider together with the inputs scoring needs: its price for
 * the requested category and its own registered location (either may be null).
 */
@Data
@Builder
public class ProviderCandidate {

    private ProviderProfile provider;
    private BigDecimal priceRate;
    private Coordinate location;

    public Double distanceKmTo(Coordinate customerLocation) {
        if (customerLocation == null || location == null) {
            return null;
        }
        return location.distanceKmTo(customerLocation);
    }
}
