package com.homeservices.marketplace.model;

import com.homeservices.marketplace.entity.ProviderProfile;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ScoredProvider {

    private ProviderProfile provider;
    private BigDecimal priceRate;
    private Double distanceKm;
    private double score;

    public Long getProviderId() {
        return provider.getId();
    }
}
