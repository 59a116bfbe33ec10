package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Address;
import com.homeservices.marketplace.entity.ProviderOffering;
import com.homeservices.marketplace.entity.ProviderProfile;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.marketplace.metrics.MatchingMetrics;
import com.homeservices.marketplace.model.Coordinate;
import com.homeservices.marketplace.model.MatchRequest;
import com.homeservices.marketplace.model.ProviderCandidate;
import com.homeservices.marketplace.model.ScoredProvider;
import com.homeservices.marketplace.repository.AddressRepository;
import com.homeservices.marketplace.repository.ProviderOfferingRepository;
import com.homeservices.marketplace.repository.ProviderProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds and ranks providers for a service category.
 *
 * Matching flow:
 *  1. Load every offering for the category; none means no match
 *  2. Keep the distinct providers that are available and verified
 *  3. Average the price over all offerings from step 1 (once per request)
 *  4. Score each provider with its own price and its own registered location
 *  5. Sort by score desc, provider id asc; truncate to the limit
 */
@Slf4j
@Service
public class ProviderMatchingService {

    static final Comparator<ScoredProvider> RANKING =
            Comparator.comparingDouble(ScoredProvider::getScore).reversed()
                    .thenComparing(ScoredProvider::getProviderId);

    private final ProviderOfferingRepository offeringRepository;
    private final ProviderProfileRepository providerRepository;
    private final AddressRepository addressRepository;
    private final ProviderScoringService scoringService;
    private final MatchingMetrics metrics;
    private final int defaultLimit;

    public ProviderMatchingService(ProviderOfferingRepository offeringRepository,
                                   ProviderProfileRepository providerRepository,
                                   AddressRepository addressRepository,
                                   ProviderScoringService scoringService,
                                   MatchingMetrics metrics,
                                   @Value("${marketplace.matching.default-limit:5}") int defaultLimit) {
        this.offeringRepository = offeringRepository;
        this.providerRepository = providerRepository;
        this.addressRepository = addressRepository;
        this.scoringService = scoringService;
        this.metrics = metrics;
        this.defaultLimit = defaultLimit;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public List<ProviderProfile> findMatches(MatchRequest request) {
        return findMatches(request, defaultLimit);
    }

    public List<ProviderProfile> findMatches(MatchRequest request, int limit) {
        return rankProviders(request, limit).stream()
                .map(ScoredProvider::getProvider)
                .toList();
    }

    public List<ProviderProfile> findMatchesNearAddress(Long categoryId, Long addressId, int limit) {
        return rankProvidersNearAddress(categoryId, addressId, limit).stream()
                .map(ScoredProvider::getProvider)
                .toList();
    }

    /**
     * Like {@link #rankProviders} but takes the customer location from a stored address.
     * An address without coordinates is treated as an unknown location.
     */
    @Transactional(readOnly = true)
    public List<ScoredProvider> rankProvidersNearAddress(Long categoryId, Long addressId, int limit) {
        Address address = addressRepository.findById(addressId)
                .orElseThrow(() -> new NotFoundException("Address", addressId));
        MatchRequest request = MatchRequest.builder()
                .categoryId(categoryId)
                .customerLocation(address.toCoordinate().orElse(null))
                .build();
        return rankProviders(request, limit);
    }

    @Transactional(readOnly = true)
    public List<ScoredProvider> rankProviders(MatchRequest request, int limit) {
        if (request == null || request.getCategoryId() == null) {
            throw new ValidationException("categoryId is required");
        }
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1, got " + limit);
        }
        return metrics.getMatchLatencyTimer().record(() -> rank(request, limit));
    }

    private List<ScoredProvider> rank(MatchRequest request, int limit) {
        Long categoryId = request.getCategoryId();

        List<ProviderOffering> offerings = offeringRepository.findByCategoryId(categoryId);
        if (offerings.isEmpty()) {
            log.debug("No offerings for category {}", categoryId);
            metrics.recordEmpty();
            return List.of();
        }

        Map<Long, BigDecimal> priceByProvider = new LinkedHashMap<>();
        for (ProviderOffering offering : offerings) {
            priceByProvider.putIfAbsent(offering.getProviderId(), offering.getPriceRate());
        }

        List<ProviderProfile> eligible =
                providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(priceByProvider.keySet());
        if (eligible.isEmpty()) {
            log.debug("No available, verified providers among {} offering category {}",
                    priceByProvider.size(), categoryId);
            metrics.recordEmpty();
            return List.of();
        }

        double categoryAvgPrice = averagePrice(offerings);

        List<ScoredProvider> ranked = eligible.stream()
                .map(provider -> ProviderCandidate.builder()
                        .provider(provider)
                        .priceRate(priceByProvider.get(provider.getId()))
                        .location(locate(provider.getId()))
                        .build())
                .map(candidate -> ScoredProvider.builder()
                        .provider(candidate.getProvider())
                        .priceRate(candidate.getPriceRate())
                        .distanceKm(candidate.distanceKmTo(request.getCustomerLocation()))
                        .score(scoringService.score(candidate, request, categoryAvgPrice))
                        .build())
                .sorted(RANKING)
                .limit(limit)
                .toList();

        metrics.recordMatched(eligible.size());
        log.debug("Ranked {} of {} eligible providers for category {} (avgPrice={})",
                ranked.size(), eligible.size(), categoryId, categoryAvgPrice);
        return ranked;
    }

    /**
     * A stored partial or out-of-range coordinate counts as an unknown location.
     */
    private Coordinate locate(Long providerId) {
        Optional<Address> address = addressRepository.findFirstByProviderIdOrderByIdAsc(providerId);
        if (address.isEmpty()) {
            return null;
        }
        try {
            return address.get().toCoordinate().orElse(null);
        } catch (ValidationException e) {
            log.warn("Ignoring location of provider {} (address {}): {}",
                    providerId, address.get().getId(), e.getMessage());
            return null;
        }
    }

    static double averagePrice(List<ProviderOffering> offerings) {
        return offerings.stream()
                .map(ProviderOffering::getPriceRate)
                .mapToDouble(BigDecimal::doubleValue)
                .average()
                .orElse(0.0);
    }
}
