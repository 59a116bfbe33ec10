package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Address;
import com.homeservices.marketplace.entity.ProviderOffering;
import com.homeservices.marketplace.entity.ProviderProfile;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.marketplace.metrics.MatchingMetrics;
import com.homeservices.marketplace.model.Coordinate;
import com.homeservices.marketplace.model.MatchRequest;
import com.homeservices.marketplace.model.ScoredProvider;
import com.homeservices.marketplace.repository.AddressRepository;
import com.homeservices.marketplace.repository.ProviderOfferingRepository;
import com.homeservices.marketplace.repository.ProviderProfileRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderMatchingServiceTest {

    private static final long PLUMBING = 1L;
    private static final Coordinate HOME = new Coordinate(40.7128, -74.0060);

    @Mock private ProviderOfferingRepository offeringRepository;
    @Mock private ProviderProfileRepository providerRepository;
    @Mock private AddressRepository addressRepository;

    private SimpleMeterRegistry meterRegistry;
    private ProviderMatchingService matcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        matcher = new ProviderMatchingService(offeringRepository, providerRepository, addressRepository,
                new ProviderScoringService(), new MatchingMetrics(meterRegistry), 5);
    }

    @Test
    @DisplayName("Category with no offerings yields an empty list without loading providers")
    void noOfferings() {
        when(offeringRepository.findByCategoryId(PLUMBING)).thenReturn(List.of());

        assertThat(matcher.findMatches(request(HOME))).isEmpty();
        verify(providerRepository, never()).findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection());
        assertThat(meterRegistry.get("marketplace.match.requests").tag("result", "empty").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Offerings whose providers are all unavailable or unverified yield an empty list")
    void noEligibleProviders() {
        when(offeringRepository.findByCategoryId(PLUMBING)).thenReturn(List.of(offering(1L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection())).thenReturn(List.of());

        assertThat(matcher.findMatches(request(HOME))).isEmpty();
    }

    @Test
    @DisplayName("Providers are ordered by score, highest first")
    void orderedByScore() {
        when(offeringRepository.findByCategoryId(PLUMBING))
                .thenReturn(List.of(offering(1L, "50"), offering(2L, "50"), offering(3L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection())).thenReturn(List.of(
                provider(1L, "3.00", 2),
                provider(2L, "5.00", 10),
                provider(3L, "4.00", 5)));

        List<ProviderProfile> matches = matcher.findMatches(request(null));

        assertThat(matches).extracting(ProviderProfile::getId).containsExactly(2L, 3L, 1L);
    }

    @Test
    @DisplayName("Equal scores are broken by ascending provider id")
    void tieBrokenByProviderId() {
        when(offeringRepository.findByCategoryId(PLUMBING))
                .thenReturn(List.of(offering(9L, "50"), offering(4L, "50"), offering(7L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection())).thenReturn(List.of(
                provider(9L, "4.00", 3),
                provider(4L, "4.00", 3),
                provider(7L, "4.00", 3)));

        List<ProviderProfile> matches = matcher.findMatches(request(null));

        assertThat(matches).extracting(ProviderProfile::getId).containsExactly(4L, 7L, 9L);
    }

    @Test
    @DisplayName("Result is truncated to the limit")
    void truncatedToLimit() {
        when(offeringRepository.findByCategoryId(PLUMBING))
                .thenReturn(List.of(offering(1L, "50"), offering(2L, "50"), offering(3L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection())).thenReturn(List.of(
                provider(1L, "3.00", 2),
                provider(2L, "5.00", 10),
                provider(3L, "4.00", 5)));

        assertThat(matcher.findMatches(request(null), 2))
                .extracting(ProviderProfile::getId)
                .containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("Category average includes offerings of ineligible providers")
    void averageOverAllOfferings() {
        // avg = (50 + 150) / 2 = 100, so provider 1 has r = 0.5 -> price 22.5
        when(offeringRepository.findByCategoryId(PLUMBING))
                .thenReturn(List.of(offering(1L, "50"), offering(2L, "150")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection()))
                .thenReturn(List.of(provider(1L, null, 0)));

        List<ScoredProvider> ranked = matcher.rankProviders(request(null), 5);

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).getScore()).isCloseTo(20.0 + 22.5, within(1e-9));
        assertThat(ranked.get(0).getPriceRate()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Each provider is scored against its own registered location")
    void eachProviderUsesOwnLocation() {
        when(offeringRepository.findByCategoryId(PLUMBING))
                .thenReturn(List.of(offering(1L, "50"), offering(2L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection()))
                .thenReturn(List.of(provider(1L, "4.00", 5), provider(2L, "4.00", 5)));
        when(addressRepository.findFirstByProviderIdOrderByIdAsc(1L))
                .thenReturn(Optional.of(address(1L, 40.90, -74.00)));   // ~21 km
        when(addressRepository.findFirstByProviderIdOrderByIdAsc(2L))
                .thenReturn(Optional.of(address(2L, 40.72, -74.00)));   // ~1 km

        List<ScoredProvider> ranked = matcher.rankProviders(request(HOME), 5);

        assertThat(ranked).extracting(ScoredProvider::getProviderId).containsExactly(2L, 1L);
        assertThat(ranked.get(0).getDistanceKm()).isLessThan(5.0);
        assertThat(ranked.get(1).getDistanceKm()).isGreaterThan(20.0);
        assertThat(ranked.get(0).getScore() - ranked.get(1).getScore()).isCloseTo(15.0, within(1e-9));
    }

    @Test
    @DisplayName("Provider without a registered address has an unknown distance")
    void providerWithoutAddress() {
        when(offeringRepository.findByCategoryId(PLUMBING)).thenReturn(List.of(offering(1L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection()))
                .thenReturn(List.of(provider(1L, "4.00", 5)));

        List<ScoredProvider> ranked = matcher.rankProviders(request(HOME), 5);

        assertThat(ranked.get(0).getDistanceKm()).isNull();
    }

    @Test
    @DisplayName("Provider address with only one coordinate is treated as an unknown location")
    void providerWithPartialCoordinate() {
        when(offeringRepository.findByCategoryId(PLUMBING))
                .thenReturn(List.of(offering(1L, "50"), offering(2L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection()))
                .thenReturn(List.of(provider(1L, "4.00", 5), provider(2L, "4.00", 5)));
        Address partial = Address.builder()
                .providerId(1L).addressLine("2 Broken Rd").city("New York").latitude(40.71).build();
        when(addressRepository.findFirstByProviderIdOrderByIdAsc(1L)).thenReturn(Optional.of(partial));
        when(addressRepository.findFirstByProviderIdOrderByIdAsc(2L))
                .thenReturn(Optional.of(address(2L, 40.72, -74.00)));

        List<ScoredProvider> ranked = matcher.rankProviders(request(HOME), 5);

        assertThat(ranked).extracting(ScoredProvider::getProviderId).containsExactly(2L, 1L);
        assertThat(ranked.get(1).getDistanceKm()).isNull();
        assertThat(ranked.get(0).getScore() - ranked.get(1).getScore()).isCloseTo(15.0, within(1e-9));
    }

    @Test
    @DisplayName("Missing category or a limit below 1 is rejected")
    void invalidInput() {
        assertThatThrownBy(() -> matcher.rankProviders(MatchRequest.builder().build(), 5))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> matcher.findMatches(request(HOME), 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Matching near an unknown address fails with NotFoundException")
    void unknownAddress() {
        when(addressRepository.findById(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> matcher.findMatchesNearAddress(PLUMBING, 42L, 5))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Matching near a stored address uses that address as the customer location")
    void nearStoredAddress() {
        when(addressRepository.findById(100L)).thenReturn(Optional.of(address(null, 40.7128, -74.0060)));
        when(offeringRepository.findByCategoryId(PLUMBING)).thenReturn(List.of(offering(1L, "50")));
        when(providerRepository.findByIdInAndAvailableTrueAndVerifiedTrue(anyCollection()))
                .thenReturn(List.of(provider(1L, "4.00", 5)));
        when(addressRepository.findFirstByProviderIdOrderByIdAsc(1L))
                .thenReturn(Optional.of(address(1L, 40.72, -74.00)));

        List<ScoredProvider> ranked = matcher.rankProvidersNearAddress(PLUMBING, 100L, 5);

        assertThat(ranked.get(0).getDistanceKm()).isLessThan(5.0);
    }

    private static MatchRequest request(Coordinate location) {
        return MatchRequest.builder().categoryId(PLUMBING).customerLocation(location).build();
    }

    private static ProviderOffering offering(Long providerId, String price) {
        return ProviderOffering.builder()
                .providerId(providerId)
                .categoryId(PLUMBING)
                .priceRate(new BigDecimal(price))
                .build();
    }

    private static ProviderProfile provider(Long id, String rating, int years) {
        return ProviderProfile.builder()
                .id(id)
                .firstName("Provider")
                .lastName(String.valueOf(id))
                .experienceYears(years)
                .available(true)
                .verified(true)
                .averageRating(rating != null ? new BigDecimal(rating) : null)
                .build();
    }

    private static Address address(Long providerId, double lat, double lng) {
        return Address.builder()
                .providerId(providerId)
                .addressLine("1 Main St")
                .city("New York")
                .latitude(lat)
                .longitude(lng)
                .build();
    }
}
