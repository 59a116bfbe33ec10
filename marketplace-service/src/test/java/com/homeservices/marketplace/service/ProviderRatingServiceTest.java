package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Booking;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.repository.BookingRepository;
import com.homeservices.marketplace.repository.ProviderProfileRepository;
import com.homeservices.shared.enums.BookingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderRatingServiceTest {

    private static final long PROVIDER_ID = 20L;

    @Mock private BookingRepository bookingRepository;
    @Mock private ProviderProfileRepository providerRepository;

    private ProviderRatingService ratingService;

    @BeforeEach
    void setUp() {
        ratingService = new ProviderRatingService(bookingRepository, providerRepository);
    }

    @Test
    @DisplayName("Average of 5, 4, 4 is 4.33 (HALF_UP, 2 decimals)")
    void averageRoundedHalfUp() {
        when(bookingRepository.findByProviderIdAndStatusAndRatingIsNotNull(PROVIDER_ID, BookingStatus.COMPLETED))
                .thenReturn(rated(5, 4, 4));
        when(providerRepository.updateAverageRating(PROVIDER_ID, new BigDecimal("4.33"))).thenReturn(1);

        Optional<BigDecimal> average = ratingService.recomputeAverage(PROVIDER_ID);

        assertThat(average).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("4.33"));
    }

    @Test
    @DisplayName("Average of 4 and 5 rounds half up to 4.50")
    void averageExactHalf() {
        assertThat(ProviderRatingService.averageOf(List.of(4, 5))).isEqualByComparingTo("4.50");
        assertThat(ProviderRatingService.averageOf(List.of(1, 2, 2))).isEqualByComparingTo("1.67");
        assertThat(ProviderRatingService.averageOf(List.of(3))).isEqualByComparingTo("3.00");
    }

    @Test
    @DisplayName("No rated bookings clears the average")
    void noRatingsClearsAverage() {
        when(bookingRepository.findByProviderIdAndStatusAndRatingIsNotNull(PROVIDER_ID, BookingStatus.COMPLETED))
                .thenReturn(List.of());
        when(providerRepository.updateAverageRating(PROVIDER_ID, null)).thenReturn(1);

        assertThat(ratingService.recomputeAverage(PROVIDER_ID)).isEmpty();
        verify(providerRepository).updateAverageRating(any(), isNull());
    }

    @Test
    @DisplayName("Unknown provider fails with NotFoundException")
    void unknownProvider() {
        when(bookingRepository.findByProviderIdAndStatusAndRatingIsNotNull(PROVIDER_ID, BookingStatus.COMPLETED))
                .thenReturn(rated(3));
        when(providerRepository.updateAverageRating(any(), any())).thenReturn(0);

        assertThatThrownBy(() -> ratingService.recomputeAverage(PROVIDER_ID))
                .isInstanceOf(NotFoundException.class);
    }

    private static List<Booking> rated(Integer... ratings) {
        return Arrays.stream(ratings)
                .map(r -> Booking.builder().providerId(PROVIDER_ID).status(BookingStatus.COMPLETED).rating(r).build())
                .toList();
    }
}
