package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Booking;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.repository.BookingRepository;
import com.homeservices.marketplace.repository.ProviderProfileRepository;
import com.homeservices.shared.enums.BookingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Maintains ProviderProfile.averageRating.
 *
 * The aggregate is always rebuilt from every completed, rated booking of the
 * provider, never adjusted incrementally. Callers must serialise calls per
 * provider (BookingLifecycleService holds a per-provider lock).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderRatingService {

    private static final int SCALE = 2;

    private final BookingRepository bookingRepository;
    private final ProviderProfileRepository providerRepository;

    @Transactional
    public Optional<BigDecimal> recomputeAverage(Long providerId) {
        List<Integer> ratings = bookingRepository
                .findByProviderIdAndStatusAndRatingIsNotNull(providerId, BookingStatus.COMPLETED)
                .stream()
                .map(Booking::getRating)
                .toList();

        BigDecimal average = averageOf(ratings);
        if (providerRepository.updateAverageRating(providerId, average) == 0) {
            throw new NotFoundException("Provider", providerId);
        }

        log.info("Provider {} average rating recomputed over {} ratings: {}", providerId, ratings.size(), average);
        return Optional.ofNullable(average);
    }

    /**
     * Arithmetic mean rounded half-up to 2 decimals; null for no ratings.
     */
    static BigDecimal averageOf(List<Integer> ratings) {
        if (ratings.isEmpty()) {
            return null;
        }
        long sum = 0;
        for (Integer rating : ratings) {
            sum += rating;
        }
        return BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(ratings.size()), SCALE, RoundingMode.HALF_UP);
    }
}
