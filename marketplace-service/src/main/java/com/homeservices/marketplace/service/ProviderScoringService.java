package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.ProviderProfile;
import com.homeservices.marketplace.model.MatchRequest;
import com.homeservices.marketplace.model.ProviderCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Fitness score of a provider for one match request (higher = better).
 *
 * Score formula:
 *   score = rating      (max 40)  (avgRating / 5) * 40, or 20 when unrated
 *         + experience  (max 30)  min(30, years * 3)
 *         + price       (max 30)  r = price / categoryAvg
 *                                   r below 1  : 30 * (1 - r/2)
 *                                   r 1 or more: max(0, 30 * (2 - r))
 *         + proximity   (0..15)   +15 under 5 km, +10 under 10 km, +5 under 20 km
 *
 * The sum is not clamped: a top-rated, 10-year, free provider next door
 * scores 115. Scores only need to be comparable within one request.
 */
@Slf4j
@Service
public class ProviderScoringService {

    static final double MAX_RATING_SCORE       = 40.0;
    static final double UNRATED_SCORE          = 20.0;
    static final double MAX_EXPERIENCE_SCORE   = 30.0;
    static final double POINTS_PER_YEAR        = 3.0;
    static final double MAX_PRICE_SCORE        = 30.0;
    private static final double RATING_SCALE   = 5.0;

    public double score(ProviderCandidate candidate, MatchRequest request, double categoryAvgPrice) {
        ProviderProfile provider = candidate.getProvider();
        Double distanceKm = candidate.distanceKmTo(request.getCustomerLocation());

        double rating     = ratingScore(provider.getAverageRating());
        double experience = experienceScore(provider.getExperienceYears());
        double price      = priceScore(candidate.getPriceRate(), categoryAvgPrice);
        double proximity  = proximityBonus(distanceKm);
        double total      = rating + experience + price + proximity;

        log.debug("Scored provider {}: rating={} experience={} price={} proximity={} (dist={}km) total={}",
                provider.getId(), rating, experience, price, proximity, distanceKm, total);
        return total;
    }

    double ratingScore(BigDecimal averageRating) {
        if (averageRating == null || averageRating.signum() == 0) {
            return UNRATED_SCORE;
        }
        return (averageRating.doubleValue() / RATING_SCALE) * MAX_RATING_SCORE;
    }

    double experienceScore(int experienceYears) {
        return Math.min(MAX_EXPERIENCE_SCORE, Math.max(0, experienceYears) * POINTS_PER_YEAR);
    }

    /**
     * Zero when the provider has no price for the category or the average is unknown.
     * A ratio of exactly 1 takes the "not cheaper" branch and earns the full 30.
     */
    double priceScore(BigDecimal priceRate, double categoryAvgPrice) {
        if (priceRate == null || categoryAvgPrice <= 0) {
            return 0.0;
        }
        double ratio = priceRate.doubleValue() / categoryAvgPrice;
        if (ratio < 1) {
            return MAX_PRICE_SCORE * (1 - ratio / 2);
        }
        return Math.max(0.0, MAX_PRICE_SCORE * (2 - ratio));
    }

    double proximityBonus(Double distanceKm) {
        if (distanceKm == null) {
            return 0.0;
        }
        if (distanceKm < 5) {
            return 15.0;
        }
        if (distanceKm < 10) {
            return 10.0;
        }
        if (distanceKm < 20) {
            return 5.0;
        }
        return 0.0;
    }
}
