package com.homeservices.marketplace.geocoding;

import com.homeservices.marketplace.model.Coordinate;

import java.util.Optional;

/**
 * Turns free-form address text into a coordinate.
 */
public interface GeocodingClient {

    /**
     * @return the best match, or empty when the address is unknown to the geocoder
     * @throws com.homeservices.marketplace.exception.DependencyUnavailableException
     *         when the geocoder cannot be reached
     */
    Optional<Coordinate> geocode(String addressText);
}
