package com.homeservices.marketplace.model;

import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.shared.util.GeoUtil;

import java.util.Optional;

/**
 * A point on the earth in signed decimal degrees. An unknown location is
 * modelled as an absent Coordinate, never as (0, 0).
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (!GeoUtil.isValidLatitude(latitude)) {
            throw new ValidationException("latitude out of range [-90, 90]: " + latitude);
        }
        if (!GeoUtil.isValidLongitude(longitude)) {
            throw new ValidationException("longitude out of range [-180, 180]: " + longitude);
        }
    }

    /**
     * Both null means unknown. Exactly one null is malformed input.
     */
    public static Optional<Coordinate> ofNullable(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return Optional.empty();
        }
        if (latitude == null || longitude == null) {
            throw new ValidationException("latitude and longitude must be given together");
        }
        return Optional.of(new Coordinate(latitude, longitude));
    }

    public double distanceKmTo(Coordinate other) {
        return GeoUtil.distanceKm(latitude, longitude, other.latitude, other.longitude);
    }
}
