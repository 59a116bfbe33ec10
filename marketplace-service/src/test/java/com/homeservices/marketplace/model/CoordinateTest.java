package com.homeservices.marketplace.model;

import com.homeservices.marketplace.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CoordinateTest {

    @Test
    @DisplayName("Latitude outside [-90, 90] is rejected")
    void latitudeOutOfRange() {
        assertThatThrownBy(() -> new Coordinate(90.5, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("latitude");
    }

    @Test
    @DisplayName("Longitude outside [-180, 180] is rejected")
    void longitudeOutOfRange() {
        assertThatThrownBy(() -> new Coordinate(0, -181))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("longitude");
    }

    @Test
    @DisplayName("Both components null means unknown location, not (0, 0)")
    void bothNullIsEmpty() {
        assertThat(Coordinate.ofNullable(null, null)).isEmpty();
    }

    @Test
    @DisplayName("Only one component given is malformed")
    void halfCoordinateRejected() {
        assertThatThrownBy(() -> Coordinate.ofNullable(12.0, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Coordinate.ofNullable(null, 12.0)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("(0, 0) is a valid known location")
    void zeroZeroIsKnown() {
        assertThat(Coordinate.ofNullable(0.0, 0.0)).contains(new Coordinate(0, 0));
    }

    @Test
    @DisplayName("distanceKmTo delegates to the haversine distance")
    void distance() {
        assertThat(new Coordinate(0, 0).distanceKmTo(new Coordinate(0, 1))).isCloseTo(111.19, within(0.5));
    }
}
