package com.homeservices.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRatedEvent {

    private String bookingId;
    private Long customerId;
    private Long providerId;
    private int rating;
    private String comment;

    /** Provider aggregate after this rating was counted. */
    private BigDecimal providerAverageRating;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant ratedAt;
}
