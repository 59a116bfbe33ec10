package com.homeservices.marketplace.model;

import lombok.Builder;
import lombok.Data;

/**
 * What the customer asked for. customerLocation is null when unknown.
 */
@Data
@Builder
public class MatchRequest {

    private Long categoryId;
    private Coordinate customerLocation;
}
