package com.homeservices.marketplace.controller;

import com.homeservices.marketplace.model.Coordinate;
import com.homeservices.marketplace.model.MatchRequest;
import com.homeservices.marketplace.model.ScoredProvider;
import com.homeservices.marketplace.service.ProviderMatchingService;
import com.homeservices.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchController {

    private final ProviderMatchingService matchingService;

    /**
     * Ranked providers for a category. The customer location comes from
     * addressId when given, else from lat/lng, else it is unknown.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ScoredProvider>>> findMatches(
            @RequestParam("categoryId") Long categoryId,
            @RequestParam(value = "lat", required = false) Double lat,
            @RequestParam(value = "lng", required = false) Double lng,
            @RequestParam(value = "addressId", required = false) Long addressId,
            @RequestParam(value = "limit", required = false) Integer limit) {

        int effectiveLimit = limit != null ? limit : matchingService.getDefaultLimit();
        if (addressId != null) {
            return ResponseEntity.ok(ApiResponse.ok(
                    matchingService.rankProvidersNearAddress(categoryId, addressId, effectiveLimit)));
        }

        MatchRequest request = MatchRequest.builder()
                .categoryId(categoryId)
                .customerLocation(Coordinate.ofNullable(lat, lng).orElse(null))
                .build();
        return ResponseEntity.ok(ApiResponse.ok(matchingService.rankProviders(request, effectiveLimit)));
    }
}
