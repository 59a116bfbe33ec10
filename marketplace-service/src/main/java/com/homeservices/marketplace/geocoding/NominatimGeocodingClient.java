package com.homeservices.marketplace.geocoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeservices.marketplace.exception.DependencyUnavailableException;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.marketplace.model.Coordinate;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Geocoder backed by a Nominatim-compatible search endpoint
 * (GET {base}/search?q=...&format=json&limit=1).
 *
 * Nominatim returns a JSON array; lat/lon come back as strings.
 */
@Slf4j
@Component
public class NominatimGeocodingClient implements GeocodingClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String userAgent;

    public NominatimGeocodingClient(RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    @Value("${marketplace.geocoding.base-url:https://nominatim.openstreetmap.org}") String baseUrl,
                                    @Value("${marketplace.geocoding.user-agent:home-services-marketplace}") String userAgent) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.userAgent = userAgent;
    }

    @Override
    @CircuitBreaker(name = "geocoder", fallbackMethod = "geocodeFallback")
    @Retry(name = "geocoder")
    public Optional<Coordinate> geocode(String addressText) {
        if (addressText == null || addressText.isBlank()) {
            return Optional.empty();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/search")
                .queryParam("q", addressText)
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (RestClientException e) {
            throw new DependencyUnavailableException("GEOCODER_UNAVAILABLE",
                    "Geocoder request failed: " + e.getMessage(), e);
        }

        return parse(addressText, response.getBody());
    }

    /**
     * Circuit open or retries exhausted: the address is stored without a location.
     */
    public Optional<Coordinate> geocodeFallback(String addressText, Throwable cause) {
        log.warn("Geocoding unavailable for '{}': {}", addressText, cause.getMessage());
        return Optional.empty();
    }

    private Optional<Coordinate> parse(String addressText, String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DependencyUnavailableException("GEOCODER_BAD_RESPONSE",
                    "Geocoder returned malformed JSON", e);
        }

        JsonNode first = root.path(0);
        if (first.isMissingNode() || !first.hasNonNull("lat") || !first.hasNonNull("lon")) {
            log.debug("No geocoding match for '{}'", addressText);
            return Optional.empty();
        }

        try {
            double lat = Double.parseDouble(first.get("lat").asText());
            double lon = Double.parseDouble(first.get("lon").asText());
            Coordinate coordinate = new Coordinate(lat, lon);
            log.debug("Geocoded '{}' -> ({}, {})", addressText, lat, lon);
            return Optional.of(coordinate);
        } catch (NumberFormatException | ValidationException e) {
            log.warn("Geocoder returned an unusable coordinate for '{}': {}", addressText, e.getMessage());
            return Optional.empty();
        }
    }
}
