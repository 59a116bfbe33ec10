package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Address;
import com.homeservices.marketplace.exception.DependencyUnavailableException;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.marketplace.geocoding.GeocodingClient;
import com.homeservices.marketplace.model.Coordinate;
import com.homeservices.marketplace.model.CreateAddressRequest;
import com.homeservices.marketplace.repository.AddressRepository;
import com.homeservices.marketplace.repository.CustomerRepository;
import com.homeservices.marketplace.repository.ProviderProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AddressServiceTest {

    @Mock private AddressRepository addressRepository;
    @Mock private CustomerRepository customerRepository;
    @Mock private ProviderProfileRepository providerRepository;
    @Mock private GeocodingClient geocodingClient;

    private AddressService addressService;

    @BeforeEach
    void setUp() {
        addressService = new AddressService(addressRepository, customerRepository, providerRepository, geocodingClient);
    }

    @Test
    @DisplayName("Explicit coordinates are stored as given and the geocoder is not called")
    void explicitCoordinates() {
        when(customerRepository.existsById(10L)).thenReturn(true);
        when(addressRepository.save(any(Address.class))).thenAnswer(inv -> inv.getArgument(0));

        Address saved = addressService.createAddress(request(10L, null, 40.7, -74.0));

        assertThat(saved.getLatitude()).isEqualTo(40.7);
        assertThat(saved.getLongitude()).isEqualTo(-74.0);
        verifyNoInteractions(geocodingClient);
    }

    @Test
    @DisplayName("Without coordinates the address text is geocoded")
    void geocodesAddressText() {
        when(providerRepository.existsById(20L)).thenReturn(true);
        when(geocodingClient.geocode("12 Oak Ave, Springfield, IL 62701"))
                .thenReturn(Optional.of(new Coordinate(39.78, -89.65)));
        when(addressRepository.save(any(Address.class))).thenAnswer(inv -> inv.getArgument(0));

        Address saved = addressService.createAddress(request(null, 20L, null, null));

        assertThat(saved.getProviderId()).isEqualTo(20L);
        assertThat(saved.toCoordinate()).contains(new Coordinate(39.78, -89.65));
    }

    @Test
    @DisplayName("Geocoder outage stores the address with an unknown location")
    void geocoderDown() {
        when(customerRepository.existsById(10L)).thenReturn(true);
        when(geocodingClient.geocode(any()))
                .thenThrow(new DependencyUnavailableException("GEOCODER_UNAVAILABLE", "connection refused"));
        when(addressRepository.save(any(Address.class))).thenAnswer(inv -> inv.getArgument(0));

        Address saved = addressService.createAddress(request(10L, null, null, null));

        assertThat(saved.getLatitude()).isNull();
        assertThat(saved.getLongitude()).isNull();
        assertThat(saved.toCoordinate()).isEmpty();
    }

    @Test
    @DisplayName("Exactly one owner must be given")
    void exactlyOneOwner() {
        assertThatThrownBy(() -> addressService.createAddress(request(null, null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> addressService.createAddress(request(10L, 20L, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Unknown customer fails with NotFoundException")
    void unknownCustomer() {
        when(customerRepository.existsById(10L)).thenReturn(false);

        assertThatThrownBy(() -> addressService.createAddress(request(10L, null, null, null)))
                .isInstanceOf(NotFoundException.class);
    }

    private static CreateAddressRequest request(Long customerId, Long providerId, Double lat, Double lng) {
        return CreateAddressRequest.builder()
                .customerId(customerId)
                .providerId(providerId)
                .addressLine("12 Oak Ave")
                .city("Springfield")
                .state("IL")
                .postalCode("62701")
                .latitude(lat)
                .longitude(lng)
                .build();
    }
}
