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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Stores customer and provider addresses. Explicit coordinates win;
 * otherwise the address text is geocoded, and a geocoding failure leaves
 * the location unknown rather than failing the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AddressService {

    private final AddressRepository addressRepository;
    private final CustomerRepository customerRepository;
    private final ProviderProfileRepository providerRepository;
    private final GeocodingClient geocodingClient;

    @Transactional
    public Address createAddress(CreateAddressRequest request) {
        if (request == null) {
            throw new ValidationException("address request is required");
        }
        boolean forCustomer = request.getCustomerId() != null;
        boolean forProvider = request.getProviderId() != null;
        if (forCustomer == forProvider) {
            throw new ValidationException("exactly one of customerId or providerId must be set");
        }
        if (isBlank(request.getAddressLine()) || isBlank(request.getCity())) {
            throw new ValidationException("addressLine and city are required");
        }
        if (forCustomer && !customerRepository.existsById(request.getCustomerId())) {
            throw new NotFoundException("Customer", request.getCustomerId());
        }
        if (forProvider && !providerRepository.existsById(request.getProviderId())) {
            throw new NotFoundException("Provider", request.getProviderId());
        }

        Address address = Address.builder()
                .customerId(request.getCustomerId())
                .providerId(request.getProviderId())
                .addressLine(request.getAddressLine().trim())
                .city(request.getCity().trim())
                .state(request.getState())
                .postalCode(request.getPostalCode())
                .build();

        Coordinate location = Coordinate.ofNullable(request.getLatitude(), request.getLongitude())
                .or(() -> geocode(address.toSingleLine()))
                .orElse(null);
        if (location != null) {
            address.setLatitude(location.latitude());
            address.setLongitude(location.longitude());
        }

        Address saved = addressRepository.save(address);
        log.info("Address {} stored for {} {} (located={})", saved.getId(),
                forCustomer ? "customer" : "provider",
                forCustomer ? request.getCustomerId() : request.getProviderId(),
                location != null);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Address> listCustomerAddresses(Long customerId) {
        return addressRepository.findByCustomerId(customerId);
    }

    private Optional<Coordinate> geocode(String addressText) {
        try {
            return geocodingClient.geocode(addressText);
        } catch (DependencyUnavailableException e) {
            log.warn("Geocoding failed for '{}' [{}], storing address without location", addressText, e.getCode());
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
