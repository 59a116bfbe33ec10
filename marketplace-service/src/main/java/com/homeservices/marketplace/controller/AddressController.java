package com.homeservices.marketplace.controller;

import com.homeservices.marketplace.entity.Address;
import com.homeservices.marketplace.model.CreateAddressRequest;
import com.homeservices.marketplace.service.AddressService;
import com.homeservices.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/addresses")
@RequiredArgsConstructor
public class AddressController {

    private final AddressService addressService;

    @PostMapping
    public ResponseEntity<ApiResponse<Address>> createAddress(@Valid @RequestBody CreateAddressRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(addressService.createAddress(request)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Address>>> listCustomerAddresses(@RequestParam("customerId") Long customerId) {
        return ResponseEntity.ok(ApiResponse.ok(addressService.listCustomerAddresses(customerId)));
    }
}
