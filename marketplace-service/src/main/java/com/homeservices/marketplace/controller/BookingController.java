package com.homeservices.marketplace.controller;

import com.homeservices.marketplace.entity.Booking;
import com.homeservices.marketplace.entity.Payment;
import com.homeservices.marketplace.model.Caller;
import com.homeservices.marketplace.model.ConfirmBookingRequest;
import com.homeservices.marketplace.model.CreateBookingRequest;
import com.homeservices.marketplace.model.RateBookingRequest;
import com.homeservices.marketplace.service.BookingLifecycleService;
import com.homeservices.shared.dto.ApiResponse;
import com.homeservices.shared.enums.CallerRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    static final String CALLER_ID_HEADER   = "X-Caller-Id";
    static final String CALLER_ROLE_HEADER = "X-Caller-Role";

    private final BookingLifecycleService bookingService;

    @PostMapping
    public ResponseEntity<ApiResponse<Booking>> createBooking(
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole,
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        Booking booking = bookingService.createBooking(new Caller(callerRole, callerId), request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(booking));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Booking>>> listBookings(
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.listBookings(new Caller(callerRole, callerId))));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<Booking>> getBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.getBooking(new Caller(callerRole, callerId), bookingId)));
    }

    @GetMapping("/{bookingId}/payment")
    public ResponseEntity<ApiResponse<Payment>> getPayment(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.getPayment(new Caller(callerRole, callerId), bookingId)));
    }

    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<ApiResponse<Booking>> confirmBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole,
            @Valid @RequestBody ConfirmBookingRequest request) {

        Caller caller = new Caller(callerRole, callerId);
        return ResponseEntity.ok(ApiResponse.ok(
                bookingService.confirmBooking(caller, bookingId, request.getPaymentMethod())));
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<Booking>> cancelBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.cancelBooking(new Caller(callerRole, callerId), bookingId)));
    }

    @PostMapping("/{bookingId}/complete")
    public ResponseEntity<ApiResponse<Booking>> completeBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.completeBooking(new Caller(callerRole, callerId), bookingId)));
    }

    @PostMapping("/{bookingId}/rate")
    public ResponseEntity<ApiResponse<Booking>> rateBooking(
            @PathVariable("bookingId") UUID bookingId,
            @RequestHeader(CALLER_ID_HEADER) Long callerId,
            @RequestHeader(CALLER_ROLE_HEADER) CallerRole callerRole,
            @Valid @RequestBody RateBookingRequest request) {

        Caller caller = new Caller(callerRole, callerId);
        return ResponseEntity.ok(ApiResponse.ok(
                bookingService.rateBooking(caller, bookingId, request.getRating(), request.getComment())));
    }
}
