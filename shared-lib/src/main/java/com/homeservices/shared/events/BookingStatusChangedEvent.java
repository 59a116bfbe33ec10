package com.homeservices.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.homeservices.shared.enums.BookingStatus;
import com.homeservices.shared.enums.CallerRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingStatusChangedEvent {

    private String bookingId;
    private Long customerId;
    private Long providerId;
    private Long categoryId;
    private BookingStatus previousStatus;
    private BookingStatus status;
    private CallerRole changedBy;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private LocalDate bookingDate;

    private String timeSlot;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
