package com.homeservices.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.homeservices.shared.enums.PaymentMethod;
import com.homeservices.shared.enums.PaymentStatus;
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
public class PaymentEvent {

    private String paymentId;
    private String bookingId;
    private Long customerId;
    private BigDecimal amount;
    private PaymentMethod paymentMethod;
    private String transactionId;
    private PaymentStatus status;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;
}
