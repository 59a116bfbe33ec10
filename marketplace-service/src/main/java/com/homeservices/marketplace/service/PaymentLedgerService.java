package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Payment;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.exception.PreconditionFailedException;
import com.homeservices.marketplace.exception.PreconditionFailedException.Reason;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.marketplace.repository.PaymentRepository;
import com.homeservices.shared.enums.PaymentMethod;
import com.homeservices.shared.enums.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Local payment ledger. There is no gateway behind it: an entry records that
 * the customer committed to pay the offering price when confirming.
 *
 * At most one entry per booking. The existence check covers the common case;
 * the unique constraint on payments.booking_id covers a concurrent insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentLedgerService {

    private static final String TRANSACTION_PREFIX = "TXN-";

    private final PaymentRepository paymentRepository;

    @Transactional
    public Payment record(UUID bookingId, BigDecimal amount, PaymentMethod method) {
        if (bookingId == null || method == null) {
            throw new ValidationException("bookingId and payment method are required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("payment amount must be positive, got " + amount);
        }
        if (paymentRepository.existsByBookingId(bookingId)) {
            throw new PreconditionFailedException(Reason.ALREADY_PAID,
                    "Booking " + bookingId + " already has a payment");
        }

        Payment payment = Payment.builder()
                .bookingId(bookingId)
                .amount(amount)
                .paymentMethod(method)
                .transactionId(TRANSACTION_PREFIX + UUID.randomUUID())
                .status(PaymentStatus.SUCCESSFUL)
                .build();

        try {
            payment = paymentRepository.saveAndFlush(payment);
        } catch (DataIntegrityViolationException e) {
            throw new PreconditionFailedException(Reason.ALREADY_PAID,
                    "Booking " + bookingId + " already has a payment", e);
        }

        log.info("Payment {} recorded for booking {}: amount={} method={} txn={}",
                payment.getId(), bookingId, amount, method, payment.getTransactionId());
        return payment;
    }

    @Transactional(readOnly = true)
    public Payment findByBooking(UUID bookingId) {
        return paymentRepository.findByBookingId(bookingId)
                .orElseThrow(() -> new NotFoundException("Payment", "for booking " + bookingId));
    }
}
