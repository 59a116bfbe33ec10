package com.homeservices.marketplace.metrics;

import com.homeservices.marketplace.exception.PreconditionFailedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer metrics for the booking lifecycle.
 *
 *   marketplace_booking_transitions_total{transition="created|confirmed|cancelled|completed|rated"}
 *   marketplace_booking_rejections_total{reason="INVALID_STATE|NOT_AUTHORIZED|..."}
 *   marketplace_payments_recorded_total
 */
@Component
public class BookingMetrics {

    private final Counter createdCounter;
    private final Counter confirmedCounter;
    private final Counter cancelledCounter;
    private final Counter completedCounter;
    private final Counter ratedCounter;
    private final Counter paymentRecordedCounter;
    private final Map<PreconditionFailedException.Reason, Counter> rejectionCounters =
            new EnumMap<>(PreconditionFailedException.Reason.class);

    public BookingMetrics(MeterRegistry registry) {
        this.createdCounter   = transitionCounter(registry, "created");
        this.confirmedCounter = transitionCounter(registry, "confirmed");
        this.cancelledCounter = transitionCounter(registry, "cancelled");
        this.completedCounter = transitionCounter(registry, "completed");
        this.ratedCounter     = transitionCounter(registry, "rated");

        this.paymentRecordedCounter = Counter.builder("marketplace.payments.recorded")
                .description("Ledger entries written on booking confirmation")
                .register(registry);

        for (PreconditionFailedException.Reason reason : PreconditionFailedException.Reason.values()) {
            rejectionCounters.put(reason, Counter.builder("marketplace.booking.rejections")
                    .tag("reason", reason.name())
                    .description("Booking operations refused by a precondition")
                    .register(registry));
        }
    }

    private static Counter transitionCounter(MeterRegistry registry, String transition) {
        return Counter.builder("marketplace.booking.transitions")
                .tag("transition", transition)
                .description("Successful booking lifecycle transitions")
                .register(registry);
    }

    public void recordCreated()          { createdCounter.increment(); }
    public void recordConfirmed()        { confirmedCounter.increment(); }
    public void recordCancelled()        { cancelledCounter.increment(); }
    public void recordCompleted()        { completedCounter.increment(); }
    public void recordRated()            { ratedCounter.increment(); }
    public void recordPaymentRecorded()  { paymentRecordedCounter.increment(); }

    public void recordRejection(PreconditionFailedException.Reason reason) {
        rejectionCounters.get(reason).increment();
    }
}
