package com.homeservices.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String BOOKING_CREATED    = "booking.created";
    public static final String BOOKING_CONFIRMED  = "booking.confirmed";
    public static final String BOOKING_CANCELLED  = "booking.cancelled";
    public static final String BOOKING_COMPLETED  = "booking.completed";
    public static final String BOOKING_RATED      = "booking.rated";
    public static final String PAYMENT_RECORDED   = "payment.recorded";
}
