package com.homeservices.marketplace.service;

import com.homeservices.marketplace.entity.Address;
import com.homeservices.marketplace.entity.Booking;
import com.homeservices.marketplace.entity.Payment;
import com.homeservices.marketplace.entity.ProviderOffering;
import com.homeservices.marketplace.exception.DependencyUnavailableException;
import com.homeservices.marketplace.exception.NotFoundException;
import com.homeservices.marketplace.exception.PreconditionFailedException;
import com.homeservices.marketplace.exception.PreconditionFailedException.Reason;
import com.homeservices.marketplace.exception.ValidationException;
import com.homeservices.marketplace.metrics.BookingMetrics;
import com.homeservices.marketplace.model.Caller;
import com.homeservices.marketplace.model.CreateBookingRequest;
import com.homeservices.marketplace.repository.AddressRepository;
import com.homeservices.marketplace.repository.BookingRepository;
import com.homeservices.marketplace.repository.CustomerRepository;
import com.homeservices.marketplace.repository.ProviderOfferingRepository;
import com.homeservices.marketplace.repository.ProviderProfileRepository;
import com.homeservices.marketplace.repository.ServiceCategoryRepository;
import com.homeservices.shared.enums.BookingStatus;
import com.homeservices.shared.enums.CallerRole;
import com.homeservices.shared.enums.PaymentMethod;
import com.homeservices.shared.events.BookingRatedEvent;
import com.homeservices.shared.events.BookingStatusChangedEvent;
import com.homeservices.shared.events.PaymentEvent;
import com.homeservices.shared.featureflag.FeatureFlagService;
import com.homeservices.shared.util.KafkaTopics;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Booking state machine.
 *
 *   PENDING --confirm--> CONFIRMED --complete--> COMPLETED --rate (once)
 *      |                    |
 *      +------cancel--------+-----> CANCELLED
 *
 * Every status change is a conditional update on the current status, so of
 * two concurrent requests for the same transition exactly one wins and the
 * other gets INVALID_STATE. Each operation runs in one transaction; a refusal
 * leaves the booking, the ledger and the provider aggregate untouched.
 */
@Slf4j
@Service
public class BookingLifecycleService {

    static final String RATING_LOCK_PREFIX = "lock:provider-rating:";

    private static final Set<BookingStatus> CANCELLABLE = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);
    private static final Set<BookingStatus> SLOT_HOLDING = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final BookingRepository bookingRepository;
    private final CustomerRepository customerRepository;
    private final ProviderProfileRepository providerRepository;
    private final ServiceCategoryRepository categoryRepository;
    private final AddressRepository addressRepository;
    private final ProviderOfferingRepository offeringRepository;
    private final PaymentLedgerService paymentLedger;
    private final ProviderRatingService ratingService;
    private final RedissonClient redissonClient;
    private final TransactionOperations transactionOperations;
    private final FeatureFlagService featureFlagService;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final BookingMetrics metrics;
    private final Clock clock;
    private final long ratingLockWaitMs;
    private final long ratingLockLeaseMs;

    public BookingLifecycleService(BookingRepository bookingRepository,
                                   CustomerRepository customerRepository,
                                   ProviderProfileRepository providerRepository,
                                   ServiceCategoryRepository categoryRepository,
                                   AddressRepository addressRepository,
                                   ProviderOfferingRepository offeringRepository,
                                   PaymentLedgerService paymentLedger,
                                   ProviderRatingService ratingService,
                                   RedissonClient redissonClient,
                                   TransactionOperations transactionOperations,
                                   FeatureFlagService featureFlagService,
                                   KafkaTemplate<String, Object> kafkaTemplate,
                                   BookingMetrics metrics,
                                   Clock clock,
                                   @Value("${marketplace.rating.lock-wait-ms:2000}") long ratingLockWaitMs,
                                   @Value("${marketplace.rating.lock-lease-ms:10000}") long ratingLockLeaseMs) {
        this.bookingRepository = bookingRepository;
        this.customerRepository = customerRepository;
        this.providerRepository = providerRepository;
        this.categoryRepository = categoryRepository;
        this.addressRepository = addressRepository;
        this.offeringRepository = offeringRepository;
        this.paymentLedger = paymentLedger;
        this.ratingService = ratingService;
        this.redissonClient = redissonClient;
        this.transactionOperations = transactionOperations;
        this.featureFlagService = featureFlagService;
        this.kafkaTemplate = kafkaTemplate;
        this.metrics = metrics;
        this.clock = clock;
        this.ratingLockWaitMs = ratingLockWaitMs;
        this.ratingLockLeaseMs = ratingLockLeaseMs;
    }

    /**
     * Creates a PENDING booking. A repeated idempotency key from the same
     * customer returns the booking created by the first request.
     */
    @Transactional
    public Booking createBooking(Caller caller, CreateBookingRequest request, String idempotencyKey) {
        if (featureFlagService.isEnabled(FeatureFlagService.BOOKING_KILL_SWITCH, false)) {
            log.warn("Booking kill switch is ON, refusing booking from customer {}", caller.id());
            throw new DependencyUnavailableException("BOOKING_DISABLED", "Booking is temporarily disabled");
        }
        validate(request);

        if (caller.role() != CallerRole.CUSTOMER || !caller.id().equals(request.getCustomerId())) {
            throw reject(Reason.NOT_AUTHORIZED,
                    "Only customer " + request.getCustomerId() + " can book for themselves");
        }

        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            Booking existing = bookingRepository.findByIdempotencyKey(idempotencyKey).orElse(null);
            if (existing != null) {
                if (!caller.isCustomerOf(existing)) {
                    throw reject(Reason.NOT_AUTHORIZED, "Idempotency key belongs to another customer");
                }
                log.info("Idempotent replay for key={}, returning booking {}", idempotencyKey, existing.getId());
                return existing;
            }
        }

        LocalDate today = LocalDate.now(clock);
        if (!request.getBookingDate().isAfter(today)) {
            throw new ValidationException("bookingDate must be after " + today + ", got " + request.getBookingDate());
        }

        if (!customerRepository.existsById(request.getCustomerId())) {
            throw new NotFoundException("Customer", request.getCustomerId());
        }
        if (!providerRepository.existsById(request.getProviderId())) {
            throw new NotFoundException("Provider", request.getProviderId());
        }
        if (!categoryRepository.existsById(request.getCategoryId())) {
            throw new NotFoundException("Category", request.getCategoryId());
        }
        Address address = addressRepository.findById(request.getAddressId())
                .orElseThrow(() -> new NotFoundException("Address", request.getAddressId()));
        if (!request.getCustomerId().equals(address.getCustomerId())) {
            throw new ValidationException("Address " + address.getId() + " does not belong to customer "
                    + request.getCustomerId());
        }

        String timeSlot = request.getTimeSlot().trim();
        if (featureFlagService.isEnabled(FeatureFlagService.DOUBLE_BOOKING_GUARD, false)
                && bookingRepository.existsByProviderIdAndBookingDateAndTimeSlotAndStatusIn(
                        request.getProviderId(), request.getBookingDate(), timeSlot, SLOT_HOLDING)) {
            throw reject(Reason.SLOT_TAKEN, "Provider " + request.getProviderId() + " is already booked on "
                    + request.getBookingDate() + " " + timeSlot);
        }

        Booking booking = bookingRepository.save(Booking.builder()
                .customerId(request.getCustomerId())
                .providerId(request.getProviderId())
                .categoryId(request.getCategoryId())
                .addressId(request.getAddressId())
                .bookingDate(request.getBookingDate())
                .timeSlot(timeSlot)
                .status(BookingStatus.PENDING)
                .idempotencyKey(idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : null)
                .build());

        publishStatusChange(KafkaTopics.BOOKING_CREATED, booking, null, caller);
        metrics.recordCreated();
        log.info("Booking {} created: customer={} provider={} category={} date={} slot={}",
                booking.getId(), booking.getCustomerId(), booking.getProviderId(), booking.getCategoryId(),
                booking.getBookingDate(), booking.getTimeSlot());
        return booking;
    }

    /**
     * PENDING to CONFIRMED. Writes exactly one ledger entry priced at the
     * provider's rate for the booked category.
     */
    @Transactional
    public Booking confirmBooking(Caller caller, UUID bookingId, PaymentMethod paymentMethod) {
        if (paymentMethod == null) {
            throw new ValidationException("paymentMethod is required");
        }
        Booking booking = load(bookingId);
        requireCustomer(caller, booking);
        requireStatus(booking, BookingStatus.PENDING, "confirm");

        ProviderOffering offering = offeringRepository
                .findByProviderIdAndCategoryId(booking.getProviderId(), booking.getCategoryId())
                .orElseThrow(() -> reject(Reason.OFFERING_MISSING, "Provider " + booking.getProviderId()
                        + " no longer offers category " + booking.getCategoryId()));

        transition(booking, BookingStatus.PENDING, BookingStatus.CONFIRMED);

        Payment payment;
        try {
            payment = paymentLedger.record(bookingId, offering.getPriceRate(), paymentMethod);
        } catch (PreconditionFailedException e) {
            metrics.recordRejection(e.getReason());
            throw e;
        }

        publishStatusChange(KafkaTopics.BOOKING_CONFIRMED, booking, BookingStatus.PENDING, caller);
        kafkaTemplate.send(KafkaTopics.PAYMENT_RECORDED, bookingId.toString(), PaymentEvent.builder()
                .paymentId(payment.getId() != null ? payment.getId().toString() : null)
                .bookingId(bookingId.toString())
                .customerId(booking.getCustomerId())
                .amount(payment.getAmount())
                .paymentMethod(payment.getPaymentMethod())
                .transactionId(payment.getTransactionId())
                .status(payment.getStatus())
                .eventTime(Instant.now(clock))
                .build());
        metrics.recordConfirmed();
        metrics.recordPaymentRecorded();
        log.info("Booking {} confirmed by customer {} (amount={} method={})",
                bookingId, caller.id(), payment.getAmount(), paymentMethod);
        return booking;
    }

    /**
     * PENDING or CONFIRMED to CANCELLED, by either party. A recorded payment
     * stays in the ledger.
     */
    @Transactional
    public Booking cancelBooking(Caller caller, UUID bookingId) {
        Booking booking = load(bookingId);
        if (!caller.isPartyTo(booking)) {
            throw reject(Reason.NOT_AUTHORIZED, caller.role() + " " + caller.id()
                    + " is not a party to booking " + bookingId);
        }
        BookingStatus current = booking.getStatus();
        if (!CANCELLABLE.contains(current)) {
            throw reject(Reason.INVALID_STATE, "Cannot cancel booking " + bookingId + " in status " + current);
        }

        transition(booking, current, BookingStatus.CANCELLED);

        publishStatusChange(KafkaTopics.BOOKING_CANCELLED, booking, current, caller);
        metrics.recordCancelled();
        log.info("Booking {} cancelled by {} {} (was {})", bookingId, caller.role(), caller.id(), current);
        return booking;
    }

    @Transactional
    public Booking completeBooking(Caller caller, UUID bookingId) {
        Booking booking = load(bookingId);
        if (!caller.isProviderOf(booking)) {
            throw reject(Reason.NOT_AUTHORIZED, "Only the assigned provider can complete booking " + bookingId);
        }
        requireStatus(booking, BookingStatus.CONFIRMED, "complete");

        transition(booking, BookingStatus.CONFIRMED, BookingStatus.COMPLETED);

        publishStatusChange(KafkaTopics.BOOKING_COMPLETED, booking, BookingStatus.CONFIRMED, caller);
        metrics.recordCompleted();
        log.info("Booking {} completed by provider {}", bookingId, caller.id());
        return booking;
    }

    /**
     * Stores the customer's rating of a completed booking and rebuilds the
     * provider's average from all of their rated bookings.
     *
     * The rating write and the recomputation share one transaction, which
     * runs while holding the provider's rating lock. Ratings of different
     * bookings of the same provider are therefore aggregated one at a time.
     */
    public Booking rateBooking(Caller caller, UUID bookingId, Integer rating, String comment) {
        if (rating == null || rating < 1 || rating > 5) {
            throw new ValidationException("rating must be between 1 and 5, got " + rating);
        }
        Booking booking = load(bookingId);
        requireCustomer(caller, booking);
        requireStatus(booking, BookingStatus.COMPLETED, "rate");
        if (booking.getRating() != null) {
            throw reject(Reason.ALREADY_RATED, "Booking " + bookingId + " is already rated");
        }

        Long providerId = booking.getProviderId();
        RLock lock = redissonClient.getLock(RATING_LOCK_PREFIX + providerId);
        BigDecimal average;
        try {
            boolean acquired = lock.tryLock(ratingLockWaitMs, ratingLockLeaseMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Could not acquire rating lock for provider {}, refusing rating of booking {}",
                        providerId, bookingId);
                throw new DependencyUnavailableException("RATING_LOCK_UNAVAILABLE",
                        "Provider " + providerId + " rating is being updated, retry later");
            }
            average = transactionOperations.execute(tx -> {
                int updated = bookingRepository.recordRatingIfAbsent(
                        bookingId, rating, comment, BookingStatus.COMPLETED, Instant.now(clock));
                if (updated == 0) {
                    throw lostRatingRace(bookingId);
                }
                return ratingService.recomputeAverage(providerId).orElse(null);
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while acquiring rating lock for provider {}", providerId, e);
            throw new DependencyUnavailableException("RATING_LOCK_INTERRUPTED",
                    "Interrupted while waiting for provider " + providerId + " rating lock", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }

        booking.setRating(rating);
        booking.setRatingComment(comment);

        kafkaTemplate.send(KafkaTopics.BOOKING_RATED, bookingId.toString(), BookingRatedEvent.builder()
                .bookingId(bookingId.toString())
                .customerId(booking.getCustomerId())
                .providerId(providerId)
                .rating(rating)
                .comment(comment)
                .providerAverageRating(average)
                .ratedAt(Instant.now(clock))
                .build());
        metrics.recordRated();
        log.info("Booking {} rated {} by customer {}; provider {} average now {}",
                bookingId, rating, caller.id(), providerId, average);
        return booking;
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Caller caller, UUID bookingId) {
        Booking booking = load(bookingId);
        if (!caller.isPartyTo(booking)) {
            throw reject(Reason.NOT_AUTHORIZED, caller.role() + " " + caller.id()
                    + " is not a party to booking " + bookingId);
        }
        return booking;
    }

    /** Caller's bookings, latest booking date first. */
    @Transactional(readOnly = true)
    public List<Booking> listBookings(Caller caller) {
        return caller.role() == CallerRole.CUSTOMER
                ? bookingRepository.findByCustomerIdOrderByBookingDateDesc(caller.id())
                : bookingRepository.findByProviderIdOrderByBookingDateDesc(caller.id());
    }

    @Transactional(readOnly = true)
    public Payment getPayment(Caller caller, UUID bookingId) {
        getBooking(caller, bookingId);
        return paymentLedger.findByBooking(bookingId);
    }

    // --- helpers ---

    private void validate(CreateBookingRequest request) {
        if (request == null) {
            throw new ValidationException("booking request is required");
        }
        if (request.getCustomerId() == null || request.getProviderId() == null
                || request.getCategoryId() == null || request.getAddressId() == null) {
            throw new ValidationException("customerId, providerId, categoryId and addressId are required");
        }
        if (request.getBookingDate() == null) {
            throw new ValidationException("bookingDate is required");
        }
        if (request.getTimeSlot() == null || request.getTimeSlot().isBlank()) {
            throw new ValidationException("timeSlot is required");
        }
    }

    private Booking load(UUID bookingId) {
        if (bookingId == null) {
            throw new ValidationException("bookingId is required");
        }
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new NotFoundException("Booking", bookingId));
    }

    private void requireCustomer(Caller caller, Booking booking) {
        if (!caller.isCustomerOf(booking)) {
            throw reject(Reason.NOT_AUTHORIZED, "Only the booking's customer may do this on booking " + booking.getId());
        }
    }

    private void requireStatus(Booking booking, BookingStatus expected, String action) {
        if (booking.getStatus() != expected) {
            throw reject(Reason.INVALID_STATE, "Cannot " + action + " booking " + booking.getId()
                    + " in status " + booking.getStatus() + ", expected " + expected);
        }
    }

    private void transition(Booking booking, BookingStatus expected, BookingStatus next) {
        Instant now = Instant.now(clock);
        int updated = bookingRepository.compareAndSetStatus(booking.getId(), expected, next, now);
        if (updated == 0) {
            throw reject(Reason.INVALID_STATE, "Booking " + booking.getId() + " is no longer " + expected);
        }
        booking.setStatus(next);
        booking.setUpdatedAt(now);
    }

    /** The conditional rating update matched nothing: find out why. */
    private PreconditionFailedException lostRatingRace(UUID bookingId) {
        Booking fresh = load(bookingId);
        if (fresh.getRating() != null) {
            return reject(Reason.ALREADY_RATED, "Booking " + bookingId + " is already rated");
        }
        return reject(Reason.INVALID_STATE, "Booking " + bookingId + " is no longer COMPLETED");
    }

    private PreconditionFailedException reject(Reason reason, String message) {
        metrics.recordRejection(reason);
        log.warn("Booking operation refused [{}]: {}", reason, message);
        return new PreconditionFailedException(reason, message);
    }

    private void publishStatusChange(String topic, Booking booking, BookingStatus previous, Caller caller) {
        kafkaTemplate.send(topic, booking.getId().toString(), BookingStatusChangedEvent.builder()
                .bookingId(booking.getId().toString())
                .customerId(booking.getCustomerId())
                .providerId(booking.getProviderId())
                .categoryId(booking.getCategoryId())
                .previousStatus(previous)
                .status(booking.getStatus())
                .changedBy(caller.role())
                .bookingDate(booking.getBookingDate())
                .timeSlot(booking.getTimeSlot())
                .changedAt(Instant.now(clock))
                .build());
    }
}
