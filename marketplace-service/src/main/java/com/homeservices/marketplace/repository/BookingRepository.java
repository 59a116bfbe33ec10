package com.homeservices.marketplace.repository;

import com.homeservices.marketplace.entity.Booking;
import com.homeservices.shared.enums.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BookingRepository extends JpaRepository<Booking, UUID> {

    Optional<Booking> findByIdempotencyKey(String idempotencyKey);

    List<Booking> findByCustomerIdOrderByBookingDateDesc(Long customerId);

    List<Booking> findByProviderIdOrderByBookingDateDesc(Long providerId);

    List<Booking> findByProviderIdAndStatusAndRatingIsNotNull(Long providerId, BookingStatus status);

    boolean existsByProviderIdAndBookingDateAndTimeSlotAndStatusIn(
            Long providerId, LocalDate bookingDate, String timeSlot, Collection<BookingStatus> statuses);

    /**
     * Compare-and-set on status. Returns 1 if this call performed the
     * transition, 0 if the booking was no longer in {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :next, b.updatedAt = :now WHERE b.id = :id AND b.status = :expected")
    int compareAndSetStatus(UUID id, BookingStatus expected, BookingStatus next, Instant now);

    /**
     * Write-once rating. Only matches a booking in {@code requiredStatus} whose rating is still null.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.rating = :rating, b.ratingComment = :comment, b.updatedAt = :now "
            + "WHERE b.id = :id AND b.status = :requiredStatus AND b.rating IS NULL")
    int recordRatingIfAbsent(UUID id, Integer rating, String comment, BookingStatus requiredStatus, Instant now);
}
