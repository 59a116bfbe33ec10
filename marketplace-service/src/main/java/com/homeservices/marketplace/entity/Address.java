package com.homeservices.marketplace.entity;

import com.homeservices.marketplace.model.Coordinate;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.Optional;

@Entity
@Table(name = "addresses",
        indexes = {
                @Index(name = "idx_address_customer", columnList = "customer_id"),
                @Index(name = "idx_address_provider", columnList = "provider_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Address {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "provider_id")
    private Long providerId;

    @Column(name = "address_line", nullable = false)
    private String addressLine;

    @Column(nullable = false, length = 100)
    private String city;

    @Column(length = 100)
    private String state;

    @Column(name = "postal_code", length = 20)
    private String postalCode;

    // Both null when geocoding failed or was skipped.
    private Double latitude;

    private Double longitude;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public Optional<Coordinate> toCoordinate() {
        return Coordinate.ofNullable(latitude, longitude);
    }

    public String toSingleLine() {
        StringBuilder sb = new StringBuilder(addressLine).append(", ").append(city);
        if (state != null && !state.isBlank()) {
            sb.append(", ").append(state);
        }
        if (postalCode != null && !postalCode.isBlank()) {
            sb.append(' ').append(postalCode);
        }
        return sb.toString();
    }
}
