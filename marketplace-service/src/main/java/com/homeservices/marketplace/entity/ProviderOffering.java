package com.homeservices.marketplace.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "provider_offerings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_offering_provider_category", columnNames = {"provider_id", "category_id"})
        },
        indexes = {
                @Index(name = "idx_offering_category", columnList = "category_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class ProviderOffering {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Column(name = "price_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal priceRate;
}
