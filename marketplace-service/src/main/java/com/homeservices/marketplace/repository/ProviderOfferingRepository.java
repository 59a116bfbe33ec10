package com.homeservices.marketplace.repository;

import com.homeservices.marketplace.entity.ProviderOffering;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProviderOfferingRepository extends JpaRepository<ProviderOffering, Long> {

    List<ProviderOffering> findByCategoryId(Long categoryId);

    Optional<ProviderOffering> findByProviderIdAndCategoryId(Long providerId, Long categoryId);
}
