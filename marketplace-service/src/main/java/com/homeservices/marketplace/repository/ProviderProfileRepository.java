package com.homeservices.marketplace.repository;

import com.homeservices.marketplace.entity.ProviderProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

@Repository
public interface ProviderProfileRepository extends JpaRepository<ProviderProfile, Long> {

    /** Eligible providers: available and verified. */
    List<ProviderProfile> findByIdInAndAvailableTrueAndVerifiedTrue(Collection<Long> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProviderProfile p SET p.averageRating = :averageRating WHERE p.id = :id")
    int updateAverageRating(Long id, BigDecimal averageRating);
}
