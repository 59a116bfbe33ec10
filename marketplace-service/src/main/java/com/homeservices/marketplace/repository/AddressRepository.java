package com.homeservices.marketplace.repository;

import com.homeservices.marketplace.entity.Address;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AddressRepository extends JpaRepository<Address, Long> {

    /** A provider's registered location is its first address. */
    Optional<Address> findFirstByProviderIdOrderByIdAsc(Long providerId);

    List<Address> findByCustomerId(Long customerId);
}
