package com.homeservices.marketplace.config;

import com.homeservices.marketplace.entity.ServiceCategory;
import com.homeservices.marketplace.repository.ServiceCategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Inserts the built-in service categories into an empty table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategorySeeder implements ApplicationRunner {

    static final List<String> DEFAULT_CATEGORIES = List.of(
            "Plumbing", "Electrical", "Cleaning", "Gardening",
            "Painting", "Carpentry", "Moving", "Appliance Repair");

    private final ServiceCategoryRepository categoryRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (categoryRepository.count() > 0) {
            return;
        }
        List<ServiceCategory> categories = DEFAULT_CATEGORIES.stream()
                .map(name -> ServiceCategory.builder()
                        .name(name)
                        .description("Professional " + name + " services")
                        .build())
                .toList();
        categoryRepository.saveAll(categories);
        log.info("Seeded {} service categories", categories.size());
    }
}
