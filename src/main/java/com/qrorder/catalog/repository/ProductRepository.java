package com.qrorder.catalog.repository;

import com.qrorder.catalog.entity.Product;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    // variants and outlet in one query, the result is cached as a detached snapshot
    @EntityGraph(attributePaths = {"variants", "outlet"})
    Optional<Product> findWithVariantsById(Long id);
}
