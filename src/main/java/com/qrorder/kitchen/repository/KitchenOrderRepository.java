package com.qrorder.kitchen.repository;

import com.qrorder.kitchen.entity.KitchenOrder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.Optional;

public interface KitchenOrderRepository extends JpaRepository<KitchenOrder, Long> {

    long countByOutletIdAndCreatedAtGreaterThanEqual(Long outletId, LocalDateTime since);

    Optional<KitchenOrder> findBySourceSessionCode(String sessionCode);

    long countBySourceSessionCode(String sessionCode);
}
