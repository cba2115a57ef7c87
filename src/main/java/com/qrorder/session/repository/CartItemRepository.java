package com.qrorder.session.repository;

import com.qrorder.session.entity.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CartItemRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findBySessionIdOrderByIdAsc(Long sessionId);

    long countBySessionId(Long sessionId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CartItem i WHERE i.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") Long sessionId);
}
