package com.qrorder.catalog.repository;

import com.qrorder.catalog.entity.Outlet;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OutletRepository extends JpaRepository<Outlet, Long> {
}
