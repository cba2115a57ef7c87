package com.qrorder.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "outlets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Outlet {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "outlet_seq")
    @SequenceGenerator(name = "outlet_seq", sequenceName = "outlet_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String name;

    /** Percentage, e.g. 10 for 10%. */
    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal taxRate;

    /** Percentage, e.g. 5 for 5%. */
    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal serviceChargeRate;

    @Builder
    public Outlet(String name, BigDecimal taxRate, BigDecimal serviceChargeRate) {
        this.name = name;
        this.taxRate = taxRate == null ? BigDecimal.ZERO : taxRate;
        this.serviceChargeRate = serviceChargeRate == null ? BigDecimal.ZERO : serviceChargeRate;
    }
}
