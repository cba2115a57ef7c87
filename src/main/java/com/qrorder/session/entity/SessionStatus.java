package com.qrorder.session.entity;

/**
 * Lifecycle of a self-order session.
 *
 * <pre>
 *   ACTIVE ──submit──▶ SUBMITTED ──payment──▶ PAID
 *     │  └──────────payment (before submit)──▶ PAID
 *     └──────────sweep / force──▶ EXPIRED
 * </pre>
 *
 * PAID and EXPIRED are terminal, no transition moves backwards.
 */
public enum SessionStatus {
    ACTIVE,
    SUBMITTED,
    PAID,
    EXPIRED
}
