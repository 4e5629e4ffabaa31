package com.library.circulation.entity;

/**
 * Lifecycle states for a {@link Reservation}. Only {@link #PENDING} is non-terminal.
 *
 * <ul>
 *   <li>{@link #PENDING}   - waiting in the title's queue</li>
 *   <li>{@link #FULFILLED} - promoted to a loan when a copy freed up</li>
 *   <li>{@link #EXPIRED}   - passed {@code expires_at} while still waiting</li>
 *   <li>{@link #CANCELLED} - withdrawn by the requester</li>
 * </ul>
 */
public enum ReservationStatus {
    PENDING,
    FULFILLED,
    EXPIRED,
    CANCELLED
}
