package com.library.circulation.mapper;

import com.library.circulation.dto.response.ReservationResponse;
import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;

import java.time.Instant;

public final class ReservationMapper {

    private ReservationMapper() {}

    public static ReservationResponse toResponse(Reservation reservation) {
        return toResponse(reservation, reservation.getQueuePosition());
    }

    public static ReservationResponse toResponse(Reservation reservation, Integer queuePosition) {
        return new ReservationResponse(
            reservation.getId(),
            reservation.getBook().getId(),
            reservation.getUserId(),
            reservation.getStatus(),
            queuePosition,
            reservation.getReservedAt(),
            reservation.getExpiresAt(),
            reservation.getCancelledAt(),
            reservation.getFulfilledAt(),
            reservation.getLoanId()
        );
    }

    /**
     * Maps the reservation as it stands at {@code now}: a pending reservation past its
     * expiry is reported as EXPIRED with no position, even if no write has recorded that
     * yet. Positions of live reservations are the caller's to compute.
     */
    public static ReservationResponse toResponse(Reservation reservation, Instant now) {
        if (isStale(reservation, now)) {
            return new ReservationResponse(
                reservation.getId(),
                reservation.getBook().getId(),
                reservation.getUserId(),
                ReservationStatus.EXPIRED,
                null,
                reservation.getReservedAt(),
                reservation.getExpiresAt(),
                reservation.getCancelledAt(),
                reservation.getFulfilledAt(),
                reservation.getLoanId()
            );
        }
        return toResponse(reservation);
    }

    public static boolean isStale(Reservation reservation, Instant now) {
        return reservation.getStatus() == ReservationStatus.PENDING && reservation.getExpiresAt().isBefore(now);
    }
}
