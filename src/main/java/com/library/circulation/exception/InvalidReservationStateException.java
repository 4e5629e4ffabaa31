package com.library.circulation.exception;

import com.library.circulation.entity.ReservationStatus;

public class InvalidReservationStateException extends CirculationException {

    public InvalidReservationStateException(Long reservationId, ReservationStatus currentStatus, String action) {
        super(ErrorCode.INVALID_RESERVATION_STATE,
              "Reservation " + reservationId + " cannot be " + action + " - current status is " + currentStatus);
    }
}
