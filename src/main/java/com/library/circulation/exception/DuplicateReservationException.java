package com.library.circulation.exception;

public class DuplicateReservationException extends CirculationException {

    public DuplicateReservationException(Long bookId, String userId, String detail) {
        super(ErrorCode.DUPLICATE_RESERVATION,
              "User " + userId + " cannot reserve book " + bookId + ": " + detail);
    }
}
