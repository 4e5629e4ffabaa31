package com.library.circulation.exception;

public class CapacityExhaustedException extends CirculationException {

    public CapacityExhaustedException(Long bookId) {
        super(ErrorCode.CAPACITY_EXHAUSTED,
              "No copies of book " + bookId + " are available; a reservation is required");
    }
}
