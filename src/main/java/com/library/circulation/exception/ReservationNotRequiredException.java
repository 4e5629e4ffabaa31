package com.library.circulation.exception;

public class ReservationNotRequiredException extends CirculationException {

    public ReservationNotRequiredException(Long bookId, int available) {
        super(ErrorCode.RESERVATION_NOT_REQUIRED,
              "Book " + bookId + " has " + available + " available cop" + (available == 1 ? "y" : "ies")
                  + "; borrow it directly");
    }
}
