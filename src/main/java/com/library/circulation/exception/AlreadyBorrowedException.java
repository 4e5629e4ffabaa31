package com.library.circulation.exception;

public class AlreadyBorrowedException extends CirculationException {

    public AlreadyBorrowedException(Long bookId, String userId) {
        super(ErrorCode.ALREADY_BORROWED,
              "User " + userId + " already has an open loan for book " + bookId);
    }
}
