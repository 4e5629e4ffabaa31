package com.library.circulation.exception;

/**
 * The title's lock could not be acquired (or a concurrent update won) within the
 * coordinator's bounded retries. Safe for the caller to retry.
 */
public class TransientConflictException extends CirculationException {

    public TransientConflictException(Long bookId, int attempts, Throwable cause) {
        super(ErrorCode.TRANSIENT_CONFLICT,
              "Book " + bookId + " is busy (gave up after " + attempts + " attempt(s)); please retry", cause);
    }
}
