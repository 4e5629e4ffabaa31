package com.library.circulation.exception;

public class QueueJumpRejectedException extends CirculationException {

    public QueueJumpRejectedException(Long bookId, int queueLength) {
        super(ErrorCode.QUEUE_JUMP_REJECTED,
              "Book " + bookId + " has " + queueLength + " pending reservation(s); reserve it instead");
    }
}
