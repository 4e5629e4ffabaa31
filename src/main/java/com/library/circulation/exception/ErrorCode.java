package com.library.circulation.exception;

/**
 * Machine-readable outcome codes returned in {@code ErrorResponse.code} so callers can
 * tell, for example, "renewal limit reached" from "reserved by another user".
 */
public enum ErrorCode {
    NOT_FOUND,
    CAPACITY_EXHAUSTED,
    QUEUE_JUMP_REJECTED,
    DUPLICATE_RESERVATION,
    ALREADY_BORROWED,
    RESERVATION_NOT_REQUIRED,
    LOAN_NOT_ACTIVE,
    LOAN_OVERDUE,
    RENEWAL_LIMIT_REACHED,
    RESERVED_BY_ANOTHER_USER,
    INVALID_LOAN_STATE,
    INVALID_RESERVATION_STATE,
    TRANSIENT_CONFLICT
}
