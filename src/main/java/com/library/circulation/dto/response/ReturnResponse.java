package com.library.circulation.dto.response;

/**
 * Outcome of a return or write-off. When someone was waiting, {@code promotedLoan} and
 * {@code fulfilledReservation} describe the loan the freed copy went to.
 */
public record ReturnResponse(
    LoanResponse loan,
    LoanResponse promotedLoan,
    ReservationResponse fulfilledReservation,
    boolean alreadyClosed
) {}
