package com.library.circulation.service;

import com.library.circulation.entity.Loan;
import com.library.circulation.entity.Reservation;

/**
 * Result of closing a loan.
 *
 * @param loan                 the closed loan
 * @param promotedLoan         loan created for the head of the queue with the freed copy,
 *                             or {@code null} if nobody was waiting
 * @param fulfilledReservation the reservation that was promoted, or {@code null}
 * @param alreadyClosed        {@code true} if the loan had been closed by an earlier request
 *                             and this call changed nothing
 */
public record ReturnOutcome(Loan loan, Loan promotedLoan, Reservation fulfilledReservation, boolean alreadyClosed) {

    static ReturnOutcome unchanged(Loan loan) {
        return new ReturnOutcome(loan, null, null, true);
    }

    public boolean promoted() {
        return promotedLoan != null;
    }
}
