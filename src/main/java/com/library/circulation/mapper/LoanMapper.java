package com.library.circulation.mapper;

import com.library.circulation.dto.response.LoanResponse;
import com.library.circulation.entity.Loan;
import com.library.circulation.entity.LoanStatus;

import java.math.BigDecimal;

/**
 * Only {@code book.getId()} is read from the association, which Hibernate serves from the
 * proxy without initialising it, so mapping is safe outside a transaction.
 */
public final class LoanMapper {

    private LoanMapper() {}

    /** Maps the loan as stored. */
    public static LoanResponse toResponse(Loan loan) {
        return toResponse(loan, loan.getStatus(), loan.getFineAmount());
    }

    /** Maps the loan with status and fine evaluated at read time. */
    public static LoanResponse toResponse(Loan loan, LoanStatus status, BigDecimal fineAmount) {
        return new LoanResponse(
            loan.getId(),
            loan.getBook().getId(),
            loan.getUserId(),
            status,
            loan.getIssuedAt(),
            loan.getDueAt(),
            loan.getReturnedAt(),
            loan.getClosedAt(),
            loan.getRenewalCount(),
            fineAmount,
            loan.getNotes()
        );
    }
}
