package com.library.circulation.exception;

import com.library.circulation.entity.LoanStatus;

public class InvalidLoanStateException extends CirculationException {

    public InvalidLoanStateException(Long loanId, LoanStatus currentStatus, String action) {
        super(ErrorCode.INVALID_LOAN_STATE,
              "Loan " + loanId + " cannot be " + action + " - current status is " + currentStatus);
    }
}
