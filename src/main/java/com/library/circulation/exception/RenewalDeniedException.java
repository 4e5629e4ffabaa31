package com.library.circulation.exception;

/**
 * Renewal was refused. {@link #getReason()} tells the caller why, and doubles as the
 * response code.
 */
public class RenewalDeniedException extends CirculationException {

    public enum Reason {
        LOAN_NOT_ACTIVE(ErrorCode.LOAN_NOT_ACTIVE),
        LOAN_OVERDUE(ErrorCode.LOAN_OVERDUE),
        RENEWAL_LIMIT_REACHED(ErrorCode.RENEWAL_LIMIT_REACHED),
        RESERVED_BY_ANOTHER_USER(ErrorCode.RESERVED_BY_ANOTHER_USER);

        private final ErrorCode code;

        Reason(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode code() {
            return code;
        }
    }

    private final Reason reason;

    public RenewalDeniedException(Long loanId, Reason reason, String detail) {
        super(reason.code(), "Loan " + loanId + " cannot be renewed: " + detail);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
