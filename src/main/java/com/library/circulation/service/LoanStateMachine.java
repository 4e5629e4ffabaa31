package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.entity.Loan;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.exception.InvalidLoanStateException;
import com.library.circulation.exception.RenewalDeniedException;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Lifecycle of a single loan: issue, overdue detection, fines, renewal and closure.
 *
 * <pre>
 *   (none) --issue--> ACTIVE --time--> OVERDUE
 *   ACTIVE --renew--> ACTIVE
 *   ACTIVE | OVERDUE --return--> RETURNED
 *   ACTIVE | OVERDUE --write-off--> LOST | DAMAGED
 * </pre>
 *
 * <p>Overdue status and fines are pure functions of the stored timestamps and "now".
 * {@link #effectiveStatus} and {@link #accruedFine} compute them without writing;
 * {@link #evaluateOverdue} persists them and is called on every write that touches a loan,
 * so no scheduler is needed for correctness.
 *
 * <p>Capacity is not this class's concern: callers release it when {@link #close} or
 * {@link #writeOff} report a transition.
 */
@Component
@RequiredArgsConstructor
public class LoanStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LoanStateMachine.class);

    private final LoanRepository loanRepository;
    private final BookRepository bookRepository;
    private final CirculationProperties properties;

    public Loan issue(Long titleId, String userId, Instant now, String notes) {
        Loan loan = new Loan();
        loan.setBook(bookRepository.getReferenceById(titleId));
        loan.setUserId(userId);
        loan.setStatus(LoanStatus.ACTIVE);
        loan.setIssuedAt(now);
        loan.setDueAt(now.plus(properties.getLoanPeriod()));
        loan.setRenewalCount(0);
        loan.setFineAmount(zero());
        loan.setNotes(notes);

        Loan saved = loanRepository.save(loan);
        log.info("Issued loan {} of book {} to user {}, due {}", saved.getId(), titleId, userId, saved.getDueAt());
        return saved;
    }

    /** Status as of {@code now}, without modifying the loan. */
    public LoanStatus effectiveStatus(Loan loan, Instant now) {
        if (loan.getStatus() == LoanStatus.ACTIVE && now.isAfter(loan.getDueAt())) {
            return LoanStatus.OVERDUE;
        }
        return loan.getStatus();
    }

    /**
     * Fine as of {@code now}: whole days late times the per-day rate. Closed loans report
     * their frozen fine. For an open loan the figure never decreases as {@code now} advances.
     */
    public BigDecimal accruedFine(Loan loan, Instant now) {
        if (loan.getStatus().isTerminal()) {
            return loan.getFineAmount();
        }
        BigDecimal computed = fineBetween(loan.getDueAt(), now);
        return computed.max(loan.getFineAmount());
    }

    /**
     * Moves an ACTIVE loan past its due date to OVERDUE and brings its stored fine up to
     * date. Closed loans are left alone.
     *
     * @return whether the loan changed
     */
    public boolean evaluateOverdue(Loan loan, Instant now) {
        if (loan.getStatus().isTerminal()) {
            return false;
        }
        boolean changed = false;
        if (effectiveStatus(loan, now) == LoanStatus.OVERDUE && loan.getStatus() != LoanStatus.OVERDUE) {
            loan.setStatus(LoanStatus.OVERDUE);
            log.info("Loan {} is overdue (due {})", loan.getId(), loan.getDueAt());
            changed = true;
        }
        BigDecimal fine = accruedFine(loan, now);
        if (fine.compareTo(loan.getFineAmount()) != 0) {
            loan.setFineAmount(fine);
            changed = true;
        }
        return changed;
    }

    /**
     * Extends the due date to {@code now + loanPeriod}.
     *
     * @param queueEmpty whether the title has no pending reservations; a waiting user
     *                   blocks renewal
     * @throws RenewalDeniedException with the specific reason
     */
    public void renew(Loan loan, Instant now, boolean queueEmpty) {
        if (loan.getStatus().isTerminal()) {
            throw new RenewalDeniedException(loan.getId(), RenewalDeniedException.Reason.LOAN_NOT_ACTIVE,
                "loan is " + loan.getStatus());
        }
        evaluateOverdue(loan, now);
        if (loan.getStatus() == LoanStatus.OVERDUE) {
            throw new RenewalDeniedException(loan.getId(), RenewalDeniedException.Reason.LOAN_OVERDUE,
                "loan was due " + loan.getDueAt());
        }
        int maxRenewals = properties.getMaxRenewals();
        if (loan.getRenewalCount() >= maxRenewals) {
            throw new RenewalDeniedException(loan.getId(), RenewalDeniedException.Reason.RENEWAL_LIMIT_REACHED,
                "renewal limit of " + maxRenewals + " reached");
        }
        if (!queueEmpty) {
            throw new RenewalDeniedException(loan.getId(), RenewalDeniedException.Reason.RESERVED_BY_ANOTHER_USER,
                "another user is waiting for this book");
        }

        loan.setDueAt(now.plus(properties.getLoanPeriod()));
        loan.setRenewalCount(loan.getRenewalCount() + 1);
        log.info("Renewed loan {} ({} of {}), now due {}", loan.getId(), loan.getRenewalCount(), maxRenewals,
            loan.getDueAt());
    }

    /**
     * Returns the copy. A loan that is already RETURNED is left as it is, so duplicate
     * return requests are harmless.
     *
     * @return {@code true} if this call closed the loan and its capacity must be released
     * @throws InvalidLoanStateException if the loan was written off as LOST or DAMAGED
     */
    public boolean close(Loan loan, Instant now) {
        if (loan.getStatus() == LoanStatus.RETURNED) {
            return false;
        }
        if (loan.getStatus().isTerminal()) {
            throw new InvalidLoanStateException(loan.getId(), loan.getStatus(), "returned");
        }
        evaluateOverdue(loan, now);
        loan.setStatus(LoanStatus.RETURNED);
        loan.setReturnedAt(now);
        loan.setClosedAt(now);
        log.info("Loan {} returned, fine {}", loan.getId(), loan.getFineAmount());
        return true;
    }

    /**
     * Administrative write-off to LOST or DAMAGED. Repeating the same write-off is a no-op.
     *
     * @return {@code true} if this call closed the loan and its capacity must be released
     */
    public boolean writeOff(Loan loan, LoanStatus outcome, Instant now) {
        if (outcome != LoanStatus.LOST && outcome != LoanStatus.DAMAGED) {
            throw new IllegalArgumentException("Not a write-off status: " + outcome);
        }
        if (loan.getStatus() == outcome) {
            return false;
        }
        if (loan.getStatus().isTerminal()) {
            throw new InvalidLoanStateException(loan.getId(), loan.getStatus(),
                "marked " + outcome.name().toLowerCase());
        }
        evaluateOverdue(loan, now);
        loan.setStatus(outcome);
        loan.setClosedAt(now);
        log.info("Loan {} written off as {}, fine {}", loan.getId(), outcome, loan.getFineAmount());
        return true;
    }

    private BigDecimal fineBetween(Instant dueAt, Instant end) {
        long daysLate = Duration.between(dueAt, end).toDays();
        if (daysLate <= 0) {
            return zero();
        }
        return properties.getFinePerDay()
            .multiply(BigDecimal.valueOf(daysLate))
            .setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }
}
