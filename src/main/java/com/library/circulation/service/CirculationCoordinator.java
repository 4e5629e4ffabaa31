package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.entity.Book;
import com.library.circulation.entity.Loan;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;
import com.library.circulation.exception.AlreadyBorrowedException;
import com.library.circulation.exception.CapacityExhaustedException;
import com.library.circulation.exception.InvalidReservationStateException;
import com.library.circulation.exception.QueueJumpRejectedException;
import com.library.circulation.exception.ReservationNotRequiredException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.TransientConflictException;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single entry point for every state change in circulation.
 *
 * <p>Each operation runs as one transaction that starts by locking the title's ledger row
 * ({@link AvailabilityLedger#lock}). That lock serializes capacity changes and queue
 * mutations per title while leaving unrelated titles free to proceed in parallel.
 * A return, its capacity release, the promotion of the queue head and the loan created for
 * it all commit together, so no other caller can observe the freed copy as available while
 * someone is waiting.
 *
 * <p>Lock timeouts, deadlocks and optimistic version conflicts are retried with bounded
 * backoff; once attempts run out the caller gets a {@link TransientConflictException}.
 * Each attempt uses a fresh transaction and persistence context.
 *
 * <p>Callers must not invoke these methods inside an existing transaction: a failed attempt
 * would mark the outer transaction rollback-only and defeat the retry.
 */
@Service
@RequiredArgsConstructor
public class CirculationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CirculationCoordinator.class);

    private final AvailabilityLedger ledger;
    private final LoanStateMachine loanStateMachine;
    private final ReservationQueueManager queueManager;
    private final LoanRepository loanRepository;
    private final ReservationRepository reservationRepository;
    private final BookRepository bookRepository;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final CirculationProperties properties;

    public Loan borrow(Long titleId, String userId, Instant now) {
        return borrow(titleId, userId, now, null);
    }

    /**
     * Lends a copy directly. Only possible while nobody is queued for the title, so a
     * borrower can never overtake a waiting reservation.
     */
    public Loan borrow(Long titleId, String userId, Instant now, String notes) {
        return inTitleScope(titleId, () -> {
            List<Reservation> queue = queueManager.pendingQueue(titleId, now);
            if (!queue.isEmpty()) {
                throw new QueueJumpRejectedException(titleId, queue.size());
            }
            if (loanRepository.existsByBookIdAndUserIdAndStatusIn(titleId, userId, LoanStatus.OPEN)) {
                throw new AlreadyBorrowedException(titleId, userId);
            }
            if (!ledger.reserveCapacity(titleId)) {
                throw new CapacityExhaustedException(titleId);
            }
            return loanStateMachine.issue(titleId, userId, now, notes);
        });
    }

    /**
     * Closes the loan and hands the freed copy straight to the head of the queue, if any.
     * Returning an already returned loan reports the earlier result and releases nothing.
     */
    public ReturnOutcome returnLoan(Long loanId, Instant now) {
        Long titleId = titleOfLoan(loanId);
        return inTitleScope(titleId, () -> {
            Loan loan = loadLoan(loanId);
            if (!loanStateMachine.close(loan, now)) {
                log.info("Loan {} was already returned; nothing to do", loanId);
                return ReturnOutcome.unchanged(loan);
            }
            return releaseAndPromote(titleId, loan, now);
        });
    }

    /** Administrative write-off; the capacity is released and the queue served as on return. */
    public ReturnOutcome markLost(Long loanId, Instant now) {
        return writeOff(loanId, LoanStatus.LOST, now);
    }

    public ReturnOutcome markDamaged(Long loanId, Instant now) {
        return writeOff(loanId, LoanStatus.DAMAGED, now);
    }

    public Loan renew(Long loanId, Instant now) {
        Long titleId = titleOfLoan(loanId);
        return inTitleScope(titleId, () -> {
            Loan loan = loadLoan(loanId);
            loanStateMachine.renew(loan, now, queueManager.queueLength(titleId, now) == 0);
            return loan;
        });
    }

    /** Persists the overdue transition and current fine of one loan. */
    public Loan evaluateOverdue(Long loanId, Instant now) {
        Long titleId = titleOfLoan(loanId);
        return inTitleScope(titleId, () -> {
            Loan loan = loadLoan(loanId);
            loanStateMachine.evaluateOverdue(loan, now);
            return loan;
        });
    }

    /** Joins the title's queue. Only accepted while no copy is available. */
    public Reservation reserve(Long titleId, String userId, Instant now) {
        return inTitleScope(titleId, () -> {
            int available = ledger.lock(titleId).available();
            if (available > 0) {
                throw new ReservationNotRequiredException(titleId, available);
            }
            return queueManager.enqueue(titleId, userId, now);
        });
    }

    public Reservation cancelReservation(Long reservationId, Instant now) {
        Long titleId = titleOfReservation(reservationId);
        return inTitleScope(titleId, () -> queueManager.cancel(reservationId, now));
    }

    /**
     * Current position of a pending reservation, after expiring stale entries ahead of it.
     *
     * @throws InvalidReservationStateException if the reservation is no longer pending
     */
    public QueuePosition queuePosition(Long reservationId, Instant now) {
        Long titleId = titleOfReservation(reservationId);
        return inTitleScope(titleId, () -> {
            List<Reservation> queue = queueManager.pendingQueue(titleId, now);
            Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
            if (reservation.getStatus() != ReservationStatus.PENDING) {
                throw new InvalidReservationStateException(reservationId, reservation.getStatus(), "queued");
            }
            return new QueuePosition(reservationId, titleId, reservation.getQueuePosition(), queue.size());
        });
    }

    public int availableCopies(Long titleId) {
        return ledger.availableCopies(titleId);
    }

    /** Effective status of a loan at {@code now}. Takes no lock and writes nothing. */
    public LoanStatus loanStatus(Long loanId, Instant now) {
        return loanStateMachine.effectiveStatus(loadLoan(loanId), now);
    }

    /**
     * Applies a catalog copy-count change. The book row, the ledger total and any
     * promotions commit together under the title lock. Added copies go to waiting
     * reservations first; a reduction leaves open loans untouched and only suspends new
     * loans.
     *
     * @return loans created for promoted reservations
     */
    public List<Promotion> onTotalCopiesChanged(Long titleId, int totalCopies, Instant now) {
        return inTitleScope(titleId, () -> {
            Book book = bookRepository.findById(titleId)
                .orElseThrow(() -> new ResourceNotFoundException("Book", titleId));
            book.setTotalCopies(totalCopies);
            ledger.updateTotalCopies(titleId, totalCopies);
            return promoteWhileAvailable(titleId, now);
        });
    }

    /**
     * Persists overdue transitions and fines for every open loan past its due date.
     * Each title is processed in its own transaction; a busy title is skipped and picked up
     * by the next sweep.
     *
     * @return the number of loans that changed
     */
    public int sweepOverdue(Instant now) {
        int changed = 0;
        for (Long titleId : loanRepository.findTitleIdsWithLoansDueBefore(LoanStatus.OPEN, now)) {
            try {
                changed += inTitleScope(titleId, () -> {
                    int count = 0;
                    for (Loan loan : loanRepository.findByBookIdAndStatusInAndDueAtBefore(titleId, LoanStatus.OPEN, now)) {
                        if (loanStateMachine.evaluateOverdue(loan, now)) {
                            count++;
                        }
                    }
                    return count;
                });
            } catch (TransientConflictException ex) {
                log.warn("Overdue sweep skipped book {}: {}", titleId, ex.getMessage());
            }
        }
        log.info("Overdue sweep updated {} loan(s)", changed);
        return changed;
    }

    /**
     * Expires stale reservations across all titles, compacting each queue.
     *
     * @return the number of reservations expired
     */
    public int expireStaleReservations(Instant now) {
        int expired = 0;
        for (Long titleId : reservationRepository.findTitleIdsWithExpiredBefore(ReservationStatus.PENDING, now)) {
            try {
                expired += inTitleScope(titleId, () -> queueManager.expireStale(titleId, now));
            } catch (TransientConflictException ex) {
                log.warn("Reservation expiry skipped book {}: {}", titleId, ex.getMessage());
            }
        }
        log.info("Reservation expiry sweep expired {} reservation(s)", expired);
        return expired;
    }

    private ReturnOutcome writeOff(Long loanId, LoanStatus outcome, Instant now) {
        Long titleId = titleOfLoan(loanId);
        return inTitleScope(titleId, () -> {
            Loan loan = loadLoan(loanId);
            if (!loanStateMachine.writeOff(loan, outcome, now)) {
                return ReturnOutcome.unchanged(loan);
            }
            return releaseAndPromote(titleId, loan, now);
        });
    }

    private ReturnOutcome releaseAndPromote(Long titleId, Loan closed, Instant now) {
        ledger.releaseCapacity(titleId);
        Optional<Promotion> promotion = promoteWhileAvailable(titleId, now).stream().findFirst();
        return new ReturnOutcome(closed,
            promotion.map(Promotion::loan).orElse(null),
            promotion.map(Promotion::reservation).orElse(null),
            false);
    }

    private List<Promotion> promoteWhileAvailable(Long titleId, Instant now) {
        List<Promotion> promotions = new ArrayList<>();
        while (ledger.lock(titleId).available() > 0) {
            Optional<Reservation> head = queueManager.promoteHead(titleId, now);
            if (head.isEmpty()) {
                break;
            }
            Reservation reservation = head.get();
            if (!ledger.reserveCapacity(titleId)) {
                throw new IllegalStateException("Capacity for book " + titleId + " vanished under lock");
            }
            Loan loan = loanStateMachine.issue(titleId, reservation.getUserId(), now, null);
            reservation.setLoanId(loan.getId());
            promotions.add(new Promotion(reservation, loan));
        }
        return promotions;
    }

    private <T> T inTitleScope(Long titleId, Supplier<T> work) {
        RetryCallback<T, RuntimeException> attempt = context -> transactionTemplate.execute(status -> {
            ledger.lock(titleId);
            return work.get();
        });
        try {
            return retryTemplate.execute(attempt);
        } catch (ConcurrencyFailureException ex) {
            int attempts = properties.getRetry().getMaxAttempts();
            log.warn("Giving up on book {} after {} attempt(s): {}", titleId, attempts, ex.getMessage());
            throw new TransientConflictException(titleId, attempts, ex);
        }
    }

    private Loan loadLoan(Long loanId) {
        return loanRepository.findById(loanId)
            .orElseThrow(() -> new ResourceNotFoundException("Loan", loanId));
    }

    private Long titleOfLoan(Long loanId) {
        return loanRepository.findTitleIdById(loanId)
            .orElseThrow(() -> new ResourceNotFoundException("Loan", loanId));
    }

    private Long titleOfReservation(Long reservationId) {
        return reservationRepository.findTitleIdById(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }
}
