package com.library.circulation.service;

import com.library.circulation.dto.response.AvailabilityResponse;
import com.library.circulation.dto.response.LoanResponse;
import com.library.circulation.dto.response.LoanStatisticsResponse;
import com.library.circulation.dto.response.ReservationResponse;
import com.library.circulation.entity.Loan;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;
import com.library.circulation.entity.TitleAvailability;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.mapper.LoanMapper;
import com.library.circulation.mapper.ReservationMapper;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Read side. Nothing here writes: overdue status, fines and reservation expiry are
 * evaluated against {@code now} on the way out, so answers are correct whether or not a
 * sweep has run.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CirculationQueryService {

    private final LoanRepository loanRepository;
    private final ReservationRepository reservationRepository;
    private final AvailabilityLedger ledger;
    private final LoanStateMachine loanStateMachine;

    public LoanResponse findLoan(Long id, Instant now) {
        Loan loan = loanRepository.findByIdWithBook(id)
            .orElseThrow(() -> new ResourceNotFoundException("Loan", id));
        return toResponse(loan, now);
    }

    /**
     * Filters by effective status: {@code OVERDUE} also matches ACTIVE loans already past
     * their due date, and {@code ACTIVE} excludes them.
     */
    public Page<LoanResponse> findLoans(String userId, Long bookId, LoanStatus status,
                                        Pageable pageable, Instant now) {
        Specification<Loan> spec = Specification.where(null);

        if (userId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("userId"), userId));
        }
        if (bookId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("book").get("id"), bookId));
        }
        if (status == LoanStatus.OVERDUE) {
            spec = spec.and((root, query, cb) -> cb.or(
                cb.equal(root.get("status"), LoanStatus.OVERDUE),
                cb.and(cb.equal(root.get("status"), LoanStatus.ACTIVE),
                       cb.lessThan(root.<Instant>get("dueAt"), now))));
        } else if (status == LoanStatus.ACTIVE) {
            spec = spec.and((root, query, cb) -> cb.and(
                cb.equal(root.get("status"), LoanStatus.ACTIVE),
                cb.greaterThanOrEqualTo(root.<Instant>get("dueAt"), now)));
        } else if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return loanRepository.findAll(spec, pageable)
            .map(loan -> toResponse(loan, now));
    }

    public List<LoanResponse> findOverdue(Instant now) {
        return loanRepository.findOpenDueBefore(LoanStatus.OPEN, now).stream()
            .map(loan -> toResponse(loan, now))
            .toList();
    }

    public LoanStatisticsResponse statistics(Instant now) {
        long overdue = loanRepository.countByStatusInAndDueAtBefore(LoanStatus.OPEN, now);
        long open = loanRepository.countByStatus(LoanStatus.ACTIVE) + loanRepository.countByStatus(LoanStatus.OVERDUE);

        BigDecimal outstanding = loanRepository.findOpenDueBefore(LoanStatus.OPEN, now).stream()
            .map(loan -> loanStateMachine.accruedFine(loan, now))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal assessed = loanRepository.sumFineAmountByStatusIn(
            EnumSet.of(LoanStatus.RETURNED, LoanStatus.LOST, LoanStatus.DAMAGED));

        return new LoanStatisticsResponse(
            loanRepository.count(),
            open - overdue,
            overdue,
            loanRepository.countByStatus(LoanStatus.RETURNED),
            loanRepository.countByStatus(LoanStatus.LOST),
            loanRepository.countByStatus(LoanStatus.DAMAGED),
            assessed,
            outstanding
        );
    }

    public ReservationResponse findReservation(Long id, Instant now) {
        Reservation reservation = reservationRepository.findByIdWithBook(id)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", id));
        return toResponse(reservation, now);
    }

    public Page<ReservationResponse> findReservations(Long bookId, String userId, ReservationStatus status,
                                                      Pageable pageable, Instant now) {
        Specification<Reservation> spec = Specification.where(null);

        if (bookId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("book").get("id"), bookId));
        }
        if (userId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("userId"), userId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        return reservationRepository.findAll(spec, pageable)
            .map(reservation -> toResponse(reservation, now));
    }

    public AvailabilityResponse availability(Long bookId, Instant now) {
        TitleAvailability row = ledger.snapshot(bookId);
        long queueLength = reservationRepository.countUnexpired(bookId, ReservationStatus.PENDING, now);
        Instant nextDueAt = row.available() > 0 ? null
            : loanRepository.findFirstByBookIdAndStatusInOrderByDueAtAsc(bookId, LoanStatus.OPEN)
                .map(Loan::getDueAt)
                .orElse(null);
        return new AvailabilityResponse(bookId, row.getTotalCopies(), row.getOnLoan(), row.available(),
            queueLength, nextDueAt);
    }

    private LoanResponse toResponse(Loan loan, Instant now) {
        return LoanMapper.toResponse(loan,
            loanStateMachine.effectiveStatus(loan, now),
            loanStateMachine.accruedFine(loan, now));
    }

    /** Positions of live reservations are counted at {@code now}, skipping expired ones ahead. */
    private ReservationResponse toResponse(Reservation reservation, Instant now) {
        if (reservation.getStatus() != ReservationStatus.PENDING || ReservationMapper.isStale(reservation, now)) {
            return ReservationMapper.toResponse(reservation, now);
        }
        long ahead = reservationRepository.countLiveAhead(
            reservation.getBook().getId(), reservation.getId(), ReservationStatus.PENDING, now);
        return ReservationMapper.toResponse(reservation, (int) ahead + 1);
    }
}
