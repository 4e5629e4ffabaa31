package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;
import com.library.circulation.exception.DuplicateReservationException;
import com.library.circulation.exception.InvalidReservationStateException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Strict FIFO waiting list per title.
 *
 * <p>Every read of the queue first expires stale entries, then renumbers the survivors
 * 1..n in creation order. Positions are therefore always derived from the current pending
 * set and never drift, and expiry never depends on a scheduler having run.
 *
 * <p>All methods must run inside the coordinator's per-title transaction, which makes
 * compaction atomic with respect to concurrent enqueues on the same title.
 */
@Component
@RequiredArgsConstructor
public class ReservationQueueManager {

    private static final Logger log = LoggerFactory.getLogger(ReservationQueueManager.class);

    private final ReservationRepository reservationRepository;
    private final LoanRepository loanRepository;
    private final BookRepository bookRepository;
    private final CirculationProperties properties;

    /** Live pending reservations for the title, head first. */
    public List<Reservation> pendingQueue(Long titleId, Instant now) {
        return refresh(titleId, now, new ArrayList<>());
    }

    public int queueLength(Long titleId, Instant now) {
        return pendingQueue(titleId, now).size();
    }

    /**
     * Expires every pending reservation of the title whose expiry has passed.
     *
     * @return the number of reservations expired
     */
    public int expireStale(Long titleId, Instant now) {
        List<Reservation> expired = new ArrayList<>();
        refresh(titleId, now, expired);
        return expired.size();
    }

    /**
     * Appends the user to the title's queue.
     *
     * @throws DuplicateReservationException if the user already holds an open loan on the
     *                                       title or is already waiting for it
     */
    public Reservation enqueue(Long titleId, String userId, Instant now) {
        List<Reservation> queue = pendingQueue(titleId, now);

        if (loanRepository.existsByBookIdAndUserIdAndStatusIn(titleId, userId, LoanStatus.OPEN)) {
            throw new DuplicateReservationException(titleId, userId, "user already has this book on loan");
        }
        queue.stream()
            .filter(r -> r.getUserId().equals(userId))
            .findFirst()
            .ifPresent(existing -> {
                throw new DuplicateReservationException(titleId, userId,
                    "already queued at position " + existing.getQueuePosition());
            });

        Reservation reservation = new Reservation();
        reservation.setBook(bookRepository.getReferenceById(titleId));
        reservation.setUserId(userId);
        reservation.setStatus(ReservationStatus.PENDING);
        reservation.setQueuePosition(queue.size() + 1);
        reservation.setReservedAt(now);
        reservation.setExpiresAt(now.plus(properties.getReservationExpiry()));

        Reservation saved = reservationRepository.save(reservation);
        log.info("Queued reservation {} for book {} by user {} at position {}",
            saved.getId(), titleId, userId, saved.getQueuePosition());
        return saved;
    }

    /**
     * Withdraws a pending reservation and closes the gap it leaves.
     *
     * @throws InvalidReservationStateException if the reservation is no longer pending,
     *                                          including one that has just expired
     */
    public Reservation cancel(Long reservationId, Instant now) {
        Reservation reservation = reservationRepository.findById(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        Long titleId = reservation.getBook().getId();

        List<Reservation> queue = pendingQueue(titleId, now);
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            throw new InvalidReservationStateException(reservationId, reservation.getStatus(), "cancelled");
        }

        queue.remove(reservation);
        reservation.setStatus(ReservationStatus.CANCELLED);
        reservation.setCancelledAt(now);
        reservation.setQueuePosition(null);
        compact(queue);

        log.info("Cancelled reservation {} for book {}; {} still waiting", reservationId, titleId, queue.size());
        return reservation;
    }

    /**
     * Marks the head of the queue FULFILLED. The caller must create the loan for it in the
     * same transaction, using capacity it has already confirmed is free.
     */
    public Optional<Reservation> promoteHead(Long titleId, Instant now) {
        List<Reservation> queue = pendingQueue(titleId, now);
        if (queue.isEmpty()) {
            return Optional.empty();
        }

        Reservation head = queue.remove(0);
        head.setStatus(ReservationStatus.FULFILLED);
        head.setFulfilledAt(now);
        head.setQueuePosition(null);
        compact(queue);

        log.info("Promoted reservation {} of user {} for book {}", head.getId(), head.getUserId(), titleId);
        return Optional.of(head);
    }

    private List<Reservation> refresh(Long titleId, Instant now, List<Reservation> expiredSink) {
        List<Reservation> pending = reservationRepository
            .findByBookIdAndStatusOrderByIdAsc(titleId, ReservationStatus.PENDING);

        List<Reservation> live = new ArrayList<>(pending.size());
        for (Reservation reservation : pending) {
            if (reservation.getExpiresAt().isBefore(now)) {
                reservation.setStatus(ReservationStatus.EXPIRED);
                reservation.setQueuePosition(null);
                expiredSink.add(reservation);
            } else {
                live.add(reservation);
            }
        }
        compact(live);

        if (!expiredSink.isEmpty()) {
            log.info("Expired {} stale reservation(s) for book {}", expiredSink.size(), titleId);
        }
        return live;
    }

    private void compact(List<Reservation> queue) {
        for (int i = 0; i < queue.size(); i++) {
            Reservation reservation = queue.get(i);
            if (!Objects.equals(reservation.getQueuePosition(), i + 1)) {
                reservation.setQueuePosition(i + 1);
            }
        }
    }
}
