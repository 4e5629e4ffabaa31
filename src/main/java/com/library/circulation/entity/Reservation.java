package com.library.circulation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A place in the waiting queue for the next free copy of a title.
 *
 * <p><strong>Queue position</strong>: {@link #queuePosition} is dense and 1-based among the
 * {@link ReservationStatus#PENDING} reservations of the same title, in creation order
 * (ascending {@code id}, allocated while the title lock is held). It is rewritten from the
 * ordered pending set by {@code ReservationQueueManager} every time that set changes, so it
 * never drifts from the set it describes. Terminal reservations carry {@code null}.
 *
 * <p><strong>Duplicates</strong>: a user has at most one pending reservation per title,
 * enforced by the partial unique index {@code idx_reservations_pending_book_user}.
 *
 * <p><strong>Promotion</strong>: when the head of the queue is promoted, {@link #loanId}
 * records the loan that was created for it in the same transaction.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "queue_position")
    private Integer queuePosition;

    @Column(name = "reserved_at", nullable = false, updatable = false)
    private Instant reservedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "fulfilled_at")
    private Instant fulfilledAt;

    @Column(name = "loan_id")
    private Long loanId;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
