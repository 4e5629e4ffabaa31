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

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One copy of a title held by one user for a bounded period.
 *
 * <p>Loans are never deleted. They end in one of the terminal states
 * {@link LoanStatus#RETURNED}, {@link LoanStatus#LOST} or {@link LoanStatus#DAMAGED}.
 * All transitions are performed by {@code LoanStateMachine} while the coordinator holds
 * the title lock.
 *
 * <p>{@link #returnedAt} is set only by a physical return; {@link #closedAt} is set by
 * every terminal transition and is the instant the fine was frozen at.
 *
 * <p>A user holds at most one open loan per title, enforced by the partial unique index
 * {@code idx_loans_open_book_user}.
 */
@Entity
@Table(name = "loans")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Loan extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    /** Opaque, already-authenticated user identifier supplied by the calling layer. */
    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private LoanStatus status;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "due_at", nullable = false)
    private Instant dueAt;

    @Column(name = "returned_at")
    private Instant returnedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "renewal_count", nullable = false)
    private int renewalCount;

    /**
     * Fine accrued so far. Recomputed on every write that touches the loan while it is
     * open, frozen once the loan is closed.
     */
    @Column(name = "fine_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal fineAmount = BigDecimal.ZERO;

    @Column(name = "notes", length = 500)
    private String notes;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
