package com.library.circulation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Copy-count ledger row for one title.
 *
 * <p>This row is also the per-title mutual-exclusion point: every borrow, return,
 * renewal and queue mutation for the title begins by locking it with
 * {@code SELECT ... FOR UPDATE}. Operations on different titles lock different rows
 * and never contend.
 *
 * <p>No {@code @Version} column: the row is only ever written while pessimistically
 * locked.
 *
 * <p>{@code onLoan} may exceed {@code totalCopies} after the catalog lowers the copy
 * count below the number of open loans. Those loans stay valid; {@link #available()}
 * simply reports zero until enough copies come back.
 */
@Entity
@Table(name = "title_availability")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "titleId", callSuper = false)
public class TitleAvailability extends BaseEntity {

    @Id
    @Column(name = "title_id")
    private Long titleId;

    @Column(name = "total_copies", nullable = false)
    private int totalCopies;

    @Column(name = "on_loan", nullable = false)
    private int onLoan;

    public TitleAvailability(Long titleId, int totalCopies) {
        this.titleId = titleId;
        this.totalCopies = totalCopies;
        this.onLoan = 0;
    }

    public int available() {
        return Math.max(0, totalCopies - onLoan);
    }
}
