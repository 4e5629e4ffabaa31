package com.library.circulation.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a {@link Loan}.
 *
 * <p>Stored via {@code EnumType.STRING}; never reorder-sensitive.
 *
 * <ul>
 *   <li>{@link #ACTIVE}   - copy is out and not yet past its due date</li>
 *   <li>{@link #OVERDUE}  - copy is out and past its due date; fine accrues daily</li>
 *   <li>{@link #RETURNED} - copy came back; fine is frozen</li>
 *   <li>{@link #LOST}     - written off by a librarian</li>
 *   <li>{@link #DAMAGED}  - returned unusable, written off by a librarian</li>
 * </ul>
 */
public enum LoanStatus {
    ACTIVE,
    OVERDUE,
    RETURNED,
    LOST,
    DAMAGED;

    /** States that hold a unit of the title's capacity. */
    public static final Set<LoanStatus> OPEN = EnumSet.of(ACTIVE, OVERDUE);

    public boolean isOpen() {
        return OPEN.contains(this);
    }

    public boolean isTerminal() {
        return !isOpen();
    }
}
