package com.library.circulation.dto.response;

import java.math.BigDecimal;

/**
 * Circulation totals. {@code activeLoans} and {@code overdueLoans} are evaluated against
 * the current time, so they are correct even if no overdue sweep has run.
 */
public record LoanStatisticsResponse(
    long totalLoans,
    long activeLoans,
    long overdueLoans,
    long returnedLoans,
    long lostLoans,
    long damagedLoans,
    BigDecimal finesAssessed,
    BigDecimal finesOutstanding
) {}
