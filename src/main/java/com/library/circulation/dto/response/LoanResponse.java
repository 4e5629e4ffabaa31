package com.library.circulation.dto.response;

import com.library.circulation.entity.LoanStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record LoanResponse(
    Long id,
    Long bookId,
    String userId,
    LoanStatus status,
    Instant issuedAt,
    Instant dueAt,
    Instant returnedAt,
    Instant closedAt,
    int renewalCount,
    BigDecimal fineAmount,
    String notes
) {}
