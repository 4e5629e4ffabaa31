package com.library.circulation.dto.response;

import com.library.circulation.entity.ReservationStatus;

import java.time.Instant;

public record ReservationResponse(
    Long id,
    Long bookId,
    String userId,
    ReservationStatus status,
    Integer queuePosition,
    Instant reservedAt,
    Instant expiresAt,
    Instant cancelledAt,
    Instant fulfilledAt,
    Long loanId
) {}
