package com.library.circulation.dto.response;

import java.time.Instant;

/**
 * Derived availability of a title. {@code nextDueAt} is the earliest due date among open
 * loans and is only filled in when no copy is available.
 */
public record AvailabilityResponse(
    Long bookId,
    int totalCopies,
    int onLoan,
    int available,
    long queueLength,
    Instant nextDueAt
) {}
