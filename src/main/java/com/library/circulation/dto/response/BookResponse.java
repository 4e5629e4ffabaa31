package com.library.circulation.dto.response;

import java.time.Instant;

public record BookResponse(
    Long id,
    String title,
    String isbn,
    int totalCopies,
    Instant createdAt,
    Instant updatedAt
) {}
