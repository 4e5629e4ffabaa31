package com.library.circulation.dto.response;

public record QueuePositionResponse(
    Long reservationId,
    Long bookId,
    int position,
    int queueLength
) {}
