package com.library.circulation.service;

/** Where a pending reservation currently stands in its title's queue. */
public record QueuePosition(Long reservationId, Long bookId, int position, int queueLength) {}
