package com.library.circulation.dto.response;

import java.time.Instant;

public record SweepResponse(int affected, Instant evaluatedAt) {}
