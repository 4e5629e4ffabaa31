package com.library.circulation.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record UpdateCopiesRequest(

    @NotNull(message = "Total copies is required")
    @Min(value = 0, message = "Total copies must not be negative")
    Integer totalCopies
) {}
