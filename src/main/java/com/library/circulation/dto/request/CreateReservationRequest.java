package com.library.circulation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateReservationRequest(

    @NotNull(message = "Book ID is required")
    Long bookId,

    @NotBlank(message = "User ID must not be blank")
    @Size(max = 100, message = "User ID must not exceed 100 characters")
    String userId
) {}
