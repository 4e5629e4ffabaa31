package com.library.circulation.controller;

import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.request.UpdateCopiesRequest;
import com.library.circulation.dto.response.AvailabilityResponse;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.service.BookService;
import com.library.circulation.service.CirculationQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Titles and their copy counts")
public class BookController {

    private final BookService bookService;
    private final CirculationQueryService queryService;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Register a book", description = "Adds a title with its number of physical copies.")
    @ApiResponse(responseCode = "201", description = "Book registered")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "ISBN already exists")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.create(request));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @PatchMapping("/{id}/copies")
    @Operation(summary = "Change the number of copies", description = "Added copies are handed to waiting "
        + "reservations first. Reducing below the number on loan keeps existing loans and blocks new ones.")
    @ApiResponse(responseCode = "200", description = "Copy count updated")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "503", description = "Title busy, retry later")
    public ResponseEntity<BookResponse> updateCopies(@PathVariable Long id,
                                                     @Valid @RequestBody UpdateCopiesRequest request) {
        return ResponseEntity.ok(bookService.updateCopies(id, request.totalCopies()));
    }

    @GetMapping("/{id}/availability")
    @Operation(summary = "Get availability", description = "Copies on loan and available, queue length, "
        + "and the earliest due date when no copy is free.")
    @ApiResponse(responseCode = "200", description = "Availability returned")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<AvailabilityResponse> availability(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.availability(id, Instant.now(clock)));
    }
}
