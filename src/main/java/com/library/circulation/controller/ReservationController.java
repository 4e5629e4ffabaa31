package com.library.circulation.controller;

import com.library.circulation.dto.request.CreateReservationRequest;
import com.library.circulation.dto.response.PagedResponse;
import com.library.circulation.dto.response.QueuePositionResponse;
import com.library.circulation.dto.response.ReservationResponse;
import com.library.circulation.dto.response.SweepResponse;
import com.library.circulation.entity.ReservationStatus;
import com.library.circulation.mapper.ReservationMapper;
import com.library.circulation.service.CirculationCoordinator;
import com.library.circulation.service.CirculationQueryService;
import com.library.circulation.service.QueuePosition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
@Tag(name = "Reservations", description = "First-come-first-served holds on unavailable titles")
public class ReservationController {

    private final CirculationCoordinator coordinator;
    private final CirculationQueryService queryService;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Create a reservation", description = "Joins the title's queue. Only accepted while "
        + "no copy is available; one pending reservation per user and title.")
    @ApiResponse(responseCode = "201", description = "Reservation created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "Copy available, duplicate reservation, or already borrowed")
    @ApiResponse(responseCode = "503", description = "Title busy, retry later")
    public ResponseEntity<ReservationResponse> create(@Valid @RequestBody CreateReservationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ReservationMapper.toResponse(
            coordinator.reserve(request.bookId(), request.userId(), Instant.now(clock))));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel a reservation", description = "Removes a pending reservation from the queue. "
        + "The record is retained for history.")
    @ApiResponse(responseCode = "200", description = "Reservation cancelled")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    @ApiResponse(responseCode = "409", description = "Reservation is not pending")
    public ResponseEntity<ReservationResponse> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(ReservationMapper.toResponse(
            coordinator.cancelReservation(id, Instant.now(clock))));
    }

    @GetMapping("/{id}/position")
    @Operation(summary = "Get queue position", description = "Expires stale entries first, so the position is exact.")
    @ApiResponse(responseCode = "200", description = "Position returned")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    @ApiResponse(responseCode = "409", description = "Reservation is not pending")
    public ResponseEntity<QueuePositionResponse> position(@PathVariable Long id) {
        QueuePosition position = coordinator.queuePosition(id, Instant.now(clock));
        return ResponseEntity.ok(new QueuePositionResponse(
            position.reservationId(), position.bookId(), position.position(), position.queueLength()));
    }

    @GetMapping
    @Operation(summary = "List reservations", description = "Returns a paginated list of reservations with optional filters.")
    public ResponseEntity<PagedResponse<ReservationResponse>> findAll(
            @Parameter(description = "Filter by book ID") @RequestParam(required = false) Long bookId,
            @Parameter(description = "Filter by user ID") @RequestParam(required = false) String userId,
            @Parameter(description = "Filter by status (PENDING, FULFILLED, EXPIRED, CANCELLED)")
            @RequestParam(required = false) ReservationStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            queryService.findReservations(bookId, userId, status, pageable, Instant.now(clock))));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get reservation by ID")
    @ApiResponse(responseCode = "200", description = "Reservation found")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    public ResponseEntity<ReservationResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.findReservation(id, Instant.now(clock)));
    }

    @PostMapping("/expire-stale")
    @Operation(summary = "Expire stale reservations", description = "Runs the expiry sweep now.")
    public ResponseEntity<SweepResponse> expireStale() {
        Instant now = Instant.now(clock);
        return ResponseEntity.ok(new SweepResponse(coordinator.expireStaleReservations(now), now));
    }
}
