package com.library.circulation.controller;

import com.library.circulation.dto.request.BorrowRequest;
import com.library.circulation.dto.response.LoanResponse;
import com.library.circulation.dto.response.LoanStatisticsResponse;
import com.library.circulation.dto.response.PagedResponse;
import com.library.circulation.dto.response.ReturnResponse;
import com.library.circulation.dto.response.SweepResponse;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.mapper.LoanMapper;
import com.library.circulation.mapper.ReservationMapper;
import com.library.circulation.service.CirculationCoordinator;
import com.library.circulation.service.CirculationQueryService;
import com.library.circulation.service.ReturnOutcome;
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
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
@Tag(name = "Loans", description = "Borrowing, returns, renewals and overdue tracking")
public class LoanController {

    private final CirculationCoordinator coordinator;
    private final CirculationQueryService queryService;
    private final Clock clock;

    @PostMapping
    @Operation(summary = "Borrow a book", description = "Lends a copy directly. Rejected when no copy is "
        + "available or when other users are already queued for the title.")
    @ApiResponse(responseCode = "201", description = "Loan created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "No copy available, queue not empty, or already borrowed")
    @ApiResponse(responseCode = "503", description = "Title busy, retry later")
    public ResponseEntity<LoanResponse> borrow(@Valid @RequestBody BorrowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(LoanMapper.toResponse(
            coordinator.borrow(request.bookId(), request.userId(), Instant.now(clock), request.notes())));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get loan by ID", description = "Status and fine are evaluated at request time.")
    @ApiResponse(responseCode = "200", description = "Loan found")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    public ResponseEntity<LoanResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.findLoan(id, Instant.now(clock)));
    }

    @GetMapping
    @Operation(summary = "List loans", description = "Returns a paginated list of loans with optional filters.")
    public ResponseEntity<PagedResponse<LoanResponse>> findAll(
            @Parameter(description = "Filter by user ID") @RequestParam(required = false) String userId,
            @Parameter(description = "Filter by book ID") @RequestParam(required = false) Long bookId,
            @Parameter(description = "Filter by status (ACTIVE, OVERDUE, RETURNED, LOST, DAMAGED)")
            @RequestParam(required = false) LoanStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            queryService.findLoans(userId, bookId, status, pageable, Instant.now(clock))));
    }

    @GetMapping("/overdue")
    @Operation(summary = "List overdue loans", description = "Open loans past their due date, oldest first.")
    public ResponseEntity<List<LoanResponse>> findOverdue() {
        return ResponseEntity.ok(queryService.findOverdue(Instant.now(clock)));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Loan statistics", description = "Counts per status and fine totals.")
    public ResponseEntity<LoanStatisticsResponse> statistics() {
        return ResponseEntity.ok(queryService.statistics(Instant.now(clock)));
    }

    @PostMapping("/{id}/return")
    @Operation(summary = "Return a loan", description = "Closes the loan and hands the copy to the head of "
        + "the reservation queue, if any. Returning an already returned loan changes nothing.")
    @ApiResponse(responseCode = "200", description = "Loan returned")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    @ApiResponse(responseCode = "409", description = "Loan was written off")
    @ApiResponse(responseCode = "503", description = "Title busy, retry later")
    public ResponseEntity<ReturnResponse> returnLoan(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(coordinator.returnLoan(id, Instant.now(clock))));
    }

    @PostMapping("/{id}/renew")
    @Operation(summary = "Renew a loan", description = "Extends the due date by one loan period.")
    @ApiResponse(responseCode = "200", description = "Loan renewed")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    @ApiResponse(responseCode = "409", description = "Loan closed, overdue, at its renewal limit, or reserved by another user")
    @ApiResponse(responseCode = "503", description = "Title busy, retry later")
    public ResponseEntity<LoanResponse> renew(@PathVariable Long id) {
        return ResponseEntity.ok(LoanMapper.toResponse(coordinator.renew(id, Instant.now(clock))));
    }

    @PostMapping("/{id}/lost")
    @Operation(summary = "Mark a loan lost", description = "Closes the loan as lost and frees its slot.")
    @ApiResponse(responseCode = "200", description = "Loan marked lost")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    @ApiResponse(responseCode = "409", description = "Loan already closed differently")
    public ResponseEntity<ReturnResponse> markLost(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(coordinator.markLost(id, Instant.now(clock))));
    }

    @PostMapping("/{id}/damaged")
    @Operation(summary = "Mark a loan damaged", description = "Closes the loan as damaged and frees its slot.")
    @ApiResponse(responseCode = "200", description = "Loan marked damaged")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    @ApiResponse(responseCode = "409", description = "Loan already closed differently")
    public ResponseEntity<ReturnResponse> markDamaged(@PathVariable Long id) {
        return ResponseEntity.ok(toResponse(coordinator.markDamaged(id, Instant.now(clock))));
    }

    @PostMapping("/overdue-sweep")
    @Operation(summary = "Run the overdue sweep", description = "Persists overdue status and fines now "
        + "instead of waiting for the scheduled run.")
    public ResponseEntity<SweepResponse> sweepOverdue() {
        Instant now = Instant.now(clock);
        return ResponseEntity.ok(new SweepResponse(coordinator.sweepOverdue(now), now));
    }

    private static ReturnResponse toResponse(ReturnOutcome outcome) {
        return new ReturnResponse(
            LoanMapper.toResponse(outcome.loan()),
            outcome.promoted() ? LoanMapper.toResponse(outcome.promotedLoan()) : null,
            outcome.fulfilledReservation() != null
                ? ReservationMapper.toResponse(outcome.fulfilledReservation()) : null,
            outcome.alreadyClosed()
        );
    }
}
