package com.library.circulation.integration;

import com.library.circulation.dto.request.BorrowRequest;
import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.request.CreateReservationRequest;
import com.library.circulation.dto.request.UpdateCopiesRequest;
import com.library.circulation.dto.response.AvailabilityResponse;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.dto.response.ErrorResponse;
import com.library.circulation.dto.response.LoanResponse;
import com.library.circulation.dto.response.LoanStatisticsResponse;
import com.library.circulation.dto.response.QueuePositionResponse;
import com.library.circulation.dto.response.ReservationResponse;
import com.library.circulation.dto.response.ReturnResponse;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.entity.ReservationStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CirculationApiIntegrationTest extends AbstractIntegrationTest {

    private static final String BOOKS_URL = "/api/v1/books";
    private static final String LOANS_URL = "/api/v1/loans";
    private static final String RESERVATIONS_URL = "/api/v1/reservations";

    @Test
    void borrowReserveReturn_overHttp() {
        Long bookId = createBook("Effective Java", "9780134685991", 1);

        ResponseEntity<LoanResponse> borrowed = restTemplate.postForEntity(LOANS_URL,
            new BorrowRequest(bookId, "alice", "first copy"), LoanResponse.class);
        assertThat(borrowed.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        LoanResponse loan = borrowed.getBody();
        assertThat(loan.status()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(loan.notes()).isEqualTo("first copy");

        ResponseEntity<ReservationResponse> reserved = restTemplate.postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(bookId, "bob"), ReservationResponse.class);
        assertThat(reserved.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(reserved.getBody().queuePosition()).isEqualTo(1);

        ResponseEntity<QueuePositionResponse> position = restTemplate.getForEntity(
            RESERVATIONS_URL + "/" + reserved.getBody().id() + "/position", QueuePositionResponse.class);
        assertThat(position.getBody().position()).isEqualTo(1);
        assertThat(position.getBody().queueLength()).isEqualTo(1);

        ResponseEntity<AvailabilityResponse> availability = restTemplate.getForEntity(
            BOOKS_URL + "/" + bookId + "/availability", AvailabilityResponse.class);
        assertThat(availability.getBody().available()).isZero();
        assertThat(availability.getBody().queueLength()).isEqualTo(1);
        assertThat(availability.getBody().nextDueAt()).isEqualTo(loan.dueAt());

        ResponseEntity<ReturnResponse> returned = restTemplate.postForEntity(
            LOANS_URL + "/" + loan.id() + "/return", null, ReturnResponse.class);
        assertThat(returned.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(returned.getBody().loan().status()).isEqualTo(LoanStatus.RETURNED);
        assertThat(returned.getBody().promotedLoan().userId()).isEqualTo("bob");
        assertThat(returned.getBody().fulfilledReservation().status()).isEqualTo(ReservationStatus.FULFILLED);
        assertThat(returned.getBody().alreadyClosed()).isFalse();

        ResponseEntity<ReturnResponse> again = restTemplate.postForEntity(
            LOANS_URL + "/" + loan.id() + "/return", null, ReturnResponse.class);
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(again.getBody().alreadyClosed()).isTrue();

        ResponseEntity<LoanStatisticsResponse> stats = restTemplate.getForEntity(
            LOANS_URL + "/statistics", LoanStatisticsResponse.class);
        assertThat(stats.getBody().totalLoans()).isEqualTo(2);
        assertThat(stats.getBody().activeLoans()).isEqualTo(1);
        assertThat(stats.getBody().returnedLoans()).isEqualTo(1);
    }

    @Test
    void borrow_withoutFreeCopy_returnsConflictWithCode() {
        Long bookId = createBook("Clean Code", "9780132350884", 1);
        restTemplate.postForEntity(LOANS_URL, new BorrowRequest(bookId, "alice", null), LoanResponse.class);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(LOANS_URL,
            new BorrowRequest(bookId, "bob", null), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().code()).isEqualTo("CAPACITY_EXHAUSTED");
    }

    @Test
    void reserve_whenCopyAvailable_returnsConflictWithCode() {
        Long bookId = createBook("Refactoring", "9780134757599", 2);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(bookId, "alice"), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().code()).isEqualTo("RESERVATION_NOT_REQUIRED");
    }

    @Test
    void renew_whenSomeoneWaiting_returnsReservedByAnotherUser() {
        Long bookId = createBook("Domain-Driven Design", "9780321125217", 1);
        LoanResponse loan = restTemplate.postForEntity(LOANS_URL,
            new BorrowRequest(bookId, "alice", null), LoanResponse.class).getBody();
        restTemplate.postForEntity(RESERVATIONS_URL, new CreateReservationRequest(bookId, "bob"),
            ReservationResponse.class);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
            LOANS_URL + "/" + loan.id() + "/renew", null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().code()).isEqualTo("RESERVED_BY_ANOTHER_USER");
    }

    @Test
    void cancelReservation_overHttp() {
        Long bookId = createBook("Release It!", "9781680502398", 1);
        restTemplate.postForEntity(LOANS_URL, new BorrowRequest(bookId, "alice", null), LoanResponse.class);
        ReservationResponse reservation = restTemplate.postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(bookId, "bob"), ReservationResponse.class).getBody();

        ResponseEntity<ReservationResponse> cancelled = restTemplate.exchange(
            RESERVATIONS_URL + "/" + reservation.id() + "/cancel", HttpMethod.PATCH, null, ReservationResponse.class);

        assertThat(cancelled.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(cancelled.getBody().status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(cancelled.getBody().queuePosition()).isNull();
    }

    @Test
    void updateCopies_overHttp_changesAvailability() {
        Long bookId = createBook("Site Reliability Engineering", "9781491929124", 1);

        ResponseEntity<BookResponse> updated = restTemplate.exchange(BOOKS_URL + "/" + bookId + "/copies",
            HttpMethod.PATCH, new HttpEntity<>(new UpdateCopiesRequest(4)), BookResponse.class);

        assertThat(updated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(updated.getBody().totalCopies()).isEqualTo(4);
        assertThat(restTemplate.getForEntity(BOOKS_URL + "/" + bookId + "/availability",
            AvailabilityResponse.class).getBody().available()).isEqualTo(4);
    }

    @Test
    void unknownLoan_returnsNotFound() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
            LOANS_URL + "/999/return", null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().code()).isEqualTo("NOT_FOUND");
    }

    @Test
    void borrow_withBlankUser_returnsValidationErrors() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(LOANS_URL,
            Map.of("bookId", 1, "userId", ""), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().fieldErrors()).extracting(ErrorResponse.FieldError::field).contains("userId");
    }

    @Test
    void createBook_duplicateIsbn_returnsConflict() {
        createBook("Effective Java", "9780134685991", 1);

        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest("Effective Java 2", "9780134685991", 1), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    private Long createBook(String title, String isbn, int copies) {
        ResponseEntity<BookResponse> response = restTemplate.postForEntity(BOOKS_URL,
            new CreateBookRequest(title, isbn, copies), BookResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }
}
