package com.library.circulation.unit.controller.handler;

import com.library.circulation.controller.handler.GlobalExceptionHandler;
import com.library.circulation.dto.response.ErrorResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.exception.ErrorCode;
import com.library.circulation.exception.TransientConflictException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void optimisticLockFailure_mapsToRetryableServiceUnavailable() {
        MockHttpServletRequest request = new MockHttpServletRequest("PATCH", "/api/v1/books/1/copies");

        ResponseEntity<ErrorResponse> response = handler.handleOptimisticLock(
            new ObjectOptimisticLockingFailureException(Book.class, 1L), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
        assertThat(response.getBody().code()).isEqualTo(ErrorCode.TRANSIENT_CONFLICT.name());
        assertThat(response.getBody().path()).isEqualTo("/api/v1/books/1/copies");
    }

    @Test
    void transientConflict_andOptimisticLockFailure_shareStatusAndCode() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/loans");

        ResponseEntity<ErrorResponse> busy = handler.handleTransientConflict(
            new TransientConflictException(1L, 3, new PessimisticLockingFailureException("lock timeout")), request);
        ResponseEntity<ErrorResponse> stale = handler.handleOptimisticLock(
            new ObjectOptimisticLockingFailureException(Book.class, 1L), request);

        assertThat(stale.getStatusCode()).isEqualTo(busy.getStatusCode());
        assertThat(stale.getBody().code()).isEqualTo(busy.getBody().code());
        assertThat(stale.getHeaders().getFirst(HttpHeaders.RETRY_AFTER))
            .isEqualTo(busy.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
    }
}
