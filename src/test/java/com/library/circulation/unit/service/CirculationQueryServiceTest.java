package com.library.circulation.unit.service;

import com.library.circulation.dto.response.AvailabilityResponse;
import com.library.circulation.dto.response.LoanResponse;
import com.library.circulation.dto.response.ReservationResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.entity.Loan;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;
import com.library.circulation.entity.TitleAvailability;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.ReservationRepository;
import com.library.circulation.service.AvailabilityLedger;
import com.library.circulation.service.CirculationQueryService;
import com.library.circulation.service.LoanStateMachine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CirculationQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private AvailabilityLedger ledger;

    @Mock
    private LoanStateMachine loanStateMachine;

    @InjectMocks
    private CirculationQueryService queryService;

    @Test
    void findLoan_reportsEffectiveStatusAndFine() {
        Loan loan = loan(10L, NOW.minus(Duration.ofDays(2)));
        when(loanRepository.findByIdWithBook(10L)).thenReturn(Optional.of(loan));
        when(loanStateMachine.effectiveStatus(loan, NOW)).thenReturn(LoanStatus.OVERDUE);
        when(loanStateMachine.accruedFine(loan, NOW)).thenReturn(new BigDecimal("2.00"));

        LoanResponse response = queryService.findLoan(10L, NOW);

        assertThat(response.status()).isEqualTo(LoanStatus.OVERDUE);
        assertThat(response.fineAmount()).isEqualByComparingTo("2.00");
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
    }

    @Test
    void findLoan_whenNotFound_throwsResourceNotFoundException() {
        when(loanRepository.findByIdWithBook(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> queryService.findLoan(99L, NOW))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Loan");
    }

    @Test
    void availability_whenNothingFree_includesNextDueDate() {
        TitleAvailability row = new TitleAvailability(1L, 1);
        row.setOnLoan(1);
        Loan earliest = loan(10L, NOW.plus(Duration.ofDays(3)));
        when(ledger.snapshot(1L)).thenReturn(row);
        when(reservationRepository.countUnexpired(1L, ReservationStatus.PENDING, NOW)).thenReturn(2L);
        when(loanRepository.findFirstByBookIdAndStatusInOrderByDueAtAsc(1L, LoanStatus.OPEN))
            .thenReturn(Optional.of(earliest));

        AvailabilityResponse response = queryService.availability(1L, NOW);

        assertThat(response.available()).isZero();
        assertThat(response.onLoan()).isEqualTo(1);
        assertThat(response.queueLength()).isEqualTo(2);
        assertThat(response.nextDueAt()).isEqualTo(NOW.plus(Duration.ofDays(3)));
    }

    @Test
    void availability_withFreeCopy_omitsNextDueDate() {
        when(ledger.snapshot(1L)).thenReturn(new TitleAvailability(1L, 2));
        when(reservationRepository.countUnexpired(1L, ReservationStatus.PENDING, NOW)).thenReturn(0L);

        AvailabilityResponse response = queryService.availability(1L, NOW);

        assertThat(response.available()).isEqualTo(2);
        assertThat(response.nextDueAt()).isNull();
        verify(loanRepository, never()).findFirstByBookIdAndStatusInOrderByDueAtAsc(any(), any());
    }

    @Test
    void findReservation_behindExpiredHead_reportsLivePosition() {
        Reservation second = reservation(6L, 2, NOW.plus(Duration.ofDays(5)));
        when(reservationRepository.findByIdWithBook(6L)).thenReturn(Optional.of(second));
        when(reservationRepository.countLiveAhead(1L, 6L, ReservationStatus.PENDING, NOW)).thenReturn(0L);

        ReservationResponse response = queryService.findReservation(6L, NOW);

        assertThat(response.status()).isEqualTo(ReservationStatus.PENDING);
        assertThat(response.queuePosition()).isEqualTo(1);
        assertThat(second.getQueuePosition()).isEqualTo(2);
    }

    @Test
    void findReservation_pastExpiry_reportsExpiredWithoutPosition() {
        Reservation head = reservation(5L, 1, NOW.minus(Duration.ofDays(1)));
        when(reservationRepository.findByIdWithBook(5L)).thenReturn(Optional.of(head));

        ReservationResponse response = queryService.findReservation(5L, NOW);

        assertThat(response.status()).isEqualTo(ReservationStatus.EXPIRED);
        assertThat(response.queuePosition()).isNull();
        verify(reservationRepository, never()).countLiveAhead(any(), any(), any(), any());
    }

    private Reservation reservation(Long id, int storedPosition, Instant expiresAt) {
        Book book = new Book();
        ReflectionTestUtils.setField(book, "id", 1L);
        Reservation reservation = new Reservation();
        ReflectionTestUtils.setField(reservation, "id", id);
        reservation.setBook(book);
        reservation.setUserId("bob");
        reservation.setStatus(ReservationStatus.PENDING);
        reservation.setQueuePosition(storedPosition);
        reservation.setReservedAt(expiresAt.minus(Duration.ofDays(7)));
        reservation.setExpiresAt(expiresAt);
        return reservation;
    }

    private Loan loan(Long id, Instant dueAt) {
        Book book = new Book();
        ReflectionTestUtils.setField(book, "id", 1L);
        Loan loan = new Loan();
        ReflectionTestUtils.setField(loan, "id", id);
        loan.setBook(book);
        loan.setUserId("alice");
        loan.setStatus(LoanStatus.ACTIVE);
        loan.setIssuedAt(dueAt.minus(Duration.ofDays(14)));
        loan.setDueAt(dueAt);
        return loan;
    }
}
