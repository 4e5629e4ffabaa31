package com.library.circulation.integration;

import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.entity.LoanStatus;
import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;
import com.library.circulation.exception.CapacityExhaustedException;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.ReservationRepository;
import com.library.circulation.service.BookService;
import com.library.circulation.service.CirculationCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class BorrowConcurrencyTest extends AbstractIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private CirculationCoordinator coordinator;

    @Autowired
    private BookService bookService;

    @Autowired
    private LoanRepository loanRepository;

    @Autowired
    private ReservationRepository reservationRepository;

    @Test
    void concurrentBorrows_neverExceedCopyCount() throws Exception {
        int copies = 3;
        int threadCount = 8;
        Long bookId = bookService.create(new CreateBookRequest("Java Concurrency in Practice", "9780321349606", copies)).id();

        List<Throwable> outcomes = runConcurrently(threadCount, i -> () -> {
            coordinator.borrow(bookId, "user" + i, NOW);
            return null;
        });

        long succeeded = outcomes.stream().filter(o -> o == null).count();
        long exhausted = outcomes.stream().filter(o -> o instanceof CapacityExhaustedException).count();

        assertThat(succeeded).isEqualTo(copies);
        assertThat(exhausted).isEqualTo(threadCount - copies);
        assertThat(coordinator.availableCopies(bookId)).isZero();
        assertThat(loanRepository.countByStatus(LoanStatus.ACTIVE)).isEqualTo(copies);
    }

    @Test
    void concurrentReservations_getDenseDistinctPositions() throws Exception {
        int threadCount = 6;
        Long bookId = bookService.create(new CreateBookRequest("Effective Java", "9780134685991", 1)).id();
        coordinator.borrow(bookId, "holder", NOW);

        List<Throwable> outcomes = runConcurrently(threadCount, i -> () -> {
            coordinator.reserve(bookId, "user" + i, NOW);
            return null;
        });

        assertThat(outcomes).containsOnlyNulls();
        List<Reservation> queue = reservationRepository.findByBookIdAndStatusOrderByIdAsc(bookId, ReservationStatus.PENDING);
        assertThat(queue).extracting(Reservation::getQueuePosition).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void concurrentDuplicateReservations_onlyOneSucceeds() throws Exception {
        int threadCount = 5;
        Long bookId = bookService.create(new CreateBookRequest("Refactoring", "9780134757599", 1)).id();
        coordinator.borrow(bookId, "holder", NOW);

        List<Throwable> outcomes = runConcurrently(threadCount, i -> () -> {
            coordinator.reserve(bookId, "alice", NOW);
            return null;
        });

        assertThat(outcomes.stream().filter(o -> o == null).count()).isEqualTo(1);
        assertThat(reservationRepository.findByBookIdAndStatusOrderByIdAsc(bookId, ReservationStatus.PENDING))
            .hasSize(1);
    }

    /** Starts all tasks at once; a {@code null} entry means the task completed normally. */
    private List<Throwable> runConcurrently(int threadCount, TaskFactory factory) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Void>> futures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            Callable<Void> task = factory.create(i);
            futures.add(executor.submit(() -> {
                startLatch.await();
                return task.call();
            }));
        }

        startLatch.countDown();

        List<Throwable> outcomes = new ArrayList<>();
        for (Future<Void> future : futures) {
            try {
                future.get();
                outcomes.add(null);
            } catch (ExecutionException e) {
                outcomes.add(e.getCause());
            }
        }
        executor.shutdown();
        return outcomes;
    }

    @FunctionalInterface
    private interface TaskFactory {
        Callable<Void> create(int index);
    }
}
