package com.library.circulation.repository;

import com.library.circulation.entity.Reservation;
import com.library.circulation.entity.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long>,
        JpaSpecificationExecutor<Reservation> {

    /** Resolves the title without loading the reservation into the persistence context. */
    @Query("SELECT r.book.id FROM Reservation r WHERE r.id = :id")
    Optional<Long> findTitleIdById(@Param("id") Long id);

    @Query("SELECT r FROM Reservation r LEFT JOIN FETCH r.book WHERE r.id = :id")
    Optional<Reservation> findByIdWithBook(@Param("id") Long id);

    /** Queue order. Ids are allocated while the title lock is held, so id order is creation order. */
    List<Reservation> findByBookIdAndStatusOrderByIdAsc(Long bookId, ReservationStatus status);

    boolean existsByBookIdAndUserIdAndStatus(Long bookId, String userId, ReservationStatus status);

    @Query("SELECT COUNT(r) FROM Reservation r WHERE r.book.id = :bookId AND r.status = :status "
        + "AND r.expiresAt >= :now")
    long countUnexpired(@Param("bookId") Long bookId,
                        @Param("status") ReservationStatus status,
                        @Param("now") Instant now);

    /** Live reservations queued ahead of {@code id} on the same title. */
    @Query("SELECT COUNT(r) FROM Reservation r WHERE r.book.id = :bookId AND r.status = :status "
        + "AND r.id < :id AND r.expiresAt >= :now")
    long countLiveAhead(@Param("bookId") Long bookId,
                        @Param("id") Long id,
                        @Param("status") ReservationStatus status,
                        @Param("now") Instant now);

    @Query("SELECT DISTINCT r.book.id FROM Reservation r WHERE r.status = :status AND r.expiresAt < :now")
    List<Long> findTitleIdsWithExpiredBefore(@Param("status") ReservationStatus status,
                                             @Param("now") Instant now);
}
