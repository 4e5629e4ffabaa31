package com.library.circulation.repository;

import com.library.circulation.entity.TitleAvailability;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TitleAvailabilityRepository extends JpaRepository<TitleAvailability, Long> {

    /**
     * Per-title critical section entry. On PostgreSQL the effective wait is bounded by the
     * connection's {@code lock_timeout}; the hint covers dialects that honour it natively.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT a FROM TitleAvailability a WHERE a.titleId = :titleId")
    Optional<TitleAvailability> findByTitleIdForUpdate(@Param("titleId") Long titleId);

    /** Creates the ledger row if no concurrent caller got there first. */
    @Modifying
    @Query(value = "INSERT INTO title_availability (title_id, total_copies, on_loan, created_at, updated_at) "
        + "VALUES (:titleId, :totalCopies, 0, now(), now()) ON CONFLICT (title_id) DO NOTHING",
        nativeQuery = true)
    int insertIfAbsent(@Param("titleId") Long titleId, @Param("totalCopies") int totalCopies);
}
