package com.library.circulation.repository;

import com.library.circulation.entity.Loan;
import com.library.circulation.entity.LoanStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LoanRepository extends JpaRepository<Loan, Long>, JpaSpecificationExecutor<Loan> {

    /** Resolves the title without loading the loan into the persistence context. */
    @Query("SELECT l.book.id FROM Loan l WHERE l.id = :id")
    Optional<Long> findTitleIdById(@Param("id") Long id);

    @Query("SELECT l FROM Loan l JOIN FETCH l.book WHERE l.id = :id")
    Optional<Loan> findByIdWithBook(@Param("id") Long id);

    boolean existsByBookIdAndUserIdAndStatusIn(Long bookId, String userId, Collection<LoanStatus> statuses);

    List<Loan> findByBookIdAndStatusInAndDueAtBefore(Long bookId, Collection<LoanStatus> statuses, Instant cutoff);

    Optional<Loan> findFirstByBookIdAndStatusInOrderByDueAtAsc(Long bookId, Collection<LoanStatus> statuses);

    @Query("SELECT DISTINCT l.book.id FROM Loan l WHERE l.status IN :statuses AND l.dueAt < :cutoff")
    List<Long> findTitleIdsWithLoansDueBefore(@Param("statuses") Collection<LoanStatus> statuses,
                                              @Param("cutoff") Instant cutoff);

    @Query("SELECT l FROM Loan l JOIN FETCH l.book WHERE l.status IN :statuses AND l.dueAt < :cutoff "
        + "ORDER BY l.dueAt ASC")
    List<Loan> findOpenDueBefore(@Param("statuses") Collection<LoanStatus> statuses,
                                 @Param("cutoff") Instant cutoff);

    long countByStatus(LoanStatus status);

    @Query("SELECT COUNT(l) FROM Loan l WHERE l.status IN :statuses AND l.dueAt < :cutoff")
    long countByStatusInAndDueAtBefore(@Param("statuses") Collection<LoanStatus> statuses,
                                       @Param("cutoff") Instant cutoff);

    @Query("SELECT COALESCE(SUM(l.fineAmount), 0) FROM Loan l WHERE l.status IN :statuses")
    BigDecimal sumFineAmountByStatusIn(@Param("statuses") Collection<LoanStatus> statuses);
}
