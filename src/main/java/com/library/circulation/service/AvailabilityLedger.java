package com.library.circulation.service;

import com.library.circulation.entity.TitleAvailability;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.repository.TitleAvailabilityRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Copy-count bookkeeping per title. The only component that changes
 * {@code title_availability.on_loan}.
 *
 * <p>Every mutating method re-reads the ledger row with {@code PESSIMISTIC_WRITE}, so a
 * test-and-increment in {@link #reserveCapacity} is atomic with respect to any other
 * transaction touching the same title, even if the caller forgot to {@link #lock} first.
 * Re-locking a row the current transaction already holds is free.
 *
 * <p>Mutating methods must run inside the coordinator's per-title transaction.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityLedger {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityLedger.class);

    private final TitleAvailabilityRepository availabilityRepository;
    private final TitleCatalog titleCatalog;

    /**
     * Enters the per-title critical section. Creates the ledger row from the catalog's copy
     * count the first time a title is seen.
     *
     * @throws ResourceNotFoundException if the catalog does not know the title
     */
    public TitleAvailability lock(Long titleId) {
        return availabilityRepository.findByTitleIdForUpdate(titleId)
            .orElseGet(() -> initialise(titleId));
    }

    /** Registers a newly catalogued title. */
    public TitleAvailability register(Long titleId, int totalCopies) {
        TitleAvailability row = availabilityRepository.save(new TitleAvailability(titleId, totalCopies));
        log.info("Registered book {} with {} copies", titleId, totalCopies);
        return row;
    }

    @Transactional(readOnly = true)
    public int availableCopies(Long titleId) {
        return availabilityRepository.findById(titleId)
            .map(TitleAvailability::available)
            .orElseGet(() -> titleCatalog.totalCopies(titleId)
                .orElseThrow(() -> new ResourceNotFoundException("Book", titleId)));
    }

    /**
     * Read-only view of the ledger row. For a title that has never been touched, returns a
     * detached row built from the catalog.
     */
    @Transactional(readOnly = true)
    public TitleAvailability snapshot(Long titleId) {
        return availabilityRepository.findById(titleId)
            .orElseGet(() -> new TitleAvailability(titleId, titleCatalog.totalCopies(titleId)
                .orElseThrow(() -> new ResourceNotFoundException("Book", titleId))));
    }

    /**
     * Takes one unit of capacity for a new loan.
     *
     * @return {@code false} iff no copy is available; the row is left untouched in that case
     */
    public boolean reserveCapacity(Long titleId) {
        TitleAvailability row = lock(titleId);
        if (row.available() == 0) {
            return false;
        }
        row.setOnLoan(row.getOnLoan() + 1);
        return true;
    }

    /**
     * Gives back one unit of capacity when a loan closes.
     *
     * @throws IllegalStateException if nothing is on loan; the ledger no longer matches the loans
     */
    public void releaseCapacity(Long titleId) {
        TitleAvailability row = lock(titleId);
        if (row.getOnLoan() == 0) {
            throw new IllegalStateException("No copies of book " + titleId + " are on loan");
        }
        row.setOnLoan(row.getOnLoan() - 1);
    }

    /**
     * Applies a catalog copy-count change. Open loans beyond the new total stay valid;
     * {@link TitleAvailability#available()} reports zero until enough of them close.
     */
    public TitleAvailability updateTotalCopies(Long titleId, int totalCopies) {
        TitleAvailability row = lock(titleId);
        int previous = row.getTotalCopies();
        row.setTotalCopies(totalCopies);
        if (totalCopies < row.getOnLoan()) {
            log.info("Book {} now has {} copies but {} on loan; new loans suspended until copies return",
                titleId, totalCopies, row.getOnLoan());
        } else {
            log.info("Book {} copies changed from {} to {}", titleId, previous, totalCopies);
        }
        return row;
    }

    private TitleAvailability initialise(Long titleId) {
        int totalCopies = titleCatalog.totalCopies(titleId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", titleId));
        availabilityRepository.insertIfAbsent(titleId, totalCopies);
        return availabilityRepository.findByTitleIdForUpdate(titleId)
            .orElseThrow(() -> new IllegalStateException("Ledger row for book " + titleId + " vanished"));
    }
}
