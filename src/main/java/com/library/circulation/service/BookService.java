package com.library.circulation.service;

import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.entity.Book;
import com.library.circulation.exception.DuplicateIsbnException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.mapper.BookMapper;
import com.library.circulation.repository.BookRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * The slice of the catalog that circulation needs: registering titles and changing their
 * copy counts.
 */
@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private final BookRepository bookRepository;
    private final AvailabilityLedger ledger;
    private final CirculationCoordinator coordinator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public BookResponse findById(Long id) {
        Book book = bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        return BookMapper.toResponse(book);
    }

    @Transactional
    public BookResponse create(CreateBookRequest request) {
        if (bookRepository.existsByIsbn(request.isbn())) {
            throw new DuplicateIsbnException(request.isbn());
        }
        Book saved = bookRepository.save(BookMapper.toEntity(request));
        ledger.register(saved.getId(), saved.getTotalCopies());
        return BookMapper.toResponse(saved);
    }

    /**
     * Changes the copy count through the coordinator, which stores it under the title lock
     * and rebalances availability in the same transaction. Must not run inside a
     * transaction: the coordinator opens its own.
     */
    public BookResponse updateCopies(Long id, int totalCopies) {
        Instant now = Instant.now(clock);
        List<Promotion> promotions = coordinator.onTotalCopiesChanged(id, totalCopies, now);
        if (!promotions.isEmpty()) {
            log.info("Copy increase on book {} served {} waiting reservation(s)", id, promotions.size());
        }
        return findById(id);
    }
}
