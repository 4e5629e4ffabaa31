package com.library.circulation.service;

import com.library.circulation.repository.BookRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

@Component
@RequiredArgsConstructor
public class BookCatalog implements TitleCatalog {

    private final BookRepository bookRepository;

    @Override
    public OptionalInt totalCopies(Long titleId) {
        return bookRepository.findTotalCopiesById(titleId)
            .map(OptionalInt::of)
            .orElseGet(OptionalInt::empty);
    }
}
