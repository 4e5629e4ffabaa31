package com.library.circulation.mapper;

import com.library.circulation.dto.request.CreateBookRequest;
import com.library.circulation.dto.response.BookResponse;
import com.library.circulation.entity.Book;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request) {
        Book book = new Book();
        book.setTitle(request.title());
        book.setIsbn(request.isbn());
        book.setTotalCopies(request.totalCopies());
        return book;
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getIsbn(),
            book.getTotalCopies(),
            book.getCreatedAt(),
            book.getUpdatedAt()
        );
    }
}
