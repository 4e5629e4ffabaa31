package com.library.circulation.repository;

import com.library.circulation.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BookRepository extends JpaRepository<Book, Long> {

    boolean existsByIsbn(String isbn);

    @Query("SELECT b.totalCopies FROM Book b WHERE b.id = :id")
    Optional<Integer> findTotalCopiesById(@Param("id") Long id);
}
