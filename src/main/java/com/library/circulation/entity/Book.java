package com.library.circulation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A catalog title. Copies of a title are fungible: the circulation engine only ever
 * reads {@link #totalCopies}, it never tracks individual copy identities.
 *
 * <p>The catalog owns this row. Changing {@code totalCopies} goes through
 * {@code BookService.updateCopies()}, which notifies the circulation coordinator so
 * the availability ledger and the reservation queue can react.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    /** ISBN-13. Unique, enforced by {@code idx_books_isbn}. */
    @Column(name = "isbn", nullable = false, unique = true, length = 13)
    private String isbn;

    @Column(name = "total_copies", nullable = false)
    private int totalCopies;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
