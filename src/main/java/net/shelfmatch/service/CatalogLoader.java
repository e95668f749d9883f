package net.shelfmatch.service;

import lombok.extern.slf4j.Slf4j;
import net.shelfmatch.model.Book;
import net.shelfmatch.repository.BookCatalogRepository;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Materializes the current catalog snapshot for one recommendation request.
 */
@Service
@Slf4j
public class CatalogLoader {

    private final BookCatalogRepository bookCatalogRepository;

    public CatalogLoader(BookCatalogRepository bookCatalogRepository) {
        this.bookCatalogRepository = bookCatalogRepository;
    }

    /**
     * Loads every recommendable book in stable id order.
     *
     * <p>Rows with a blank title or author, and repeated ids, are dropped. An empty catalog is a
     * normal result; repository failures propagate.</p>
     *
     * @return immutable catalog snapshot
     */
    public List<Book> loadCatalog() {
        List<Book> rows = bookCatalogRepository.listBooks();
        List<Book> catalog = new ArrayList<>(rows.size());
        Set<Long> seen = new HashSet<>();
        for (Book book : rows) {
            if (book == null) {
                continue;
            }
            if (!StringUtils.hasText(book.title()) || !StringUtils.hasText(book.author())) {
                log.debug("Dropping book {} without title or author", book.id());
                continue;
            }
            if (!seen.add(book.id())) {
                log.debug("Dropping repeated catalog row for book {}", book.id());
                continue;
            }
            catalog.add(book);
        }
        return List.copyOf(catalog);
    }
}
