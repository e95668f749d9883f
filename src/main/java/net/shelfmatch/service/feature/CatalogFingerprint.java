package net.shelfmatch.service.feature;

import net.shelfmatch.model.Book;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 fingerprint over every book field the feature matrix reads, in catalog order.
 *
 * <p>Each field is hashed on its own with a length prefix, so moving words between title,
 * author, description or genres changes the fingerprint even when the joined text is equal.
 * Two catalogs with equal fingerprints produce identical feature matrices.</p>
 */
public final class CatalogFingerprint {

    private static final char RECORD_SEPARATOR = '\u001E';

    private CatalogFingerprint() {
    }

    public static String of(List<Book> books, double maxRating) {
        MessageDigest digest = sha256();
        StringBuilder record = new StringBuilder();
        for (Book book : books) {
            BookSignals signals = BookSignals.of(book, maxRating);
            record.setLength(0);
            record.append(book.id()).append(RECORD_SEPARATOR);
            appendField(record, book.title());
            appendField(record, book.author());
            appendField(record, book.description());
            record.append(book.genres().size()).append(':');
            for (String genre : book.genres()) {
                appendField(record, genre);
            }
            record.append(signals.likes()).append(';')
                .append(Double.doubleToLongBits(signals.averageRating())).append(RECORD_SEPARATOR);
            digest.update(record.toString().getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    // null and empty hash differently: "-" versus "0:"
    private static void appendField(StringBuilder record, String value) {
        if (value == null) {
            record.append('-');
            return;
        }
        record.append(value.length()).append(':').append(value);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 unavailable", exception);
        }
    }
}
