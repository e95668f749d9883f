package net.shelfmatch.service.feature;

import net.shelfmatch.model.Book;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Turns a book's text fields into the token stream the vectorizer counts.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Title, author, description and genre tags joined by single spaces; missing fields are empty.
     */
    public static String document(Book book) {
        StringJoiner joiner = new StringJoiner(" ");
        joiner.add(nullToEmpty(book.title()));
        joiner.add(nullToEmpty(book.author()));
        joiner.add(nullToEmpty(book.description()));
        for (String genre : book.genres()) {
            joiner.add(nullToEmpty(genre));
        }
        return joiner.toString();
    }

    /**
     * Lowercases, replaces every character that is not a letter or digit with a space,
     * collapses whitespace and trims.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder normalized = new StringBuilder(lower.length());
        boolean pendingSpace = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                if (pendingSpace && normalized.length() > 0) {
                    normalized.append(' ');
                }
                pendingSpace = false;
                normalized.append(c);
            } else {
                pendingSpace = true;
            }
        }
        return normalized.toString();
    }

    /**
     * Normalized tokens of at least {@link VectorizerPolicy#MIN_TOKEN_LENGTH} characters,
     * stop words removed, in document order.
     */
    public static List<String> tokenize(String text) {
        String normalized = normalize(text);
        List<String> tokens = new ArrayList<>();
        if (normalized.isEmpty()) {
            return tokens;
        }
        for (String token : normalized.split(" ")) {
            if (token.length() >= VectorizerPolicy.MIN_TOKEN_LENGTH && !EnglishStopWords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Unigrams followed by n-grams up to {@link VectorizerPolicy#MAX_NGRAM} over adjacent tokens.
     */
    public static List<String> terms(List<String> tokens) {
        List<String> terms = new ArrayList<>(tokens);
        for (int n = 2; n <= VectorizerPolicy.MAX_NGRAM; n++) {
            for (int start = 0; start + n <= tokens.size(); start++) {
                terms.add(String.join(" ", tokens.subList(start, start + n)));
            }
        }
        return terms;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
