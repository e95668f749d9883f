package net.shelfmatch.service.feature;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.shelfmatch.model.Book;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void should_StripPunctuationAndCollapseWhitespace_When_Normalizing() {
        assertThat(TextNormalizer.normalize("  Dune: Messiah!!  (1969)\tEdition ")).isEqualTo("dune messiah 1969 edition");
    }

    @Test
    void should_ReturnEmpty_When_NormalizingNullOrPunctuationOnly() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("--- !!! ...")).isEmpty();
    }

    @Test
    void should_DropStopWordsAndSingleCharacters_When_Tokenizing() {
        assertThat(TextNormalizer.tokenize("The Lord of the Rings, Part 1: a Journey x"))
            .containsExactly("lord", "rings", "journey");
    }

    @Test
    void should_AppendAdjacentBigrams_When_BuildingTerms() {
        assertThat(TextNormalizer.terms(List.of("dune", "messiah", "herbert")))
            .containsExactly("dune", "messiah", "herbert", "dune messiah", "messiah herbert");
    }

    @Test
    void should_TreatMissingFieldsAsEmpty_When_BuildingDocument() {
        Book book = new Book(7L, "Solaris", "Lem", null, List.of("Science Fiction", "Classic"), null, null, null, null);

        String document = TextNormalizer.document(book);

        assertThat(TextNormalizer.tokenize(document)).containsExactly("solaris", "lem", "science", "fiction", "classic");
    }
}
