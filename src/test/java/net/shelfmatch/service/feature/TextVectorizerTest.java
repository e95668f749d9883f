package net.shelfmatch.service.feature;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TextVectorizerTest {

    @Test
    void should_KeepOnlyTermsSharedByTwoDocuments_When_CatalogIsSmall() {
        TextVectorizer vectorizer = new TextVectorizer();

        double[][] rows = vectorizer.fitTransform(List.of("Dune Herbert", "Dune Messiah Herbert", "Cooking 101 Chef"));

        assertThat(vectorizer.vocabulary()).containsExactly("dune", "herbert");
        assertThat(rows[0]).containsExactly(rows[1]);
        assertThat(rows[0][0]).isCloseTo(Math.sqrt(0.5), within(1e-12));
        assertThat(rows[2]).containsOnly(0.0);
    }

    @Test
    void should_WeightBySmoothedInverseDocumentFrequency_When_TermsDifferInRarity() {
        TextVectorizer vectorizer = new TextVectorizer();

        double[][] rows = vectorizer.fitTransform(List.of(
            "apple banana", "apple banana", "apple cherry", "cherry kiwi", "kiwi lime"));

        assertThat(vectorizer.vocabulary()).containsExactly("apple", "apple banana", "banana", "cherry", "kiwi");
        assertThat(rows[0][0]).isCloseTo(0.5062044059286201, within(1e-9));
        assertThat(rows[0][1]).isCloseTo(0.6098184563533858, within(1e-9));
        assertThat(rows[0][2]).isCloseTo(0.6098184563533858, within(1e-9));
        assertThat(rows[0][3]).isZero();
    }

    @Test
    void should_DropTerms_When_TheyAppearInMoreThanEightyPercentOfDocuments() {
        TextVectorizer vectorizer = new TextVectorizer();

        vectorizer.fitTransform(List.of(
            "fantasy dragons", "fantasy dragons", "fantasy wizards", "fantasy wizards", "fantasy mystery", "space opera"));

        assertThat(vectorizer.vocabulary()).doesNotContain("fantasy").contains("dragons", "wizards");
    }

    @Test
    void should_ProduceUnitRows_When_DocumentHasVocabularyTerms() {
        TextVectorizer vectorizer = new TextVectorizer();

        double[][] rows = vectorizer.fitTransform(List.of(
            "red apple pie", "green apple tart", "red cherry pie", "green pear tart", "plain bread"));

        for (double[] row : rows) {
            double norm = VectorMath.norm(row);
            assertThat(norm == 0.0 || Math.abs(norm - 1.0) < 1e-12).isTrue();
        }
    }

    @Test
    void should_ReturnNoRows_When_CatalogIsEmpty() {
        TextVectorizer vectorizer = new TextVectorizer();

        assertThat(vectorizer.fitTransform(List.of())).isEmpty();
        assertThat(vectorizer.vocabulary()).isEmpty();
    }

    @Test
    void should_RejectSecondFit_When_InstanceAlreadyFitted() {
        TextVectorizer vectorizer = new TextVectorizer();
        vectorizer.fitTransform(List.of("one document", "one document"));

        assertThatThrownBy(() -> vectorizer.fitTransform(List.of("another")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void should_KeepLexicographicallySmallestTerms_When_CapBreaksFrequencyTie() {
        Map<String, Integer> documentFrequency = new HashMap<>();
        Map<String, Long> corpusFrequency = new HashMap<>();
        for (int i = 0; i <= VectorizerPolicy.MAX_FEATURES; i++) {
            String term = String.format("term%05d", i);
            documentFrequency.put(term, 2);
            corpusFrequency.put(term, 2L);
        }

        List<String> vocabulary = TextVectorizer.selectVocabulary(100, documentFrequency, corpusFrequency);

        assertThat(vocabulary).hasSize(VectorizerPolicy.MAX_FEATURES)
            .startsWith("term00000")
            .doesNotContain(String.format("term%05d", VectorizerPolicy.MAX_FEATURES));
    }

    @Test
    void should_PreferFrequentTerms_When_VocabularyExceedsCap() {
        Map<String, Integer> documentFrequency = new HashMap<>();
        Map<String, Long> corpusFrequency = new HashMap<>();
        for (int i = 0; i <= VectorizerPolicy.MAX_FEATURES; i++) {
            String term = String.format("term%05d", i);
            documentFrequency.put(term, 2);
            corpusFrequency.put(term, 3L);
        }
        corpusFrequency.put("term00000", 2L);

        List<String> vocabulary = TextVectorizer.selectVocabulary(100, documentFrequency, corpusFrequency);

        assertThat(vocabulary).hasSize(VectorizerPolicy.MAX_FEATURES).doesNotContain("term00000");
    }
}
