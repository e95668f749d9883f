package net.shelfmatch.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.shelfmatch.application.recommendation.RecommendationResponseUseCase;
import net.shelfmatch.exception.RecommendationDataAccessException;
import net.shelfmatch.service.RecommendationService;
import net.shelfmatch.service.ScoredBook;
import net.shelfmatch.testutil.CatalogFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class RecommendationCliRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Mock
    private RecommendationService recommendationService;

    private RecommendationCliRunner runner(String... args) {
        return new RecommendationCliRunner(new DefaultApplicationArguments(args), recommendationService,
            new RecommendationResponseUseCase(), CatalogFixtures.defaultProperties(), objectMapper,
            new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private JsonNode printedJson() throws Exception {
        return objectMapper.readTree(buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void should_PrintRecommendationsAsJson_When_UserIdGiven() throws Exception {
        when(recommendationService.recommend(12L, 1L, 3)).thenReturn(List.of(
            ScoredBook.popularity(CatalogFixtures.duneMessiah(), 28.0)));

        runner("--recommend.user-id=12", "--recommend.book-id=1", "--recommend.limit=3").run();

        JsonNode json = printedJson();
        assertThat(json.path("recommendations")).hasSize(1);
        assertThat(json.path("recommendations").get(0).path("id").asLong()).isEqualTo(2L);
        assertThat(json.path("recommendations").get(0).path("score").asDouble()).isEqualTo(28.0);
        assertThat(json.path("recommendations").get(0).path("source").asText()).isEqualTo("popularity");
    }

    @Test
    void should_PrintErrorPayload_When_UserIdIsInvalid() throws Exception {
        runner("--recommend.user-id=abc").run();

        assertThat(printedJson().path("error").asText()).isEqualTo("recommend.user-id must be a number");
        verifyNoInteractions(recommendationService);
    }

    @Test
    void should_PrintErrorPayload_When_DataIsUnavailable() throws Exception {
        when(recommendationService.recommend(4L, null, 4)).thenThrow(new RecommendationDataAccessException(
            "listBooks", "Failed to load book catalog", new DataAccessResourceFailureException("down")));

        runner("--recommend.user-id=4").run();

        assertThat(printedJson().path("error").asText()).isEqualTo("Recommendation data is unavailable");
    }

    @Test
    void should_DoNothing_When_OptionIsAbsent() throws Exception {
        runner("--server.port=0").run();

        assertThat(buffer.size()).isZero();
        verifyNoInteractions(recommendationService);
    }
}
