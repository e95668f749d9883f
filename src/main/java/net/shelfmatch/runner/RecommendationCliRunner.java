package net.shelfmatch.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.shelfmatch.application.recommendation.RecommendationResponseUseCase;
import net.shelfmatch.config.RecommendationProperties;
import net.shelfmatch.controller.support.ErrorResponseUtils;
import net.shelfmatch.exception.RecommendationDataAccessException;
import net.shelfmatch.service.RecommendationService;
import net.shelfmatch.service.ScoredBook;
import net.shelfmatch.util.LoggingUtils;
import net.shelfmatch.util.RequestParameterParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Runs one recommendation at startup when {@code --recommend.user-id} is given and prints the JSON
 * response to stdout.
 *
 * <p>Options: {@code --recommend.user-id=<id>} (required to activate),
 * {@code --recommend.book-id=<id>}, {@code --recommend.limit=<n>} (defaults to the configured default count). Invalid input or unavailable
 * data prints {@code {"error": "..."}} instead.</p>
 */
@Component
public class RecommendationCliRunner implements CommandLineRunner {

    static final String USER_OPTION = "recommend.user-id";
    static final String BOOK_OPTION = "recommend.book-id";
    static final String LIMIT_OPTION = "recommend.limit";

    private static final Logger log = LoggerFactory.getLogger(RecommendationCliRunner.class);

    private final ApplicationArguments arguments;
    private final RecommendationService recommendationService;
    private final RecommendationResponseUseCase recommendationResponseUseCase;
    private final int defaultCount;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public RecommendationCliRunner(ApplicationArguments arguments,
                                   RecommendationService recommendationService,
                                   RecommendationResponseUseCase recommendationResponseUseCase,
                                   RecommendationProperties properties,
                                   ObjectMapper objectMapper) {
        this(arguments, recommendationService, recommendationResponseUseCase, properties, objectMapper, System.out);
    }

    RecommendationCliRunner(ApplicationArguments arguments,
                            RecommendationService recommendationService,
                            RecommendationResponseUseCase recommendationResponseUseCase,
                            RecommendationProperties properties,
                            ObjectMapper objectMapper,
                            PrintStream out) {
        this.arguments = arguments;
        this.recommendationService = recommendationService;
        this.recommendationResponseUseCase = recommendationResponseUseCase;
        this.defaultCount = properties.getDefaultCount();
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(String... args) throws Exception {
        if (!arguments.containsOption(USER_OPTION)) {
            return;
        }

        Object payload;
        try {
            long userId = RequestParameterParser.requirePositiveId(optionValue(USER_OPTION), USER_OPTION);
            Long bookId = RequestParameterParser.optionalPositiveId(optionValue(BOOK_OPTION), BOOK_OPTION).orElse(null);
            int limit = RequestParameterParser.optionalInt(optionValue(LIMIT_OPTION), LIMIT_OPTION).orElse(defaultCount);
            log.info("Computing recommendations for user {} from the command line.", userId);
            List<ScoredBook> recommendations = recommendationService.recommend(userId, bookId, limit);
            payload = recommendationResponseUseCase.toResponse(recommendations);
        } catch (IllegalArgumentException ex) {
            log.warn("Invalid recommendation options: {}", ex.getMessage());
            payload = ErrorResponseUtils.errorBody(ex.getMessage());
        } catch (RecommendationDataAccessException ex) {
            LoggingUtils.error(log, ex, "Recommendation data unavailable ({})", ex.getOperation());
            payload = ErrorResponseUtils.errorBody("Recommendation data is unavailable");
        }
        out.println(toJson(payload));
    }

    private String optionValue(String option) {
        List<String> values = arguments.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private String toJson(Object payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(payload);
    }
}
