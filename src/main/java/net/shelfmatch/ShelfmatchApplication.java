/**
 * Main application class for shelfmatch
 *
 * Features:
 * - Excludes default datasource auto-configuration; {@code DatabaseConfig} wires JDBC only when a URL is set
 * - Serves {@code GET /api/recommendations} by default
 * - With {@code --recommend.user-id} runs without a web server, prints one JSON response and exits
 */

package net.shelfmatch;

import java.util.Arrays;
import java.util.Map;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    // The schema is owned by the upstream application; never run schema.sql here
    SqlInitializationAutoConfiguration.class
})
public class ShelfmatchApplication {

    static final String CLI_OPTION_PREFIX = "--recommend.user-id";

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ShelfmatchApplication.class);
        boolean commandLineMode = isCommandLineMode(args);
        if (commandLineMode) {
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setBannerMode(Banner.Mode.OFF);
            // stdout carries the JSON payload; keep routine logging quiet
            application.setDefaultProperties(Map.of("logging.level.root", "WARN"));
        }
        ConfigurableApplicationContext context = application.run(args);
        if (commandLineMode) {
            System.exit(SpringApplication.exit(context));
        }
    }

    static boolean isCommandLineMode(String[] args) {
        return args != null && Arrays.stream(args).anyMatch(arg -> arg != null && arg.startsWith(CLI_OPTION_PREFIX));
    }
}
