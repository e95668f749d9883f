package net.shelfmatch.config;

import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Database wiring that activates only when a datasource URL is configured.
 *
 * Features:
 * - Activates only when spring.datasource.url resolves to a non-empty value
 * - Builds the Hikari pool from spring.datasource.* (after URL normalization)
 * - Exposes the JdbcTemplate the catalog and activity repositories read through
 *
 * Without a URL no JdbcTemplate exists and both repositories run disabled, returning an empty
 * catalog and empty activity.
 *
 * @see DatabaseUrlEnvironmentPostProcessor
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
@EnableConfigurationProperties(DataSourceProperties.class)
public class DatabaseConfig {

    @Bean
    @ConditionalOnMissingBean(DataSource.class)
    @ConfigurationProperties(prefix = "spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder()
            .type(HikariDataSource.class)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean(JdbcTemplate.class)
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }
}
