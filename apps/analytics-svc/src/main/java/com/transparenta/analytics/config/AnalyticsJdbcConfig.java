package com.transparenta.analytics.config;

import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Store access goes through a named-parameter template whose statements carry the configured
 * query timeout; a timed-out aggregation surfaces as a DataAccessException.
 */
@Configuration
public class AnalyticsJdbcConfig {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsJdbcConfig.class);

    @Bean
    public NamedParameterJdbcTemplate analyticsJdbcTemplate(DataSource dataSource, AnalyticsProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        int timeout = properties.query().timeoutSeconds();
        jdbcTemplate.setQueryTimeout(timeout);
        if (timeout == 0) {
            log.warn("analytics.query.timeout-seconds is 0; aggregation statements will run without a timeout");
        }
        log.info("Analytics JDBC template ready (queryTimeout={}s, maxLimit={})", timeout, properties.query().maxLimit());
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }
}
