package com.topostat.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Spring {@link Configuration} that provides the {@link ResultStore} bean.
 * <p>
 * When {@code spring.datasource.url} is set, a pooled {@link DataSource} is built and a
 * {@link JdbcResultStore} persists results to the database. Otherwise an
 * {@link InMemoryResultStore} is used as a fallback, suitable for development and
 * testing but not durable across restarts.
 */
@Configuration
public class ResultStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ResultStoreConfig.class);

    @Bean
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties dataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @ConditionalOnProperty(name = "spring.datasource.url")
    public DataSource dataSource(DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().build();
    }

    /**
     * JDBC-backed store when a DataSource exists, in-memory store otherwise.
     * Creates the required database tables on startup.
     */
    @Bean
    public ResultStore resultStore(Optional<DataSource> dataSource) throws SQLException {
        if (dataSource.isPresent()) {
            log.info("Configuring JDBC result store (PostgreSQL)");
            var store = new JdbcResultStore(dataSource.get());
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory result store (results will not persist across restarts)");
        return new InMemoryResultStore();
    }
}
