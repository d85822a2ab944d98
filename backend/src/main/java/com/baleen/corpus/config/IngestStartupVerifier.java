package com.baleen.corpus.config;

import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Refuses to start with settings that cannot work, or with a store that does not answer.
 */
@Component
public class IngestStartupVerifier {
    private static final Logger log = LoggerFactory.getLogger(IngestStartupVerifier.class);

    private final IngestProperties properties;
    private final DataSource dataSource;
    private final IngestJdbcRepository repository;

    public IngestStartupVerifier(IngestProperties properties, DataSource dataSource, IngestJdbcRepository repository) {
        this.properties = properties;
        this.dataSource = dataSource;
        this.repository = repository;
    }

    @PostConstruct
    public void verify() {
        List<String> problems = configurationProblems(properties, maxConnectionPoolSize(dataSource));
        if (!repository.isDbReachable()) {
            problems.add("database is unreachable");
        }
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid ingestion configuration: " + String.join("; ", problems));
        }
        log.info(
            "Ingestion configuration verified: workerPoolSize={} schedulerEnabled={} intervalSeconds={}",
            properties.getWorkerPoolSize(),
            properties.getScheduler().isEnabled(),
            properties.getScheduler().getIntervalSeconds()
        );
    }

    static List<String> configurationProblems(IngestProperties properties, Integer connectionPoolSize) {
        List<String> problems = new ArrayList<>();
        if (connectionPoolSize != null && properties.getWorkerPoolSize() > connectionPoolSize) {
            problems.add("baleen.worker-pool-size=" + properties.getWorkerPoolSize()
                + " exceeds the connection pool size " + connectionPoolSize);
        }
        if (properties.getSanitizer().getAllowedTags().isEmpty()) {
            problems.add("baleen.sanitizer.allowed-tags must not be empty");
        }
        if (properties.getScheduler().getIntervalSeconds() <= 0) {
            problems.add("baleen.scheduler.interval-seconds must be positive");
        }
        if (properties.getRetry().getMaxAttempts() < 1) {
            problems.add("baleen.retry.max-attempts must be at least 1");
        }
        if (properties.getRequestTimeoutMs() <= 0) {
            problems.add("baleen.request-timeout-ms must be positive");
        }
        return problems;
    }

    private static Integer maxConnectionPoolSize(DataSource dataSource) {
        if (dataSource instanceof HikariDataSource hikari) {
            return hikari.getMaximumPoolSize();
        }
        return null;
    }
}
