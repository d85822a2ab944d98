package com.baleen.corpus.ingest.service;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedRegistration;
import com.baleen.corpus.ingest.model.FeedSeedSummary;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.baleen.corpus.ingest.util.UrlNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Feed list maintenance: manual registration, seeding from a CSV feed list, and
 * deactivation/reactivation. Feeds are never deleted.
 */
@Service
public class FeedRegistryService {
    private static final Logger log = LoggerFactory.getLogger(FeedRegistryService.class);
    private static final int MAX_ERROR_SAMPLES = 20;
    private static final Set<String> KNOWN_COLUMNS = Set.of("url", "xml_url", "xmlurl", "title", "html_url", "htmlurl", "category", "categories");

    private final IngestJdbcRepository repository;
    private final IngestProperties properties;
    private final Clock clock;

    public FeedRegistryService(IngestJdbcRepository repository, IngestProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public FeedRecord register(FeedRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("Feed registration is required");
        }
        String url = UrlNormalizer.sanitizeHttpUrl(registration.url());
        if (url == null) {
            throw new IllegalArgumentException("Feed url must be an absolute http(s) URL: " + registration.url());
        }
        FeedRegistration normalized = new FeedRegistration(
            url,
            blankToNull(registration.title()),
            UrlNormalizer.sanitizeHttpUrl(registration.htmlUrl()),
            normalizeCategories(registration.categories()),
            registration.extensions()
        );
        long id = repository.upsertFeed(normalized, clock.instant());
        return repository.findFeedById(id);
    }

    public FeedSeedSummary importSeedCsv() {
        return importSeedCsv(null);
    }

    /**
     * Imports a feed list. A requested path is resolved against the directory of the configured
     * {@code baleen.data.feeds-csv} and must stay inside it.
     */
    public FeedSeedSummary importSeedCsv(String requestedPath) {
        Path configured = resolvePath(properties.getData().getFeedsCsv());
        Path path = requestedPath == null || requestedPath.isBlank()
            ? configured
            : withinSeedDirectory(configured, requestedPath);
        ErrorCollector errors = new ErrorCollector();
        int upserted = 0;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String url = UrlNormalizer.sanitizeHttpUrl(getColumn(record, "url", "xml_url", "xmlurl"));
                if (url == null) {
                    errors.add("csv row " + record.getRecordNumber() + " missing or invalid url");
                    continue;
                }
                FeedRegistration registration = new FeedRegistration(
                    url,
                    getColumn(record, "title"),
                    UrlNormalizer.sanitizeHttpUrl(getColumn(record, "html_url", "htmlurl")),
                    splitCategories(getColumn(record, "category", "categories")),
                    extraColumns(record)
                );
                try {
                    repository.upsertFeed(registration, clock.instant());
                    upserted++;
                } catch (RuntimeException e) {
                    errors.add("csv row " + record.getRecordNumber() + " (" + url + "): " + e.getMessage());
                }
            }
        } catch (IOException e) {
            errors.add("failed to read feed list at " + path + ": " + e.getMessage());
        }
        log.info("Seeded {} feed(s) from {} with {} error(s)", upserted, path, errors.totalCount());
        return new FeedSeedSummary(upserted, errors.totalCount(), errors.sampleErrors());
    }

    public FeedRecord deactivate(long feedId) {
        return changeStatus(feedId, FeedStatus.INACTIVE);
    }

    public FeedRecord reactivate(long feedId) {
        return changeStatus(feedId, FeedStatus.ACTIVE);
    }

    private FeedRecord changeStatus(long feedId, FeedStatus status) {
        if (!repository.setFeedStatus(feedId, status, clock.instant())) {
            throw new IllegalArgumentException("Unknown feed id " + feedId);
        }
        log.info("Feed {} set to {}", feedId, status);
        return repository.findFeedById(feedId);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (Map.Entry<String, String> column : record.toMap().entrySet()) {
                String header = column.getKey();
                if (header != null && header.trim().equalsIgnoreCase(name)) {
                    String value = column.getValue() == null ? "" : column.getValue().trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Map<String, String> extraColumns(CSVRecord record) {
        Map<String, String> extensions = new LinkedHashMap<>();
        for (Map.Entry<String, String> column : record.toMap().entrySet()) {
            String header = column.getKey();
            if (header == null || header.isBlank() || KNOWN_COLUMNS.contains(header.trim().toLowerCase(Locale.ROOT))) {
                continue;
            }
            String value = column.getValue() == null ? "" : column.getValue().trim();
            if (!value.isEmpty()) {
                extensions.put(header.trim(), value);
            }
        }
        return extensions;
    }

    private Set<String> splitCategories(String raw) {
        Set<String> categories = new LinkedHashSet<>();
        if (raw == null) {
            return categories;
        }
        for (String part : raw.split("[;|]")) {
            String normalized = normalizeCategory(part);
            if (normalized != null) {
                categories.add(normalized);
            }
        }
        return categories;
    }

    private Set<String> normalizeCategories(Set<String> raw) {
        Set<String> categories = new LinkedHashSet<>();
        for (String category : raw) {
            String normalized = normalizeCategory(category);
            if (normalized != null) {
                categories.add(normalized);
            }
        }
        return categories;
    }

    private String normalizeCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private Path withinSeedDirectory(Path configured, String requestedPath) {
        Path directory = configured.getParent() == null ? configured : configured.getParent();
        Path candidate = directory.resolve(requestedPath).normalize();
        if (!candidate.startsWith(directory)) {
            throw new IllegalArgumentException("Feed list path must stay under " + directory + ": " + requestedPath);
        }
        return candidate;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private static class ErrorCollector {
        private int totalCount;
        private final List<String> sampleErrors = new ArrayList<>();

        private void add(String message) {
            totalCount++;
            if (sampleErrors.size() < MAX_ERROR_SAMPLES) {
                sampleErrors.add(message);
            }
        }

        private int totalCount() {
            return totalCount;
        }

        private List<String> sampleErrors() {
            return List.copyOf(sampleErrors);
        }
    }
}
