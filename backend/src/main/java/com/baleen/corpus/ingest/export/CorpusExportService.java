package com.baleen.corpus.ingest.export;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.model.ExportSummary;
import com.baleen.corpus.ingest.model.FeedRecord;
import com.baleen.corpus.ingest.model.FeedStatus;
import com.baleen.corpus.ingest.model.PostRecord;
import com.baleen.corpus.ingest.persistence.IngestJdbcRepository;
import com.baleen.corpus.ingest.sanitize.HtmlSanitizer;
import com.baleen.corpus.ingest.sanitize.SanitizeLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.jsoup.nodes.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Writes the stored corpus to disk, one document per post under a directory per category, plus a
 * README with per-category counts and a feeds.json lookup file.
 */
@Service
public class CorpusExportService {
    private static final Logger log = LoggerFactory.getLogger(CorpusExportService.class);
    private static final DateTimeFormatter README_DATE = DateTimeFormatter.ofPattern("MMM dd, yyyy 'at' HH:mm", Locale.ENGLISH)
        .withZone(ZoneOffset.UTC);
    static final Set<String> FORMATS = Set.of("json", "html");

    private final IngestJdbcRepository repository;
    private final HtmlSanitizer sanitizer;
    private final IngestProperties properties;
    private final ObjectWriter writer;
    private final Clock clock;

    public CorpusExportService(
        IngestJdbcRepository repository,
        HtmlSanitizer sanitizer,
        IngestProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.repository = repository;
        this.sanitizer = sanitizer;
        this.properties = properties;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.clock = clock;
    }

    public ExportSummary export(String root, String format, String level, Set<String> categories) {
        String scheme = format == null || format.isBlank() ? "json" : format.trim().toLowerCase(Locale.ROOT);
        if (!FORMATS.contains(scheme)) {
            throw new CorpusExportException("Unknown export format '" + format + "'; use one of json, html");
        }
        SanitizeLevel sanitizeLevel;
        try {
            sanitizeLevel = SanitizeLevel.parse(level);
        } catch (IllegalArgumentException e) {
            throw new CorpusExportException("Unknown sanitize level '" + level + "'; use one of raw, safe, text", e);
        }

        Path rootPath = resolveRoot(root);
        ensureDirectory(rootPath);

        Map<Long, String> categoryByFeed = new LinkedHashMap<>();
        List<FeedRecord> exportedFeeds = new ArrayList<>();
        for (FeedRecord feed : repository.findFeeds(null, null)) {
            String category = feed.primaryCategory();
            if (categories == null || categories.isEmpty() || categories.contains(category)) {
                categoryByFeed.put(feed.id(), category);
                exportedFeeds.add(feed);
            }
        }

        Map<String, Integer> counts = new TreeMap<>();
        Map<String, Path> categoryDirs = new LinkedHashMap<>();
        try {
            repository.forEachPostInFeeds(categoryByFeed.keySet(), post -> {
                String category = categoryByFeed.get(post.feedId());
                Path dir = categoryDirs.computeIfAbsent(category, name -> ensureDirectory(rootPath.resolve(safeName(name))));
                Path file = dir.resolve(post.id() + "." + scheme);
                String body = scheme.equals("json") ? toJson(post, sanitizeLevel) : toHtml(post, sanitizeLevel);
                write(file, body);
                counts.merge(category, 1, Integer::sum);
            });
        } catch (UncheckedIOException e) {
            throw new CorpusExportException("Failed writing export to " + rootPath + ": " + e.getCause().getMessage(), e);
        }

        Instant exportedAt = clock.instant();
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        Set<String> allCategories = new TreeSet<>(categoryByFeed.values());
        try {
            write(rootPath.resolve("README"), readme(exportedAt, exportedFeeds.size(), total, allCategories.size(), counts));
            write(rootPath.resolve("feeds.json"), feedInfo(exportedFeeds));
        } catch (UncheckedIOException e) {
            throw new CorpusExportException("Failed writing export metadata to " + rootPath + ": " + e.getCause().getMessage(), e);
        }
        log.info("Exported {} post(s) from {} feed(s) to {}", total, exportedFeeds.size(), rootPath);
        return new ExportSummary(
            rootPath.toString(),
            scheme,
            sanitizeLevel.name(),
            exportedFeeds.size(),
            total,
            Map.copyOf(counts),
            exportedAt
        );
    }

    /**
     * Export roots are resolved against {@code baleen.export.root} and may not leave it.
     */
    private Path resolveRoot(String root) {
        Path base = Paths.get(properties.getExport().getRoot()).toAbsolutePath().normalize();
        if (root == null || root.isBlank()) {
            return base;
        }
        Path candidate = base.resolve(root.trim()).normalize();
        if (!candidate.startsWith(base)) {
            throw new CorpusExportException("Export root must stay under " + base + ": " + root);
        }
        return candidate;
    }

    private String readme(Instant exportedAt, int feeds, int posts, int categories, Map<String, Integer> counts) {
        List<String> lines = new ArrayList<>();
        lines.add("Baleen RSS Export");
        lines.add("=================");
        lines.add("");
        lines.add("Exported on: " + README_DATE.format(exportedAt));
        lines.add(feeds + " feeds containing " + posts + " posts in " + categories + " categories.");
        lines.add("");
        lines.add("Category Counts");
        lines.add("---------------");
        lines.add("");
        counts.forEach((category, count) -> lines.add("- " + category + ": " + count));
        lines.add("");
        return String.join("\n", lines);
    }

    private String feedInfo(List<FeedRecord> feeds) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (FeedRecord feed : feeds) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", feed.id());
            row.put("title", feed.title());
            row.put("url", feed.url());
            row.put("htmlUrl", feed.htmlUrl());
            row.put("categories", feed.categories());
            row.put("active", feed.status() != FeedStatus.INACTIVE);
            rows.add(row);
        }
        return serialize(rows);
    }

    private String toJson(PostRecord post, SanitizeLevel level) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", post.id());
        doc.put("feedId", post.feedId());
        doc.put("url", post.url());
        doc.put("title", post.title());
        doc.put("publishedAt", post.publishedAt());
        doc.put("extractionStatus", post.extractionStatus());
        doc.put("guid", post.guid());
        doc.put("fingerprint", post.fingerprint());
        doc.put("content", sanitizer.sanitize(post.content(), level));
        return serialize(doc);
    }

    private String toHtml(PostRecord post, SanitizeLevel level) {
        String title = post.title() == null ? "" : Entities.escape(post.title());
        String content = sanitizer.sanitize(post.content(), level);
        if (level == SanitizeLevel.TEXT) {
            content = "<p>" + Entities.escape(content) + "</p>";
        }
        return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\" />\n<title>" + title + "</title>\n</head>\n<body>\n"
            + "<h1>" + title + "</h1>\n" + content + "\n</body>\n</html>\n";
    }

    private String serialize(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (IOException e) {
            throw new CorpusExportException("Unable to serialize export document", e);
        }
    }

    private Path ensureDirectory(Path directory) {
        try {
            if (Files.exists(directory) && !Files.isDirectory(directory)) {
                throw new CorpusExportException("'" + directory + "' is not a directory");
            }
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CorpusExportException("Unable to create export directory " + directory + ": " + e.getMessage(), e);
        }
    }

    private void write(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String safeName(String category) {
        String cleaned = category.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() || cleaned.startsWith(".") ? "_" + cleaned : cleaned;
    }
}
