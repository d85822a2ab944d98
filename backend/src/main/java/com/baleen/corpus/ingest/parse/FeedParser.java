package com.baleen.corpus.ingest.parse;

import com.baleen.corpus.ingest.model.EntryDecodeResult;
import com.baleen.corpus.ingest.model.FeedEntry;
import com.baleen.corpus.ingest.model.ParsedFeed;
import com.baleen.corpus.ingest.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Decodes RSS 2.0, RSS 1.0 (RDF) and Atom payloads with the lenient jsoup XML parser. A payload
 * that is not a recognisable feed fails as a whole; a broken entry only skips itself.
 */
@Service
public class FeedParser {
    private static final Logger log = LoggerFactory.getLogger(FeedParser.class);

    public ParsedFeed parse(byte[] payload, String baseUrl) {
        if (payload == null || payload.length == 0) {
            throw new FeedParseException("empty feed payload");
        }
        Document document;
        try (InputStream in = open(payload)) {
            document = Jsoup.parse(in, null, baseUrl == null ? "" : baseUrl, Parser.xmlParser());
        } catch (IOException e) {
            throw new FeedParseException("unreadable feed payload: " + e.getMessage(), e);
        }

        FeedFormat format = FeedFormat.sniff(document);
        if (format == null) {
            throw new FeedParseException("payload is not an RSS, RDF or Atom document");
        }

        List<Element> items = format == FeedFormat.ATOM
            ? document.getElementsByTag("entry")
            : document.getElementsByTag("item");
        List<EntryDecodeResult> results = new ArrayList<>(items.size());
        for (Element item : items) {
            EntryDecodeResult result;
            try {
                result = format == FeedFormat.ATOM ? decodeAtomEntry(item, baseUrl) : decodeRssItem(item, baseUrl);
            } catch (RuntimeException e) {
                result = EntryDecodeResult.skipped("decode_error: " + e.getMessage());
            }
            if (!result.isParsed()) {
                log.debug("Skipping entry in {}: {}", baseUrl, result.skipReason());
            }
            results.add(result);
        }
        return new ParsedFeed(format, feedTitle(document, format), results);
    }

    private EntryDecodeResult decodeRssItem(Element item, String baseUrl) {
        String title = childText(item, "title");
        String guid = childText(item, "guid");
        if (guid == null) {
            String about = item.attr("rdf:about");
            guid = about.isBlank() ? null : about.trim();
        }
        String link = UrlNormalizer.resolve(baseUrl, childText(item, "link"));
        String summary = firstNonBlank(childText(item, "content:encoded"), childText(item, "description"));
        OffsetDateTime publishedAt = FeedDates.parse(firstNonBlank(
            childText(item, "pubDate"),
            childText(item, "dc:date"),
            childText(item, "published")
        ));
        return buildEntry(title, link, summary, publishedAt, guid);
    }

    private EntryDecodeResult decodeAtomEntry(Element entry, String baseUrl) {
        String title = childText(entry, "title");
        String guid = childText(entry, "id");
        String link = UrlNormalizer.resolve(baseUrl, atomLink(entry));
        String summary = firstNonBlank(childText(entry, "content"), childText(entry, "summary"));
        OffsetDateTime publishedAt = FeedDates.parse(firstNonBlank(
            childText(entry, "published"),
            childText(entry, "updated"),
            childText(entry, "issued")
        ));
        return buildEntry(title, link, summary, publishedAt, guid);
    }

    private EntryDecodeResult buildEntry(String title, String link, String summary, OffsetDateTime publishedAt, String guid) {
        String resolvedLink = UrlNormalizer.sanitizeHttpUrl(link);
        if (resolvedLink == null && guid != null && UrlNormalizer.looksLikeHttpUrl(guid)) {
            resolvedLink = guid.trim();
        }
        if (resolvedLink == null) {
            return EntryDecodeResult.skipped(guid == null ? "missing link and guid" : "missing link");
        }
        return EntryDecodeResult.parsed(new FeedEntry(title, resolvedLink, summary, publishedAt, guid));
    }

    private String atomLink(Element entry) {
        String fallback = null;
        for (Element child : entry.children()) {
            if (!child.tagName().equalsIgnoreCase("link")) {
                continue;
            }
            String href = child.attr("href");
            if (href.isBlank()) {
                href = child.text();
            }
            if (href.isBlank()) {
                continue;
            }
            String rel = child.attr("rel");
            if (rel.isBlank() || rel.equalsIgnoreCase("alternate")) {
                return href.trim();
            }
            if (fallback == null && !rel.equalsIgnoreCase("self") && !rel.equalsIgnoreCase("enclosure")) {
                fallback = href.trim();
            }
        }
        return fallback;
    }

    private String feedTitle(Document document, FeedFormat format) {
        Element container = format == FeedFormat.ATOM
            ? document.getElementsByTag("feed").first()
            : document.getElementsByTag("channel").first();
        return container == null ? null : childText(container, "title");
    }

    private String childText(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(tagName)) {
                String value = child.children().isEmpty() ? child.wholeText() : child.html();
                value = value == null ? null : value.trim();
                return value == null || value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private InputStream open(byte[] payload) throws IOException {
        InputStream raw = new ByteArrayInputStream(payload);
        if (isGzip(payload)) {
            return new GZIPInputStream(raw);
        }
        return raw;
    }

    private boolean isGzip(byte[] payload) {
        return payload.length >= 2 && (payload[0] & 0xff) == 0x1f && (payload[1] & 0xff) == 0x8b;
    }
}
