package com.baleen.corpus.ingest.sanitize;

import com.baleen.corpus.config.IngestProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import org.jsoup.safety.Safelist;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Whitelist sanitizer for article markup. Disallowed tags are unwrapped with their text kept,
 * executable and embedded content is removed outright, and output is serialized as XML so it is
 * always well-formed.
 */
@Service
public class HtmlSanitizer {
    static final Set<String> ALWAYS_REMOVED = Set.of(
        "script", "style", "noscript", "iframe", "object", "embed", "template"
    );
    private static final String ALWAYS_REMOVED_SELECTOR = String.join(", ", ALWAYS_REMOVED);

    private final Set<String> allowedTags;
    private final Safelist safelist;
    private final Document.OutputSettings outputSettings;

    @Autowired
    public HtmlSanitizer(IngestProperties properties) {
        this(properties.getSanitizer().getAllowedTags());
    }

    HtmlSanitizer(List<String> configuredTags) {
        Set<String> tags = new LinkedHashSet<>();
        if (configuredTags != null) {
            for (String tag : configuredTags) {
                if (tag == null || tag.isBlank()) {
                    continue;
                }
                String normalized = tag.trim().toLowerCase(Locale.ROOT);
                if (!ALWAYS_REMOVED.contains(normalized)) {
                    tags.add(normalized);
                }
            }
        }
        this.allowedTags = Set.copyOf(tags);
        this.safelist = buildSafelist(tags);
        this.outputSettings = new Document.OutputSettings()
            .syntax(Document.OutputSettings.Syntax.xml)
            .escapeMode(Entities.EscapeMode.xhtml)
            .prettyPrint(false);
    }

    public Set<String> allowedTags() {
        return allowedTags;
    }

    public String sanitize(String html) {
        return sanitize(html, SanitizeLevel.SAFE);
    }

    /**
     * SAFE cleaning with relative {@code href}/{@code src} values resolved against {@code baseUri}
     * before the protocol check, so they survive as absolute URLs.
     */
    public String sanitize(String html, String baseUri) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return clean(html, baseUri);
    }

    public String sanitize(String html, SanitizeLevel level) {
        if (html == null || html.isBlank()) {
            return "";
        }
        SanitizeLevel effective = level == null ? SanitizeLevel.SAFE : level;
        return switch (effective) {
            case RAW -> html;
            case TEXT -> toText(html);
            case SAFE -> clean(html, null);
        };
    }

    private String clean(String html, String baseUri) {
        String base = baseUri == null ? "" : baseUri;
        Document fragment = Jsoup.parseBodyFragment(html, base);
        fragment.outputSettings().prettyPrint(false);
        fragment.select(ALWAYS_REMOVED_SELECTOR).remove();
        return Jsoup.clean(fragment.body().html(), base, safelist, outputSettings).trim();
    }

    private String toText(String html) {
        Document fragment = Jsoup.parseBodyFragment(html);
        fragment.select(ALWAYS_REMOVED_SELECTOR).remove();
        return fragment.body().text();
    }

    private static Safelist buildSafelist(Set<String> tags) {
        Safelist list = new Safelist();
        if (!tags.isEmpty()) {
            list.addTags(tags.toArray(new String[0]));
        }
        if (tags.contains("a")) {
            list.addAttributes("a", "href", "title")
                .addProtocols("a", "href", "http", "https", "mailto");
        }
        if (tags.contains("img")) {
            list.addAttributes("img", "src", "alt", "title")
                .addProtocols("img", "src", "http", "https");
        }
        if (tags.contains("blockquote")) {
            list.addAttributes("blockquote", "cite")
                .addProtocols("blockquote", "cite", "http", "https");
        }
        return list;
    }
}
