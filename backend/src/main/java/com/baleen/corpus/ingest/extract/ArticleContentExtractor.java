package com.baleen.corpus.ingest.extract;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.http.PoliteHttpClient;
import com.baleen.corpus.ingest.model.ArticleExtraction;
import com.baleen.corpus.ingest.model.FeedEntry;
import com.baleen.corpus.ingest.model.HttpFetchResult;
import com.baleen.corpus.ingest.sanitize.HtmlSanitizer;
import com.baleen.corpus.ingest.util.ReasonCodeClassifier;
import com.baleen.corpus.ingest.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches an entry's page and isolates the article body with a readability-style scoring pass.
 * Any failure degrades to the feed summary instead of raising.
 */
@Service
public class ArticleContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(ArticleContentExtractor.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final Pattern CHARSET = Pattern.compile("charset=\"?([\\w\\-]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern UNLIKELY = Pattern.compile(
        "banner|breadcrumb|combx|comment|community|cover-wrap|disqus|extra|footer|gdpr|header|legends|menu|"
            + "related|remark|replies|rss|shoutbox|sidebar|skyscraper|social|sponsor|ad-break|agegate|"
            + "pagination|pager|popup|share|newsletter|cookie",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MAYBE_CANDIDATE = Pattern.compile("and|article|body|column|content|main|shadow",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITIVE = Pattern.compile(
        "article|body|content|entry|hentry|h-entry|main|page|pagination|post|text|blog|story",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NEGATIVE = Pattern.compile(
        "hidden|banner|combx|comment|com-|contact|foot|footer|footnote|gdpr|masthead|media|meta|outbrain|promo|"
            + "related|scroll|share|shoutbox|sidebar|skyscraper|sponsor|shopping|tags|tool|widget",
        Pattern.CASE_INSENSITIVE
    );
    private static final Set<String> FURNITURE = Set.of(
        "script", "style", "noscript", "iframe", "object", "embed", "template",
        "nav", "header", "footer", "aside", "form", "button", "input", "select", "textarea", "svg", "canvas"
    );
    private static final Set<String> SCORED_PARENT_TAGS = Set.of("p", "pre", "td", "blockquote");

    private final PoliteHttpClient httpClient;
    private final IngestProperties properties;
    private final HtmlSanitizer sanitizer;

    public ArticleContentExtractor(PoliteHttpClient httpClient, IngestProperties properties, HtmlSanitizer sanitizer) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.sanitizer = sanitizer;
    }

    public ArticleExtraction extract(FeedEntry entry) {
        String link = entry.link();
        String summary = sanitizer.sanitize(entry.summary(), link);
        if (!properties.getExtraction().isEnabled()) {
            return ArticleExtraction.degraded(summary, link, "extraction_disabled");
        }

        HttpFetchResult fetch = httpClient.get(
            link,
            ACCEPT_HTML,
            Map.of(),
            properties.getExtraction().getMaxAttempts()
        );
        String canonical = fetch.finalUri() == null ? link : fetch.finalUrlOrRequested();
        if (!fetch.isSuccessful()) {
            String reason = ReasonCodeClassifier.classify(fetch);
            log.debug("Article fetch failed for {}: {}", link, reason);
            return ArticleExtraction.degraded(summary, canonical, reason);
        }
        if (!isHtml(fetch.contentType()) || fetch.bodyBytes() == null || fetch.bodyBytes().length == 0) {
            log.debug("Article at {} is not HTML ({})", link, fetch.contentType());
            return ArticleExtraction.degraded(summary, canonical, "not_html");
        }

        Document document;
        try {
            document = Jsoup.parse(new ByteArrayInputStream(fetch.bodyBytes()), headerCharset(fetch.contentType()), canonical);
        } catch (IOException e) {
            log.debug("Article at {} could not be decoded: {}", link, e.getMessage());
            return ArticleExtraction.degraded(summary, canonical, ReasonCodeClassifier.PARSING_FAILED);
        }
        String canonicalFromPage = canonicalLink(document);
        if (canonicalFromPage != null) {
            canonical = canonicalFromPage;
        }

        String article = isolateArticle(document);
        String sanitized = sanitizer.sanitize(article);
        int textLength = Jsoup.parseBodyFragment(sanitized).body().text().length();
        if (textLength < properties.getExtraction().getMinTextLength()) {
            log.debug("Article at {} too short after extraction ({} chars)", link, textLength);
            return ArticleExtraction.degraded(summary, canonical, "too_short");
        }
        return ArticleExtraction.full(sanitized, canonical);
    }

    public String isolateArticle(String html, String baseUri) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return isolateArticle(Jsoup.parse(html, baseUri == null ? "" : baseUri));
    }

    String isolateArticle(Document document) {
        Element body = document.body();
        if (body == null) {
            return "";
        }
        for (String tag : FURNITURE) {
            body.select(tag).remove();
        }
        for (Element element : body.select("*")) {
            if (element == body || element.parent() == null) {
                continue;
            }
            String hint = classAndId(element);
            if (!hint.isEmpty()
                && UNLIKELY.matcher(hint).find()
                && !MAYBE_CANDIDATE.matcher(hint).find()
                && !element.tagName().equals("article")
                && !element.tagName().equals("main")) {
                element.remove();
            }
        }
        absolutizeLinks(body);

        Map<Element, Double> scores = new IdentityHashMap<>();
        for (Element paragraph : body.select("p, pre, td, blockquote")) {
            if (!SCORED_PARENT_TAGS.contains(paragraph.tagName())) {
                continue;
            }
            String text = paragraph.text();
            if (text.length() < 25) {
                continue;
            }
            double contentScore = 1 + countCommas(text) + Math.min(3, text.length() / 100);
            Element parent = paragraph.parent();
            if (parent != null) {
                scores.merge(parent, contentScore, Double::sum);
                Element grandParent = parent.parent();
                if (grandParent != null && grandParent != body.parent()) {
                    scores.merge(grandParent, contentScore / 2, Double::sum);
                }
            }
        }
        if (scores.isEmpty()) {
            return body.html();
        }

        Element top = null;
        double topScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Element, Double> scored : scores.entrySet()) {
            Element candidate = scored.getKey();
            double score = (scored.getValue() + initialScore(candidate)) * (1 - linkDensity(candidate));
            scored.setValue(score);
            if (score > topScore) {
                topScore = score;
                top = candidate;
            }
        }
        if (top == null) {
            return body.html();
        }

        Element parent = top.parent();
        if (top == body || parent == null) {
            return top.html();
        }
        double siblingThreshold = Math.max(10, topScore * 0.2);
        StringBuilder out = new StringBuilder();
        for (Element sibling : parent.children()) {
            boolean append = sibling == top;
            if (!append) {
                Double siblingScore = scores.get(sibling);
                if (siblingScore != null && siblingScore >= siblingThreshold) {
                    append = true;
                } else if (sibling.tagName().equals("p")) {
                    String text = sibling.text();
                    double density = linkDensity(sibling);
                    append = (text.length() > 80 && density < 0.25)
                        || (text.length() > 0 && density == 0 && text.contains(". "));
                }
            }
            if (append) {
                out.append(sibling.outerHtml());
            }
        }
        return out.toString();
    }

    private double initialScore(Element element) {
        double score = switch (element.tagName()) {
            case "article", "main" -> 10;
            case "div" -> 5;
            case "pre", "td", "blockquote" -> 3;
            case "address", "ol", "ul", "dl", "dd", "dt", "li", "form" -> -3;
            case "h1", "h2", "h3", "h4", "h5", "h6", "th" -> -5;
            default -> 0;
        };
        return score + classWeight(element);
    }

    private double classWeight(Element element) {
        double weight = 0;
        String className = element.className();
        if (!className.isBlank()) {
            if (NEGATIVE.matcher(className).find()) {
                weight -= 25;
            }
            if (POSITIVE.matcher(className).find()) {
                weight += 25;
            }
        }
        String id = element.id();
        if (!id.isBlank()) {
            if (NEGATIVE.matcher(id).find()) {
                weight -= 25;
            }
            if (POSITIVE.matcher(id).find()) {
                weight += 25;
            }
        }
        return weight;
    }

    private double linkDensity(Element element) {
        int textLength = element.text().length();
        if (textLength == 0) {
            return 0;
        }
        int linkLength = 0;
        for (Element anchor : element.select("a")) {
            linkLength += anchor.text().length();
        }
        return Math.min(1.0, (double) linkLength / textLength);
    }

    private int countCommas(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ',') {
                count++;
            }
        }
        return count;
    }

    private String classAndId(Element element) {
        return (element.className() + " " + element.id()).trim();
    }

    private void absolutizeLinks(Element root) {
        for (Element anchor : root.select("a[href]")) {
            String absolute = anchor.absUrl("href");
            if (!absolute.isEmpty()) {
                anchor.attr("href", absolute);
            }
        }
        for (Element image : root.select("img[src]")) {
            String absolute = image.absUrl("src");
            if (!absolute.isEmpty()) {
                image.attr("src", absolute);
            }
        }
    }

    private String canonicalLink(Document document) {
        Element canonical = document.selectFirst("link[rel=canonical][href]");
        if (canonical == null) {
            return null;
        }
        String href = canonical.absUrl("href");
        if (href.isEmpty()) {
            href = UrlNormalizer.resolve(document.location(), canonical.attr("href"));
        }
        return UrlNormalizer.sanitizeHttpUrl(href);
    }

    private boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("text/html") || lower.contains("application/xhtml");
    }

    /**
     * Charset named by the Content-Type header, or {@code null} to let jsoup read the BOM and
     * {@code <meta charset>} (UTF-8 when neither is present).
     */
    private String headerCharset(String contentType) {
        if (contentType != null) {
            Matcher matcher = CHARSET.matcher(contentType);
            if (matcher.find()) {
                String name = matcher.group(1);
                try {
                    if (Charset.isSupported(name)) {
                        return name;
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("Illegal charset name {}: {}", name, e.getMessage());
                }
                log.debug("Unsupported charset {}, detecting from the document", name);
            }
        }
        return null;
    }
}
