package com.baleen.corpus.ingest.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;

/**
 * Closed set of supported syndication formats, resolved by sniffing the document root.
 */
public enum FeedFormat {
    RSS,
    RDF,
    ATOM;

    public static FeedFormat sniff(Document document) {
        if (document == null) {
            return null;
        }
        for (Element element : document.children()) {
            String name = element.tagName().toLowerCase(Locale.ROOT);
            if (name.equals("rss")) {
                return RSS;
            }
            if (name.equals("feed")) {
                return ATOM;
            }
            if (name.equals("rdf:rdf") || name.endsWith(":rdf") || name.equals("rdf")) {
                return RDF;
            }
        }
        if (document.selectFirst("channel > item") != null) {
            return RSS;
        }
        return null;
    }
}
