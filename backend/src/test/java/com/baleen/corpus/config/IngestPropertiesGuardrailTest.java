package com.baleen.corpus.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        IngestProperties properties = new IngestProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("baleen-corpus/0.1"));

        properties.setUserAgent("  my-crawler/2.0  ");
        assertEquals("my-crawler/2.0", properties.getUserAgent());
    }

    @Test
    void poolsAndDelaysAreClamped() {
        IngestProperties properties = new IngestProperties();
        properties.setWorkerPoolSize(0);
        properties.setPerHostDelayMs(-10);
        properties.setPerHostConcurrency(-1);
        properties.getRetry().setBaseDelayMs(-5);
        properties.getExtraction().setMinTextLength(-1);
        assertEquals(1, properties.getWorkerPoolSize());
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(1, properties.getPerHostConcurrency());
        assertEquals(0, properties.getRetry().getBaseDelayMs());
        assertEquals(0, properties.getExtraction().getMinTextLength());
    }

    @Test
    void allowedTagsAreTrimmedAndLowercased() {
        IngestProperties properties = new IngestProperties();
        assertEquals(IngestProperties.DEFAULT_ALLOWED_TAGS, properties.getSanitizer().getAllowedTags());

        properties.getSanitizer().setAllowedTags(Arrays.asList(" P ", "", null, "Blockquote"));
        assertEquals(List.of("p", "blockquote"), properties.getSanitizer().getAllowedTags());
    }
}
