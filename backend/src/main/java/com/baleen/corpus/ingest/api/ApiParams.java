package com.baleen.corpus.ingest.api;

import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

final class ApiParams {
    private ApiParams() {
    }

    static Instant parseInstant(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid " + name + " timestamp: " + raw);
        }
    }

    static <E extends Enum<E>> E parseEnum(String name, String raw, Class<E> type) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported " + name + " value: " + raw);
        }
    }
}
