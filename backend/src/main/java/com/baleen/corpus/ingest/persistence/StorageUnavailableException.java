package com.baleen.corpus.ingest.persistence;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The document store could not be reached. Callers treat it as a transient, retry-next-tick failure.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
