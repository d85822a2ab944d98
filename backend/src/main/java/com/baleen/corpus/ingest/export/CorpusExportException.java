package com.baleen.corpus.ingest.export;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class CorpusExportException extends RuntimeException {
    public CorpusExportException(String message) {
        super(message);
    }

    public CorpusExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
