package com.baleen.corpus.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveIngestionJobException extends RuntimeException {
    public ActiveIngestionJobException(String message) {
        super(message);
    }
}
