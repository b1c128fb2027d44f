package com.vehicle.tracker.scrape.http;

import com.vehicle.tracker.scrape.model.HttpFetchResult;

/**
 * Raised once a listing fetch has exhausted its retries. Fails the run.
 */
public class SourceFetchException extends RuntimeException {
    private final transient HttpFetchResult result;

    public SourceFetchException(String message, HttpFetchResult result) {
        super(message);
        this.result = result;
    }

    public HttpFetchResult getResult() {
        return result;
    }
}
