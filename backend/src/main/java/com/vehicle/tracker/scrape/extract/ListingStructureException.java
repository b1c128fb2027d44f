package com.vehicle.tracker.scrape.extract;

/**
 * The loaded page no longer has the listing structure the parser expects. Not retried.
 */
public class ListingStructureException extends RuntimeException {
    private final String rawContent;

    public ListingStructureException(String message, String rawContent) {
        super(message);
        this.rawContent = rawContent;
    }

    public String getRawContent() {
        return rawContent;
    }
}
