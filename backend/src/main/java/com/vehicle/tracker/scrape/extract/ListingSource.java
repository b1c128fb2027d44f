package com.vehicle.tracker.scrape.extract;

public interface ListingSource {

    /**
     * Opens a fresh page and performs its initial load.
     *
     * @throws com.vehicle.tracker.scrape.http.SourceFetchException when the initial load fails
     */
    ListingPage open();
}
