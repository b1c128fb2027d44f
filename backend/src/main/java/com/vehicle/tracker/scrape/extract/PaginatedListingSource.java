package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.http.ListingHttpClient;
import org.springframework.stereotype.Component;

@Component
public class PaginatedListingSource implements ListingSource {
    private final ListingHttpClient httpClient;
    private final ScraperProperties properties;

    public PaginatedListingSource(ListingHttpClient httpClient, ScraperProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public ListingPage open() {
        return PaginatedListingPage.open(httpClient, properties);
    }
}
