package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.service.RunCancellation;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ListingExtractor {
    private final ListingCardParser parser;
    private final VehicleListingFilter filter;
    private final ScraperProperties properties;

    public ListingExtractor(ListingCardParser parser, VehicleListingFilter filter, ScraperProperties properties) {
        this.parser = parser;
        this.filter = filter;
        this.properties = properties;
    }

    public ListingExtraction extract(ListingPage page, RunCancellation cancellation) {
        ScraperProperties.Extraction extraction = properties.getExtraction();
        return new ListingExtraction(
            page,
            parser,
            filter,
            cancellation == null ? RunCancellation.none() : cancellation,
            extraction.getSettleThreshold(),
            Duration.ofSeconds(extraction.getGrowthTimeoutSeconds()),
            extraction.getMaxGrowthSteps()
        );
    }
}
