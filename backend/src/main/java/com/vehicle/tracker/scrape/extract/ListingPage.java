package com.vehicle.tracker.scrape.extract;

import java.time.Duration;

/**
 * A listing page whose content grows on demand, one scroll or pagination step at a time.
 * Implementations are single-use and not thread-safe.
 */
public interface ListingPage extends AutoCloseable {

    /**
     * Base URI used to resolve relative links found in {@link #content()}.
     */
    String baseUri();

    /**
     * Markup of everything loaded so far.
     */
    String content();

    int pagesLoaded();

    /**
     * Triggers one growth step and waits at most {@code timeout} for new content.
     * A timeout is reported as {@link GrowthOutcome#TIMED_OUT}, not thrown.
     */
    GrowthOutcome grow(Duration timeout);

    @Override
    default void close() {
    }
}
