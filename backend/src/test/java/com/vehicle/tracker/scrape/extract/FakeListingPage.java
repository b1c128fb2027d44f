package com.vehicle.tracker.scrape.extract;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Scripted in-memory page. Each queued step is returned by one {@link #grow(Duration)} call;
 * once the script is used up every further step reports no new content.
 */
public class FakeListingPage implements ListingPage {
    public static final String BASE_URI = "https://fr.renew.auto";

    private final StringBuilder content = new StringBuilder();
    private final Deque<Step> steps = new ArrayDeque<>();
    private int pagesLoaded = 1;
    private int growCalls;
    private boolean closed;

    public FakeListingPage(String initialHtml) {
        content.append(initialHtml);
    }

    public FakeListingPage thenGrow(String html) {
        steps.add(new Step(GrowthOutcome.GREW, html));
        return this;
    }

    public FakeListingPage then(GrowthOutcome outcome) {
        steps.add(new Step(outcome, null));
        return this;
    }

    @Override
    public String baseUri() {
        return BASE_URI;
    }

    @Override
    public String content() {
        return content.toString();
    }

    @Override
    public int pagesLoaded() {
        return pagesLoaded;
    }

    @Override
    public GrowthOutcome grow(Duration timeout) {
        growCalls++;
        Step step = steps.poll();
        if (step == null) {
            return GrowthOutcome.NO_NEW_CONTENT;
        }
        if (step.outcome() == GrowthOutcome.GREW) {
            pagesLoaded++;
            content.append(step.html());
        }
        return step.outcome();
    }

    @Override
    public void close() {
        closed = true;
    }

    public int growCalls() {
        return growCalls;
    }

    public boolean isClosed() {
        return closed;
    }

    public static String card(String path, String title, String price, String color) {
        return "<article class=\"vehicle-card\">"
            + "<a href=\"" + path + "\"><h2>" + title + "</h2></a>"
            + "<span class=\"price\">" + price + "</span>"
            + "<span class=\"color\">" + color + "</span>"
            + "</article>";
    }

    public static String cards(int fromInclusive, int toExclusive) {
        StringBuilder html = new StringBuilder();
        for (int i = fromInclusive; i < toExclusive; i++) {
            html.append(card("/vehicule/" + i, "Renault Clio " + i, (15000 + i) + " €", "Noir"));
        }
        return html.toString();
    }

    private record Step(GrowthOutcome outcome, String html) {}
}
