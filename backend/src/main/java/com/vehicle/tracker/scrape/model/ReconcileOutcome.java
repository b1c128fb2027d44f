package com.vehicle.tracker.scrape.model;

public record ReconcileOutcome(String url, boolean isNew, boolean priceChanged, Long oldPrice, Long newPrice) {

    public static ReconcileOutcome inserted(String url, Long price) {
        return new ReconcileOutcome(url, true, false, null, price);
    }

    public static ReconcileOutcome priceChanged(String url, Long oldPrice, Long newPrice) {
        return new ReconcileOutcome(url, false, true, oldPrice, newPrice);
    }

    public static ReconcileOutcome unchanged(String url, Long price) {
        return new ReconcileOutcome(url, false, false, null, price);
    }
}
