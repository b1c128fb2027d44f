package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.config.ScraperProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drops listings the catalog does not track: skip keywords in the card text, excluded exterior
 * colors, conditional exclusions, and (when configured) cards mentioning none of the required
 * keywords.
 */
@Component
public class VehicleListingFilter {
    private final List<String> skipKeywords;
    private final List<String> excludedColors;
    private final List<String> requiredKeywords;
    private final List<Exclusion> conditionalExclusions;

    public VehicleListingFilter(ScraperProperties properties) {
        ScraperProperties.Filter filter = properties.getFilter();
        this.skipKeywords = normalize(filter.getSkipKeywords());
        this.excludedColors = normalize(filter.getExcludedColors());
        this.requiredKeywords = normalize(filter.getRequiredKeywords());
        List<Exclusion> exclusions = new ArrayList<>();
        for (ScraperProperties.ConditionalExclusion rule : filter.getConditionalExclusions()) {
            if (rule == null || rule.getKeyword() == null || rule.getKeyword().isBlank()) {
                continue;
            }
            exclusions.add(new Exclusion(
                rule.getKeyword().trim().toLowerCase(Locale.ROOT),
                normalize(rule.getUnlessKeywords()),
                normalize(rule.getOnlyWithKeywords())
            ));
        }
        this.conditionalExclusions = List.copyOf(exclusions);
    }

    public boolean accepts(ListingCard card) {
        String text = lower(card.text());
        for (String keyword : skipKeywords) {
            if (text.contains(keyword)) {
                return false;
            }
        }
        String color = lower(card.record().exteriorColor());
        for (String excluded : excludedColors) {
            if (color.contains(excluded)) {
                return false;
            }
        }
        for (Exclusion exclusion : conditionalExclusions) {
            if (exclusion.excludes(text)) {
                return false;
            }
        }
        if (requiredKeywords.isEmpty()) {
            return true;
        }
        for (String keyword : requiredKeywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private record Exclusion(String keyword, List<String> unlessKeywords, List<String> onlyWithKeywords) {
        boolean excludes(String text) {
            if (!text.contains(keyword) || containsAny(text, unlessKeywords)) {
                return false;
            }
            return onlyWithKeywords.isEmpty() || containsAny(text, onlyWithKeywords);
        }
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(value -> value.trim().toLowerCase(Locale.ROOT))
            .toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
