package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.model.VehicleRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VehicleListingFilterTest {

    @Test
    void bladeRuleDropsOnlyGreyCardsWithoutBodyColouredBlade() {
        VehicleListingFilter filter = new VehicleListingFilter(bladeRuleProperties());

        assertThat(filter.accepts(card("Megane E-Tech Iconic lame F1 Gris Schiste", "Gris Schiste"))).isFalse();
        assertThat(filter.accepts(card("Megane E-Tech Iconic lame F1 ton caisse Gris Rafale", "Gris Rafale"))).isTrue();
        assertThat(filter.accepts(card("Megane E-Tech Iconic lame F1 Blanc Glacier", "Blanc Glacier"))).isTrue();
        assertThat(filter.accepts(card("Megane E-Tech Iconic Gris Schiste", "Gris Schiste"))).isTrue();
    }

    @Test
    void skipKeywordsAndColorsAreCaseInsensitive() {
        ScraperProperties properties = new ScraperProperties();
        properties.getFilter().setSkipKeywords(List.of("Super Charge"));
        properties.getFilter().setExcludedColors(List.of("rouge"));
        VehicleListingFilter filter = new VehicleListingFilter(properties);

        assertThat(filter.accepts(card("Megane E-Tech SUPER CHARGE", "Noir Etoile"))).isFalse();
        assertThat(filter.accepts(card("Megane E-Tech Optimum Charge", "Rouge Flamme"))).isFalse();
        assertThat(filter.accepts(card("Megane E-Tech Optimum Charge", "Noir Etoile"))).isTrue();
    }

    @Test
    void requiredKeywordsKeepOnlyMatchingCards() {
        ScraperProperties properties = new ScraperProperties();
        properties.getFilter().setRequiredKeywords(List.of("optimum charge", "22 kw"));
        VehicleListingFilter filter = new VehicleListingFilter(properties);

        assertThat(filter.accepts(card("Megane E-Tech 22 kW", "Noir"))).isTrue();
        assertThat(filter.accepts(card("Megane E-Tech standard charge", "Noir"))).isFalse();
    }

    @Test
    void emptyConfigurationAcceptsEverything() {
        VehicleListingFilter filter = new VehicleListingFilter(new ScraperProperties());

        assertThat(filter.accepts(card("anything", null))).isTrue();
    }

    private static ScraperProperties bladeRuleProperties() {
        ScraperProperties.ConditionalExclusion rule = new ScraperProperties.ConditionalExclusion();
        rule.setKeyword("lame F1");
        rule.setUnlessKeywords(List.of("ton caisse"));
        rule.setOnlyWithKeywords(List.of("gris schiste", "gris rafale"));
        ScraperProperties properties = new ScraperProperties();
        properties.getFilter().setConditionalExclusions(List.of(rule));
        return properties;
    }

    private static ListingCard card(String text, String color) {
        VehicleRecord record = new VehicleRecord(
            "https://fr.renew.auto/vehicule/1",
            "Renault Megane E-Tech",
            2250000L,
            null,
            null,
            color,
            null,
            List.of(),
            null,
            null,
            null,
            null
        );
        return new ListingCard(record, text);
    }
}
