package com.vehicle.tracker.scrape.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriceParserTest {

    @Test
    void parsesSpaceGroupedEuroPrice() {
        assertThat(PriceParser.parseMinorUnits("20 990 €")).isEqualTo(2_099_000L);
        assertThat(PriceParser.parseMinorUnits("20\u00A0990\u00A0€")).isEqualTo(2_099_000L);
        assertThat(PriceParser.parseMinorUnits("20\u202F990 €")).isEqualTo(2_099_000L);
    }

    @Test
    void distinguishesDecimalFromGroupingSeparators() {
        assertThat(PriceParser.parseMinorUnits("€18,500.00")).isEqualTo(1_850_000L);
        assertThat(PriceParser.parseMinorUnits("19.490,50 EUR")).isEqualTo(1_949_050L);
        assertThat(PriceParser.parseMinorUnits("18.500 €")).isEqualTo(1_850_000L);
        assertThat(PriceParser.parseMinorUnits("1'250.5 CHF")).isEqualTo(125_050L);
    }

    @Test
    void usesFirstNumberInText() {
        assertThat(PriceParser.parseMinorUnits("À partir de 15 900 € ou 199 €/mois")).isEqualTo(1_590_000L);
    }

    @Test
    void returnsNullWhenNoPriceCanBeRead() {
        assertThat(PriceParser.parseMinorUnits(null)).isNull();
        assertThat(PriceParser.parseMinorUnits("   ")).isNull();
        assertThat(PriceParser.parseMinorUnits("Prix sur demande")).isNull();
        assertThat(PriceParser.parseMinorUnits("9999999999999999999 €")).isNull();
    }
}
