package com.vehicle.tracker.scrape.util;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns displayed price text ("20 990 €", "€18,500.00", "19.490,50 EUR") into integer minor units.
 */
public final class PriceParser {
    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\d[\\d\\s\\u00A0\\u202F.,']*");
    private static final Pattern GROUPING_CHARS = Pattern.compile("[\\s\\u00A0\\u202F']");
    private static final int MAX_DIGITS = 15;

    private PriceParser() {
    }

    public static Long parseMinorUnits(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = NUMBER_TOKEN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String token = GROUPING_CHARS.matcher(matcher.group()).replaceAll("");
        token = stripTrailingSeparators(token);
        if (token.isEmpty()) {
            return null;
        }

        String integerPart = token;
        String fractionPart = "";
        int lastSeparator = Math.max(token.lastIndexOf('.'), token.lastIndexOf(','));
        if (lastSeparator >= 0) {
            String tail = token.substring(lastSeparator + 1);
            if (tail.length() == 1 || tail.length() == 2) {
                integerPart = token.substring(0, lastSeparator);
                fractionPart = tail;
            }
        }
        integerPart = integerPart.replace(".", "").replace(",", "");
        if (integerPart.isEmpty() || integerPart.length() > MAX_DIGITS) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(fractionPart.isEmpty() ? integerPart : integerPart + "." + fractionPart);
            return value.movePointRight(2).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static String stripTrailingSeparators(String token) {
        int end = token.length();
        while (end > 0 && !Character.isDigit(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(0, end);
    }
}
