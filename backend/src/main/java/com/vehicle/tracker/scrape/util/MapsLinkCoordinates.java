package com.vehicle.tracker.scrape.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads latitude and longitude out of a Google Maps link. Out-of-range pairs are ignored.
 */
public final class MapsLinkCoordinates {
    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("/maps/dir//([-+]?\\d+\\.\\d+),([-+]?\\d+\\.\\d+)"),
        Pattern.compile("@([-+]?\\d+\\.\\d+),([-+]?\\d+\\.\\d+)"),
        Pattern.compile("[?&]q=([-+]?\\d+\\.\\d+),([-+]?\\d+\\.\\d+)")
    );

    private MapsLinkCoordinates() {
    }

    public record Coordinates(double latitude, double longitude) {}

    public static Coordinates parse(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String decoded = href.replace("%2C", ",").replace("%2c", ",");
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(decoded);
            if (!matcher.find()) {
                continue;
            }
            double latitude = Double.parseDouble(matcher.group(1));
            double longitude = Double.parseDouble(matcher.group(2));
            if (Math.abs(latitude) <= 90 && Math.abs(longitude) <= 180) {
                return new Coordinates(latitude, longitude);
            }
        }
        return null;
    }
}
