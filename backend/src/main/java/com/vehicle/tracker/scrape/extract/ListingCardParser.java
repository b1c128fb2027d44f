package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.model.VehicleRecord;
import com.vehicle.tracker.scrape.util.MapsLinkCoordinates;
import com.vehicle.tracker.scrape.util.PriceParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

@Component
public class ListingCardParser {
    private static final Logger log = LoggerFactory.getLogger(ListingCardParser.class);

    private final ScraperProperties.Selectors selectors;
    private final Pattern emptyResults;

    public ListingCardParser(ScraperProperties properties) {
        this.selectors = properties.getSelectors();
        String pattern = selectors.getEmptyResultsPattern();
        this.emptyResults = pattern == null || pattern.isBlank() ? null : Pattern.compile(pattern);
    }

    /**
     * Parses every listing container currently present in {@code html}.
     *
     * @throws ListingStructureException when no container is present on a page that is not an
     *                                   explicit empty result, or when a container has no title
     */
    public List<ListingCard> parse(String html, String baseUri) {
        Document document = Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
        Elements containers = document.select(selectors.getListing());
        if (containers.isEmpty()) {
            if (emptyResults != null && emptyResults.matcher(document.text()).find()) {
                return List.of();
            }
            throw new ListingStructureException(
                "No listing container matched selector '" + selectors.getListing() + "'",
                html
            );
        }

        List<ListingCard> cards = new ArrayList<>();
        for (Element container : containers) {
            String title = text(container, selectors.getTitle());
            if (title == null) {
                throw new ListingStructureException(
                    "Listing container without title (selector '" + selectors.getTitle() + "')",
                    html
                );
            }
            String url = listingUrl(container);
            if (url == null) {
                log.debug("Skipping listing '{}' without an identifier link", title);
                continue;
            }
            cards.add(new ListingCard(toRecord(container, url, title), container.text()));
        }
        return cards;
    }

    private VehicleRecord toRecord(Element container, String url, String title) {
        MapsLinkCoordinates.Coordinates coordinates = coordinates(container);
        return new VehicleRecord(
            url,
            title,
            PriceParser.parseMinorUnits(text(container, selectors.getPrice())),
            text(container, selectors.getTrim()),
            text(container, selectors.getChargeType()),
            text(container, selectors.getColor()),
            text(container, selectors.getSeats()),
            packs(container),
            text(container, selectors.getLocation()),
            coordinates == null ? null : coordinates.latitude(),
            coordinates == null ? null : coordinates.longitude(),
            photoUrl(container)
        );
    }

    private String listingUrl(Element container) {
        Element link = container.is("a[href]") ? container : select(container, selectors.getLink());
        if (link == null) {
            return null;
        }
        String absolute = link.absUrl("href");
        if (absolute.isBlank()) {
            String raw = link.attr("href");
            return raw.isBlank() ? null : raw.trim();
        }
        return absolute;
    }

    private List<String> packs(Element container) {
        if (isBlank(selectors.getPacks())) {
            return List.of();
        }
        TreeSet<String> packs = new TreeSet<>();
        for (Element item : container.select(selectors.getPacks())) {
            String text = item.text().trim();
            if (!text.isEmpty()) {
                packs.add(text);
            }
        }
        return new ArrayList<>(packs);
    }

    private MapsLinkCoordinates.Coordinates coordinates(Element container) {
        Element link = select(container, selectors.getMapsLink());
        return link == null ? null : MapsLinkCoordinates.parse(link.attr("href"));
    }

    private String photoUrl(Element container) {
        Element image = select(container, selectors.getPhoto());
        if (image == null) {
            return null;
        }
        String src = image.absUrl("src");
        if (src.isBlank()) {
            src = image.absUrl("data-src");
        }
        return src.isBlank() ? null : src;
    }

    private String text(Element container, String selector) {
        Element element = select(container, selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private Element select(Element container, String selector) {
        if (isBlank(selector)) {
            return null;
        }
        return container.selectFirst(selector);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
