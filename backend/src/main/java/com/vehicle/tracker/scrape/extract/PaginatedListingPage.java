package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.http.ListingHttpClient;
import com.vehicle.tracker.scrape.http.SourceFetchException;
import com.vehicle.tracker.scrape.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Simulates an infinite-scroll page over a paginated search URL: every growth step fetches the
 * next results page and appends its body to the loaded content.
 */
public class PaginatedListingPage implements ListingPage {
    private static final Logger log = LoggerFactory.getLogger(PaginatedListingPage.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final ListingHttpClient httpClient;
    private final ScraperProperties.Source source;
    private final Duration initialTimeout;
    private final StringBuilder content = new StringBuilder();
    private int pagesLoaded;
    private int nextPage = 1;
    private String lastBody;

    PaginatedListingPage(ListingHttpClient httpClient, ScraperProperties properties) {
        this.httpClient = httpClient;
        this.source = properties.getSource();
        this.initialTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    public static PaginatedListingPage open(ListingHttpClient httpClient, ScraperProperties properties) {
        PaginatedListingPage page = new PaginatedListingPage(httpClient, properties);
        page.loadInitial();
        return page;
    }

    private void loadInitial() {
        String url = pageUrl(nextPage);
        HttpFetchResult result = httpClient.get(url, ACCEPT_HTML, initialTimeout);
        if (!result.isSuccessful()) {
            throw new SourceFetchException("Initial listing page load failed for " + url + ": " + result.describe(), result);
        }
        nextPage++;
        append(bodyHtml(result));
    }

    @Override
    public String baseUri() {
        return source.getBaseUrl();
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
        if (nextPage > source.getMaxPages()) {
            return GrowthOutcome.EXHAUSTED;
        }
        String url = pageUrl(nextPage);
        HttpFetchResult result = httpClient.get(url, ACCEPT_HTML, timeout);
        if (result.isTimeout()) {
            log.info("Listing page {} did not answer within {}s", nextPage, timeout.toSeconds());
            return GrowthOutcome.TIMED_OUT;
        }
        if (result.statusCode() == 404 || result.statusCode() == 410) {
            log.info("Listing page {} returned {}; no further pages", nextPage, result.statusCode());
            return GrowthOutcome.EXHAUSTED;
        }
        if (!result.isSuccessful()) {
            throw new SourceFetchException("Listing page fetch failed for " + url + ": " + result.describe(), result);
        }
        nextPage++;
        String body = bodyHtml(result);
        if (body.isBlank() || body.equals(lastBody)) {
            return GrowthOutcome.NO_NEW_CONTENT;
        }
        append(body);
        return GrowthOutcome.GREW;
    }

    String pageUrl(int page) {
        String searchUrl = source.getSearchUrl();
        String separator = searchUrl.contains("?") ? "&" : "?";
        return searchUrl + separator + source.getPageParam() + "=" + page;
    }

    private void append(String body) {
        pagesLoaded++;
        lastBody = body;
        content.append("<section data-page=\"").append(pagesLoaded).append("\">")
            .append(body)
            .append("</section>\n");
    }

    private String bodyHtml(HttpFetchResult result) {
        String raw = result.body();
        if (raw == null || raw.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(raw, result.finalUrlOrRequested());
        return document.body().html();
    }
}
