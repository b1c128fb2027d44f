package com.vehicle.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "vehicle-tracker/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 500;
    private int requestTimeoutSeconds = 15;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Source source = new Source();
    private Extraction extraction = new Extraction();
    private Selectors selectors = new Selectors();
    private Filter filter = new Filter();
    private Reconcile reconcile = new Reconcile();
    private Run run = new Run();
    private Diagnostics diagnostics = new Diagnostics();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Selectors getSelectors() {
        return selectors;
    }

    public void setSelectors(Selectors selectors) {
        this.selectors = selectors;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public void setReconcile(Reconcile reconcile) {
        this.reconcile = reconcile;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Source {
        private String baseUrl = "https://fr.renew.auto";
        private String searchUrl = "https://fr.renew.auto/achat-vehicules-occasions.html";
        private String pageParam = "page";
        private int maxPages = 20;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public String getPageParam() {
            return pageParam == null || pageParam.isBlank() ? "page" : pageParam.trim();
        }

        public void setPageParam(String pageParam) {
            this.pageParam = pageParam;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }

    public static class Extraction {
        private int settleThreshold = 2;
        private int growthTimeoutSeconds = 15;
        private int maxGrowthSteps = 50;

        public int getSettleThreshold() {
            return Math.max(1, settleThreshold);
        }

        public void setSettleThreshold(int settleThreshold) {
            this.settleThreshold = Math.max(1, settleThreshold);
        }

        public int getGrowthTimeoutSeconds() {
            return Math.max(1, growthTimeoutSeconds);
        }

        public void setGrowthTimeoutSeconds(int growthTimeoutSeconds) {
            this.growthTimeoutSeconds = Math.max(1, growthTimeoutSeconds);
        }

        public int getMaxGrowthSteps() {
            return Math.max(1, maxGrowthSteps);
        }

        public void setMaxGrowthSteps(int maxGrowthSteps) {
            this.maxGrowthSteps = Math.max(1, maxGrowthSteps);
        }
    }

    public static class Selectors {
        private String listing = "article.vehicle-card";
        private String link = "a[href]";
        private String title = "h2, h3";
        private String price = ".price";
        private String trim = ".trim";
        private String chargeType = ".charge-type";
        private String color = ".color";
        private String seats = ".seats";
        private String packs = ".packs li";
        private String location = ".location";
        private String mapsLink = "a[href*=maps]";
        private String photo = "img[src]";
        private String emptyResultsPattern = "(?i)(aucun r[ée]sultat|0 r[ée]sultat|no results)";

        public String getListing() {
            return listing;
        }

        public void setListing(String listing) {
            this.listing = listing;
        }

        public String getLink() {
            return link;
        }

        public void setLink(String link) {
            this.link = link;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getPrice() {
            return price;
        }

        public void setPrice(String price) {
            this.price = price;
        }

        public String getTrim() {
            return trim;
        }

        public void setTrim(String trim) {
            this.trim = trim;
        }

        public String getChargeType() {
            return chargeType;
        }

        public void setChargeType(String chargeType) {
            this.chargeType = chargeType;
        }

        public String getColor() {
            return color;
        }

        public void setColor(String color) {
            this.color = color;
        }

        public String getSeats() {
            return seats;
        }

        public void setSeats(String seats) {
            this.seats = seats;
        }

        public String getPacks() {
            return packs;
        }

        public void setPacks(String packs) {
            this.packs = packs;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getMapsLink() {
            return mapsLink;
        }

        public void setMapsLink(String mapsLink) {
            this.mapsLink = mapsLink;
        }

        public String getPhoto() {
            return photo;
        }

        public void setPhoto(String photo) {
            this.photo = photo;
        }

        public String getEmptyResultsPattern() {
            return emptyResultsPattern;
        }

        public void setEmptyResultsPattern(String emptyResultsPattern) {
            this.emptyResultsPattern = emptyResultsPattern;
        }
    }

    public static class Filter {
        private List<String> skipKeywords = new ArrayList<>();
        private List<String> excludedColors = new ArrayList<>();
        private List<String> requiredKeywords = new ArrayList<>();
        private List<ConditionalExclusion> conditionalExclusions = new ArrayList<>();

        public List<String> getSkipKeywords() {
            return skipKeywords;
        }

        public void setSkipKeywords(List<String> skipKeywords) {
            this.skipKeywords = skipKeywords == null ? new ArrayList<>() : skipKeywords;
        }

        public List<String> getExcludedColors() {
            return excludedColors;
        }

        public void setExcludedColors(List<String> excludedColors) {
            this.excludedColors = excludedColors == null ? new ArrayList<>() : excludedColors;
        }

        public List<String> getRequiredKeywords() {
            return requiredKeywords;
        }

        public void setRequiredKeywords(List<String> requiredKeywords) {
            this.requiredKeywords = requiredKeywords == null ? new ArrayList<>() : requiredKeywords;
        }

        public List<ConditionalExclusion> getConditionalExclusions() {
            return conditionalExclusions;
        }

        public void setConditionalExclusions(List<ConditionalExclusion> conditionalExclusions) {
            this.conditionalExclusions = conditionalExclusions == null ? new ArrayList<>() : conditionalExclusions;
        }
    }

    /**
     * Drops a listing whose card text contains {@code keyword}, unless it also mentions one of
     * {@code unlessKeywords}. When {@code onlyWithKeywords} is non-empty the rule applies only to
     * cards mentioning at least one of them.
     */
    public static class ConditionalExclusion {
        private String keyword;
        private List<String> unlessKeywords = new ArrayList<>();
        private List<String> onlyWithKeywords = new ArrayList<>();

        public String getKeyword() {
            return keyword;
        }

        public void setKeyword(String keyword) {
            this.keyword = keyword;
        }

        public List<String> getUnlessKeywords() {
            return unlessKeywords;
        }

        public void setUnlessKeywords(List<String> unlessKeywords) {
            this.unlessKeywords = unlessKeywords == null ? new ArrayList<>() : unlessKeywords;
        }

        public List<String> getOnlyWithKeywords() {
            return onlyWithKeywords;
        }

        public void setOnlyWithKeywords(List<String> onlyWithKeywords) {
            this.onlyWithKeywords = onlyWithKeywords == null ? new ArrayList<>() : onlyWithKeywords;
        }
    }

    public static class Reconcile {
        private int batchSize = 10;
        private int storeMaxAttempts = 3;
        private int storeRetryDelayMs = 200;
        private int transactionTimeoutSeconds = 30;
        private int availabilityGraceMinutes = 0;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getStoreMaxAttempts() {
            return Math.max(1, storeMaxAttempts);
        }

        public void setStoreMaxAttempts(int storeMaxAttempts) {
            this.storeMaxAttempts = Math.max(1, storeMaxAttempts);
        }

        public int getStoreRetryDelayMs() {
            return Math.max(0, storeRetryDelayMs);
        }

        public void setStoreRetryDelayMs(int storeRetryDelayMs) {
            this.storeRetryDelayMs = storeRetryDelayMs;
        }

        public int getTransactionTimeoutSeconds() {
            return Math.max(1, transactionTimeoutSeconds);
        }

        public void setTransactionTimeoutSeconds(int transactionTimeoutSeconds) {
            this.transactionTimeoutSeconds = Math.max(1, transactionTimeoutSeconds);
        }

        public int getAvailabilityGraceMinutes() {
            return Math.max(0, availabilityGraceMinutes);
        }

        public void setAvailabilityGraceMinutes(int availabilityGraceMinutes) {
            this.availabilityGraceMinutes = Math.max(0, availabilityGraceMinutes);
        }
    }

    public static class Run {
        private int heartbeatSeconds = 30;
        private int staleRunMinutes = 60;

        public int getHeartbeatSeconds() {
            return Math.max(1, heartbeatSeconds);
        }

        public void setHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = Math.max(1, heartbeatSeconds);
        }

        public int getStaleRunMinutes() {
            return Math.max(0, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(0, staleRunMinutes);
        }
    }

    public static class Diagnostics {
        private String snapshotPath = "debug_fail_page.html";

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean stats;
        private boolean exitAfterRun = true;
        private int pollIntervalMs = 1000;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isStats() {
            return stats;
        }

        public void setStats(boolean stats) {
            this.stats = stats;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }
    }
}
