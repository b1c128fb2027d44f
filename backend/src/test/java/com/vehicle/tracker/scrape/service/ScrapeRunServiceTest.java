package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.MutableClock;
import com.vehicle.tracker.scrape.extract.FakeListingPage;
import com.vehicle.tracker.scrape.extract.ListingCardParser;
import com.vehicle.tracker.scrape.extract.ListingExtractor;
import com.vehicle.tracker.scrape.extract.ListingSource;
import com.vehicle.tracker.scrape.extract.ListingStructureException;
import com.vehicle.tracker.scrape.extract.VehicleListingFilter;
import com.vehicle.tracker.scrape.http.SourceFetchException;
import com.vehicle.tracker.scrape.model.ReconcileOutcome;
import com.vehicle.tracker.scrape.model.RunCounters;
import com.vehicle.tracker.scrape.model.ScrapeRunResult;
import com.vehicle.tracker.scrape.model.VehicleRecord;
import com.vehicle.tracker.scrape.persistence.ScrapeRunJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.vehicle.tracker.scrape.extract.FakeListingPage.cards;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeRunServiceTest {
    private static final Instant STARTED_AT = Instant.parse("2032-04-01T06:00:00Z");
    private static final long RUN_ID = 42L;

    @Mock
    private ListingSource listingSource;
    @Mock
    private ListingReconciler reconciler;
    @Mock
    private ScrapeRunJdbcRepository runRepository;
    @Mock
    private DiagnosticSnapshotWriter snapshotWriter;

    private ScraperProperties properties;
    private ScrapeRunService service;
    private final List<String> progressMessages = new ArrayList<>();
    private final List<Integer> progressValues = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getReconcile().setBatchSize(10);
        properties.getSource().setMaxPages(5);
        ListingExtractor extractor = new ListingExtractor(
            new ListingCardParser(properties),
            new VehicleListingFilter(properties),
            properties
        );
        service = new ScrapeRunService(
            listingSource,
            extractor,
            reconciler,
            runRepository,
            snapshotWriter,
            properties,
            new MutableClock(STARTED_AT)
        );
        when(runRepository.insertScrapeRun(eq(STARTED_AT), eq("RUNNING"), anyString())).thenReturn(RUN_ID);
    }

    @Test
    void completedRunReconcilesEverythingAndRunsAvailabilityPass() {
        FakeListingPage page = new FakeListingPage(cards(0, 3));
        when(listingSource.open()).thenReturn(page);
        when(reconciler.reconcileBatch(anyList())).thenAnswer(invocation -> insertedOutcomes(invocation.getArgument(0)));
        when(reconciler.runAvailabilityPass(STARTED_AT)).thenReturn(7);

        ScrapeRunResult result = service.execute(context(new RunCancellation()));

        assertThat(result.counters()).isEqualTo(new RunCounters(1, 3, 3, 0));
        assertThat(result.markedUnavailable()).isEqualTo(7);
        assertThat(result.stopReason()).isEqualTo("settled");
        assertThat(page.isClosed()).isTrue();
        assertThat(progressValues).startsWith(10).contains(95);
        assertThat(progressMessages).contains("Scraping... Page 1 | Listings: 3 | New: 3");
        verify(runRepository).completeScrapeRun(eq(RUN_ID), any(), eq("COMPLETED"), contains("unavailable=7"), eq(result.counters()));
    }

    @Test
    void structuralFailureKeepsCommittedBatchesAndSkipsAvailabilityPass() {
        String broken = "<article class=\"vehicle-card\"><a href=\"/v/broken\"><span>no title</span></a></article>";
        FakeListingPage page = new FakeListingPage(cards(0, 12)).thenGrow(broken);
        when(listingSource.open()).thenReturn(page);
        when(reconciler.reconcileBatch(anyList())).thenAnswer(invocation -> insertedOutcomes(invocation.getArgument(0)));

        assertThatThrownBy(() -> service.execute(context(new RunCancellation())))
            .isInstanceOf(ListingStructureException.class);

        ArgumentCaptor<List<VehicleRecord>> batches = ArgumentCaptor.forClass(List.class);
        verify(reconciler, times(1)).reconcileBatch(batches.capture());
        assertThat(batches.getValue()).hasSize(10);
        verify(reconciler, never()).runAvailabilityPass(any());
        verify(snapshotWriter).write(contains("/v/broken"));
        ArgumentCaptor<RunCounters> counters = ArgumentCaptor.forClass(RunCounters.class);
        verify(runRepository).completeScrapeRun(eq(RUN_ID), any(), eq("FAILED"), contains("structure_error"), counters.capture());
        assertThat(counters.getValue().listingsProcessed()).isEqualTo(10);
    }

    @Test
    void storeFailureAfterRetriesFailsTheRunAndKeepsEarlierBatches() {
        when(listingSource.open()).thenReturn(new FakeListingPage(cards(0, 25)));
        when(reconciler.reconcileBatch(anyList()))
            .thenAnswer(invocation -> insertedOutcomes(invocation.getArgument(0)))
            .thenThrow(new QueryTimeoutException("statement timed out"));

        assertThatThrownBy(() -> service.execute(context(new RunCancellation())))
            .isInstanceOf(QueryTimeoutException.class)
            .hasMessage("statement timed out");

        verify(reconciler, times(2)).reconcileBatch(anyList());
        verify(reconciler, never()).runAvailabilityPass(any());
        verify(snapshotWriter, never()).write(anyString());
        ArgumentCaptor<RunCounters> counters = ArgumentCaptor.forClass(RunCounters.class);
        verify(runRepository).completeScrapeRun(
            eq(RUN_ID),
            any(),
            eq("FAILED"),
            contains("exception=QueryTimeoutException"),
            counters.capture()
        );
        assertThat(counters.getValue().listingsProcessed()).isEqualTo(10);
        assertThat(counters.getValue().listingsAdded()).isEqualTo(10);
    }

    @Test
    void cancellationBeforeFirstBatchCommitsNothing() {
        when(listingSource.open()).thenReturn(new FakeListingPage(cards(0, 4)));
        RunCancellation cancellation = new RunCancellation();
        cancellation.request();

        assertThatThrownBy(() -> service.execute(context(cancellation)))
            .isInstanceOf(ScrapeCancelledException.class);

        verify(reconciler, never()).reconcileBatch(anyList());
        verify(reconciler, never()).runAvailabilityPass(any());
        verify(runRepository).completeScrapeRun(eq(RUN_ID), any(), eq("CANCELLED"), anyString(), any());
    }

    @Test
    void initialLoadFailureFailsTheRun() {
        when(listingSource.open()).thenThrow(new SourceFetchException("Initial listing page load failed", null));

        assertThatThrownBy(() -> service.execute(context(new RunCancellation())))
            .isInstanceOf(SourceFetchException.class);

        verify(reconciler, never()).runAvailabilityPass(any());
        verify(snapshotWriter, never()).write(anyString());
        verify(runRepository).completeScrapeRun(eq(RUN_ID), any(), eq("FAILED"), contains("SourceFetchException"), any());
        verify(runRepository, never()).updateScrapeRunProgress(anyLong(), any(), any());
    }

    private ScrapeRunContext context(RunCancellation cancellation) {
        return new ScrapeRunContext(1L, STARTED_AT, cancellation, (generation, progress, message, counters) -> {
            progressValues.add(progress);
            progressMessages.add(message);
        });
    }

    private static List<ReconcileOutcome> insertedOutcomes(List<VehicleRecord> records) {
        List<ReconcileOutcome> outcomes = new ArrayList<>();
        for (VehicleRecord record : records) {
            outcomes.add(ReconcileOutcome.inserted(record.url(), record.price()));
        }
        return outcomes;
    }
}
