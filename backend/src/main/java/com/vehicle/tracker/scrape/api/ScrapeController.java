package com.vehicle.tracker.scrape.api;

import com.vehicle.tracker.scrape.model.ScrapeRunMeta;
import com.vehicle.tracker.scrape.model.StatsResponse;
import com.vehicle.tracker.scrape.model.StatusResponse;
import com.vehicle.tracker.scrape.model.TriggerResponse;
import com.vehicle.tracker.scrape.model.VehiclesResponse;
import com.vehicle.tracker.scrape.persistence.ScrapeRunJdbcRepository;
import com.vehicle.tracker.scrape.service.ScrapeJobController;
import com.vehicle.tracker.scrape.service.VehicleCatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private static final int MAX_RUNS_LIMIT = 200;

    private final ScrapeJobController jobController;
    private final VehicleCatalogService catalogService;
    private final ScrapeRunJdbcRepository runRepository;

    public ScrapeController(
        ScrapeJobController jobController,
        VehicleCatalogService catalogService,
        ScrapeRunJdbcRepository runRepository
    ) {
        this.jobController = jobController;
        this.catalogService = catalogService;
        this.runRepository = runRepository;
    }

    @PostMapping("/refresh")
    public TriggerResponse refresh() {
        jobController.start();
        return TriggerResponse.accepted("Scraping started");
    }

    @PostMapping("/cancel")
    public TriggerResponse cancel() {
        if (jobController.cancel()) {
            return TriggerResponse.accepted("Cancellation requested");
        }
        return new TriggerResponse(false, "No scrape is running", null);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return StatusResponse.from(jobController.snapshot());
    }

    @PostMapping("/status/acknowledge")
    public StatusResponse acknowledge() {
        return StatusResponse.from(jobController.acknowledge());
    }

    @GetMapping("/vehicles")
    public VehiclesResponse vehicles(@RequestParam(name = "available", required = false) Boolean available) {
        return catalogService.listVehicles(available);
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return new StatsResponse(true, catalogService.stats());
    }

    @GetMapping("/runs")
    public List<ScrapeRunMeta> runs(@RequestParam(name = "limit", required = false) Integer limit) {
        int resolved = limit == null ? 20 : limit;
        if (resolved < 1 || resolved > MAX_RUNS_LIMIT) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be between 1 and " + MAX_RUNS_LIMIT);
        }
        return runRepository.findRecentScrapeRuns(resolved);
    }
}
