package com.cusip.refdata.load.api;

import com.cusip.refdata.load.model.HealthResponse;
import com.cusip.refdata.load.model.LoadRequest;
import com.cusip.refdata.load.model.LoadResponse;
import com.cusip.refdata.load.model.LoadResult;
import com.cusip.refdata.load.model.RecordType;
import com.cusip.refdata.load.model.StatusResponse;
import com.cusip.refdata.load.service.LoadOrchestratorService;
import com.cusip.refdata.load.service.LoadStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class LoadController {
    private final LoadOrchestratorService orchestratorService;
    private final LoadStatusService statusService;

    public LoadController(LoadOrchestratorService orchestratorService, LoadStatusService statusService) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
    }

    @PostMapping("/jobs/load-issuer")
    public LoadResponse loadIssuer(@RequestBody(required = false) LoadRequest request) {
        return loadOne(RecordType.ISSUER, request);
    }

    @PostMapping("/jobs/load-issue")
    public LoadResponse loadIssue(@RequestBody(required = false) LoadRequest request) {
        return loadOne(RecordType.ISSUE, request);
    }

    @PostMapping("/jobs/load-issue-attr")
    public LoadResponse loadIssueAttributes(@RequestBody(required = false) LoadRequest request) {
        return loadOne(RecordType.ISSUE_ATTRIBUTE, request);
    }

    @PostMapping("/jobs/load/{recordType}")
    public LoadResponse loadRecordType(
        @PathVariable("recordType") String recordType,
        @RequestBody(required = false) LoadRequest request
    ) {
        return loadOne(RecordType.fromApiName(recordType), request);
    }

    @PostMapping("/jobs/load-all")
    public LoadResponse loadAll(@RequestBody(required = false) LoadRequest request) {
        LocalDate date = resolveDate(request);
        List<LoadResult> results = orchestratorService.loadAll(date);
        return LoadResponse.forRun(date, results);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return statusService.health();
    }

    @GetMapping("/ready")
    public Map<String, String> ready() {
        return statusService.readiness();
    }

    @GetMapping("/live")
    public Map<String, String> live() {
        return Map.of("status", "alive");
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.status();
    }

    private LoadResponse loadOne(RecordType recordType, LoadRequest request) {
        LocalDate date = resolveDate(request);
        LoadResult result = orchestratorService.loadRecordType(recordType, date);
        return LoadResponse.forRecordType(recordType, date, result);
    }

    private LocalDate resolveDate(LoadRequest request) {
        return request == null ? LocalDate.now() : request.dateOrToday();
    }
}
