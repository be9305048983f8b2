package com.cusip.refdata.load.service;

import com.cusip.refdata.load.model.HealthResponse;
import com.cusip.refdata.load.model.StatusResponse;
import com.cusip.refdata.load.persistence.MasterJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class LoadStatusService {
    private static final Logger log = LoggerFactory.getLogger(LoadStatusService.class);
    private static final String DEFAULT_VERSION = "0.1.0";

    private final MasterJdbcRepository repository;
    private final LoadOrchestratorService orchestratorService;

    public LoadStatusService(MasterJdbcRepository repository, LoadOrchestratorService orchestratorService) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
    }

    public HealthResponse health() {
        boolean connected = isDbReachable();
        return new HealthResponse(
            connected ? "healthy" : "unhealthy",
            connected ? "connected" : "disconnected",
            version()
        );
    }

    public Map<String, String> readiness() {
        Map<String, String> body = new LinkedHashMap<>();
        try {
            body.put("status", repository.isDbReachable() ? "ready" : "not ready");
        } catch (Exception e) {
            body.put("status", "not ready");
            body.put("reason", e.getMessage());
        }
        return body;
    }

    public StatusResponse status() {
        if (!isDbReachable()) {
            return new StatusResponse(false, new LinkedHashMap<>(), orchestratorService.isRunning());
        }
        return new StatusResponse(true, repository.tableCounts(), orchestratorService.isRunning());
    }

    private boolean isDbReachable() {
        try {
            return repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private String version() {
        String version = LoadStatusService.class.getPackage().getImplementationVersion();
        return version == null ? DEFAULT_VERSION : version;
    }
}
