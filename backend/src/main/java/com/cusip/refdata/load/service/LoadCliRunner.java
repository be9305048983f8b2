package com.cusip.refdata.load.service;

import com.cusip.refdata.config.LoaderProperties;
import com.cusip.refdata.load.model.LoadResult;
import com.cusip.refdata.load.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class LoadCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LoadCliRunner.class);

    private final LoaderProperties properties;
    private final LoadOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public LoadCliRunner(
        LoaderProperties properties,
        LoadOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        LocalDate date = resolveDate(properties.getCli().getDate());
        Set<RecordType> types = resolveTypes(properties.getCli().getTypes());
        log.info("Loading {} for {}", types, date);

        List<LoadResult> results = orchestratorService.load(types, date);
        for (LoadResult result : results) {
            log.info(
                "Summary {}: status={}, file={}, read={}, rejected={}, upserted={}, error={}",
                result.recordType().apiName(),
                result.status(),
                result.file(),
                result.rowsRead(),
                result.rowsRejected(),
                result.rowsUpserted(),
                result.error()
            );
        }
        boolean failed = results.stream().anyMatch(LoadResult::isFailed);

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> failed ? 1 : 0);
            System.exit(exitCode);
        }
    }

    static LocalDate resolveDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return LocalDate.now();
        }
        return LocalDate.parse(raw.trim());
    }

    static Set<RecordType> resolveTypes(String raw) {
        if (raw == null || raw.isBlank()) {
            return EnumSet.allOf(RecordType.class);
        }
        EnumSet<RecordType> types = EnumSet.noneOf(RecordType.class);
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .map(RecordType::fromApiName)
            .forEach(types::add);
        return types.isEmpty() ? EnumSet.allOf(RecordType.class) : types;
    }
}
