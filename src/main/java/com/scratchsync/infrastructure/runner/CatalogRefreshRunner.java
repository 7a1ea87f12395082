package com.scratchsync.infrastructure.runner;

import com.scratchsync.application.usecase.RefreshCatalogUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch mode: refreshes every catalog once at startup. The exit code is non-zero when a
 * catalog failed one of its run guards.
 */
@Component
@ConditionalOnProperty(name = "catalog.run-on-startup", havingValue = "true")
public class CatalogRefreshRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CatalogRefreshRunner.class);

    private final RefreshCatalogUseCase refreshCatalogUseCase;
    private volatile int exitCode;

    public CatalogRefreshRunner(RefreshCatalogUseCase refreshCatalogUseCase) {
        this.refreshCatalogUseCase = refreshCatalogUseCase;
    }

    @Override
    public void run(ApplicationArguments args) {
        RefreshCatalogUseCase.RefreshSummary summary = refreshCatalogUseCase.execute();
        for (RefreshCatalogUseCase.CatalogRunSummary catalog : summary.catalogs()) {
            if (catalog.isFatal()) {
                logger.error("[guard] {} failed: {}", catalog.catalog(), String.join("; ", catalog.fatal()));
            }
        }
        exitCode = summary.hasFatal() ? 1 : 0;
        logger.info("Catalog refresh finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
