package com.scratchsync.infrastructure.config;

import com.scratchsync.application.usecase.CatalogRunSettings;
import com.scratchsync.application.usecase.HostingOptions;
import com.scratchsync.domain.ports.AssetFetcher;
import com.scratchsync.domain.ports.ManifestStore;
import com.scratchsync.domain.ports.SnapshotStore;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.domain.service.ContentAddresser;
import com.scratchsync.domain.service.ContentClassifier;
import com.scratchsync.domain.service.GuardMode;
import com.scratchsync.domain.service.SnapshotReconciler;
import com.scratchsync.infrastructure.fetch.FetchSettings;
import com.scratchsync.infrastructure.fetch.HttpAssetFetcher;
import com.scratchsync.infrastructure.fetch.PlaywrightBrowserFetcher;
import com.scratchsync.infrastructure.fetch.ResilientAssetFetcher;
import com.scratchsync.infrastructure.fetch.UpstreamHeaderProfiles;
import com.scratchsync.infrastructure.persistence.FileSnapshotStore;
import com.scratchsync.infrastructure.persistence.JsonManifestStore;
import com.scratchsync.infrastructure.storage.StorageConfigResolver;
import com.scratchsync.infrastructure.storage.StorageProviderConfig;
import com.scratchsync.infrastructure.storage.StorageProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wiring of the ingestion pipeline: fetchers, storage, stores and run switches.
 */
@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Value("${catalog.output-dir:public/data}")
    private String outputDir;

    @Bean
    public HostingOptions hostingOptions(
            @Value("${ingestion.concurrency:6}") int concurrency,
            @Value("${ingestion.dry-run:false}") boolean dryRun,
            @Value("${ingestion.rehost-all:false}") boolean rehostAll,
            @Value("${ingestion.only-missing:true}") boolean onlyMissing,
            @Value("${ingestion.allow-localhost:false}") boolean allowLocalhost,
            @Value("${ingestion.upstream-hosts:}") String upstreamHosts) {
        HostingOptions options = new HostingOptions(concurrency, dryRun, rehostAll, onlyMissing,
            allowLocalhost, splitList(upstreamHosts));
        logger.info("Hosting options: {}", options);
        return options;
    }

    @Bean
    public CatalogRunSettings catalogRunSettings(
            HostingOptions hostingOptions,
            @Value("${catalog.manifest.remote-mirror:false}") boolean remoteMirror,
            @Value("${catalog.guard.min-coverage:0.5}") double minCoverage,
            @Value("${reconcile.fail-on-guard:false}") boolean failOnGuard) {
        return new CatalogRunSettings(hostingOptions.dryRun(), remoteMirror, minCoverage, failOnGuard);
    }

    @Bean
    public FetchSettings fetchSettings(
            @Value("${fetch.max-attempts:3}") int maxAttempts,
            @Value("${fetch.base-delay-ms:250}") long baseDelayMs,
            @Value("${fetch.jitter-ms:100}") long jitterMs,
            @Value("${fetch.timeout-ms:10000}") int timeoutMs,
            @Value("${fetch.browser-timeout-ms:30000}") int browserTimeoutMs) {
        return new FetchSettings(maxAttempts, baseDelayMs, jitterMs, timeoutMs, browserTimeoutMs);
    }

    @Bean
    public UpstreamHeaderProfiles upstreamHeaderProfiles(@Value("${fetch.referers:}") String referers) {
        Map<String, String> extra = new LinkedHashMap<>();
        for (String pair : splitList(referers)) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                extra.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            } else {
                logger.warn("Ignoring malformed fetch.referers entry '{}'", pair);
            }
        }
        return new UpstreamHeaderProfiles(extra);
    }

    @Bean
    public HttpAssetFetcher httpAssetFetcher(FetchSettings fetchSettings) {
        return new HttpAssetFetcher(fetchSettings);
    }

    @Bean
    @ConditionalOnProperty(name = "fetch.browser-fallback.enabled", havingValue = "true", matchIfMissing = true)
    public PlaywrightBrowserFetcher playwrightBrowserFetcher(FetchSettings fetchSettings, HostingOptions hostingOptions) {
        return new PlaywrightBrowserFetcher(hostingOptions.concurrency(), fetchSettings.browserTimeoutMs());
    }

    @Bean
    @Primary
    public AssetFetcher assetFetcher(HttpAssetFetcher direct,
                                     ObjectProvider<PlaywrightBrowserFetcher> browser,
                                     UpstreamHeaderProfiles headerProfiles) {
        return new ResilientAssetFetcher(direct, browser.getIfAvailable(), headerProfiles);
    }

    @Bean
    public ContentClassifier contentClassifier() {
        return new ContentClassifier();
    }

    @Bean
    public ContentAddresser contentAddresser() {
        return new ContentAddresser();
    }

    @Bean
    public SnapshotReconciler snapshotReconciler(@Value("${reconcile.guard-mode:RECORD_COUNT}") GuardMode guardMode) {
        return new SnapshotReconciler(guardMode);
    }

    @Bean
    public StorageProviderConfig storageProviderConfig(Environment environment) {
        Map<String, String> env = new LinkedHashMap<>();
        for (String key : StorageConfigResolver.KEYS) {
            String value = environment.getProperty(key);
            if (value != null) {
                env.put(key, value);
            }
        }
        StorageProviderConfig config = StorageConfigResolver.resolve(env);
        logger.info("Storage configuration: {}", config);
        return config;
    }

    @Bean
    public StorageProvider storageProvider(StorageProviderConfig config, HostingOptions hostingOptions) {
        return StorageProviderFactory.create(config, hostingOptions.dryRun());
    }

    @Bean
    public ManifestStore manifestStore() {
        return new JsonManifestStore(Path.of(outputDir));
    }

    @Bean
    public SnapshotStore snapshotStore() {
        return new FileSnapshotStore(Path.of(outputDir));
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
