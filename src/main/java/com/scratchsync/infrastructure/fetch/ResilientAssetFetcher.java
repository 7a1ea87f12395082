package com.scratchsync.infrastructure.fetch;

import com.scratchsync.domain.exception.FetchException;
import com.scratchsync.domain.model.FetchedContent;
import com.scratchsync.domain.ports.AssetFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Two-tier fetcher: direct HTTP first, headless browser when the direct tier fails or
 * answers with HTML or no content type.
 */
public class ResilientAssetFetcher implements AssetFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ResilientAssetFetcher.class);

    private final AssetFetcher direct;
    private final AssetFetcher browser;
    private final UpstreamHeaderProfiles headerProfiles;

    /**
     * @param browser fallback tier, or null to disable it
     */
    public ResilientAssetFetcher(AssetFetcher direct, AssetFetcher browser, UpstreamHeaderProfiles headerProfiles) {
        this.direct = direct;
        this.browser = browser;
        this.headerProfiles = headerProfiles;
    }

    @Override
    public FetchedContent fetch(String url, Map<String, String> headers) throws FetchException {
        Map<String, String> requestHeaders = new LinkedHashMap<>(headerProfiles.headersFor(url));
        if (headers != null) {
            requestHeaders.putAll(headers);
        }

        FetchException directFailure;
        try {
            FetchedContent content = direct.fetch(url, requestHeaders);
            if (!needsBrowser(content.declaredContentType()) || browser == null) {
                return content;
            }
            logger.debug("Direct fetch of {} returned content-type '{}', escalating to browser",
                url, content.declaredContentType());
            directFailure = null;
        } catch (FetchException e) {
            if (browser == null) {
                throw e;
            }
            logger.debug("Direct fetch of {} failed, escalating to browser: {}", url, e.getMessage());
            directFailure = e;
        }

        try {
            return browser.fetch(url, requestHeaders);
        } catch (FetchException e) {
            if (directFailure != null) {
                e.addSuppressed(directFailure);
            }
            throw e;
        }
    }

    static boolean needsBrowser(String declaredContentType) {
        if (declaredContentType == null) {
            return true;
        }
        String type = declaredContentType.trim().toLowerCase(Locale.ROOT);
        return type.isEmpty() || type.startsWith("text/html");
    }
}
