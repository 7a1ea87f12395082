package com.scratchsync.infrastructure.fetch;

import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.RequestOptions;
import com.microsoft.playwright.options.WaitUntilState;
import com.scratchsync.domain.exception.FetchException;
import com.scratchsync.domain.model.FetchedContent;
import com.scratchsync.domain.model.ImageFormat;
import com.scratchsync.domain.ports.AssetFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;

/**
 * Downloads through headless Chromium, for upstreams that answer plain HTTP clients with an
 * HTML challenge page.
 *
 * Browsers live in a pool of at most {@code poolSize} slots, launched lazily. A Playwright
 * instance is not thread-safe, so every slot owns its own and is used by one thread at a time.
 */
public class PlaywrightBrowserFetcher implements AssetFetcher, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserFetcher.class);

    private static final List<String> BROWSER_ARGS = List.of("--no-sandbox", "--disable-dev-shm-usage");

    private final int timeoutMs;
    private final Semaphore permits;
    private final BlockingQueue<BrowserSlot> idle;
    private volatile boolean closed;

    public PlaywrightBrowserFetcher(int poolSize, int timeoutMs) {
        this.timeoutMs = timeoutMs;
        this.permits = new Semaphore(Math.max(1, poolSize));
        this.idle = new LinkedBlockingQueue<>();
    }

    @Override
    public FetchedContent fetch(String url, Map<String, String> headers) throws FetchException {
        if (closed) {
            throw new FetchException(url, "browser pool is closed");
        }
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "interrupted while waiting for a browser", e);
        }
        BrowserSlot slot = null;
        boolean healthy = true;
        try {
            slot = Optional.ofNullable(idle.poll()).orElseGet(BrowserSlot::launch);
            return fetchWith(slot.browser, url, headers);
        } catch (PlaywrightException e) {
            healthy = false;
            throw new FetchException(url, "browser fetch failed: " + firstLine(e.getMessage()), e);
        } finally {
            if (slot != null) {
                if (healthy && !closed) {
                    idle.offer(slot);
                } else {
                    slot.close();
                }
            }
            permits.release();
        }
    }

    private FetchedContent fetchWith(Browser browser, String url, Map<String, String> headers) throws FetchException {
        Map<String, String> extraHeaders = new LinkedHashMap<>(headers == null ? Map.of() : headers);
        String userAgent = extraHeaders.remove("User-Agent");

        try (BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(userAgent != null ? userAgent : UpstreamHeaderProfiles.USER_AGENT)
                .setExtraHTTPHeaders(extraHeaders))) {
            Page page = context.newPage();
            Response response = page.navigate(url, new Page.NavigateOptions()
                .setTimeout(timeoutMs)
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            if (response == null) {
                throw new FetchException(url, "browser got no response");
            }

            String contentType = lower(response.headerValue("content-type"));
            byte[] body;
            try {
                body = response.body();
            } catch (PlaywrightException e) {
                // navigation bodies are sometimes unavailable; the request API shares the context's cookies
                logger.debug("Navigation body unavailable for {}, re-fetching: {}", url, firstLine(e.getMessage()));
                APIResponse api = context.request().get(url, RequestOptions.create().setTimeout(timeoutMs));
                if (!api.ok()) {
                    throw new FetchException(url, "browser request got HTTP " + api.status());
                }
                body = api.body();
                String apiType = lower(api.headers().get("content-type"));
                contentType = apiType.isEmpty() ? contentType : apiType;
            }

            if (body == null || body.length == 0) {
                throw new FetchException(url, "browser got an empty body");
            }
            if (contentType.isEmpty() || contentType.startsWith("text/html")) {
                contentType = ImageFormat.sniff(body)
                    .map(ImageFormat::getContentType)
                    .orElseThrow(() -> new FetchException(url,
                        "browser got unexpected content-type " + describe(response) + " and bytes that are not PNG/JPEG"));
            }
            if (contentType.contains("image/webp")) {
                throw new FetchException(url, "unsupported content-type image/webp");
            }
            return new FetchedContent(body, contentType);
        }
    }

    @Override
    public void close() {
        closed = true;
        List<BrowserSlot> slots = new ArrayList<>();
        idle.drainTo(slots);
        slots.forEach(BrowserSlot::close);
        if (!slots.isEmpty()) {
            logger.info("Closed {} browser(s)", slots.size());
        }
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }

    private static String describe(Response response) {
        String type = response.headerValue("content-type");
        return type == null || type.isBlank() ? "(empty)" : type;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private static final class BrowserSlot {
        private final Playwright playwright;
        private final Browser browser;

        private BrowserSlot(Playwright playwright, Browser browser) {
            this.playwright = playwright;
            this.browser = browser;
        }

        static BrowserSlot launch() {
            Playwright playwright = Playwright.create();
            try {
                Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(true)
                    .setArgs(BROWSER_ARGS));
                logger.info("Launched headless browser");
                return new BrowserSlot(playwright, browser);
            } catch (PlaywrightException e) {
                playwright.close();
                throw e;
            }
        }

        void close() {
            try {
                browser.close();
            } catch (PlaywrightException e) {
                logger.debug("Browser close failed: {}", e.getMessage());
            }
            try {
                playwright.close();
            } catch (PlaywrightException e) {
                logger.debug("Playwright close failed: {}", e.getMessage());
            }
        }
    }
}
