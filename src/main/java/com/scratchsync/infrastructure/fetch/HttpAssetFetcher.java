package com.scratchsync.infrastructure.fetch;

import com.scratchsync.domain.exception.FetchException;
import com.scratchsync.domain.model.FetchedContent;
import com.scratchsync.domain.ports.AssetFetcher;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Direct HTTP download with retries and exponential backoff.
 *
 * Any 2xx response is returned as-is, whatever its content type; deciding whether the body
 * is an image is left to the caller.
 */
public class HttpAssetFetcher implements AssetFetcher, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HttpAssetFetcher.class);

    private final CloseableHttpClient httpClient;
    private final FetchSettings settings;

    public HttpAssetFetcher(FetchSettings settings) {
        this.settings = settings;
        Timeout timeout = Timeout.ofMilliseconds(settings.timeoutMs());
        this.httpClient = HttpClients.custom()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                    .setConnectTimeout(timeout)
                    .setSocketTimeout(timeout)
                    .build())
                .setMaxConnTotal(64)
                .setMaxConnPerRoute(16)
                .build())
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build())
            .build();
    }

    @Override
    public FetchedContent fetch(String url, Map<String, String> headers) throws FetchException {
        String lastError = "no attempt made";
        for (int attempt = 0; attempt < settings.maxAttempts(); attempt++) {
            try {
                return get(url, headers);
            } catch (HttpStatusException e) {
                lastError = "HTTP " + e.statusCode;
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
            }
            logger.debug("Attempt {}/{} for {} failed: {}", attempt + 1, settings.maxAttempts(), url, lastError);

            if (attempt < settings.maxAttempts() - 1) {
                sleepBeforeRetry(url, attempt);
            }
        }
        throw new FetchException(url, "download failed after " + settings.maxAttempts() + " attempts: " + lastError);
    }

    private FetchedContent get(String url, Map<String, String> headers) throws IOException {
        HttpGet request = new HttpGet(url);
        if (headers != null) {
            headers.forEach(request::setHeader);
        }

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            if (statusCode < 200 || statusCode >= 300) {
                EntityUtils.consume(entity);
                throw new HttpStatusException(statusCode);
            }
            String contentType = entity != null ? entity.getContentType() : null;
            if (contentType == null && response.getFirstHeader("Content-Type") != null) {
                contentType = response.getFirstHeader("Content-Type").getValue();
            }
            byte[] body = entity != null ? EntityUtils.toByteArray(entity) : new byte[0];
            return new FetchedContent(body, contentType);
        }
    }

    private void sleepBeforeRetry(String url, int attempt) throws FetchException {
        long jitter = settings.jitterMs() > 0 ? ThreadLocalRandom.current().nextLong(settings.jitterMs()) : 0;
        try {
            Thread.sleep(settings.backoffMillis(attempt, jitter));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "interrupted while waiting to retry", e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private static final class HttpStatusException extends IOException {
        private final int statusCode;

        HttpStatusException(int statusCode) {
            super("HTTP " + statusCode);
            this.statusCode = statusCode;
        }
    }
}
