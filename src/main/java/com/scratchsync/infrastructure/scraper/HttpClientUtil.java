package com.scratchsync.infrastructure.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Utility for fetching JSON listings from upstream catalog endpoints.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final Timeout TIMEOUT = Timeout.ofSeconds(30);

    private HttpClientUtil() {
    }

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * Makes a GET request and returns the response as JsonNode.
     *
     * A response declaring a non-JSON content type is an error; a missing content type is parsed anyway.
     */
    public static JsonNode getJson(String url, Map<String, String> headers) throws IOException {
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(TIMEOUT)
            .setResponseTimeout(TIMEOUT)
            .build();
        try (CloseableHttpClient httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build()) {
            HttpGet request = new HttpGet(url);
            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String contentType = entity != null ? entity.getContentType() : null;

                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("HTTP request to {} failed with status {}", url, statusCode);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }
                if (contentType != null && !contentType.isEmpty() && !isJson(contentType)) {
                    logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Expected JSON response but received: " + contentType);
                }

                try {
                    return objectMapper.readTree(responseBody);
                } catch (JsonProcessingException e) {
                    logger.error("Failed to parse JSON. URL: {}", url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
                }
            }
        }
    }

    static boolean isJson(String contentType) {
        String type = contentType.toLowerCase();
        int semi = type.indexOf(';');
        String base = (semi >= 0 ? type.substring(0, semi) : type).trim();
        return base.equals("application/json") || base.endsWith("+json");
    }
}
