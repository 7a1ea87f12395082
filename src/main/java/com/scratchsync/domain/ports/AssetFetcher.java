package com.scratchsync.domain.ports;

import com.scratchsync.domain.exception.FetchException;
import com.scratchsync.domain.model.FetchedContent;

import java.util.Map;

/**
 * Port for downloading upstream assets.
 */
public interface AssetFetcher {

    /**
     * Downloads a URL.
     *
     * @param url     Absolute http(s) URL
     * @param headers Extra request headers, overriding the defaults; may be empty
     * @return Body and declared content type
     * @throws FetchException when every attempt failed
     */
    FetchedContent fetch(String url, Map<String, String> headers) throws FetchException;

    default FetchedContent fetch(String url) throws FetchException {
        return fetch(url, Map.of());
    }
}
