package com.countrycache.adapter.out.image;

import io.vertx.core.Future;
import io.vertx.ext.web.client.WebClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Downloads flag images for the summary. A flag that cannot be fetched yields null
 * so the summary still renders.
 */
@Slf4j
@RequiredArgsConstructor
public class FlagImageLoader {

    private final WebClient webClient;
    private final long timeoutMs;

    public Future<byte[]> load(String flagUrl) {
        if (flagUrl == null || flagUrl.isBlank()) {
            return Future.succeededFuture(null);
        }
        try {
            return webClient.getAbs(flagUrl)
                    .timeout(timeoutMs)
                    .send()
                    .map(response -> {
                        if (response.statusCode() != 200 || response.body() == null) {
                            log.warn("Failed to fetch flag {}: HTTP {}", flagUrl, response.statusCode());
                            return (byte[]) null;
                        }
                        return response.body().getBytes();
                    })
                    .recover(error -> {
                        log.warn("Failed to fetch flag {}: {}", flagUrl, error.getMessage());
                        return Future.succeededFuture(null);
                    });
        } catch (RuntimeException e) {
            log.warn("Invalid flag URL {}: {}", flagUrl, e.getMessage());
            return Future.succeededFuture(null);
        }
    }

    /**
     * Load every flag concurrently, preserving order
     */
    public Future<List<byte[]>> loadAll(List<String> flagUrls) {
        List<Future<byte[]>> loads = flagUrls.stream().map(this::load).collect(Collectors.toList());
        return Future.all(loads)
                .map(all -> loads.stream().map(Future::result).collect(Collectors.toList()));
    }
}
