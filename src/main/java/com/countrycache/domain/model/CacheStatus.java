package com.countrycache.domain.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Snapshot of the cache: how many countries are stored and when the last refresh committed
 */
@Value
public class CacheStatus {
    long totalCountries;
    LocalDateTime lastRefreshedAt;  // null before the first successful refresh
}
