package com.countrycache.domain.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Result of a successful refresh. A failed refresh completes its future with
 * a {@code SourceException} or {@code StorageException} instead.
 */
@Value
public class RefreshOutcome {
    int inserted;
    int updated;
    LocalDateTime refreshedAt;

    public int getCountriesProcessed() {
        return inserted + updated;
    }
}
