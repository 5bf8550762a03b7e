package com.countrycache.adapter.in.web.status;

import com.countrycache.adapter.in.web.country.CountryResponse;
import com.countrycache.domain.model.CacheStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for GET /status. last_refreshed_at is null until the first refresh.
 */
public record StatusResponse(
        @JsonProperty("total_countries") long totalCountries,
        @JsonProperty("last_refreshed_at") String lastRefreshedAt
) {
    public static StatusResponse from(CacheStatus status) {
        return new StatusResponse(status.getTotalCountries(),
                CountryResponse.formatTimestamp(status.getLastRefreshedAt()));
    }
}
