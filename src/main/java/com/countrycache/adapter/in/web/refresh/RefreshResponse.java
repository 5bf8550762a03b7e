package com.countrycache.adapter.in.web.refresh;

import com.countrycache.adapter.in.web.country.CountryResponse;
import com.countrycache.domain.model.RefreshOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a successful refresh
 */
public record RefreshResponse(
        @JsonProperty("status") String status,
        @JsonProperty("countries_processed") int countriesProcessed,
        @JsonProperty("last_refreshed_at") String lastRefreshedAt
) {
    public static RefreshResponse success(RefreshOutcome outcome) {
        return new RefreshResponse(
                "success",
                outcome.getCountriesProcessed(),
                CountryResponse.formatTimestamp(outcome.getRefreshedAt())
        );
    }
}
