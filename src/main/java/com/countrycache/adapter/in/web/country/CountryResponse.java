package com.countrycache.adapter.in.web.country;

import com.countrycache.domain.model.Country;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * DTO for a country as returned by the API
 */
public record CountryResponse(
        @JsonProperty("name") String name,
        @JsonProperty("capital") String capital,
        @JsonProperty("region") String region,
        @JsonProperty("population") Long population,
        @JsonProperty("currency_code") String currencyCode,
        @JsonProperty("exchange_rate") BigDecimal exchangeRate,
        @JsonProperty("estimated_gdp") BigDecimal estimatedGdp,
        @JsonProperty("flag_url") String flagUrl,
        @JsonProperty("last_refreshed_at") String lastRefreshedAt
) {
    public static CountryResponse from(Country country) {
        return new CountryResponse(
                country.getName(),
                country.getCapital(),
                country.getRegion(),
                country.getPopulation(),
                country.getCurrencyCode(),
                country.getExchangeRate(),
                country.getEstimatedGdp(),
                country.getFlagUrl(),
                formatTimestamp(country.getLastRefreshedAt())
        );
    }

    /**
     * ISO-8601 in UTC, e.g. 2025-10-22T18:00:00Z
     */
    public static String formatTimestamp(LocalDateTime timestamp) {
        if (timestamp == null) {
            return null;
        }
        return timestamp.atOffset(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
