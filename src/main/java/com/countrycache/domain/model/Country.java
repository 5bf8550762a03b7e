package com.countrycache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Country entity - one cached country enriched with its exchange rate.
 * Identified by name (natural key).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Country {

    /** Decimal places kept for exchange rates, in memory and in storage */
    public static final int EXCHANGE_RATE_SCALE = 12;

    private String name;                    // Unique natural key
    private String capital;
    private String region;
    private Long population;
    private String currencyCode;            // First currency reported by the country source
    private BigDecimal exchangeRate;        // Units of currency per USD, null when not quoted
    private BigDecimal estimatedGdp;        // Derived from population and exchangeRate
    private String flagUrl;
    private LocalDateTime lastRefreshedAt;  // UTC, identical for every record of one refresh

    public boolean hasExchangeRate() {
        return exchangeRate != null;
    }
}
