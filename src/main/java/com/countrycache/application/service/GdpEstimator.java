package com.countrycache.application.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Estimates a country's GDP in USD from its population and exchange rate:
 * population x per-capita multiplier / rate.
 */
public class GdpEstimator {

    public static final BigDecimal DEFAULT_MULTIPLIER = new BigDecimal("1500");

    private final BigDecimal perCapitaMultiplier;

    public GdpEstimator() {
        this(DEFAULT_MULTIPLIER);
    }

    public GdpEstimator(BigDecimal perCapitaMultiplier) {
        if (perCapitaMultiplier == null || perCapitaMultiplier.signum() <= 0) {
            throw new IllegalArgumentException("Per-capita multiplier must be positive: " + perCapitaMultiplier);
        }
        this.perCapitaMultiplier = perCapitaMultiplier;
    }

    /**
     * @return the estimate rounded to cents, or null when population is not positive
     *         or the rate is missing or not positive
     */
    public BigDecimal estimate(Long population, BigDecimal exchangeRate) {
        if (population == null || population <= 0) {
            return null;
        }
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            return null;
        }
        return BigDecimal.valueOf(population)
                .multiply(perCapitaMultiplier)
                .divide(exchangeRate, 2, RoundingMode.HALF_UP);
    }
}
