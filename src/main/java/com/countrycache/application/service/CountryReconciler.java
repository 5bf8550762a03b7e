package com.countrycache.application.service;

import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.RawCountry;
import com.countrycache.domain.model.RawRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Joins raw countries with raw rates by currency code (case-insensitive)
 * and derives the GDP estimate.
 * Countries without a matching rate are kept with null rate and null GDP.
 * When a name repeats, the last occurrence wins.
 */
@Slf4j
@RequiredArgsConstructor
public class CountryReconciler {

    private final GdpEstimator gdpEstimator;

    public List<Country> reconcile(List<RawCountry> rawCountries, List<RawRate> rawRates) {
        Map<String, BigDecimal> ratesByCode = indexRates(rawRates);
        Map<String, Country> candidates = new LinkedHashMap<>();

        for (RawCountry raw : rawCountries) {
            BigDecimal rate = lookupRate(ratesByCode, raw.getCurrencyCode());
            Country candidate = Country.builder()
                    .name(raw.getName())
                    .capital(raw.getCapital())
                    .region(raw.getRegion())
                    .population(raw.getPopulation())
                    .currencyCode(raw.getCurrencyCode())
                    .exchangeRate(rate)
                    .estimatedGdp(gdpEstimator.estimate(raw.getPopulation(), rate))
                    .flagUrl(raw.getFlagUrl())
                    .build();

            if (candidates.put(raw.getName(), candidate) != null) {
                log.debug("Duplicate country {} in source data, keeping last occurrence", raw.getName());
            }
        }

        long withoutRate = candidates.values().stream().filter(c -> !c.hasExchangeRate()).count();
        log.info("Reconciled {} countries with {} rates ({} without a matching rate)",
                candidates.size(), ratesByCode.size(), withoutRate);
        return new ArrayList<>(candidates.values());
    }

    private Map<String, BigDecimal> indexRates(List<RawRate> rawRates) {
        Map<String, BigDecimal> index = new HashMap<>();
        for (RawRate rate : rawRates) {
            index.put(normalize(rate.getCurrencyCode()), rate.getRate());
        }
        return index;
    }

    private BigDecimal lookupRate(Map<String, BigDecimal> ratesByCode, String currencyCode) {
        if (currencyCode == null || currencyCode.isBlank()) {
            return null;
        }
        BigDecimal rate = ratesByCode.get(normalize(currencyCode));
        if (rate == null || rate.scale() <= Country.EXCHANGE_RATE_SCALE) {
            return rate;
        }
        // GDP is derived from the rate as stored
        return rate.setScale(Country.EXCHANGE_RATE_SCALE, RoundingMode.HALF_UP);
    }

    private static String normalize(String currencyCode) {
        return currencyCode.trim().toUpperCase(Locale.ROOT);
    }
}
