package com.countrycache.application.service;

import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.RawCountry;
import com.countrycache.domain.model.RawRate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CountryReconciler
 */
class CountryReconcilerTest {

    private CountryReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new CountryReconciler(new GdpEstimator());
    }

    @Test
    void reconcile_shouldAttachRateAndEstimateGdp() {
        List<Country> result = reconciler.reconcile(
                List.of(raw("Testland", 1000, "TST")),
                List.of(new RawRate("TST", new BigDecimal("2.0"))));

        assertEquals(1, result.size());
        Country country = result.get(0);
        assertEquals("Testland", country.getName());
        assertEquals("Test City", country.getCapital());
        assertEquals("Testregion", country.getRegion());
        assertEquals(1000L, country.getPopulation());
        assertEquals("TST", country.getCurrencyCode());
        assertEquals(new BigDecimal("2.0"), country.getExchangeRate());
        assertEquals(new BigDecimal("750000.00"), country.getEstimatedGdp());
        assertEquals("https://flags.example/testland.png", country.getFlagUrl());
        assertNull(country.getLastRefreshedAt());
    }

    @Test
    void reconcile_shouldMatchCurrencyCodeCaseInsensitively() {
        List<Country> result = reconciler.reconcile(
                List.of(raw("Lowerland", 10, "ngn")),
                List.of(new RawRate("NGN", new BigDecimal("1500"))));

        assertEquals(new BigDecimal("1500"), result.get(0).getExchangeRate());
        assertNotNull(result.get(0).getEstimatedGdp());
    }

    @Test
    void reconcile_shouldKeepCountryWithoutMatchingRate() {
        List<Country> result = reconciler.reconcile(
                List.of(raw("Nowhere", 5000, "XXX"), raw("Cashless", 5000, null)),
                List.of(new RawRate("USD", BigDecimal.ONE)));

        assertEquals(2, result.size());
        for (Country country : result) {
            assertNull(country.getExchangeRate());
            assertNull(country.getEstimatedGdp());
        }
        assertNull(result.get(1).getCurrencyCode());
    }

    @Test
    void reconcile_shouldNotEstimateGdpForZeroPopulation() {
        List<Country> result = reconciler.reconcile(
                List.of(raw("Empty Isle", 0, "USD")),
                List.of(new RawRate("USD", BigDecimal.ONE)));

        assertEquals(BigDecimal.ONE, result.get(0).getExchangeRate());
        assertNull(result.get(0).getEstimatedGdp());
    }

    @Test
    void reconcile_shouldKeepLastOccurrenceOfDuplicateName() {
        List<Country> result = reconciler.reconcile(
                List.of(raw("Twin", 100, "USD"), raw("Other", 1, "USD"), raw("Twin", 200, "USD")),
                List.of(new RawRate("USD", BigDecimal.ONE)));

        assertEquals(2, result.size());
        Country twin = result.stream().filter(c -> c.getName().equals("Twin")).findFirst().orElseThrow();
        assertEquals(200L, twin.getPopulation());
    }

    @Test
    void reconcile_shouldRoundRateToStoredScaleBeforeEstimatingGdp() {
        List<Country> result = reconciler.reconcile(
                List.of(raw("Tinyland", 1000, "TNY")),
                List.of(new RawRate("TNY", new BigDecimal("0.000012345678901234"))));

        Country tinyland = result.get(0);
        assertEquals(new BigDecimal("0.000012345679"), tinyland.getExchangeRate());
        assertEquals(new GdpEstimator().estimate(1000L, tinyland.getExchangeRate()), tinyland.getEstimatedGdp());
    }

    @Test
    void reconcile_shouldHandleEmptyInputs() {
        assertTrue(reconciler.reconcile(List.of(), List.of()).isEmpty());
    }

    private static RawCountry raw(String name, long population, String currencyCode) {
        return new RawCountry(name, "Test City", "Testregion", population, currencyCode,
                "https://flags.example/" + name.toLowerCase() + ".png");
    }
}
