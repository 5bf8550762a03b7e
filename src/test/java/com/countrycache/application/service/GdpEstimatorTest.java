package com.countrycache.application.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GdpEstimator
 */
class GdpEstimatorTest {

    private final GdpEstimator estimator = new GdpEstimator();

    @Test
    void estimate_shouldDividePopulationTimesMultiplierByRate() {
        // 1000 * 1500 / 2.0
        assertEquals(new BigDecimal("750000.00"), estimator.estimate(1000L, new BigDecimal("2.0")));
    }

    @Test
    void estimate_shouldRoundToCents() {
        // 10 * 1500 / 3 = 5000
        assertEquals(new BigDecimal("5000.00"), estimator.estimate(10L, new BigDecimal("3")));
        // 1 * 1500 / 7 = 214.2857...
        assertEquals(new BigDecimal("214.29"), estimator.estimate(1L, new BigDecimal("7")));
    }

    @Test
    void estimate_shouldBeNullWithoutRate() {
        assertNull(estimator.estimate(1000L, null));
    }

    @Test
    void estimate_shouldBeNullForZeroOrNegativeRate() {
        assertNull(estimator.estimate(1000L, BigDecimal.ZERO));
        assertNull(estimator.estimate(1000L, new BigDecimal("-1.5")));
    }

    @Test
    void estimate_shouldBeNullForZeroPopulation() {
        assertNull(estimator.estimate(0L, new BigDecimal("2.0")));
        assertNull(estimator.estimate(null, new BigDecimal("2.0")));
    }

    @Test
    void estimate_shouldBeDeterministic() {
        BigDecimal first = estimator.estimate(206139589L, new BigDecimal("1600.23"));
        BigDecimal second = estimator.estimate(206139589L, new BigDecimal("1600.23"));
        assertEquals(first, second);
        assertTrue(first.signum() > 0);
    }

    @Test
    void constructor_shouldRejectNonPositiveMultiplier() {
        assertThrows(IllegalArgumentException.class, () -> new GdpEstimator(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new GdpEstimator(null));
    }
}
