package com.countrycache.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Exchange rate as reported by the rate source
 */
@Value
public class RawRate {
    String currencyCode;
    BigDecimal rate;  // Units of currency per base currency (USD)
}
