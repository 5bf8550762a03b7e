package com.countrycache.domain.model;

import lombok.Value;

/**
 * Country as reported by the country data source, before reconciliation
 */
@Value
public class RawCountry {
    String name;
    String capital;
    String region;
    long population;
    String currencyCode;  // null if the country reports no currency
    String flagUrl;
}
