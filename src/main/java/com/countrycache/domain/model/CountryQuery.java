package com.countrycache.domain.model;

/**
 * Read-side criteria for listing countries.
 * Region and currency match case-insensitively; null means no filter.
 */
public record CountryQuery(
        String region,
        String currencyCode,
        CountrySortField sortField,
        boolean descending,
        Integer limit,
        int offset
) {

    public static CountryQuery all() {
        return new CountryQuery(null, null, CountrySortField.NAME, false, null, 0);
    }

    public boolean matches(Country country) {
        if (region != null && !region.equalsIgnoreCase(country.getRegion())) {
            return false;
        }
        return currencyCode == null || currencyCode.equalsIgnoreCase(country.getCurrencyCode());
    }
}
