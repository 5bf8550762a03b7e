package com.countrycache.domain.model;

/**
 * Fields a country listing can be ordered by
 */
public enum CountrySortField {
    NAME("name"),
    POPULATION("population"),
    ESTIMATED_GDP("estimated_gdp"),
    EXCHANGE_RATE("exchange_rate");

    private final String value;

    CountrySortField(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CountrySortField fromValue(String value) {
        for (CountrySortField field : values()) {
            if (field.value.equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown ordering field: " + value);
    }

    public static boolean isValid(String value) {
        for (CountrySortField field : values()) {
            if (field.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
