package com.countrycache.application.service;

import com.countrycache.application.port.in.CountryQueryUseCase.CountryListCommand;
import com.countrycache.domain.model.CountrySortField;
import com.countrycache.domain.model.CountryQuery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validates listing parameters and converts them into a {@link CountryQuery}
 */
public class CountryQueryValidator {

    static final int MAX_LIMIT = 1000;

    private static final String SORT_FIELDS = Arrays.stream(CountrySortField.values())
            .map(CountrySortField::getValue)
            .collect(Collectors.joining(", "));

    public ValidationResult validate(CountryListCommand command) {
        List<String> errors = new ArrayList<>();

        validateOrdering(command.ordering(), errors);
        validateLimit(command.limit(), errors);
        validateOffset(command.offset(), errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    /**
     * Convert a command that passed {@link #validate}
     */
    public CountryQuery toQuery(CountryListCommand command) {
        CountrySortField sortField = CountrySortField.NAME;
        boolean descending = false;

        String ordering = trimToNull(command.ordering());
        if (ordering != null) {
            descending = ordering.startsWith("-");
            sortField = CountrySortField.fromValue(descending ? ordering.substring(1) : ordering);
        }

        String limit = trimToNull(command.limit());
        String offset = trimToNull(command.offset());

        return new CountryQuery(
                trimToNull(command.region()),
                trimToNull(command.currency()),
                sortField,
                descending,
                limit == null ? null : Integer.parseInt(limit),
                offset == null ? 0 : Integer.parseInt(offset)
        );
    }

    private void validateOrdering(String ordering, List<String> errors) {
        String value = trimToNull(ordering);
        if (value == null) {
            return;
        }
        String field = value.startsWith("-") ? value.substring(1) : value;
        if (!CountrySortField.isValid(field)) {
            errors.add("ordering must be one of " + SORT_FIELDS + " (optionally prefixed with -)");
        }
    }

    private void validateLimit(String limit, List<String> errors) {
        String value = trimToNull(limit);
        if (value == null) {
            return;
        }
        Integer parsed = parseInt(value);
        if (parsed == null || parsed < 1 || parsed > MAX_LIMIT) {
            errors.add("limit must be an integer between 1 and " + MAX_LIMIT);
        }
    }

    private void validateOffset(String offset, List<String> errors) {
        String value = trimToNull(offset);
        if (value == null) {
            return;
        }
        Integer parsed = parseInt(value);
        if (parsed == null || parsed < 0) {
            errors.add("offset must be a non-negative integer");
        }
    }

    private Integer parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }
}
