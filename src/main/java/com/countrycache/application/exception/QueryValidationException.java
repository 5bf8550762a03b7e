package com.countrycache.application.exception;

import lombok.Getter;

import java.util.List;

/**
 * Listing parameters that cannot be turned into a query
 */
@Getter
public class QueryValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public QueryValidationException(List<String> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }
}
