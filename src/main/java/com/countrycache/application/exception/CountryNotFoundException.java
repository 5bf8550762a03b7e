package com.countrycache.application.exception;

import lombok.Getter;

@Getter
public class CountryNotFoundException extends RuntimeException {

    private final String name;

    public CountryNotFoundException(String name) {
        super("Country not found: " + name);
        this.name = name;
    }
}
