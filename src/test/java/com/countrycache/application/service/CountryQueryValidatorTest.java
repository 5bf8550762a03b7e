package com.countrycache.application.service;

import com.countrycache.application.port.in.CountryQueryUseCase.CountryListCommand;
import com.countrycache.domain.model.CountryQuery;
import com.countrycache.domain.model.CountrySortField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CountryQueryValidator
 */
class CountryQueryValidatorTest {

    private CountryQueryValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CountryQueryValidator();
    }

    @Test
    void testEmptyCommandIsValid() {
        CountryListCommand command = CountryListCommand.empty();

        assertTrue(validator.validate(command).isValid());
        assertEquals(CountryQuery.all(), validator.toQuery(command));
    }

    @Test
    void testDescendingOrdering() {
        CountryListCommand command = new CountryListCommand("Africa", "NGN", "-estimated_gdp", "10", "5");

        assertTrue(validator.validate(command).isValid());
        CountryQuery query = validator.toQuery(command);
        assertEquals("Africa", query.region());
        assertEquals("NGN", query.currencyCode());
        assertEquals(CountrySortField.ESTIMATED_GDP, query.sortField());
        assertTrue(query.descending());
        assertEquals(10, query.limit());
        assertEquals(5, query.offset());
    }

    @Test
    void testAscendingOrdering() {
        CountryQuery query = validator.toQuery(new CountryListCommand(null, null, "population", null, null));

        assertEquals(CountrySortField.POPULATION, query.sortField());
        assertFalse(query.descending());
        assertNull(query.limit());
    }

    @Test
    void testBlankParametersAreIgnored() {
        CountryListCommand command = new CountryListCommand(" ", "", " ", "", null);

        assertTrue(validator.validate(command).isValid());
        CountryQuery query = validator.toQuery(command);
        assertNull(query.region());
        assertNull(query.currencyCode());
        assertEquals(CountrySortField.NAME, query.sortField());
    }

    @Test
    void testUnknownOrderingField() {
        ValidationResult result = validator.validate(new CountryListCommand(null, null, "-capital", null, null));

        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertEquals("ordering must be one of name, population, estimated_gdp, exchange_rate (optionally prefixed with -)",
                result.errors().get(0));
    }

    @Test
    void testInvalidPagination() {
        ValidationResult result = validator.validate(new CountryListCommand(null, null, null, "0", "-1"));

        assertFalse(result.isValid());
        assertEquals(2, result.errors().size());
    }

    @Test
    void testNonNumericLimit() {
        ValidationResult result = validator.validate(new CountryListCommand(null, null, null, "ten", null));

        assertFalse(result.isValid());
        assertFalse(result.errors().isEmpty());
    }
}
