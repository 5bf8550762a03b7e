package com.countrycache.application.port.in;

import com.countrycache.domain.model.CacheStatus;
import com.countrycache.domain.model.Country;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

import java.util.List;
import java.util.Optional;

/**
 * Input port for reading and deleting cached countries
 */
public interface CountryQueryUseCase {

    /**
     * List countries filtered, ordered and paged by the raw request parameters
     * @return Future failed with QueryValidationException if a parameter is invalid
     */
    Future<List<Country>> listCountries(CountryListCommand command);

    /**
     * @return Future failed with CountryNotFoundException if no country has this name
     */
    Future<Country> getCountry(String name);

    /**
     * @return Future failed with CountryNotFoundException if no country has this name
     */
    Future<Void> deleteCountry(String name);

    Future<CacheStatus> getStatus();

    Future<Optional<Buffer>> getSummaryImage();

    /**
     * Raw listing parameters as received from the caller
     */
    record CountryListCommand(
            String region,
            String currency,
            String ordering,
            String limit,
            String offset
    ) {
        public static CountryListCommand empty() {
            return new CountryListCommand(null, null, null, null, null);
        }
    }
}
