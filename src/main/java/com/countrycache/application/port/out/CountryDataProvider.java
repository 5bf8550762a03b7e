package com.countrycache.application.port.out;

import com.countrycache.domain.model.RawCountry;
import io.vertx.core.Future;

import java.util.List;

/**
 * Output port for fetching country metadata from an external source
 */
public interface CountryDataProvider {

    /**
     * Fetch every country the source knows about
     * @return Future with the complete list, or failed with a SourceException
     */
    Future<List<RawCountry>> fetchCountries();
}
