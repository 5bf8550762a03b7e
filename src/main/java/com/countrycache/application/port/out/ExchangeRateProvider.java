package com.countrycache.application.port.out;

import com.countrycache.domain.model.RawRate;
import io.vertx.core.Future;

import java.util.List;

/**
 * Output port for fetching exchange rates from an external source
 */
public interface ExchangeRateProvider {

    /**
     * Fetch current exchange rates
     * @return Future with one rate per currency (relative to USD), or failed with a SourceException
     */
    Future<List<RawRate>> fetchRates();
}
