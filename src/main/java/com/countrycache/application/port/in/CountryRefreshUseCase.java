package com.countrycache.application.port.in;

import com.countrycache.domain.model.RefreshOutcome;
import io.vertx.core.Future;

/**
 * Input port for refreshing the country cache from the external sources
 */
public interface CountryRefreshUseCase {

    /**
     * Fetch both sources, reconcile, write all records in one transaction and
     * regenerate the summary image. Calls made while a refresh is running
     * receive the result of that refresh.
     * @return Future with the outcome, or failed with SourceException / StorageException
     */
    Future<RefreshOutcome> refreshCountries();
}
