package com.countrycache.application.port.out;

import com.countrycache.domain.model.CacheStatus;
import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.CountryQuery;
import com.countrycache.domain.model.RefreshPlan;
import io.vertx.core.Future;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Output port for country persistence.
 * Failures are reported as {@link com.countrycache.application.exception.StorageException}.
 */
public interface CountryRepository {

    /**
     * Names of every stored country
     */
    Future<Set<String>> findAllNames();

    /**
     * Every stored country, ordered by name
     */
    Future<List<Country>> findAll();

    /**
     * Stored countries matching the query, ordered and paged as requested
     */
    Future<List<Country>> find(CountryQuery query);

    Future<Optional<Country>> findByName(String name);

    /**
     * @return Future with true if a country was removed
     */
    Future<Boolean> deleteByName(String name);

    Future<CacheStatus> getCacheStatus();

    /**
     * Apply all inserts and updates of the plan in one transaction, stamping every
     * written record and the cache status with {@code refreshedAt}.
     * Either everything lands or nothing does.
     * @return Future with the number of records written
     */
    Future<Integer> saveAll(RefreshPlan plan, LocalDateTime refreshedAt);
}
