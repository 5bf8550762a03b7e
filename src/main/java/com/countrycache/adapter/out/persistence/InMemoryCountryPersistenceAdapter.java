package com.countrycache.adapter.out.persistence;

import com.countrycache.application.port.out.CountryRepository;
import com.countrycache.domain.model.CacheStatus;
import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.CountryQuery;
import com.countrycache.domain.model.CountrySortField;
import com.countrycache.domain.model.RefreshPlan;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of CountryRepository.
 * A bulk write builds a new snapshot and swaps it in, so readers never see a partial refresh.
 */
@Slf4j
public class InMemoryCountryPersistenceAdapter implements CountryRepository {

    private TreeMap<String, Country> countries = new TreeMap<>();
    private LocalDateTime lastRefreshedAt;

    @Override
    public synchronized Future<Set<String>> findAllNames() {
        return Future.succeededFuture(new LinkedHashSet<>(countries.keySet()));
    }

    @Override
    public Future<List<Country>> findAll() {
        return find(CountryQuery.all());
    }

    @Override
    public synchronized Future<List<Country>> find(CountryQuery query) {
        Stream<Country> matching = countries.values().stream()
                .filter(query::matches)
                .sorted(comparator(query.sortField(), query.descending()))
                .skip(query.offset());
        if (query.limit() != null) {
            matching = matching.limit(query.limit());
        }
        return Future.succeededFuture(matching.map(this::copy).collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<Optional<Country>> findByName(String name) {
        return Future.succeededFuture(Optional.ofNullable(countries.get(name)).map(this::copy));
    }

    @Override
    public synchronized Future<Boolean> deleteByName(String name) {
        return Future.succeededFuture(countries.remove(name) != null);
    }

    @Override
    public synchronized Future<CacheStatus> getCacheStatus() {
        return Future.succeededFuture(new CacheStatus(countries.size(), lastRefreshedAt));
    }

    @Override
    public synchronized Future<Integer> saveAll(RefreshPlan plan, LocalDateTime refreshedAt) {
        TreeMap<String, Country> next = new TreeMap<>(countries);
        Stream.concat(plan.getInserts().stream(), plan.getUpdates().stream())
                .forEach(country -> next.put(country.getName(),
                        country.toBuilder().lastRefreshedAt(refreshedAt).build()));

        countries = next;
        lastRefreshedAt = refreshedAt;
        log.info("Stored {} countries in memory", plan.total());
        return Future.succeededFuture(plan.total());
    }

    private Country copy(Country country) {
        return country.toBuilder().build();
    }

    private static Comparator<Country> comparator(CountrySortField field, boolean descending) {
        Comparator<Country> byField;
        switch (field) {
            case POPULATION:
                byField = nullsLast(Country::getPopulation, descending);
                break;
            case ESTIMATED_GDP:
                byField = nullsLast(Country::getEstimatedGdp, descending);
                break;
            case EXCHANGE_RATE:
                byField = nullsLast(Country::getExchangeRate, descending);
                break;
            case NAME:
            default:
                byField = nullsLast(Country::getName, descending);
                break;
        }
        return byField.thenComparing(Country::getName);
    }

    private static <T extends Comparable<? super T>> Comparator<Country> nullsLast(
            Function<Country, T> key, boolean descending) {
        Comparator<T> order = descending ? Comparator.<T>reverseOrder() : Comparator.<T>naturalOrder();
        return Comparator.comparing(key, Comparator.nullsLast(order));
    }
}
