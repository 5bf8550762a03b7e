package com.countrycache.adapter.out.persistence;

import com.countrycache.application.exception.StorageException;
import com.countrycache.application.port.out.CountryRepository;
import com.countrycache.domain.model.CacheStatus;
import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.CountryQuery;
import com.countrycache.domain.model.CountrySortField;
import com.countrycache.domain.model.RefreshPlan;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC implementation of CountryRepository.
 * Bulk writes run inside a single transaction.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcCountryPersistenceAdapter implements CountryRepository {

    private static final String COLUMNS = "NAME, CAPITAL, REGION, POPULATION, CURRENCY_CODE, " +
            "EXCHANGE_RATE, ESTIMATED_GDP, FLAG_URL, LAST_REFRESHED_AT";

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS COUNTRY (" +
                    "NAME VARCHAR(100) NOT NULL PRIMARY KEY, " +
                    "CAPITAL VARCHAR(100), " +
                    "REGION VARCHAR(100), " +
                    "POPULATION BIGINT NOT NULL, " +
                    "CURRENCY_CODE VARCHAR(10), " +
                    "EXCHANGE_RATE DECIMAL(30, " + Country.EXCHANGE_RATE_SCALE + "), " +
                    "ESTIMATED_GDP DECIMAL(38, 2), " +
                    "FLAG_URL VARCHAR(200), " +
                    "LAST_REFRESHED_AT TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS CACHE_STATUS (" +
                    "ID INT NOT NULL PRIMARY KEY, " +
                    "LAST_REFRESHED_AT TIMESTAMP)",
            // Widen columns of databases created with the narrower layout
            "ALTER TABLE COUNTRY ALTER COLUMN EXCHANGE_RATE SET DATA TYPE DECIMAL(30, " + Country.EXCHANGE_RATE_SCALE + ")",
            "ALTER TABLE COUNTRY ALTER COLUMN ESTIMATED_GDP SET DATA TYPE DECIMAL(38, 2)"
    );

    private final JDBCPool jdbcPool;

    /**
     * Create the tables if they do not exist yet
     */
    public Future<Void> initializeSchema() {
        Future<Void> future = Future.succeededFuture();
        for (String ddl : SCHEMA) {
            future = future.compose(v -> jdbcPool.query(ddl).execute().mapEmpty());
        }
        return future
                .onSuccess(v -> log.info("Country schema ready"))
                .onFailure(error -> log.error("Failed to create country schema: {}", error.getMessage()));
    }

    @Override
    public Future<Set<String>> findAllNames() {
        return jdbcPool.query("SELECT NAME FROM COUNTRY")
                .execute()
                .<Set<String>>map(rows -> {
                    Set<String> names = new LinkedHashSet<>();
                    rows.forEach(row -> names.add(row.getString("NAME")));
                    log.debug("Loaded {} existing country names", names.size());
                    return names;
                })
                .recover(error -> storageFailure("Could not read existing countries", error));
    }

    @Override
    public Future<List<Country>> findAll() {
        return find(CountryQuery.all());
    }

    @Override
    public Future<List<Country>> find(CountryQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM COUNTRY");
        List<Object> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();

        if (query.region() != null) {
            conditions.add("LOWER(REGION) = ?");
            params.add(query.region().toLowerCase(Locale.ROOT));
        }
        if (query.currencyCode() != null) {
            conditions.add("LOWER(CURRENCY_CODE) = ?");
            params.add(query.currencyCode().toLowerCase(Locale.ROOT));
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }

        sql.append(" ORDER BY ").append(column(query.sortField()))
                .append(query.descending() ? " DESC" : " ASC")
                .append(" NULLS LAST, NAME ASC");

        if (query.limit() != null) {
            sql.append(" LIMIT ? OFFSET ?");
            params.add(query.limit());
            params.add(query.offset());
        } else if (query.offset() > 0) {
            sql.append(" OFFSET ? ROWS");
            params.add(query.offset());
        }

        return jdbcPool.preparedQuery(sql.toString())
                .execute(Tuple.wrap(params))
                .<List<Country>>map(rows -> {
                    List<Country> countries = new ArrayList<>(rows.size());
                    rows.forEach(row -> countries.add(toCountry(row)));
                    return countries;
                })
                .recover(error -> storageFailure("Could not list countries", error));
    }

    @Override
    public Future<Optional<Country>> findByName(String name) {
        return jdbcPool.preparedQuery("SELECT " + COLUMNS + " FROM COUNTRY WHERE NAME = ?")
                .execute(Tuple.of(name))
                .<Optional<Country>>map(rows -> {
                    if (rows.size() > 0) {
                        return Optional.of(toCountry(rows.iterator().next()));
                    }
                    log.debug("No country found for {}", name);
                    return Optional.empty();
                })
                .recover(error -> storageFailure("Could not read country " + name, error));
    }

    @Override
    public Future<Boolean> deleteByName(String name) {
        return jdbcPool.preparedQuery("DELETE FROM COUNTRY WHERE NAME = ?")
                .execute(Tuple.of(name))
                .map(result -> result.rowCount() > 0)
                .recover(error -> storageFailure("Could not delete country " + name, error));
    }

    @Override
    public Future<CacheStatus> getCacheStatus() {
        return jdbcPool.query("SELECT COUNT(*) AS CNT FROM COUNTRY")
                .execute()
                .map(rows -> rows.iterator().next().getLong("CNT"))
                .compose(total -> jdbcPool.query("SELECT LAST_REFRESHED_AT FROM CACHE_STATUS WHERE ID = 1")
                        .execute()
                        .map(rows -> {
                            LocalDateTime lastRefreshedAt = rows.size() > 0
                                    ? rows.iterator().next().getLocalDateTime("LAST_REFRESHED_AT")
                                    : null;
                            return new CacheStatus(total, lastRefreshedAt);
                        }))
                .recover(error -> storageFailure("Could not read cache status", error));
    }

    @Override
    public Future<Integer> saveAll(RefreshPlan plan, LocalDateTime refreshedAt) {
        log.info("Saving {} countries ({} inserts, {} updates) in one transaction",
                plan.total(), plan.getInserts().size(), plan.getUpdates().size());

        return jdbcPool.withTransaction(connection -> insertAll(connection, plan.getInserts(), refreshedAt)
                        .compose(v -> updateAll(connection, plan.getUpdates(), refreshedAt))
                        .compose(v -> saveCacheStatus(connection, refreshedAt))
                        .map(v -> plan.total()))
                .onSuccess(count -> log.info("Committed {} countries", count))
                .recover(error -> storageFailure("Failed to save countries, transaction rolled back", error));
    }

    private Future<Void> insertAll(SqlConnection connection, List<Country> countries, LocalDateTime refreshedAt) {
        if (countries.isEmpty()) {
            return Future.succeededFuture();
        }
        String sql = "INSERT INTO COUNTRY (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        List<Tuple> batch = countries.stream()
                .map(country -> Tuple.of(
                        country.getName(),
                        country.getCapital(),
                        country.getRegion(),
                        country.getPopulation(),
                        country.getCurrencyCode(),
                        country.getExchangeRate(),
                        country.getEstimatedGdp(),
                        country.getFlagUrl(),
                        refreshedAt))
                .collect(Collectors.toList());

        return connection.preparedQuery(sql)
                .executeBatch(batch)
                .onSuccess(result -> log.debug("Inserted {} countries", countries.size()))
                .mapEmpty();
    }

    private Future<Void> updateAll(SqlConnection connection, List<Country> countries, LocalDateTime refreshedAt) {
        if (countries.isEmpty()) {
            return Future.succeededFuture();
        }
        String sql = "UPDATE COUNTRY SET CAPITAL = ?, REGION = ?, POPULATION = ?, CURRENCY_CODE = ?, " +
                "EXCHANGE_RATE = ?, ESTIMATED_GDP = ?, FLAG_URL = ?, LAST_REFRESHED_AT = ? WHERE NAME = ?";
        List<Tuple> batch = countries.stream()
                .map(country -> Tuple.of(
                        country.getCapital(),
                        country.getRegion(),
                        country.getPopulation(),
                        country.getCurrencyCode(),
                        country.getExchangeRate(),
                        country.getEstimatedGdp(),
                        country.getFlagUrl(),
                        refreshedAt,
                        country.getName()))
                .collect(Collectors.toList());

        return connection.preparedQuery(sql)
                .executeBatch(batch)
                .onSuccess(result -> log.debug("Updated {} countries", countries.size()))
                .mapEmpty();
    }

    private Future<Void> saveCacheStatus(SqlConnection connection, LocalDateTime refreshedAt) {
        return connection.preparedQuery("MERGE INTO CACHE_STATUS (ID, LAST_REFRESHED_AT) KEY (ID) VALUES (1, ?)")
                .execute(Tuple.of(refreshedAt))
                .onSuccess(result -> log.debug("Cache status set to {}", refreshedAt))
                .mapEmpty();
    }

    private Country toCountry(Row row) {
        return Country.builder()
                .name(row.getString("NAME"))
                .capital(row.getString("CAPITAL"))
                .region(row.getString("REGION"))
                .population(row.getLong("POPULATION"))
                .currencyCode(row.getString("CURRENCY_CODE"))
                .exchangeRate(row.getBigDecimal("EXCHANGE_RATE"))
                .estimatedGdp(row.getBigDecimal("ESTIMATED_GDP"))
                .flagUrl(row.getString("FLAG_URL"))
                .lastRefreshedAt(row.getLocalDateTime("LAST_REFRESHED_AT"))
                .build();
    }

    private static String column(CountrySortField field) {
        switch (field) {
            case POPULATION:
                return "POPULATION";
            case ESTIMATED_GDP:
                return "ESTIMATED_GDP";
            case EXCHANGE_RATE:
                return "EXCHANGE_RATE";
            case NAME:
            default:
                return "NAME";
        }
    }

    private static <T> Future<T> storageFailure(String message, Throwable error) {
        log.error("{}: {}", message, error.getMessage());
        return Future.failedFuture(new StorageException(message, error));
    }
}
