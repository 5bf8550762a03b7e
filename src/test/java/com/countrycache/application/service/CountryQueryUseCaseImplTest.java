package com.countrycache.application.service;

import com.countrycache.adapter.out.persistence.InMemoryCountryPersistenceAdapter;
import com.countrycache.application.exception.CountryNotFoundException;
import com.countrycache.application.exception.QueryValidationException;
import com.countrycache.application.port.in.CountryQueryUseCase.CountryListCommand;
import com.countrycache.application.port.out.SummaryImageRenderer;
import com.countrycache.domain.model.CacheStatus;
import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.RefreshPlan;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit test for CountryQueryUseCaseImpl
 */
class CountryQueryUseCaseImplTest {

    private static final LocalDateTime REFRESHED_AT = LocalDateTime.of(2025, 10, 22, 18, 0);

    private InMemoryCountryPersistenceAdapter repository;
    private SummaryImageRenderer summaryImageRenderer;
    private CountryQueryUseCaseImpl useCase;

    @BeforeEach
    void setUp() throws InterruptedException {
        repository = new InMemoryCountryPersistenceAdapter();
        summaryImageRenderer = mock(SummaryImageRenderer.class);
        useCase = new CountryQueryUseCaseImpl(new CountryQueryValidator(), repository, summaryImageRenderer);

        List<Country> countries = List.of(
                country("Nigeria", "Africa", "NGN", 206139589L, "1600.230000", "193231926.60"),
                country("Ghana", "Africa", "GHS", 31072940L, "10.800000", "4315686111.11"),
                country("France", "Europe", "EUR", 67391582L, "0.920000", null),
                country("Atlantis", "Oceania", null, 0L, null, null));
        assertTrue(await(repository.saveAll(new RefreshPlan(countries, List.of()), REFRESHED_AT)).succeeded());
    }

    @Test
    void listCountries_shouldReturnAllOrderedByName() throws InterruptedException {
        List<Country> result = await(useCase.listCountries(CountryListCommand.empty())).result();

        assertEquals(List.of("Atlantis", "France", "Ghana", "Nigeria"), names(result));
    }

    @Test
    void listCountries_shouldFilterByRegionCaseInsensitively() throws InterruptedException {
        List<Country> result = await(useCase.listCountries(
                new CountryListCommand("africa", null, null, null, null))).result();

        assertEquals(List.of("Ghana", "Nigeria"), names(result));
    }

    @Test
    void listCountries_shouldFilterByCurrency() throws InterruptedException {
        List<Country> result = await(useCase.listCountries(
                new CountryListCommand(null, "ngn", null, null, null))).result();

        assertEquals(List.of("Nigeria"), names(result));
    }

    @Test
    void listCountries_shouldOrderByGdpDescendingWithNullsLast() throws InterruptedException {
        List<Country> result = await(useCase.listCountries(
                new CountryListCommand(null, null, "-estimated_gdp", null, null))).result();

        assertEquals(List.of("Ghana", "Nigeria", "Atlantis", "France"), names(result));
    }

    @Test
    void listCountries_shouldPage() throws InterruptedException {
        List<Country> result = await(useCase.listCountries(
                new CountryListCommand(null, null, "-population", "2", "1"))).result();

        assertEquals(List.of("France", "Ghana"), names(result));
    }

    @Test
    void listCountries_shouldRejectInvalidOrdering() throws InterruptedException {
        AsyncResult<List<Country>> result = await(useCase.listCountries(
                new CountryListCommand(null, null, "capital", null, null)));

        assertTrue(result.failed());
        QueryValidationException error = assertInstanceOf(QueryValidationException.class, result.cause());
        assertEquals(1, error.getErrors().size());
    }

    @Test
    void getCountry_shouldReturnStoredCountry() throws InterruptedException {
        Country country = await(useCase.getCountry("Ghana")).result();

        assertEquals("GHS", country.getCurrencyCode());
        assertEquals(REFRESHED_AT, country.getLastRefreshedAt());
    }

    @Test
    void getCountry_shouldFailWhenMissing() throws InterruptedException {
        AsyncResult<Country> result = await(useCase.getCountry("Narnia"));

        assertTrue(result.failed());
        assertInstanceOf(CountryNotFoundException.class, result.cause());
    }

    @Test
    void deleteCountry_shouldRemoveCountry() throws InterruptedException {
        assertTrue(await(useCase.deleteCountry("France")).succeeded());

        assertInstanceOf(CountryNotFoundException.class, await(useCase.getCountry("France")).cause());
        assertEquals(3, await(useCase.getStatus()).result().getTotalCountries());
    }

    @Test
    void deleteCountry_shouldFailWhenMissing() throws InterruptedException {
        AsyncResult<Void> result = await(useCase.deleteCountry("Narnia"));

        assertTrue(result.failed());
        assertInstanceOf(CountryNotFoundException.class, result.cause());
    }

    @Test
    void getStatus_shouldReportCountAndRefreshTime() throws InterruptedException {
        CacheStatus status = await(useCase.getStatus()).result();

        assertEquals(4, status.getTotalCountries());
        assertEquals(REFRESHED_AT, status.getLastRefreshedAt());
    }

    @Test
    void getSummaryImage_shouldDelegateToRenderer() throws InterruptedException {
        Buffer png = Buffer.buffer(new byte[]{(byte) 0x89, 'P', 'N', 'G'});
        when(summaryImageRenderer.readCurrent()).thenReturn(Future.succeededFuture(Optional.of(png)));

        assertEquals(png, await(useCase.getSummaryImage()).result().orElseThrow());
    }

    private static Country country(String name, String region, String currency, long population,
                                   String rate, String gdp) {
        return Country.builder()
                .name(name)
                .capital(name + " City")
                .region(region)
                .population(population)
                .currencyCode(currency)
                .exchangeRate(rate == null ? null : new BigDecimal(rate))
                .estimatedGdp(gdp == null ? null : new BigDecimal(gdp))
                .build();
    }

    private static List<String> names(List<Country> countries) {
        return countries.stream().map(Country::getName).toList();
    }

    private static <T> AsyncResult<T> await(Future<T> future) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<AsyncResult<T>> result = new AtomicReference<>();
        future.onComplete(ar -> {
            result.set(ar);
            latch.countDown();
        });
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        return result.get();
    }
}
