package com.countrycache.adapter.out.http;

import com.countrycache.application.exception.SourceException;
import com.countrycache.domain.model.RawRate;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for ExchangeRateHttpAdapter against a local HTTP server
 */
class ExchangeRateHttpAdapterTest {

    private Vertx vertx;
    private WebClient webClient;
    private StubHttpServer stub;
    private ExchangeRateHttpAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        webClient = WebClient.create(vertx);
        stub = StubHttpServer.start(vertx);
        adapter = new ExchangeRateHttpAdapter(webClient, stub.url("/latest/USD"), 5000);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void fetchRates_shouldParseRates() throws InterruptedException {
        // Given
        stub.respond("/latest/USD", 200,
                "{\"result\":\"success\",\"base_code\":\"USD\",\"rates\":{\"USD\":1,\"EUR\":0.92,\"NGN\":1600.23}}");

        // When
        AsyncResult<List<RawRate>> result = await(adapter.fetchRates());

        // Then
        assertTrue(result.succeeded(), () -> String.valueOf(result.cause()));
        Map<String, BigDecimal> rates = result.result().stream()
                .collect(Collectors.toMap(RawRate::getCurrencyCode, RawRate::getRate));
        assertEquals(3, rates.size());
        assertEquals(0, BigDecimal.ONE.compareTo(rates.get("USD")));
        assertEquals(new BigDecimal("0.92"), rates.get("EUR"));
        assertEquals(new BigDecimal("1600.23"), rates.get("NGN"));
    }

    @Test
    void fetchRates_shouldReportUnavailableWhenProviderReportsError() throws InterruptedException {
        stub.respond("/latest/USD", 200, "{\"result\":\"error\",\"error-type\":\"unsupported-code\"}");

        SourceException error = failure(await(adapter.fetchRates()));

        assertEquals(SourceException.Kind.UNAVAILABLE, error.getKind());
        assertEquals("Open Exchange Rate API", error.getSourceName());
        assertTrue(error.getMessage().contains("unsupported-code"));
    }

    @Test
    void fetchRates_shouldReportUnavailableOnServerError() throws InterruptedException {
        stub.respond("/latest/USD", 503, "");

        assertEquals(SourceException.Kind.UNAVAILABLE, failure(await(adapter.fetchRates())).getKind());
    }

    @Test
    void fetchRates_shouldReportMalformedWithoutRates() throws InterruptedException {
        stub.respond("/latest/USD", 200, "{\"result\":\"success\"}");

        assertEquals(SourceException.Kind.MALFORMED, failure(await(adapter.fetchRates())).getKind());
    }

    @Test
    void fetchRates_shouldReportMalformedOnNonNumericRate() throws InterruptedException {
        stub.respond("/latest/USD", 200, "{\"result\":\"success\",\"rates\":{\"EUR\":\"0.92\"}}");

        assertEquals(SourceException.Kind.MALFORMED, failure(await(adapter.fetchRates())).getKind());
    }

    @Test
    void fetchRates_shouldReportMalformedOnArrayBody() throws InterruptedException {
        stub.respond("/latest/USD", 200, "[1, 2, 3]");

        assertEquals(SourceException.Kind.MALFORMED, failure(await(adapter.fetchRates())).getKind());
    }

    private static SourceException failure(AsyncResult<?> result) {
        assertTrue(result.failed());
        return assertInstanceOf(SourceException.class, result.cause());
    }

    private static <T> AsyncResult<T> await(Future<T> future) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<AsyncResult<T>> result = new AtomicReference<>();
        future.onComplete(ar -> {
            result.set(ar);
            latch.countDown();
        });
        assertTrue(latch.await(10, TimeUnit.SECONDS));
        return result.get();
    }
}
