package com.countrycache.adapter.out.http;

import com.countrycache.application.exception.SourceException;
import com.countrycache.application.port.out.ExchangeRateProvider;
import com.countrycache.domain.model.RawRate;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP adapter fetching USD-based exchange rates from the Open Exchange Rate API.
 * Implements ExchangeRateProvider output port.
 */
@Slf4j
public class ExchangeRateHttpAdapter implements ExchangeRateProvider {

    static final String SOURCE_NAME = "Open Exchange Rate API";

    private final WebClient webClient;
    private final String url;
    private final long timeoutMs;

    public ExchangeRateHttpAdapter(WebClient webClient, String url, long timeoutMs) {
        this.webClient = webClient;
        this.url = url;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Future<List<RawRate>> fetchRates() {
        log.info("Fetching exchange rates from {}", url);

        return webClient.getAbs(url)
                .timeout(timeoutMs)
                .send()
                .recover(error -> SourceFailures.translate(SOURCE_NAME, error))
                .compose(response -> SourceFailures.requireOk(SOURCE_NAME, response))
                .compose(this::parse)
                .onSuccess(rates -> log.info("Fetched {} exchange rates", rates.size()))
                .onFailure(error -> log.error("Failed to fetch exchange rates: {}", error.getMessage()));
    }

    private Future<List<RawRate>> parse(HttpResponse<Buffer> response) {
        try {
            JsonObject body = new JsonObject(response.bodyAsString());
            if ("error".equalsIgnoreCase(body.getString("result"))) {
                return Future.failedFuture(SourceException.unavailable(SOURCE_NAME,
                        "provider reported " + body.getString("error-type", "an error")));
            }
            return Future.succeededFuture(parseRates(body));
        } catch (DecodeException | ClassCastException | IllegalStateException | NullPointerException e) {
            return Future.failedFuture(SourceException.malformed(SOURCE_NAME, e));
        }
    }

    private List<RawRate> parseRates(JsonObject body) {
        JsonObject rates = body.getJsonObject("rates");
        if (rates == null) {
            throw new IllegalStateException("missing rates object");
        }

        List<RawRate> result = new ArrayList<>(rates.size());
        for (Map.Entry<String, Object> entry : rates) {
            if (!(entry.getValue() instanceof Number)) {
                throw new IllegalStateException("rate for " + entry.getKey() + " is not a number");
            }
            result.add(new RawRate(entry.getKey(), new BigDecimal(entry.getValue().toString())));
        }
        return result;
    }
}
