package com.countrycache.adapter.out.http;

import com.countrycache.application.exception.SourceException;
import com.countrycache.application.port.out.CountryDataProvider;
import com.countrycache.domain.model.RawCountry;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP adapter fetching country metadata from the RestCountries v2 API.
 * Implements CountryDataProvider output port.
 */
@Slf4j
public class RestCountriesHttpAdapter implements CountryDataProvider {

    static final String SOURCE_NAME = "RestCountries API";

    private final WebClient webClient;
    private final String url;
    private final long timeoutMs;

    public RestCountriesHttpAdapter(WebClient webClient, String url, long timeoutMs) {
        this.webClient = webClient;
        this.url = url;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Future<List<RawCountry>> fetchCountries() {
        log.info("Fetching countries from {}", url);

        return webClient.getAbs(url)
                .timeout(timeoutMs)
                .send()
                .recover(error -> SourceFailures.translate(SOURCE_NAME, error))
                .compose(response -> SourceFailures.requireOk(SOURCE_NAME, response))
                .compose(this::parse)
                .onSuccess(countries -> log.info("Fetched {} countries", countries.size()))
                .onFailure(error -> log.error("Failed to fetch countries: {}", error.getMessage()));
    }

    private Future<List<RawCountry>> parse(HttpResponse<Buffer> response) {
        try {
            return Future.succeededFuture(parseCountries(response.bodyAsString()));
        } catch (DecodeException | ClassCastException | IllegalStateException e) {
            return Future.failedFuture(SourceException.malformed(SOURCE_NAME, e));
        }
    }

    List<RawCountry> parseCountries(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("empty body");
        }
        JsonArray entries = new JsonArray(body);
        List<RawCountry> countries = new ArrayList<>(entries.size());

        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.getValue(i);
            if (!(entry instanceof JsonObject)) {
                throw new IllegalStateException("entry " + i + " is not an object");
            }
            RawCountry country = toRawCountry((JsonObject) entry);
            if (country != null) {
                countries.add(country);
            }
        }
        return countries;
    }

    private RawCountry toRawCountry(JsonObject entry) {
        String name = entry.getString("name");
        if (name == null || name.isBlank()) {
            log.warn("Skipping country with missing name: {}", entry.encode());
            return null;
        }

        Number population = entry.getNumber("population");
        long populationValue = population == null ? 0L : population.longValue();
        if (populationValue < 0) {
            throw new IllegalStateException("negative population for " + name);
        }

        return new RawCountry(
                name.trim(),
                entry.getString("capital"),
                entry.getString("region"),
                populationValue,
                firstCurrencyCode(entry.getJsonArray("currencies")),
                entry.getString("flag")
        );
    }

    private String firstCurrencyCode(JsonArray currencies) {
        if (currencies == null || currencies.isEmpty()) {
            return null;
        }
        JsonObject first = currencies.getJsonObject(0);
        if (first == null) {
            return null;
        }
        String code = first.getString("code");
        return code == null || code.isBlank() ? null : code.trim();
    }
}
