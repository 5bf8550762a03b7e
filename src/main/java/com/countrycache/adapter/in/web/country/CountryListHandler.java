package com.countrycache.adapter.in.web.country;

import com.countrycache.adapter.in.web.ApiResponses;
import com.countrycache.application.port.in.CountryQueryUseCase;
import com.countrycache.application.port.in.CountryQueryUseCase.CountryListCommand;
import io.vertx.core.Handler;
import io.vertx.core.MultiMap;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.Collectors;

/**
 * Handles GET /countries with region, currency, ordering, limit and offset parameters
 */
@Slf4j
@RequiredArgsConstructor
public class CountryListHandler implements Handler<RoutingContext> {

    private final CountryQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        MultiMap params = context.queryParams();
        String currency = params.contains("currency") ? params.get("currency") : params.get("currency_code");

        CountryListCommand command = new CountryListCommand(
                params.get("region"),
                currency,
                params.get("ordering"),
                params.get("limit"),
                params.get("offset")
        );
        log.debug("Listing countries: {}", command);

        queryUseCase.listCountries(command)
                .onSuccess(countries -> ApiResponses.json(context, 200, countries.stream()
                        .map(CountryResponse::from)
                        .collect(Collectors.toList())))
                .onFailure(error -> ApiResponses.failure(context, error));
    }
}
