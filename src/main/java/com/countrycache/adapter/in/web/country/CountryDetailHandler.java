package com.countrycache.adapter.in.web.country;

import com.countrycache.adapter.in.web.ApiResponses;
import com.countrycache.application.port.in.CountryQueryUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles GET and DELETE /countries/:name
 */
@Slf4j
@RequiredArgsConstructor
public class CountryDetailHandler {

    private final CountryQueryUseCase queryUseCase;

    public void get(RoutingContext context) {
        String name = context.pathParam("name");
        queryUseCase.getCountry(name)
                .onSuccess(country -> ApiResponses.json(context, 200, CountryResponse.from(country)))
                .onFailure(error -> ApiResponses.failure(context, error));
    }

    public void delete(RoutingContext context) {
        String name = context.pathParam("name");
        log.info("Delete requested for country {}", name);
        queryUseCase.deleteCountry(name)
                .onSuccess(v -> context.response().setStatusCode(204).end())
                .onFailure(error -> ApiResponses.failure(context, error));
    }
}
