package com.countrycache.adapter.in.web.refresh;

import com.countrycache.adapter.in.web.ApiResponses;
import com.countrycache.application.port.in.CountryRefreshUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for cache refresh
 * Handles POST /countries/refresh
 */
@Slf4j
@RequiredArgsConstructor
public class CountryRefreshHandler implements Handler<RoutingContext> {

    private final CountryRefreshUseCase refreshUseCase;

    @Override
    public void handle(RoutingContext context) {
        log.info("Refresh requested");

        refreshUseCase.refreshCountries()
                .onSuccess(outcome -> ApiResponses.json(context, 200, RefreshResponse.success(outcome)))
                .onFailure(error -> {
                    log.error("Refresh failed: {}", error.getMessage());
                    ApiResponses.failure(context, error);
                });
    }
}
