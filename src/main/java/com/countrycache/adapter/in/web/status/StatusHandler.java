package com.countrycache.adapter.in.web.status;

import com.countrycache.adapter.in.web.ApiResponses;
import com.countrycache.application.port.in.CountryQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Handles GET /status
 */
@RequiredArgsConstructor
public class StatusHandler implements Handler<RoutingContext> {

    private final CountryQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        queryUseCase.getStatus()
                .onSuccess(status -> ApiResponses.json(context, 200, StatusResponse.from(status)))
                .onFailure(error -> ApiResponses.failure(context, error));
    }
}
