package com.countrycache.adapter.in.web.country;

import com.countrycache.adapter.in.web.ApiResponses;
import com.countrycache.adapter.in.web.dto.ErrorResponse;
import com.countrycache.application.port.in.CountryQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Handles GET /countries/image
 */
@RequiredArgsConstructor
public class SummaryImageHandler implements Handler<RoutingContext> {

    private final CountryQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        queryUseCase.getSummaryImage()
                .onSuccess(image -> {
                    if (image.isEmpty()) {
                        ApiResponses.json(context, 404, ErrorResponse.of("Summary image not found"));
                        return;
                    }
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "image/png")
                            .end(image.get());
                })
                .onFailure(error -> ApiResponses.failure(context, error));
    }
}
