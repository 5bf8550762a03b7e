package com.countrycache.adapter.in.web;

import com.countrycache.adapter.in.web.country.CountryDetailHandler;
import com.countrycache.adapter.in.web.country.CountryListHandler;
import com.countrycache.adapter.in.web.country.SummaryImageHandler;
import com.countrycache.adapter.in.web.dto.ErrorResponse;
import com.countrycache.adapter.in.web.refresh.CountryRefreshHandler;
import com.countrycache.adapter.in.web.status.StatusHandler;
import com.countrycache.application.port.in.CountryQueryUseCase;
import com.countrycache.application.port.in.CountryRefreshUseCase;
import io.vertx.core.json.Json;
import io.vertx.ext.web.Router;

/**
 * Router configuration for country endpoints
 */
public class WebRouter {

    private final Router router;
    private final CountryRefreshHandler refreshHandler;
    private final CountryListHandler listHandler;
    private final CountryDetailHandler detailHandler;
    private final SummaryImageHandler imageHandler;
    private final StatusHandler statusHandler;

    public WebRouter(Router router, CountryRefreshUseCase refreshUseCase, CountryQueryUseCase queryUseCase) {
        this.router = router;
        this.refreshHandler = new CountryRefreshHandler(refreshUseCase);
        this.listHandler = new CountryListHandler(queryUseCase);
        this.detailHandler = new CountryDetailHandler(queryUseCase);
        this.imageHandler = new SummaryImageHandler(queryUseCase);
        this.statusHandler = new StatusHandler(queryUseCase);
    }

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options().handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post("/countries/refresh").handler(refreshHandler);
        router.get("/countries").handler(listHandler);

        // Must precede /countries/:name
        router.get("/countries/image").handler(imageHandler);

        router.get("/countries/:name").handler(detailHandler::get);
        router.delete("/countries/:name").handler(detailHandler::delete);

        router.get("/status").handler(statusHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"country-currency-cache\"}"));

        // Root endpoint
        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"name\":\"Country Currency Cache\",\"version\":\"1.0.0\"}"));

        // Default route - 404
        router.route().handler(ctx -> ctx.response()
                .setStatusCode(404)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(ErrorResponse.of("Endpoint not found"))));
    }
}
