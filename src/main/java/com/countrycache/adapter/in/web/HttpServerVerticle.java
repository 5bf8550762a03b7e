package com.countrycache.adapter.in.web;

import com.countrycache.adapter.out.http.ExchangeRateHttpAdapter;
import com.countrycache.adapter.out.http.RestCountriesHttpAdapter;
import com.countrycache.adapter.out.image.FlagImageLoader;
import com.countrycache.adapter.out.image.Java2dSummaryImageAdapter;
import com.countrycache.adapter.out.persistence.InMemoryCountryPersistenceAdapter;
import com.countrycache.adapter.out.persistence.JdbcCountryPersistenceAdapter;
import com.countrycache.application.port.in.CountryQueryUseCase;
import com.countrycache.application.port.in.CountryRefreshUseCase;
import com.countrycache.application.port.out.CountryDataProvider;
import com.countrycache.application.port.out.CountryRepository;
import com.countrycache.application.port.out.ExchangeRateProvider;
import com.countrycache.application.port.out.SummaryImageRenderer;
import com.countrycache.application.service.CountryDiffClassifier;
import com.countrycache.application.service.CountryQueryUseCaseImpl;
import com.countrycache.application.service.CountryQueryValidator;
import com.countrycache.application.service.CountryReconciler;
import com.countrycache.application.service.CountryRefreshService;
import com.countrycache.application.service.GdpEstimator;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8080;
    private static final long DEFAULT_TIMEOUT_MS = 30_000;

    private JDBCPool jdbcPool;
    private WebClient webClient;
    private CountryRepository countryRepository;
    private CountryRefreshUseCase refreshUseCase;
    private CountryQueryUseCase queryUseCase;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeStorage()
                .compose(v -> {
                    log.info("Storage initialized successfully");
                    initializeServices();
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", getPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (webClient != null) {
            webClient.close();
        }
        if (jdbcPool != null) {
            jdbcPool.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeStorage() {
        String storageType = config().getJsonObject("storage", new JsonObject()).getString("type", "jdbc");
        if ("memory".equalsIgnoreCase(storageType)) {
            log.info("Using in-memory country storage");
            countryRepository = new InMemoryCountryPersistenceAdapter();
            return Future.succeededFuture();
        }

        try {
            JsonObject dbConfig = config().getJsonObject("database");
            if (dbConfig == null) {
                return Future.failedFuture("Database configuration not found in application.yml");
            }

            log.info("Connecting to database: {}", dbConfig.getString("url"));

            JsonObject poolConfig = new JsonObject()
                    .put("url", dbConfig.getString("url"))
                    .put("user", dbConfig.getString("user"))
                    .put("password", dbConfig.getString("password", ""))
                    .put("driver_class", dbConfig.getString("driver_class"))
                    .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

            jdbcPool = JDBCPool.pool(vertx, poolConfig);
            JdbcCountryPersistenceAdapter jdbcAdapter = new JdbcCountryPersistenceAdapter(jdbcPool);
            countryRepository = jdbcAdapter;

            return jdbcPool.query("SELECT 1").execute()
                    .onSuccess(result -> log.info("Database connection test successful"))
                    .onFailure(error -> log.error("Database connection failed", error))
                    .compose(result -> jdbcAdapter.initializeSchema());

        } catch (Exception e) {
            log.error("Error initializing database", e);
            return Future.failedFuture(e);
        }
    }

    private void initializeServices() {
        JsonObject sources = config().getJsonObject("sources", new JsonObject());
        JsonObject summary = config().getJsonObject("summary", new JsonObject());
        JsonObject gdp = config().getJsonObject("gdp", new JsonObject());
        long timeoutMs = sources.getLong("timeout-ms", DEFAULT_TIMEOUT_MS);

        webClient = WebClient.create(vertx, new WebClientOptions()
                .setUserAgent("country-currency-cache/1.0.0")
                .setFollowRedirects(true));

        // Output ports (adapters)
        CountryDataProvider countryProvider = new RestCountriesHttpAdapter(webClient,
                sources.getJsonObject("countries", new JsonObject()).getString("url"), timeoutMs);
        ExchangeRateProvider rateProvider = new ExchangeRateHttpAdapter(webClient,
                sources.getJsonObject("rates", new JsonObject()).getString("url"), timeoutMs);
        SummaryImageRenderer summaryImageRenderer = new Java2dSummaryImageAdapter(
                vertx,
                new FlagImageLoader(webClient, timeoutMs),
                Path.of(summary.getString("image-path", "cache/summary.png")),
                summary.getInteger("top-count", 5));

        // Application services (use cases)
        Object multiplier = gdp.getValue("per-capita-multiplier");
        GdpEstimator gdpEstimator = multiplier == null
                ? new GdpEstimator()
                : new GdpEstimator(new BigDecimal(multiplier.toString()));

        refreshUseCase = new CountryRefreshService(
                countryProvider,
                rateProvider,
                new CountryReconciler(gdpEstimator),
                new CountryDiffClassifier(),
                countryRepository,
                summaryImageRenderer,
                Clock.systemUTC()
        );
        queryUseCase = new CountryQueryUseCaseImpl(new CountryQueryValidator(), countryRepository, summaryImageRenderer);

        log.info("Services wired up (Hexagonal Architecture)");
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        new WebRouter(router, refreshUseCase, queryUseCase).setupRoutes();

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }

    private int getPort() {
        return config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }
}
