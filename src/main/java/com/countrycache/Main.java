package com.countrycache;

import com.countrycache.adapter.in.web.HttpServerVerticle;
import com.countrycache.infrastructure.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Country Currency Cache...");

        // Summary image is rendered without a display
        System.setProperty("java.awt.headless", "true");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        JsonObject config = ConfigLoader.load();
        int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8080);

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    // Add shutdown hook
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Country Currency Cache...");
                        vertx.close();
                    }));

                    log.info("Country Currency Cache is ready!");
                    log.info("API Endpoint: http://localhost:{}/countries", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }
}
