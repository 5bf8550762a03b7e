package com.countrycache.adapter.out.http;

import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Local HTTP server serving canned responses per path, for adapter tests
 */
public class StubHttpServer {

    private final Map<String, Handler<HttpServerRequest>> routes = new ConcurrentHashMap<>();
    private HttpServer server;

    public static StubHttpServer start(Vertx vertx) throws Exception {
        StubHttpServer stub = new StubHttpServer();
        stub.server = vertx.createHttpServer()
                .requestHandler(request -> stub.routes
                        .getOrDefault(request.path(), r -> r.response().setStatusCode(404).end())
                        .handle(request))
                .listen(0)
                .toCompletionStage()
                .toCompletableFuture()
                .get(5, TimeUnit.SECONDS);
        return stub;
    }

    public StubHttpServer respond(String path, int statusCode, String body) {
        routes.put(path, request -> request.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(body));
        return this;
    }

    /**
     * Accept the request and never answer it
     */
    public StubHttpServer hang(String path) {
        routes.put(path, request -> {
        });
        return this;
    }

    public String url(String path) {
        return "http://localhost:" + server.actualPort() + path;
    }
}
