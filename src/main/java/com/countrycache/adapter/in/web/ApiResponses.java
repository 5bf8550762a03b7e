package com.countrycache.adapter.in.web;

import com.countrycache.adapter.in.web.dto.DetailResponse;
import com.countrycache.adapter.in.web.dto.ErrorResponse;
import com.countrycache.application.exception.CountryNotFoundException;
import com.countrycache.application.exception.QueryValidationException;
import com.countrycache.application.exception.SourceException;
import com.countrycache.application.exception.StorageException;
import io.vertx.core.json.Json;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes JSON responses and maps application failures to HTTP statuses
 */
@Slf4j
public final class ApiResponses {

    private ApiResponses() {
    }

    public static void json(RoutingContext context, int statusCode, Object body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(body));
    }

    public static void failure(RoutingContext context, Throwable error) {
        if (error instanceof CountryNotFoundException) {
            json(context, 404, new DetailResponse("Country not found"));
        } else if (error instanceof QueryValidationException) {
            json(context, 400, ErrorResponse.of("Validation failed", ((QueryValidationException) error).getErrors()));
        } else if (error instanceof SourceException) {
            json(context, 503, ErrorResponse.of("External data source unavailable", error.getMessage()));
        } else if (error instanceof StorageException) {
            json(context, 503, ErrorResponse.of("Storage failure", error.getMessage()));
        } else if (error instanceof IllegalArgumentException) {
            json(context, 400, ErrorResponse.of("Validation failed", error.getMessage()));
        } else {
            log.error("Unhandled error for {} {}", context.request().method(), context.request().path(), error);
            json(context, 500, ErrorResponse.of("Internal server error"));
        }
    }
}
