package com.countrycache.adapter.out.http;

import com.countrycache.application.exception.SourceException;
import io.vertx.core.Future;
import io.vertx.ext.web.client.HttpResponse;

import java.util.concurrent.TimeoutException;

/**
 * Maps transport failures and unexpected HTTP statuses to {@link SourceException}
 */
final class SourceFailures {

    private SourceFailures() {
    }

    static <T> Future<T> translate(String sourceName, Throwable error) {
        if (error instanceof SourceException) {
            return Future.failedFuture(error);
        }
        if (isTimeout(error)) {
            return Future.failedFuture(SourceException.timeout(sourceName, error));
        }
        return Future.failedFuture(SourceException.unavailable(sourceName, error));
    }

    static <T> Future<HttpResponse<T>> requireOk(String sourceName, HttpResponse<T> response) {
        if (response.statusCode() != 200) {
            return Future.failedFuture(SourceException.unavailable(sourceName,
                    "HTTP " + response.statusCode()));
        }
        return Future.succeededFuture(response);
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
            // Vert.x reports request timeouts with this message
            String message = t.getMessage();
            if (message != null && message.contains("timeout period")) {
                return true;
            }
        }
        return false;
    }
}
