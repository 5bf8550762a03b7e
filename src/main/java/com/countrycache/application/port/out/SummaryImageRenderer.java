package com.countrycache.application.port.out;

import com.countrycache.domain.model.Country;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Output port for the generated summary image.
 * There is a single current image; each render replaces it.
 */
public interface SummaryImageRenderer {

    /**
     * Render the summary of the given countries and replace the current image
     */
    Future<Void> render(List<Country> countries, LocalDateTime refreshedAt);

    /**
     * @return Future with the current image bytes, or empty if none was rendered yet
     */
    Future<Optional<Buffer>> readCurrent();
}
