package com.countrycache.application.service;

import com.countrycache.application.exception.CountryNotFoundException;
import com.countrycache.application.exception.QueryValidationException;
import com.countrycache.application.port.in.CountryQueryUseCase;
import com.countrycache.application.port.out.CountryRepository;
import com.countrycache.application.port.out.SummaryImageRenderer;
import com.countrycache.domain.model.CacheStatus;
import com.countrycache.domain.model.Country;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Application service implementing the read side and single-record deletion
 */
@Slf4j
@RequiredArgsConstructor
public class CountryQueryUseCaseImpl implements CountryQueryUseCase {

    private final CountryQueryValidator validator;
    private final CountryRepository repository;
    private final SummaryImageRenderer summaryImageRenderer;

    @Override
    public Future<List<Country>> listCountries(CountryListCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Invalid country listing parameters: {}", validation.errors());
            return Future.failedFuture(new QueryValidationException(validation.errors()));
        }
        return repository.find(validator.toQuery(command));
    }

    @Override
    public Future<Country> getCountry(String name) {
        return repository.findByName(name)
                .compose(country -> country
                        .map(Future::succeededFuture)
                        .orElseGet(() -> Future.failedFuture(new CountryNotFoundException(name))));
    }

    @Override
    public Future<Void> deleteCountry(String name) {
        return repository.deleteByName(name)
                .compose(deleted -> {
                    if (!deleted) {
                        return Future.failedFuture(new CountryNotFoundException(name));
                    }
                    log.info("Deleted country {}", name);
                    return Future.succeededFuture();
                });
    }

    @Override
    public Future<CacheStatus> getStatus() {
        return repository.getCacheStatus();
    }

    @Override
    public Future<Optional<Buffer>> getSummaryImage() {
        return summaryImageRenderer.readCurrent();
    }
}
