package com.countrycache.application.service;

import com.countrycache.application.port.in.CountryRefreshUseCase;
import com.countrycache.application.port.out.CountryDataProvider;
import com.countrycache.application.port.out.CountryRepository;
import com.countrycache.application.port.out.ExchangeRateProvider;
import com.countrycache.application.port.out.SummaryImageRenderer;
import com.countrycache.domain.model.Country;
import com.countrycache.domain.model.RawCountry;
import com.countrycache.domain.model.RawRate;
import com.countrycache.domain.model.RefreshOutcome;
import com.countrycache.domain.model.RefreshPlan;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Use case implementation for the country refresh pipeline:
 * fetch (both sources concurrently) -> reconcile -> classify -> bulk write -> render summary.
 * Depends only on ports, not concrete adapters.
 */
@Slf4j
public class CountryRefreshService implements CountryRefreshUseCase {

    private final CountryDataProvider countryProvider;
    private final ExchangeRateProvider rateProvider;
    private final CountryReconciler reconciler;
    private final CountryDiffClassifier classifier;
    private final CountryRepository repository;
    private final SummaryImageRenderer summaryImageRenderer;
    private final Clock clock;

    // guarded by this
    private Future<RefreshOutcome> inFlight;

    public CountryRefreshService(
            CountryDataProvider countryProvider,
            ExchangeRateProvider rateProvider,
            CountryReconciler reconciler,
            CountryDiffClassifier classifier,
            CountryRepository repository,
            SummaryImageRenderer summaryImageRenderer,
            Clock clock
    ) {
        this.countryProvider = countryProvider;
        this.rateProvider = rateProvider;
        this.reconciler = reconciler;
        this.classifier = classifier;
        this.repository = repository;
        this.summaryImageRenderer = summaryImageRenderer;
        this.clock = clock;
    }

    @Override
    public synchronized Future<RefreshOutcome> refreshCountries() {
        if (inFlight != null) {
            log.info("Refresh already in progress, joining it");
            return inFlight;
        }

        Future<RefreshOutcome> refresh = runPipeline();
        inFlight = refresh;
        refresh.onComplete(ar -> clearInFlight(refresh));
        return refresh;
    }

    private synchronized void clearInFlight(Future<RefreshOutcome> completed) {
        if (inFlight == completed) {
            inFlight = null;
        }
    }

    private Future<RefreshOutcome> runPipeline() {
        LocalDateTime refreshedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        log.info("Country data refresh initiated (generation {})", refreshedAt);

        return fetchSources()
                .compose(sources -> classify(sources)
                        .onSuccess(plan -> log.info("Processing {} countries and {} exchange rates",
                                sources.countries().size(), sources.rates().size())))
                .compose(plan -> write(plan, refreshedAt))
                .compose(outcome -> renderSummary(outcome).map(outcome))
                .onSuccess(outcome -> log.info("Country data refresh completed: {} processed ({} inserted, {} updated)",
                        outcome.getCountriesProcessed(), outcome.getInserted(), outcome.getUpdated()))
                .onFailure(error -> log.error("Country data refresh failed: {}", error.getMessage()));
    }

    /**
     * Both fetches run concurrently; the first failure fails the whole step.
     */
    private Future<SourceData> fetchSources() {
        log.info("Starting concurrent fetch from external sources...");
        Future<List<RawCountry>> countries = countryProvider.fetchCountries();
        Future<List<RawRate>> rates = rateProvider.fetchRates();

        return Future.all(countries, rates)
                .map(all -> new SourceData(countries.result(), rates.result()))
                .onSuccess(data -> log.info("Fetched data from both sources"));
    }

    private Future<RefreshPlan> classify(SourceData sources) {
        List<Country> candidates = reconciler.reconcile(sources.countries(), sources.rates());
        return repository.findAllNames()
                .map(existingNames -> classifier.classify(candidates, existingNames));
    }

    private Future<RefreshOutcome> write(RefreshPlan plan, LocalDateTime refreshedAt) {
        return repository.saveAll(plan, refreshedAt)
                .map(written -> new RefreshOutcome(plan.getInserts().size(), plan.getUpdates().size(), refreshedAt));
    }

    /**
     * The data is committed at this point, so a rendering failure is logged and
     * does not fail the refresh.
     */
    private Future<Void> renderSummary(RefreshOutcome outcome) {
        if (outcome.getCountriesProcessed() == 0) {
            log.info("Nothing written, skipping summary image");
            return Future.succeededFuture();
        }
        return repository.findAll()
                .compose(countries -> summaryImageRenderer.render(countries, outcome.getRefreshedAt()))
                .recover(error -> {
                    log.error("Failed to generate summary image", error);
                    return Future.succeededFuture();
                });
    }

    private record SourceData(List<RawCountry> countries, List<RawRate> rates) {}
}
