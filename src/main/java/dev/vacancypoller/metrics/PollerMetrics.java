package dev.vacancypoller.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for token refresh and vacancy ingestion.
 */
@Component
public class PollerMetrics {

    private static final String TAG_ENDPOINT = "endpoint";
    private final MeterRegistry registry;

    // Tokens
    private final Counter tokensRefreshedCounter;
    private final Counter tokenRefreshFailuresCounter;

    // Vacancies
    private final Counter vacanciesFoundCounter;
    private final Counter vacanciesSkippedCounter;
    private final Counter vacanciesCreatedCounter;
    private final Counter vacanciesFailedCounter;

    private final ConcurrentHashMap<String, Timer> endpointTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunFound = new AtomicInteger(0);
    private final AtomicInteger lastRunCreated = new AtomicInteger(0);
    private final AtomicInteger lastRunFailed = new AtomicInteger(0);

    public PollerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.tokensRefreshedCounter = Counter.builder("vacancy_poller_tokens_refreshed_total")
                .description("Credentials whose token pair was rotated")
                .register(registry);

        this.tokenRefreshFailuresCounter = Counter.builder("vacancy_poller_token_refresh_failures_total")
                .description("Expired credentials that could not be refreshed")
                .register(registry);

        this.vacanciesFoundCounter = Counter.builder("vacancy_poller_vacancies_found_total")
                .description("Vacancy items returned by similar-vacancy searches")
                .register(registry);

        this.vacanciesSkippedCounter = Counter.builder("vacancy_poller_vacancies_skipped_total")
                .description("Vacancy items already present in the store")
                .register(registry);

        this.vacanciesCreatedCounter = Counter.builder("vacancy_poller_vacancies_created_total")
                .description("New vacancy rows persisted")
                .register(registry);

        this.vacanciesFailedCounter = Counter.builder("vacancy_poller_vacancies_failed_total")
                .description("Vacancy items that could not be persisted")
                .register(registry);

        Gauge.builder("vacancy_poller_last_run_vacancies_found", lastRunFound, AtomicInteger::get)
                .description("Vacancy items seen in the last poll")
                .register(registry);

        Gauge.builder("vacancy_poller_last_run_vacancies_created", lastRunCreated, AtomicInteger::get)
                .description("Vacancies created in the last poll")
                .register(registry);

        Gauge.builder("vacancy_poller_last_run_vacancies_failed", lastRunFailed, AtomicInteger::get)
                .description("Vacancies that failed to persist in the last poll")
                .register(registry);
    }

    /**
     * Get or create a latency timer for a provider endpoint.
     */
    public Timer getEndpointTimer(String endpoint) {
        return endpointTimers.computeIfAbsent(endpoint, name ->
                Timer.builder("vacancy_poller_api_request_duration")
                        .description("Latency of job-board API requests")
                        .tag(TAG_ENDPOINT, name)
                        .register(registry)
        );
    }

    public void recordApiCall(String endpoint) {
        Counter.builder("vacancy_poller_api_calls_total")
                .tag(TAG_ENDPOINT, endpoint)
                .register(registry)
                .increment();
    }

    public void recordApiError(String endpoint) {
        Counter.builder("vacancy_poller_api_errors_total")
                .tag(TAG_ENDPOINT, endpoint)
                .register(registry)
                .increment();
    }

    public void recordApiLatency(String endpoint, long latencyMs) {
        getEndpointTimer(endpoint).record(Duration.ofMillis(latencyMs));
    }

    public void recordTokenRefreshed() {
        tokensRefreshedCounter.increment();
    }

    public void recordTokenRefreshFailure() {
        tokenRefreshFailuresCounter.increment();
    }

    public void recordVacanciesFound(int count) {
        vacanciesFoundCounter.increment(count);
    }

    public void recordVacanciesSkipped(int count) {
        vacanciesSkippedCounter.increment(count);
    }

    public void recordVacanciesCreated(int count) {
        vacanciesCreatedCounter.increment(count);
    }

    public void recordVacanciesFailed(int count) {
        vacanciesFailedCounter.increment(count);
    }

    /**
     * Update last poll statistics.
     */
    public void updateLastRunStats(int found, int created, int failed) {
        lastRunFound.set(found);
        lastRunCreated.set(created);
        lastRunFailed.set(failed);
    }
}
