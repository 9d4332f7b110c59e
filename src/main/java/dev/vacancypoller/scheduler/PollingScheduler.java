package dev.vacancypoller.scheduler;

import dev.vacancypoller.config.PollerProperties;
import dev.vacancypoller.service.TokenRefreshService;
import dev.vacancypoller.service.VacancyPollService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single coordination loop for the two periodic jobs.
 *
 * <p>A background ticker only posts signals; both jobs run on the thread that called
 * {@link #start()}, so token refresh and vacancy polling never overlap. Each job has at
 * most one pending tick: ticks that arrive while one is already queued are dropped.
 * A stop request is observed between jobs and never interrupts one in progress; on context
 * shutdown the caller waits up to {@code poller.shutdown-timeout} for that job to finish.
 */
@Slf4j
@Component
public class PollingScheduler {

    enum Signal {
        REFRESH_TICK,
        PARSE_TICK,
        SHUTDOWN
    }

    private final TokenRefreshService tokenRefreshService;
    private final VacancyPollService vacancyPollService;
    private final Duration refreshInterval;
    private final Duration parseInterval;
    private final Duration shutdownTimeout;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final AtomicBoolean refreshPending = new AtomicBoolean(false);
    private final AtomicBoolean parsePending = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private volatile CountDownLatch loopExited;

    public PollingScheduler(TokenRefreshService tokenRefreshService, VacancyPollService vacancyPollService,
            PollerProperties properties) {
        this.tokenRefreshService = tokenRefreshService;
        this.vacancyPollService = vacancyPollService;
        this.refreshInterval = properties.getRefreshInterval();
        this.parseInterval = properties.getParseInterval();
        this.shutdownTimeout = properties.getShutdownTimeout();
    }

    /**
     * Run the loop on the calling thread until {@link #stop()} is called.
     */
    public void start() {
        CountDownLatch exited = new CountDownLatch(1);
        loopExited = exited;

        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("polling-ticker");
            thread.setDaemon(true);
            return thread;
        });
        ticker.scheduleAtFixedRate(() -> post(Signal.REFRESH_TICK, refreshPending),
                refreshInterval.toMillis(), refreshInterval.toMillis(), TimeUnit.MILLISECONDS);
        ticker.scheduleAtFixedRate(() -> post(Signal.PARSE_TICK, parsePending),
                parseInterval.toMillis(), parseInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.debug("Tickers started (refresh every {}s, parse every {}s)",
                refreshInterval.toSeconds(), parseInterval.toSeconds());

        try {
            while (!stopRequested) {
                Signal signal = signals.take();
                if (stopRequested || signal == Signal.SHUTDOWN) {
                    break;
                }
                dispatch(signal);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Polling loop interrupted");
        } finally {
            ticker.shutdownNow();
            log.info("Polling loop stopped");
            exited.countDown();
        }
    }

    /**
     * Ask a running {@link #start()} to return. Call at most once per start.
     */
    public void stop() {
        stopRequested = true;
        signals.offer(Signal.SHUTDOWN);
    }

    /**
     * Stop the loop and wait, bounded by the shutdown timeout, for a running job to
     * finish before the context closes the store and HTTP client under it.
     */
    @PreDestroy
    public void stopOnShutdown() {
        if (!stopRequested) {
            stop();
        }

        CountDownLatch exited = loopExited;
        if (exited == null) {
            return;
        }
        try {
            if (!exited.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Polling loop still busy after {}ms, continuing shutdown", shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the polling loop to stop");
        }
    }

    int pendingSignals() {
        return signals.size();
    }

    private void post(Signal tick, AtomicBoolean pending) {
        if (pending.compareAndSet(false, true)) {
            signals.offer(tick);
        }
    }

    private void dispatch(Signal signal) {
        try {
            if (signal == Signal.REFRESH_TICK) {
                refreshPending.set(false);
                tokenRefreshService.refreshAll();
            } else if (signal == Signal.PARSE_TICK) {
                parsePending.set(false);
                vacancyPollService.parse();
            }
        } catch (RuntimeException e) {
            log.error("{} failed: {}", signal, e.getMessage(), e);
        }
    }
}
