package com.csd.packagefinder.service;

import com.csd.packagefinder.exception.InvalidSearchRequestException;
import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.RegistryOutcome;
import com.csd.packagefinder.model.RegistrySearchError;
import com.csd.packagefinder.model.SearchResult;
import com.csd.packagefinder.registry.RegistrySource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Searches every configured registry for every requested name.
 * <p>
 * One {@link RegistrySource#find} call per (name, registry) pair runs on a bounded pool. The
 * timeout clock of a call starts when a worker picks it up, so time spent queued behind other
 * calls never counts; a call that runs out is reported as a TIMEOUT error and its worker is
 * interrupted. Results for a name are assembled only after all of its calls have settled, in
 * registry order.
 */
@Slf4j
public class PackageSearcher {

    private final List<RegistrySource> sources;
    private final SearchSettings settings;

    public PackageSearcher(List<RegistrySource> sources) {
        this(sources, SearchSettings.defaults());
    }

    public PackageSearcher(List<RegistrySource> sources, SearchSettings settings) {
        if (sources == null || sources.isEmpty()) {
            throw new InvalidSearchRequestException("At least one registry must be configured");
        }
        if (settings.getConcurrency() < 1) {
            throw new InvalidSearchRequestException("Concurrency must be positive: " + settings.getConcurrency());
        }
        if (settings.getTimeout().isNegative() || settings.getTimeout().isZero()) {
            throw new InvalidSearchRequestException("Timeout must be positive: " + settings.getTimeout());
        }
        this.sources = List.copyOf(sources);
        this.settings = settings;
    }

    public List<RegistrySource> registries() {
        return sources;
    }

    public SearchSettings getSettings() {
        return settings;
    }

    public SearchResult searchPackage(String name) {
        return searchPackages(List.of(validName(name))).get(name.trim());
    }

    /**
     * @return one entry per distinct (trimmed) name, in the order given
     * @throws InvalidSearchRequestException when no names are given or a name is blank
     */
    public Map<String, SearchResult> searchPackages(List<String> names) {
        List<String> queries = validate(names);
        int total = queries.size() * sources.size();
        log.info("Searching for {} package(s) across {} registries", queries.size(), sources.size());

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(settings.getConcurrency(), total),
                workerThreads("registry-search-"));
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, workerThreads("registry-search-timer-"));
        timer.setRemoveOnCancelPolicy(true);
        try {
            AtomicInteger completed = new AtomicInteger();
            Map<String, List<CompletableFuture<RegistryOutcome>>> pending = new LinkedHashMap<>();
            for (String name : queries) {
                List<CompletableFuture<RegistryOutcome>> futures = new ArrayList<>(sources.size());
                for (RegistrySource source : sources) {
                    TimedCall call = new TimedCall(source, name, timer);
                    pool.execute(call);
                    futures.add(call.result
                            .handle((outcome, failure) -> settle(source, name, outcome, failure))
                            .whenComplete((outcome, failure) ->
                                    log.debug("Progress: {}/{} searches completed", completed.incrementAndGet(), total)));
                }
                pending.put(name, futures);
            }

            Map<String, SearchResult> results = new LinkedHashMap<>();
            for (Map.Entry<String, List<CompletableFuture<RegistryOutcome>>> entry : pending.entrySet()) {
                List<RegistryOutcome> outcomes = entry.getValue().stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList());
                SearchResult result = ResultAggregator.aggregate(outcomes);
                log.info("'{}': found in {} registr{}, {} error(s)", entry.getKey(), result.getInfos().size(),
                        result.getInfos().size() == 1 ? "y" : "ies", result.getErrors().size());
                results.put(entry.getKey(), result);
            }
            return results;
        } finally {
            pool.shutdownNow();
            timer.shutdownNow();
        }
    }

    /**
     * Runs one lookup on a pool worker and arms its deadline when the lookup starts. If the
     * deadline fires first, {@link #result} fails with a {@link TimeoutException} and the worker
     * is interrupted; an interrupt that lands after the lookup returned is cleared before the
     * worker moves on.
     */
    private final class TimedCall implements Runnable {

        final CompletableFuture<RegistryOutcome> result = new CompletableFuture<>();

        private final RegistrySource source;
        private final String name;
        private final ScheduledExecutorService timer;
        private Thread worker;

        TimedCall(RegistrySource source, String name, ScheduledExecutorService timer) {
            this.source = source;
            this.name = name;
            this.timer = timer;
        }

        @Override
        public void run() {
            synchronized (this) {
                worker = Thread.currentThread();
            }
            ScheduledFuture<?> deadline = timer.schedule(this::expire,
                    settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(source.find(name));
            } catch (RuntimeException | Error e) {
                result.completeExceptionally(e);
            } finally {
                deadline.cancel(false);
                synchronized (this) {
                    worker = null;
                }
                Thread.interrupted();
            }
        }

        private synchronized void expire() {
            if (result.completeExceptionally(new TimeoutException()) && worker != null) {
                worker.interrupt();
            }
        }
    }

    private RegistryOutcome settle(RegistrySource source, String name, RegistryOutcome outcome, Throwable failure) {
        if (failure == null) {
            if (outcome != null) {
                return outcome;
            }
            log.warn("{} returned no outcome for '{}'", source.id(), name);
            return RegistryOutcome.failed(error(source, name, ErrorReason.PARSE_FAILURE, "registry returned no outcome"));
        }
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
        if (cause instanceof TimeoutException) {
            log.warn("{} did not answer for '{}' within {}", source.id(), name, settings.getTimeout());
            return RegistryOutcome.failed(error(source, name, ErrorReason.TIMEOUT, "no answer within " + settings.getTimeout()));
        }
        log.warn("{} failed for '{}'", source.id(), name, cause);
        return RegistryOutcome.failed(error(source, name, ErrorReason.PARSE_FAILURE, cause.toString()));
    }

    private static RegistrySearchError error(RegistrySource source, String name, ErrorReason reason, String detail) {
        return RegistrySearchError.builder()
                .repository(source.id())
                .packageName(name)
                .reason(reason)
                .detail(detail)
                .build();
    }

    private static List<String> validate(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new InvalidSearchRequestException("At least one package name is required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String name : names) {
            distinct.add(validName(name).trim());
        }
        return new ArrayList<>(distinct);
    }

    private static String validName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidSearchRequestException("Package names must not be blank");
        }
        return name;
    }

    private static ThreadFactory workerThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
