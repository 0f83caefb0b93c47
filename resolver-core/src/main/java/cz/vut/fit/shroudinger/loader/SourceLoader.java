package cz.vut.fit.shroudinger.loader;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.ConfigLists;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.errors.ErrorKind;
import cz.vut.fit.shroudinger.errors.ShroudingerException;
import cz.vut.fit.shroudinger.matching.MatchingEngine;
import cz.vut.fit.shroudinger.matching.Snapshot;
import cz.vut.fit.shroudinger.models.BlocklistEntry;
import cz.vut.fit.shroudinger.models.SourceConfig;
import cz.vut.fit.shroudinger.models.SourceReloadResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fetches and parses blocklist sources, merges them and publishes the result to the {@link MatchingEngine}.
 * <p>
 * Reloads are serialised. Sources are fetched in parallel; a source that fails keeps contributing the entries
 * of its last successful load, so one broken source never empties the blocklist.
 */
public class SourceLoader implements Closeable {
    public static final String COMPONENT_NAME = "source-loader";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(SourceLoader.class);

    private record FetchOutcome(@Nullable ParsedSource parsed, @Nullable ShroudingerException error) {
    }

    private final SourceFetcher _fetcher;
    private final MatchingEngine _engine;
    private final Clock _clock;
    private final long _maxEntries;
    private final Duration _reloadInterval;

    private final ReentrantLock _reloadLock = new ReentrantLock();
    private final ExecutorService _fetchExecutor;
    private final ScheduledExecutorService _scheduler;
    private ScheduledFuture<?> _periodicReload;

    // Guarded by _reloadLock
    private Map<String, SourceState> _states = Map.of();

    private volatile int _activeSources;
    private volatile Instant _lastReload;

    public SourceLoader(@NotNull Properties properties, @NotNull SourceFetcher fetcher,
                        @NotNull MatchingEngine engine, @NotNull Clock clock) {
        _fetcher = fetcher;
        _engine = engine;
        _clock = clock;
        _maxEntries = Common.getLong(properties, ResolverConfig.MAX_ENTRIES_CONFIG,
                ResolverConfig.MAX_ENTRIES_DEFAULT);
        _reloadInterval = Common.getSeconds(properties, ResolverConfig.RELOAD_INTERVAL_S_CONFIG,
                ResolverConfig.RELOAD_INTERVAL_S_DEFAULT);

        _fetchExecutor = Executors.newFixedThreadPool(4, new ThreadFactoryBuilder()
                .setNameFormat("source-fetch-%d").setDaemon(true).build());
        _scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("source-reload").setDaemon(true).build());
    }

    /**
     * Builds the default fetcher: HTTP(S) and file origins with retries as configured.
     */
    public static SourceFetcher defaultFetcher(@NotNull Properties properties) {
        var timeout = Common.getMillis(properties, ResolverConfig.FETCH_TIMEOUT_MS_CONFIG,
                ResolverConfig.FETCH_TIMEOUT_MS_DEFAULT);
        var attempts = Common.getInt(properties, ResolverConfig.FETCH_ATTEMPTS_CONFIG,
                ResolverConfig.FETCH_ATTEMPTS_DEFAULT);
        var backoff = Common.getMillis(properties, ResolverConfig.FETCH_BACKOFF_MS_CONFIG,
                ResolverConfig.FETCH_BACKOFF_MS_DEFAULT);

        return new RetryingSourceFetcher(
                new DefaultSourceFetcher(new HttpSourceFetcher(timeout), new FileSourceFetcher()),
                attempts, backoff);
    }

    /**
     * Fetches every enabled source, merges the results and publishes a new snapshot.
     *
     * @param sources The complete current source configuration. Sources that were loaded before but are missing
     *                from the list or disabled have their entries removed.
     * @return One result per source in the order of the configuration. Disabled sources that never contributed
     * anything are omitted.
     */
    public List<SourceReloadResult> reload(@NotNull List<SourceConfig> sources) {
        ConfigLists.requireUniqueSourceNames(sources);

        _reloadLock.lock();
        try {
            var now = _clock.instant();
            var started = System.nanoTime();

            var pending = new HashMap<String, CompletableFuture<FetchOutcome>>();
            for (var source : sources) {
                if (source.enabled())
                    pending.put(source.name(), CompletableFuture.supplyAsync(() -> load(source, now), _fetchExecutor));
            }

            var results = new ArrayList<SourceReloadResult>(sources.size());
            var newStates = new HashMap<String, SourceState>();
            int active = 0;

            for (var source : sources) {
                var previous = _states.get(source.name());

                if (!source.enabled()) {
                    if (previous != null) {
                        Logger.info("Source {} disabled; removing {} entries", source.name(),
                                previous.entries().size());
                        results.add(new SourceReloadResult(source.name(), 0, previous.entries().size(), 0, 0,
                                null, null));
                    }
                    continue;
                }

                active++;
                var outcome = pending.get(source.name()).join();
                if (outcome.error() != null) {
                    var error = outcome.error();
                    if (previous != null) {
                        newStates.put(source.name(), previous);
                        Logger.warn("Source {} failed to load ({}); keeping {} entries from the previous load",
                                source.name(), error.getMessage(), previous.entries().size());
                    } else {
                        Logger.warn("Source {} failed to load ({})", source.name(), error.getMessage());
                    }
                    results.add(SourceReloadResult.failed(source.name(), error.getKind(), error.getMessage()));
                    continue;
                }

                var parsed = Objects.requireNonNull(outcome.parsed());
                var diff = diff(previous == null ? Map.of() : previous.entries(), parsed.entries());
                newStates.put(source.name(), new SourceState(source, diff.entries, now));
                results.add(new SourceReloadResult(source.name(), diff.added, diff.removed, diff.updated,
                        parsed.rejected(), null, null));

                Logger.debug("Source {} loaded: {} entries (+{} -{} ~{}), {} rejected", source.name(),
                        parsed.entries().size(), diff.added, diff.removed, diff.updated, parsed.rejected());
            }

            for (var previousName : _states.keySet()) {
                if (sources.stream().noneMatch(s -> s.name().equals(previousName)))
                    Logger.info("Source {} is no longer configured; removing its entries", previousName);
            }

            var merged = EntryMerger.merge(newStates.values(), _maxEntries);
            var snapshot = Snapshot.build(merged, _engine.falsePositiveRate(), now);
            var current = _engine.current();
            if (current != null && current.fingerprint().equals(snapshot.fingerprint())) {
                Logger.info("Reload finished in {} ms; the blocklist is unchanged",
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            } else {
                _engine.publish(snapshot);
                Logger.info("Reload finished in {} ms; {} sources active, {} entries",
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), active, merged.size());
            }

            _states = newStates;
            _activeSources = active;
            _lastReload = now;
            return results;
        } finally {
            _reloadLock.unlock();
        }
    }

    /**
     * Schedules {@link #reload(List)} to run with the configured interval between the end of one run and the
     * start of the next. An interval of zero disables the periodic reload.
     */
    public synchronized void startPeriodicReload(@NotNull List<SourceConfig> sources) {
        if (_periodicReload != null)
            _periodicReload.cancel(false);

        var intervalMs = _reloadInterval.toMillis();
        if (intervalMs <= 0) {
            Logger.info("Periodic reload disabled");
            return;
        }

        var sourcesCopy = List.copyOf(sources);
        _periodicReload = _scheduler.scheduleWithFixedDelay(() -> {
            try {
                reload(sourcesCopy);
            } catch (RuntimeException e) {
                Logger.error("Periodic reload failed", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        Logger.info("Periodic reload scheduled every {} s", _reloadInterval.toSeconds());
    }

    public int activeSources() {
        return _activeSources;
    }

    public @Nullable Instant lastReload() {
        return _lastReload;
    }

    private FetchOutcome load(SourceConfig source, Instant now) {
        try {
            var content = _fetcher.fetch(source);
            var parsed = Parsers.forFormat(source.format()).parse(content, source, now);
            return new FetchOutcome(parsed, null);
        } catch (ShroudingerException e) {
            return new FetchOutcome(null, e);
        } catch (RuntimeException e) {
            Logger.error("Unexpected error while loading source {}", source.name(), e);
            return new FetchOutcome(null, new ShroudingerException(ErrorKind.SOURCE_FETCH,
                    "Unexpected error: " + e.getClass().getSimpleName(), e));
        }
    }

    private static final class Diff {
        final Map<RuleKey, BlocklistEntry> entries;
        int added;
        int removed;
        int updated;

        Diff(int capacity) {
            entries = new LinkedHashMap<>(capacity);
        }
    }

    /**
     * Compares the new entries of a source with the previous ones. An entry whose rule did not change keeps its
     * original instance, and thereby its creation time.
     */
    private static Diff diff(Map<RuleKey, BlocklistEntry> previous, Map<RuleKey, BlocklistEntry> current) {
        var diff = new Diff(current.size());
        for (var item : current.entrySet()) {
            var entry = item.getValue();
            var old = previous.get(item.getKey());
            if (old == null) {
                diff.added++;
                diff.entries.put(item.getKey(), entry);
            } else if (old.sameRuleAs(entry) && old.priority() == entry.priority()) {
                diff.entries.put(item.getKey(), old);
            } else {
                diff.updated++;
                diff.entries.put(item.getKey(), entry);
            }
        }

        for (var key : previous.keySet()) {
            if (!current.containsKey(key))
                diff.removed++;
        }

        return diff;
    }

    @Override
    public void close() {
        _scheduler.shutdownNow();
        _fetchExecutor.shutdownNow();
    }
}
