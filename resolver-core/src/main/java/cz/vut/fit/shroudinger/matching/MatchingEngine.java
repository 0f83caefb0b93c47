package cz.vut.fit.shroudinger.matching;

import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.DomainNames;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.errors.ValidationException;
import cz.vut.fit.shroudinger.models.MatchResult;
import cz.vut.fit.shroudinger.resolver.DnsMessages;
import cz.vut.fit.shroudinger.stats.EventType;
import cz.vut.fit.shroudinger.stats.Stage;
import cz.vut.fit.shroudinger.stats.StatsAggregator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Answers blocklist checks against the currently published {@link Snapshot}.
 * <p>
 * Readers load the snapshot reference once per check and never take a lock. A reload builds a complete new
 * snapshot off to the side and publishes it with a single reference swap, so a check observes either the old
 * or the new rule set, never a mixture of the two.
 */
public class MatchingEngine {
    public static final String COMPONENT_NAME = "matching-engine";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(MatchingEngine.class);

    private final AtomicReference<Snapshot> _current = new AtomicReference<>();
    private final StatsAggregator _stats;
    private final double _falsePositiveRate;
    private final long _slowLookupThresholdNanos;

    public MatchingEngine(@NotNull Properties properties, @NotNull StatsAggregator stats) {
        _stats = stats;
        _falsePositiveRate = Common.getDouble(properties, ResolverConfig.BLOOM_FALSE_POSITIVE_RATE_CONFIG,
                ResolverConfig.BLOOM_FALSE_POSITIVE_RATE_DEFAULT);
        _slowLookupThresholdNanos = 1000L * Common.getLong(properties, ResolverConfig.SLOW_LOOKUP_THRESHOLD_US_CONFIG,
                ResolverConfig.SLOW_LOOKUP_THRESHOLD_US_DEFAULT);
    }

    /**
     * Validates and normalises the name and the query type, then evaluates the name.
     *
     * @param domain The name to check.
     * @param qtype  The query type mnemonic, e.g. {@code A} or {@code AAAA}.
     * @return The verdict.
     * @throws ValidationException if the name or the query type is malformed.
     */
    public MatchResult check(@NotNull String domain, @NotNull String qtype) throws ValidationException {
        DnsMessages.parseType(qtype);
        return checkNormalized(DomainNames.normalize(domain));
    }

    /**
     * Evaluates an already normalised name. Never fails; before the first snapshot is published, the verdict is
     * {@link MatchResult#NOT_READY}.
     */
    public MatchResult checkNormalized(@NotNull String normalizedDomain) {
        var start = System.nanoTime();
        var snapshot = _current.get();

        MatchResult result;
        if (snapshot == null) {
            result = MatchResult.NOT_READY;
        } else {
            result = snapshot.match(normalizedDomain);
        }

        var elapsed = System.nanoTime() - start;
        _stats.record(EventType.LOOKUP);
        if (result.blocked())
            _stats.record(EventType.BLOCKED);
        _stats.recordLatency(Stage.CHECK, elapsed);

        if (elapsed > _slowLookupThresholdNanos) {
            Logger.warn("Slow blocklist lookup: {} us (matched by {})", elapsed / 1000, result.matchedBy());
        }

        return result;
    }

    /**
     * Atomically replaces the current snapshot.
     *
     * @return The previous snapshot, or null.
     */
    public @Nullable Snapshot publish(@NotNull Snapshot snapshot) {
        var previous = _current.getAndSet(snapshot);
        _stats.updateSnapshotCounts(snapshot.perSourceCounts(), snapshot.categoryCounts());
        Logger.info("Published blocklist snapshot: {} entries, fingerprint {}", snapshot.totalEntries(),
                snapshot.fingerprint().substring(0, 12));
        return previous;
    }

    public @Nullable Snapshot current() {
        return _current.get();
    }

    public boolean isReady() {
        return _current.get() != null;
    }

    public double falsePositiveRate() {
        return _falsePositiveRate;
    }
}
