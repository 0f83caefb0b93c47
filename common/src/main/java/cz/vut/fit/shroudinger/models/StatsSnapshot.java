package cz.vut.fit.shroudinger.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Anonymous aggregate counters. Contains no domain names, client identifiers or query content.
 *
 * @param lookupCount        The number of checks performed.
 * @param blockedCount       The number of checks that resulted in a block.
 * @param cacheHits          Resolutions served from the cache.
 * @param cacheMisses        Resolutions that needed an upstream query.
 * @param avgLatencyMicros   The mean duration of a complete resolution.
 * @param stageLatencyMicros The mean duration of each processing stage.
 * @param resolutionFailures Resolutions that ended with a terminal error.
 * @param resolutionTimeouts Resolutions that ended because the deadline expired.
 * @param perSourceCounts    The number of entries each source contributed to the current snapshot.
 * @param categoryCounts     The number of entries of each category in the current snapshot.
 * @param stateTransitions   Circuit-breaker transitions, by target state.
 * @param serverHealth       The current state of every upstream server.
 * @param takenAt            When the statistics were taken.
 */
public record StatsSnapshot(long lookupCount,
                            long blockedCount,
                            long cacheHits,
                            long cacheMisses,
                            long avgLatencyMicros,
                            Map<String, Long> stageLatencyMicros,
                            long resolutionFailures,
                            long resolutionTimeouts,
                            Map<String, Integer> perSourceCounts,
                            Map<Category, Integer> categoryCounts,
                            Map<CircuitState, Long> stateTransitions,
                            List<ServerHealthView> serverHealth,
                            Instant takenAt) {
}
