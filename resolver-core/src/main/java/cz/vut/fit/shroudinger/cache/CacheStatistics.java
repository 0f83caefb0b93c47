package cz.vut.fit.shroudinger.cache;

/**
 * Counters of the anonymous response cache.
 */
public record CacheStatistics(int size, int capacity, long hits, long misses, long evictions, long expirations) {
}
