package cz.vut.fit.shroudinger.cache;

import org.jetbrains.annotations.NotNull;

/**
 * A response produced by an upstream resolution, with the number of seconds it may be cached for.
 */
public record CachedResponse(byte @NotNull [] payload, long ttlSeconds) {
}
