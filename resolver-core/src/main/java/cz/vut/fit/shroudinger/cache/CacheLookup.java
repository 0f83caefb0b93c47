package cz.vut.fit.shroudinger.cache;

import org.jetbrains.annotations.NotNull;

/**
 * The result of {@link AnonymousResponseCache#getOrResolve}.
 *
 * @param payload The response in wire format.
 * @param hit     True if the response was already cached; false if this call or a concurrent identical call
 *                resolved it.
 */
public record CacheLookup(byte @NotNull [] payload, boolean hit) {
}
