package cz.vut.fit.shroudinger.cache;

import cz.vut.fit.shroudinger.errors.ShroudingerException;
import org.jetbrains.annotations.NotNull;

/**
 * Produces a response on a cache miss.
 */
@FunctionalInterface
public interface UpstreamResolver {
    @NotNull CachedResponse resolve() throws ShroudingerException;
}
