package cz.vut.fit.shroudinger.cache;

import com.google.common.hash.HashCode;
import org.jetbrains.annotations.NotNull;

/**
 * An opaque cache key: a keyed one-way digest of the query name and type. Neither the key nor its string form
 * reveals the name.
 */
public final class CacheKey {
    private final HashCode _digest;

    CacheKey(@NotNull HashCode digest) {
        _digest = digest;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CacheKey other && _digest.equals(other._digest));
    }

    @Override
    public int hashCode() {
        return _digest.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey[" + _digest.toString().substring(0, 8) + "]";
    }
}
