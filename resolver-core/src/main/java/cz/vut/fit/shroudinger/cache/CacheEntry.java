package cz.vut.fit.shroudinger.cache;

/**
 * A cached response in wire format, with its expiry and LRU bookkeeping in ticker nanoseconds.
 */
final class CacheEntry {
    private final byte[] _payload;
    private final long _expiresAtNanos;
    private volatile long _lastAccess;

    CacheEntry(byte[] payload, long expiresAtNanos, long accessSequence) {
        _payload = payload;
        _expiresAtNanos = expiresAtNanos;
        _lastAccess = accessSequence;
    }

    byte[] payload() {
        return _payload;
    }

    boolean isExpired(long nowNanos) {
        return nowNanos - _expiresAtNanos >= 0;
    }

    long lastAccess() {
        return _lastAccess;
    }

    void touch(long accessSequence) {
        _lastAccess = accessSequence;
    }
}
