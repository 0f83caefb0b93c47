package cz.vut.fit.shroudinger.cache;

import com.google.common.base.Ticker;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.errors.ShroudingerException;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A TTL-bounded cache of DNS responses that never stores a query name.
 * <p>
 * Entries are keyed by an HMAC-SHA256 digest of the name and the query type. The HMAC key is random and lives
 * only in memory, so the keys of a dumped cache cannot be matched against a dictionary of names.
 * <p>
 * Expired entries are dropped lazily on access and by a periodic sweep. When the cache grows beyond its capacity,
 * the least recently used entries are evicted; for capacities of 100 and more, eviction removes an extra 1 %
 * in one pass so that the ordering work is not repeated on every insertion.
 * <p>
 * Concurrent misses for the same key are coalesced: only one resolution runs, the other callers wait for it.
 */
public class AnonymousResponseCache implements Closeable {
    public static final String COMPONENT_NAME = "response-cache";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(AnonymousResponseCache.class);

    private final ConcurrentMap<CacheKey, CacheEntry> _entries = new ConcurrentHashMap<>();
    private final SingleFlight<CacheKey, byte[]> _singleFlight = new SingleFlight<>();
    private final HashFunction _keyFunction;
    private final Ticker _ticker;
    private final int _capacity;
    private final long _maxTtlSeconds;

    private final AtomicLong _accessSequence = new AtomicLong();
    private final ReentrantLock _evictionLock = new ReentrantLock();
    private final LongAdder _hits = new LongAdder();
    private final LongAdder _misses = new LongAdder();
    private final LongAdder _evictions = new LongAdder();
    private final LongAdder _expirations = new LongAdder();

    private final ScheduledExecutorService _scheduler;

    public AnonymousResponseCache(@NotNull Properties properties, @NotNull Ticker ticker) {
        _ticker = ticker;
        _capacity = Math.max(1, Common.getInt(properties, ResolverConfig.CACHE_CAPACITY_CONFIG,
                ResolverConfig.CACHE_CAPACITY_DEFAULT));
        _maxTtlSeconds = Common.getLong(properties, ResolverConfig.CACHE_MAX_TTL_S_CONFIG,
                ResolverConfig.CACHE_MAX_TTL_S_DEFAULT);

        var secret = new byte[32];
        new SecureRandom().nextBytes(secret);
        _keyFunction = Hashing.hmacSha256(secret);

        var sweepInterval = Common.getLong(properties, ResolverConfig.CACHE_SWEEP_INTERVAL_MS_CONFIG,
                ResolverConfig.CACHE_SWEEP_INTERVAL_MS_DEFAULT);
        _scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("cache-sweep").setDaemon(true).build());
        if (sweepInterval > 0) {
            _scheduler.scheduleAtFixedRate(this::sweepExpired, sweepInterval, sweepInterval, TimeUnit.MILLISECONDS);
        }
    }

    public CacheKey keyOf(@NotNull String domain, int qtype) {
        return new CacheKey(_keyFunction.newHasher()
                .putString(domain, StandardCharsets.UTF_8)
                .putByte((byte) 0)
                .putInt(qtype)
                .hash());
    }

    /**
     * @return A copy of the cached response, or null if there is no live entry.
     */
    public byte[] get(@NotNull String domain, int qtype) {
        var payload = lookup(keyOf(domain, qtype));
        return payload == null ? null : payload.clone();
    }

    /**
     * Stores a response. Its TTL is capped at the configured maximum; a response with a TTL of zero
     * or less is not stored.
     */
    public void put(@NotNull String domain, int qtype, @NotNull CachedResponse response) {
        store(keyOf(domain, qtype), response);
    }

    /**
     * Returns the cached response for the name and type, or resolves it.
     * <p>
     * If an identical resolution is already running, the caller waits for its result for at most
     * {@code waitTimeoutNanos} instead of starting another one.
     *
     * @param domain           The normalised name.
     * @param qtype            The numeric query type.
     * @param resolver         Produces the response on a miss.
     * @param waitTimeoutNanos How long the caller may wait for an identical in-flight resolution.
     * @return The response and whether it was a cache hit.
     * @throws ShroudingerException if the resolution failed or the wait timed out.
     */
    public CacheLookup getOrResolve(@NotNull String domain, int qtype, @NotNull UpstreamResolver resolver,
                                    long waitTimeoutNanos) throws ShroudingerException {
        var key = keyOf(domain, qtype);
        var cached = lookup(key);
        if (cached != null) {
            _hits.increment();
            return new CacheLookup(cached.clone(), true);
        }

        _misses.increment();
        var payload = _singleFlight.execute(key, () -> {
            // A previous leader may have stored the response just before this call became the leader
            var stored = lookup(key);
            if (stored != null)
                return stored;

            var response = resolver.resolve();
            store(key, response);
            return response.payload();
        }, waitTimeoutNanos);

        return new CacheLookup(payload.clone(), false);
    }

    private byte[] lookup(CacheKey key) {
        var entry = _entries.get(key);
        if (entry == null)
            return null;

        if (entry.isExpired(_ticker.read())) {
            if (_entries.remove(key, entry))
                _expirations.increment();
            return null;
        }

        entry.touch(_accessSequence.incrementAndGet());
        return entry.payload();
    }

    private void store(CacheKey key, CachedResponse response) {
        var ttl = Math.min(response.ttlSeconds(), _maxTtlSeconds);
        if (ttl <= 0)
            return;

        var now = _ticker.read();
        var entry = new CacheEntry(response.payload().clone(), now + TimeUnit.SECONDS.toNanos(ttl),
                _accessSequence.incrementAndGet());
        _entries.put(key, entry);

        if (_entries.size() > _capacity)
            evict();
    }

    private void evict() {
        _evictionLock.lock();
        try {
            if (_entries.size() <= _capacity)
                return;

            sweepExpired();
            var target = _capacity - _capacity / 100;
            var excess = _entries.size() - target;
            if (excess <= 0)
                return;

            var candidates = new ArrayList<Map.Entry<CacheKey, CacheEntry>>(_entries.entrySet());
            candidates.sort(Comparator.comparingLong(e -> e.getValue().lastAccess()));
            for (int i = 0; i < excess && i < candidates.size(); i++) {
                var candidate = candidates.get(i);
                if (_entries.remove(candidate.getKey(), candidate.getValue()))
                    _evictions.increment();
            }
        } finally {
            _evictionLock.unlock();
        }
    }

    /**
     * Removes all expired entries.
     *
     * @return The number of removed entries.
     */
    public int sweepExpired() {
        var now = _ticker.read();
        int removed = 0;
        for (var entry : _entries.entrySet()) {
            if (entry.getValue().isExpired(now) && _entries.remove(entry.getKey(), entry.getValue()))
                removed++;
        }

        if (removed > 0) {
            _expirations.add(removed);
            Logger.debug("Swept {} expired responses", removed);
        }
        return removed;
    }

    public void clear() {
        var size = _entries.size();
        _entries.clear();
        Logger.info("Response cache cleared ({} entries)", size);
    }

    public int size() {
        return _entries.size();
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(_entries.size(), _capacity, _hits.sum(), _misses.sum(), _evictions.sum(),
                _expirations.sum());
    }

    @Override
    public void close() {
        _scheduler.shutdownNow();
    }
}
