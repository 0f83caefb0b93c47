package cz.vut.fit.shroudinger.resolver;

import com.google.common.base.Ticker;
import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.DomainNames;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.cache.AnonymousResponseCache;
import cz.vut.fit.shroudinger.cache.CachedResponse;
import cz.vut.fit.shroudinger.errors.*;
import cz.vut.fit.shroudinger.matching.MatchingEngine;
import cz.vut.fit.shroudinger.models.ResolveResult;
import cz.vut.fit.shroudinger.pool.ConnectionPool;
import cz.vut.fit.shroudinger.pool.PooledConnection;
import cz.vut.fit.shroudinger.stats.EventType;
import cz.vut.fit.shroudinger.stats.Stage;
import cz.vut.fit.shroudinger.stats.StatsAggregator;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Message;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.*;

/**
 * Resolves a name end to end: blocklist check, then the anonymous cache, then the upstream servers.
 * <p>
 * On a cache miss the servers are tried in descending priority. A server whose circuit is open is skipped;
 * a server that fails or times out is released with an error and the next one is tried, as long as the deadline
 * allows. There is no fallback to plain-text DNS: when every encrypted server is unavailable, the resolution
 * fails.
 */
public class ResolutionOrchestrator {
    public static final String COMPONENT_NAME = "orchestrator";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ResolutionOrchestrator.class);

    private record Answer(byte[] wire, Message message) {
    }

    private final MatchingEngine _engine;
    private final AnonymousResponseCache _cache;
    private final ConnectionPool _pool;
    private final StatsAggregator _stats;
    private final ExecutorService _exchangeExecutor;
    private final Ticker _ticker;

    private final Duration _acquireTimeout;
    private final Duration _queryTimeout;
    private final long _negativeTtlSeconds;

    public ResolutionOrchestrator(@NotNull Properties properties, @NotNull MatchingEngine engine,
                                  @NotNull AnonymousResponseCache cache, @NotNull ConnectionPool pool,
                                  @NotNull StatsAggregator stats, @NotNull ExecutorService exchangeExecutor,
                                  @NotNull Ticker ticker) {
        _engine = engine;
        _cache = cache;
        _pool = pool;
        _stats = stats;
        _exchangeExecutor = exchangeExecutor;
        _ticker = ticker;

        _acquireTimeout = Common.getMillis(properties, ResolverConfig.POOL_ACQUIRE_TIMEOUT_MS_CONFIG,
                ResolverConfig.POOL_ACQUIRE_TIMEOUT_MS_DEFAULT);
        _queryTimeout = Common.getMillis(properties, ResolverConfig.QUERY_TIMEOUT_MS_CONFIG,
                ResolverConfig.QUERY_TIMEOUT_MS_DEFAULT);
        _negativeTtlSeconds = Common.getLong(properties, ResolverConfig.CACHE_NEGATIVE_TTL_S_CONFIG,
                ResolverConfig.CACHE_NEGATIVE_TTL_S_DEFAULT);
    }

    /**
     * Resolves the name. Never throws; failures are reported through {@link ResolveResult#error()}.
     *
     * @param domain   The name to resolve.
     * @param qtype    The query type mnemonic.
     * @param deadline The time budget of the whole resolution.
     */
    public ResolveResult resolve(@NotNull String domain, @NotNull String qtype, @NotNull Duration deadline) {
        var start = _ticker.read();
        var deadlineNanos = start + deadline.toNanos();

        try {
            final String name;
            final int type;
            try {
                name = DomainNames.normalize(domain);
                type = DnsMessages.parseType(qtype);
            } catch (ValidationException e) {
                _stats.record(EventType.VALIDATION_ERROR);
                return ResolveResult.failed(ErrorKind.VALIDATION);
            }

            var verdict = _engine.checkNormalized(name);
            if (verdict.blocked())
                return ResolveResult.blocked(verdict.category());

            var cacheStart = _ticker.read();
            var lookup = _cache.getOrResolve(name, type, () -> queryUpstream(name, type, deadlineNanos),
                    deadlineNanos - cacheStart);
            _stats.recordLatency(Stage.CACHE, _ticker.read() - cacheStart);
            _stats.record(lookup.hit() ? EventType.CACHE_HIT : EventType.CACHE_MISS);
            _stats.record(EventType.RESOLUTION_SUCCESS);
            return ResolveResult.resolved(lookup.payload(), lookup.hit());
        } catch (ShroudingerException e) {
            if (e.getKind() == ErrorKind.RESOLUTION_TIMEOUT) {
                _stats.record(EventType.RESOLUTION_TIMEOUT);
            } else {
                _stats.record(EventType.RESOLUTION_FAILURE);
            }
            Logger.debug("Resolution failed: {}", e.getMessage());
            return ResolveResult.failed(e.getKind());
        } finally {
            _stats.recordLatency(Stage.TOTAL, _ticker.read() - start);
        }
    }

    /**
     * Queries the servers in priority order until one answers or the deadline expires.
     */
    CachedResponse queryUpstream(String name, int type, long deadlineNanos) throws ShroudingerException {
        var upstreamStart = _ticker.read();
        try {
            var query = DnsMessages.newQuery(name, type);
            var wire = query.toWire();

            ShroudingerException lastError = null;
            boolean attempted = false;
            for (var server : _pool.serversByPriority()) {
                var remaining = deadlineNanos - _ticker.read();
                if (remaining <= 0)
                    throw new ResolutionTimeoutException("Deadline expired before an upstream server answered");

                PooledConnection connection;
                try {
                    connection = _pool.acquire(server, server.protocol(),
                            min(_acquireTimeout, Duration.ofNanos(remaining)));
                } catch (ShroudingerException e) {
                    Logger.debug("Skipping server {}: {}", server.name(), e.getMessage());
                    lastError = e;
                    continue;
                }

                attempted = true;
                remaining = deadlineNanos - _ticker.read();
                var timeout = min(_queryTimeout, Duration.ofNanos(Math.max(1, remaining)));
                try {
                    var answer = exchange(connection, query, wire, timeout);
                    _pool.release(connection, false);
                    return new CachedResponse(answer.wire(),
                            DnsMessages.cacheTtl(answer.message(), _negativeTtlSeconds));
                } catch (ResolutionTimeoutException e) {
                    Logger.debug("Server {} did not answer within {} ms", server.name(), timeout.toMillis());
                    _pool.release(connection, true);
                    lastError = e;
                } catch (ShroudingerException e) {
                    Logger.debug("Server {} failed: {}", server.name(), e.getMessage());
                    _pool.release(connection, true);
                    lastError = e;
                }
            }

            if (deadlineNanos - _ticker.read() <= 0)
                throw new ResolutionTimeoutException("Deadline expired before an upstream server answered");
            if (!attempted)
                throw new ResolutionFailureException("No upstream server is available", lastError);
            throw new ResolutionFailureException("All upstream servers failed", lastError);
        } finally {
            _stats.recordLatency(Stage.UPSTREAM, _ticker.read() - upstreamStart);
        }
    }

    private Answer exchange(PooledConnection connection, Message query, byte[] wire, Duration timeout)
            throws ShroudingerException {
        var future = _exchangeExecutor.submit(() -> connection.exchange(wire, timeout));
        try {
            var bytes = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return new Answer(bytes, DnsMessages.parseResponse(query, bytes));
        } catch (TimeoutException e) {
            future.cancel(true);
            connection.abort();
            throw new ResolutionTimeoutException("Upstream server timed out");
        } catch (InterruptedException e) {
            future.cancel(true);
            connection.abort();
            Thread.currentThread().interrupt();
            throw new ResolutionFailureException("Interrupted while waiting for the upstream server");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException)
                throw new ResolutionTimeoutException("Upstream server timed out");
            throw new ResolutionFailureException("Upstream exchange failed", cause);
        } catch (IOException e) {
            throw new ResolutionFailureException("Invalid upstream response", e);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
