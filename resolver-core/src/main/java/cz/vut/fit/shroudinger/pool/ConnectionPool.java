package cz.vut.fit.shroudinger.pool;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.ResolverConfig;
import cz.vut.fit.shroudinger.errors.*;
import cz.vut.fit.shroudinger.models.Protocol;
import cz.vut.fit.shroudinger.models.ServerConfig;
import cz.vut.fit.shroudinger.models.ServerHealthView;
import cz.vut.fit.shroudinger.stats.StatsAggregator;
import cz.vut.fit.shroudinger.stats.StatsEvent;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * Bounded pools of reusable connections to the upstream servers, one pool per (server, protocol).
 * <p>
 * Every server has a {@link CircuitBreaker}: while its circuit is open, {@link #acquire} fails immediately with
 * a {@link CircuitOpenException}. A failed connection attempt and a release with {@code wasError} count as
 * failures of the server; a clean release counts as a success. Idle connections are closed after the idle
 * timeout by a background reaper.
 */
public class ConnectionPool implements Closeable {
    public static final String COMPONENT_NAME = "connection-pool";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ConnectionPool.class);

    private record PoolKey(String server, Protocol protocol) {
    }

    private static final class ServerPool {
        final ServerConfig server;
        final Protocol protocol;
        final UpstreamConnector connector;
        final ServerHealth health;
        final Semaphore permits;
        final Deque<PooledConnection> idle = new ConcurrentLinkedDeque<>();

        ServerPool(ServerConfig server, Protocol protocol, UpstreamConnector connector, ServerHealth health,
                   int maxConnections) {
            this.server = server;
            this.protocol = protocol;
            this.connector = connector;
            this.health = health;
            this.permits = new Semaphore(maxConnections, true);
        }
    }

    private final Map<PoolKey, ServerPool> _pools = new ConcurrentHashMap<>();
    private final List<ServerConfig> _serversByPriority;
    private final Ticker _ticker;
    private final Duration _connectTimeout;
    private final long _idleTimeoutNanos;
    private final ScheduledExecutorService _reaper;
    private volatile boolean _closed;

    public ConnectionPool(@NotNull Properties properties, @NotNull List<ServerConfig> servers,
                          @NotNull Map<Protocol, UpstreamConnector> connectors, @NotNull StatsAggregator stats,
                          @NotNull Ticker ticker) {
        _ticker = ticker;
        _connectTimeout = Common.getMillis(properties, ResolverConfig.CONNECT_TIMEOUT_MS_CONFIG,
                ResolverConfig.CONNECT_TIMEOUT_MS_DEFAULT);
        var idleTimeout = Common.getMillis(properties, ResolverConfig.POOL_IDLE_TIMEOUT_MS_CONFIG,
                ResolverConfig.POOL_IDLE_TIMEOUT_MS_DEFAULT);
        _idleTimeoutNanos = idleTimeout.toNanos();

        var maxConnections = Common.getInt(properties, ResolverConfig.POOL_MAX_CONNECTIONS_CONFIG,
                ResolverConfig.POOL_MAX_CONNECTIONS_DEFAULT);
        var threshold = Common.getInt(properties, ResolverConfig.BREAKER_FAILURE_THRESHOLD_CONFIG,
                ResolverConfig.BREAKER_FAILURE_THRESHOLD_DEFAULT);
        var cooldown = Common.getMillis(properties, ResolverConfig.BREAKER_COOLDOWN_MS_CONFIG,
                ResolverConfig.BREAKER_COOLDOWN_MS_DEFAULT);
        var maxCooldown = Common.getMillis(properties, ResolverConfig.BREAKER_MAX_COOLDOWN_MS_CONFIG,
                ResolverConfig.BREAKER_MAX_COOLDOWN_MS_DEFAULT);

        if (maxConnections < 1)
            throw new ConfigurationException("The connection pool needs at least one connection per server");

        for (var server : servers) {
            var connector = connectors.get(server.protocol());
            if (connector == null)
                throw new ConfigurationException("No connector for protocol " + server.protocol().label()
                        + " of server " + server.name());

            var breaker = new CircuitBreaker(threshold, cooldown, maxCooldown, ticker, state -> {
                stats.record(StatsEvent.transition(state));
                Logger.info("Circuit of server {} is now {}", server.name(), state);
            });
            var health = new ServerHealth(server, breaker);
            _pools.put(new PoolKey(server.name(), server.protocol()),
                    new ServerPool(server, server.protocol(), connector, health, maxConnections));
        }

        var ordered = new ArrayList<>(servers);
        ordered.sort(Comparator.comparingInt(ServerConfig::priority).reversed());
        _serversByPriority = Collections.unmodifiableList(ordered);

        _reaper = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("connection-reaper").setDaemon(true).build());
        var reapInterval = Math.max(1000, idleTimeout.toMillis() / 2);
        _reaper.scheduleWithFixedDelay(this::reapIdle, reapInterval, reapInterval, TimeUnit.MILLISECONDS);
    }

    /**
     * Takes an idle connection to the server or opens a new one, waiting up to {@code timeout} for a free slot.
     *
     * @throws CircuitOpenException       if the circuit of the server is open.
     * @throws PoolTimeoutException       if no slot became free in time.
     * @throws ResolutionFailureException if a new connection could not be opened.
     */
    public PooledConnection acquire(@NotNull ServerConfig server, @NotNull Protocol protocol,
                                    @NotNull Duration timeout) throws ShroudingerException {
        var pool = _pools.get(new PoolKey(server.name(), protocol));
        if (pool == null)
            throw new IllegalArgumentException("Unknown server " + server.name() + " (" + protocol.label() + ")");
        if (_closed)
            throw new ResolutionFailureException("The connection pool is closed");

        var breaker = pool.health.breaker();
        var permit = breaker.tryAcquirePermission();
        if (permit == null)
            throw new CircuitOpenException(server.name());

        try {
            if (!pool.permits.tryAcquire(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS)) {
                breaker.releasePermission(permit);
                throw new PoolTimeoutException(server.name());
            }
        } catch (InterruptedException e) {
            breaker.releasePermission(permit);
            Thread.currentThread().interrupt();
            throw new ResolutionFailureException("Interrupted while waiting for a connection");
        }

        var now = _ticker.read();
        PooledConnection connection;
        while ((connection = pool.idle.pollFirst()) != null) {
            if (connection.isUsable(now, _idleTimeoutNanos)) {
                connection.markAcquired(permit);
                return connection;
            }
            connection.close();
        }

        try {
            var upstream = pool.connector.open(server, _connectTimeout);
            connection = new PooledConnection(server, protocol, upstream, _ticker);
            connection.markAcquired(permit);
            Logger.debug("Opened a new {} connection to {}", protocol.label(), server.name());
            return connection;
        } catch (IOException | RuntimeException e) {
            pool.permits.release();
            pool.health.onFailure(permit);
            Logger.warn("Cannot connect to server {}: {}", server.name(), e.toString());
            throw new ResolutionFailureException("Cannot connect to the upstream server", e);
        }
    }

    /**
     * Returns a connection to its pool.
     *
     * @param connection The connection.
     * @param wasError   True if the exchange failed; the connection is then closed instead of being reused and
     *                   the failure is recorded in the server's circuit breaker.
     */
    public void release(@NotNull PooledConnection connection, boolean wasError) {
        var pool = _pools.get(new PoolKey(connection.server().name(), connection.protocol()));
        if (pool == null || !connection.markReleased())
            return;

        if (wasError) {
            connection.close();
            pool.health.onFailure(connection.permit());
        } else {
            pool.health.onSuccess(connection.permit(), connection.lastLatencyNanos());
            if (_closed) {
                connection.close();
            } else {
                pool.idle.offerFirst(connection);
            }
        }
        pool.permits.release();
    }

    /**
     * @return The servers ordered from the highest priority.
     */
    public List<ServerConfig> serversByPriority() {
        return _serversByPriority;
    }

    public ServerHealth health(@NotNull ServerConfig server) {
        var pool = _pools.get(new PoolKey(server.name(), server.protocol()));
        if (pool == null)
            throw new IllegalArgumentException("Unknown server " + server.name());
        return pool.health;
    }

    public List<ServerHealthView> healthViews() {
        var views = new ArrayList<ServerHealthView>(_serversByPriority.size());
        for (var server : _serversByPriority)
            views.add(health(server).view());
        return views;
    }

    /**
     * @return The number of servers that would currently be admitted by their circuit breaker.
     */
    public int availableServers() {
        int count = 0;
        for (var pool : _pools.values()) {
            if (pool.health.breaker().isAvailable())
                count++;
        }
        return count;
    }

    public int idleConnections(@NotNull ServerConfig server) {
        var pool = _pools.get(new PoolKey(server.name(), server.protocol()));
        return pool == null ? 0 : pool.idle.size();
    }

    /**
     * Closes idle connections that have not been used within the idle timeout.
     */
    void reapIdle() {
        var now = _ticker.read();
        int reaped = 0;
        for (var pool : _pools.values()) {
            for (var connection : pool.idle) {
                if (!connection.isUsable(now, _idleTimeoutNanos) && pool.idle.remove(connection)) {
                    connection.close();
                    reaped++;
                }
            }
        }
        if (reaped > 0)
            Logger.debug("Closed {} idle connections", reaped);
    }

    @Override
    public void close() {
        _closed = true;
        _reaper.shutdownNow();
        for (var pool : _pools.values()) {
            PooledConnection connection;
            while ((connection = pool.idle.pollFirst()) != null)
                connection.close();
        }
    }
}
