package cz.vut.fit.shroudinger;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.shroudinger.cache.AnonymousResponseCache;
import cz.vut.fit.shroudinger.cache.CacheStatistics;
import cz.vut.fit.shroudinger.errors.ConfigurationException;
import cz.vut.fit.shroudinger.errors.ErrorKind;
import cz.vut.fit.shroudinger.errors.ValidationException;
import cz.vut.fit.shroudinger.loader.SourceFetcher;
import cz.vut.fit.shroudinger.loader.SourceLoader;
import cz.vut.fit.shroudinger.matching.MatchingEngine;
import cz.vut.fit.shroudinger.models.*;
import cz.vut.fit.shroudinger.pool.CircuitBreaker;
import cz.vut.fit.shroudinger.pool.ConnectionPool;
import cz.vut.fit.shroudinger.pool.UpstreamConnector;
import cz.vut.fit.shroudinger.pool.UpstreamConnectors;
import cz.vut.fit.shroudinger.resolver.ResolutionOrchestrator;
import cz.vut.fit.shroudinger.resolver.ServerTester;
import cz.vut.fit.shroudinger.stats.EventType;
import cz.vut.fit.shroudinger.stats.StatsAggregator;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The resolver core: owns every component and exposes the operations used by the transport layers.
 * <p>
 * Construction validates the server configuration and fails with a {@link ConfigurationException} if no server
 * is configured or a server uses a transport without a connector. Blocklists are not loaded until
 * {@link #reload(List)} is called; until then checks report "not ready" and resolutions are not filtered.
 */
public class ShroudingerCore implements Closeable {
    public static final String COMPONENT_NAME = "core";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ShroudingerCore.class);

    private final StatsAggregator _stats;
    private final MatchingEngine _engine;
    private final SourceLoader _loader;
    private final AnonymousResponseCache _cache;
    private final ConnectionPool _pool;
    private final ResolutionOrchestrator _orchestrator;
    private final ServerTester _tester;
    private final ExecutorService _exchangeExecutor;
    private final Clock _clock;
    private final Instant _startedAt;
    private final int _batchLimit;
    private final int _totalServers;
    private final List<ServerConfig> _servers;
    private final String _checkDomain;
    private final Duration _checkTimeout;

    public ShroudingerCore(@NotNull Properties properties,
                           @NotNull List<ServerConfig> servers,
                           @NotNull SourceFetcher fetcher,
                           @NotNull Map<Protocol, UpstreamConnector> connectors,
                           @NotNull Clock clock,
                           @NotNull Ticker ticker) {
        ConfigLists.requireUniqueServerNames(servers);
        if (servers.isEmpty())
            throw new ConfigurationException("At least one upstream server must be configured");
        for (var server : servers) {
            if (server.protocol() == Protocol.DOQ)
                throw new ConfigurationException("Server " + server.name() + " uses DoQ, which is not supported");
            if (!connectors.containsKey(server.protocol()))
                throw new ConfigurationException("No connector for protocol " + server.protocol().label());
        }

        _clock = clock;
        _startedAt = clock.instant();
        _totalServers = servers.size();
        _servers = List.copyOf(servers);
        try {
            _checkDomain = DomainNames.normalize(properties.getProperty(ResolverConfig.SERVER_CHECK_DOMAIN_CONFIG,
                    ResolverConfig.SERVER_CHECK_DOMAIN_DEFAULT));
        } catch (ValidationException e) {
            throw new ConfigurationException("The server check name is malformed", e);
        }
        _checkTimeout = Common.getMillis(properties, ResolverConfig.SERVER_CHECK_TIMEOUT_MS_CONFIG,
                ResolverConfig.SERVER_CHECK_TIMEOUT_MS_DEFAULT);
        _batchLimit = Common.getInt(properties, ResolverConfig.BATCH_CHECK_LIMIT_CONFIG,
                ResolverConfig.BATCH_CHECK_LIMIT_DEFAULT);

        _stats = new StatsAggregator(clock);
        _engine = new MatchingEngine(properties, _stats);
        _loader = new SourceLoader(properties, fetcher, _engine, clock);
        _cache = new AnonymousResponseCache(properties, ticker);
        _pool = new ConnectionPool(properties, servers, connectors, _stats, ticker);
        _stats.setHealthSupplier(_pool::healthViews);

        _exchangeExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("upstream-exchange-%d").setDaemon(true).build());
        _orchestrator = new ResolutionOrchestrator(properties, _engine, _cache, _pool, _stats, _exchangeExecutor,
                ticker);
        _tester = new ServerTester(connectors, _exchangeExecutor, ticker);

        Logger.info("Resolver core started with {} upstream servers", servers.size());
    }

    /**
     * Creates a core from properties alone: the server list is read from
     * {@link ResolverConfig#SERVERS_JSON_CONFIG} and the default fetchers and connectors are used.
     */
    public static ShroudingerCore create(@NotNull Properties properties) {
        var servers = ConfigLists.readServers(Common.makeMapper().build(), properties);
        var core = new ShroudingerCore(properties, servers, SourceLoader.defaultFetcher(properties),
                UpstreamConnectors.defaults(properties), Clock.systemUTC(), Ticker.systemTicker());
        if (Common.getBoolean(properties, ResolverConfig.SERVER_CHECK_ON_START_CONFIG,
                ResolverConfig.SERVER_CHECK_ON_START_DEFAULT)) {
            core.startServerCheck();
        }
        return core;
    }

    /**
     * Reads the source list from {@link ResolverConfig#SOURCES_JSON_CONFIG}.
     */
    public static List<SourceConfig> configuredSources(@NotNull Properties properties) {
        return ConfigLists.readSources(Common.makeMapper().build(), properties);
    }

    /**
     * Checks a name against the blocklist.
     *
     * @throws ValidationException if the name or the query type is malformed.
     */
    public MatchResult check(@NotNull String domain, @NotNull String qtype) throws ValidationException {
        try {
            return _engine.check(domain, qtype);
        } catch (ValidationException e) {
            _stats.record(EventType.VALIDATION_ERROR);
            throw e;
        }
    }

    /**
     * Checks up to the configured number of names. A malformed name yields an item with an error and does not
     * affect the others.
     *
     * @throws ValidationException if the batch is larger than the limit.
     */
    public List<BatchCheckItem> checkBatch(@NotNull List<String> domains, @NotNull String qtype)
            throws ValidationException {
        if (domains.size() > _batchLimit)
            throw new ValidationException("Batch exceeds the limit of " + _batchLimit + " names");

        var items = new ArrayList<BatchCheckItem>(domains.size());
        for (int i = 0; i < domains.size(); i++) {
            try {
                items.add(new BatchCheckItem(i, check(domains.get(i), qtype), null));
            } catch (ValidationException e) {
                items.add(new BatchCheckItem(i, null, ErrorKind.VALIDATION));
            }
        }
        return items;
    }

    public ResolveResult resolve(@NotNull String domain, @NotNull String qtype, @NotNull Duration deadline) {
        return _orchestrator.resolve(domain, qtype, deadline);
    }

    /**
     * Tests whether a server answers a query for {@code testDomain}. The server does not need to be one of the
     * configured servers; its pooled connections and circuit breaker are not involved.
     *
     * @throws ValidationException if the test name is malformed.
     */
    public ServerTestResult testServer(@NotNull ServerConfig server, @NotNull String testDomain,
                                       @NotNull Duration timeout) throws ValidationException {
        return _tester.test(server, testDomain, timeout);
    }

    /**
     * Tests every configured server concurrently. A measured latency seeds the latency average of the server;
     * a failed test counts as one failure in its circuit breaker.
     */
    public List<ServerTestResult> testServerConnections() {
        Logger.info("Testing the connections to {} upstream servers", _servers.size());
        var futures = new ArrayList<CompletableFuture<ServerTestResult>>(_servers.size());
        for (var server : _servers)
            futures.add(CompletableFuture.supplyAsync(() -> testConfiguredServer(server), _exchangeExecutor));

        var results = new ArrayList<ServerTestResult>(futures.size());
        for (var future : futures)
            results.add(future.join());
        return results;
    }

    /**
     * Runs {@link #testServerConnections()} in the background.
     */
    public void startServerCheck() {
        CompletableFuture.runAsync(this::testServerConnections, _exchangeExecutor)
                .exceptionally(e -> {
                    Logger.warn("The server connectivity check failed", e);
                    return null;
                });
    }

    private ServerTestResult testConfiguredServer(ServerConfig server) {
        ServerTestResult result;
        try {
            result = _tester.test(server, _checkDomain, _checkTimeout);
        } catch (ValidationException e) {
            // Validated in the constructor
            throw new IllegalStateException(e);
        }

        var health = _pool.health(server);
        if (result.success()) {
            health.recordLatency(result.latencyMicros() * 1000);
            Logger.info("Server {} ({}) is reachable, latency {} us", server.name(), server.protocol().label(),
                    result.latencyMicros());
        } else {
            health.onFailure(CircuitBreaker.Permit.REGULAR);
            Logger.warn("Server {} ({}) failed the connectivity check: {}", server.name(),
                    server.protocol().label(), result.error());
        }
        return result;
    }

    public List<SourceReloadResult> reload(@NotNull List<SourceConfig> sources) {
        return _loader.reload(sources);
    }

    public void startPeriodicReload(@NotNull List<SourceConfig> sources) {
        _loader.startPeriodicReload(sources);
    }

    public StatsSnapshot stats() {
        return _stats.snapshot();
    }

    public CoreStatus status() {
        var snapshot = _engine.current();
        return new CoreStatus(
                snapshot != null,
                snapshot == null ? 0 : snapshot.totalEntries(),
                _loader.activeSources(),
                _loader.lastReload(),
                Duration.between(_startedAt, _clock.instant()),
                _pool.availableServers(),
                _totalServers,
                _cache.size());
    }

    public CacheStatistics cacheStatistics() {
        return _cache.statistics();
    }

    public void clearCache() {
        _cache.clear();
    }

    @Override
    public void close() {
        Logger.info("Shutting down the resolver core");
        _loader.close();
        _cache.close();
        _pool.close();
        _exchangeExecutor.shutdownNow();
    }
}
