package cz.vut.fit.shroudinger;

/**
 * The configuration keys, descriptions and default values for the resolver core.
 */
@SuppressWarnings("ALL")
public class ResolverConfig {
    /* --- Matching engine --- */
    public static final String BLOOM_FALSE_POSITIVE_RATE_CONFIG = "shroudinger.matching.bloom.fpp";
    public static final String BLOOM_FALSE_POSITIVE_RATE_DOC = "The target false-positive rate of the Bloom filter built for each snapshot.";
    public static final String BLOOM_FALSE_POSITIVE_RATE_DEFAULT = "0.01";

    public static final String SLOW_LOOKUP_THRESHOLD_US_CONFIG = "shroudinger.matching.slow.lookup.threshold";
    public static final String SLOW_LOOKUP_THRESHOLD_US_DOC = "Check operations slower than this are logged as a warning (microseconds).";
    public static final String SLOW_LOOKUP_THRESHOLD_US_DEFAULT = "1000";

    public static final String BATCH_CHECK_LIMIT_CONFIG = "shroudinger.matching.batch.limit";
    public static final String BATCH_CHECK_LIMIT_DOC = "The maximum number of domain names accepted by a single batch check.";
    public static final String BATCH_CHECK_LIMIT_DEFAULT = "100";

    /* --- Source loader --- */
    public static final String MAX_ENTRIES_CONFIG = "shroudinger.loader.max.entries";
    public static final String MAX_ENTRIES_DOC = "The maximum number of merged blocklist entries in a snapshot. Lowest priority entries are dropped first.";
    public static final String MAX_ENTRIES_DEFAULT = "10000000";

    public static final String RELOAD_INTERVAL_S_CONFIG = "shroudinger.loader.reload.interval";
    public static final String RELOAD_INTERVAL_S_DOC = "The interval of the periodic source refresh (seconds). Zero disables the timer.";
    public static final String RELOAD_INTERVAL_S_DEFAULT = "86400";

    public static final String FETCH_TIMEOUT_MS_CONFIG = "shroudinger.loader.fetch.timeout";
    public static final String FETCH_TIMEOUT_MS_DOC = "The connect and request timeout for fetching a remote blocklist (milliseconds).";
    public static final String FETCH_TIMEOUT_MS_DEFAULT = "30000";

    public static final String FETCH_ATTEMPTS_CONFIG = "shroudinger.loader.fetch.attempts";
    public static final String FETCH_ATTEMPTS_DOC = "The number of attempts made to fetch a single source before it is marked as failed.";
    public static final String FETCH_ATTEMPTS_DEFAULT = "3";

    public static final String FETCH_BACKOFF_MS_CONFIG = "shroudinger.loader.fetch.backoff";
    public static final String FETCH_BACKOFF_MS_DOC = "The initial delay between fetch attempts, doubled after every failure (milliseconds).";
    public static final String FETCH_BACKOFF_MS_DEFAULT = "1000";

    /* --- Anonymous response cache --- */
    public static final String CACHE_CAPACITY_CONFIG = "shroudinger.cache.capacity";
    public static final String CACHE_CAPACITY_DOC = "The maximum number of cached responses. Least recently used entries are evicted first.";
    public static final String CACHE_CAPACITY_DEFAULT = "10000";

    public static final String CACHE_MAX_TTL_S_CONFIG = "shroudinger.cache.ttl.max";
    public static final String CACHE_MAX_TTL_S_DOC = "The upper bound applied to the TTL taken from a resolved record (seconds).";
    public static final String CACHE_MAX_TTL_S_DEFAULT = "3600";

    public static final String CACHE_NEGATIVE_TTL_S_CONFIG = "shroudinger.cache.ttl.negative";
    public static final String CACHE_NEGATIVE_TTL_S_DOC = "The TTL used for responses without answer records and without an SOA record (seconds).";
    public static final String CACHE_NEGATIVE_TTL_S_DEFAULT = "60";

    public static final String CACHE_SWEEP_INTERVAL_MS_CONFIG = "shroudinger.cache.sweep.interval";
    public static final String CACHE_SWEEP_INTERVAL_MS_DOC = "The interval of the background sweep that purges expired entries (milliseconds).";
    public static final String CACHE_SWEEP_INTERVAL_MS_DEFAULT = "30000";

    /* --- Connection pool and circuit breaker --- */
    public static final String POOL_MAX_CONNECTIONS_CONFIG = "shroudinger.pool.max.connections";
    public static final String POOL_MAX_CONNECTIONS_DOC = "The maximum number of connections kept open to a single upstream server.";
    public static final String POOL_MAX_CONNECTIONS_DEFAULT = "10";

    public static final String POOL_ACQUIRE_TIMEOUT_MS_CONFIG = "shroudinger.pool.acquire.timeout";
    public static final String POOL_ACQUIRE_TIMEOUT_MS_DOC = "The maximum time to wait for a free connection slot (milliseconds).";
    public static final String POOL_ACQUIRE_TIMEOUT_MS_DEFAULT = "1000";

    public static final String POOL_IDLE_TIMEOUT_MS_CONFIG = "shroudinger.pool.idle.timeout";
    public static final String POOL_IDLE_TIMEOUT_MS_DOC = "Idle pooled connections older than this are closed (milliseconds).";
    public static final String POOL_IDLE_TIMEOUT_MS_DEFAULT = "30000";

    public static final String CONNECT_TIMEOUT_MS_CONFIG = "shroudinger.pool.connect.timeout";
    public static final String CONNECT_TIMEOUT_MS_DOC = "The TCP connect and TLS handshake timeout for a new upstream connection (milliseconds).";
    public static final String CONNECT_TIMEOUT_MS_DEFAULT = "3000";

    public static final String QUERY_TIMEOUT_MS_CONFIG = "shroudinger.resolver.query.timeout";
    public static final String QUERY_TIMEOUT_MS_DOC = "The maximum time spent on a single upstream server before failing over (milliseconds).";
    public static final String QUERY_TIMEOUT_MS_DEFAULT = "2000";

    public static final String BREAKER_FAILURE_THRESHOLD_CONFIG = "shroudinger.breaker.failure.threshold";
    public static final String BREAKER_FAILURE_THRESHOLD_DOC = "The number of consecutive failures that opens the circuit of a server.";
    public static final String BREAKER_FAILURE_THRESHOLD_DEFAULT = "5";

    public static final String BREAKER_COOLDOWN_MS_CONFIG = "shroudinger.breaker.cooldown";
    public static final String BREAKER_COOLDOWN_MS_DOC = "The time an open circuit waits before allowing a trial request (milliseconds).";
    public static final String BREAKER_COOLDOWN_MS_DEFAULT = "30000";

    public static final String BREAKER_MAX_COOLDOWN_MS_CONFIG = "shroudinger.breaker.cooldown.max";
    public static final String BREAKER_MAX_COOLDOWN_MS_DOC = "The upper bound of the cool-down, which doubles after every failed trial (milliseconds).";
    public static final String BREAKER_MAX_COOLDOWN_MS_DEFAULT = "300000";

    public static final String SERVER_CHECK_ON_START_CONFIG = "shroudinger.servers.check.on.start";
    public static final String SERVER_CHECK_ON_START_DOC = "Whether a core created from properties tests the connectivity of every server when it starts.";
    public static final String SERVER_CHECK_ON_START_DEFAULT = "true";

    public static final String SERVER_CHECK_DOMAIN_CONFIG = "shroudinger.servers.check.domain";
    public static final String SERVER_CHECK_DOMAIN_DOC = "The name queried by the startup connectivity check. It is never logged.";
    public static final String SERVER_CHECK_DOMAIN_DEFAULT = "example.com";

    public static final String SERVER_CHECK_TIMEOUT_MS_CONFIG = "shroudinger.servers.check.timeout";
    public static final String SERVER_CHECK_TIMEOUT_MS_DOC = "The time budget of one server connectivity check, including the connection setup (milliseconds).";
    public static final String SERVER_CHECK_TIMEOUT_MS_DEFAULT = "5000";

    /* --- Sources and servers --- */
    public static final String SOURCES_JSON_CONFIG = "shroudinger.sources";
    public static final String SOURCES_JSON_DOC = "A JSON array of blocklist source definitions.";
    public static final String SOURCES_JSON_DEFAULT = "[]";

    public static final String SERVERS_JSON_CONFIG = "shroudinger.servers";
    public static final String SERVERS_JSON_DOC = "A JSON array of encrypted upstream resolver definitions. At least one is required.";
    public static final String SERVERS_JSON_DEFAULT = "[]";
}
