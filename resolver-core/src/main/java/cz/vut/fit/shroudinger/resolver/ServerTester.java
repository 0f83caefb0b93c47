package cz.vut.fit.shroudinger.resolver;

import com.google.common.base.Ticker;
import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.DomainNames;
import cz.vut.fit.shroudinger.errors.ErrorKind;
import cz.vut.fit.shroudinger.errors.ValidationException;
import cz.vut.fit.shroudinger.models.Protocol;
import cz.vut.fit.shroudinger.models.ServerConfig;
import cz.vut.fit.shroudinger.models.ServerTestResult;
import cz.vut.fit.shroudinger.pool.UpstreamConnection;
import cz.vut.fit.shroudinger.pool.UpstreamConnector;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Type;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tests whether an upstream server answers queries: opens a dedicated connection outside the pool, sends one
 * {@code A} query for the test name and validates the response.
 * <p>
 * The test never touches the circuit breakers or the cache, and neither the result nor the log carries the
 * test name.
 */
public class ServerTester {
    public static final String COMPONENT_NAME = "server-tester";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ServerTester.class);

    private final Map<Protocol, UpstreamConnector> _connectors;
    private final ExecutorService _executor;
    private final Ticker _ticker;

    public ServerTester(@NotNull Map<Protocol, UpstreamConnector> connectors, @NotNull ExecutorService executor,
                        @NotNull Ticker ticker) {
        _connectors = connectors;
        _executor = executor;
        _ticker = ticker;
    }

    /**
     * Runs the test. Connection setup and the exchange together are bounded by {@code timeout}.
     *
     * @throws ValidationException if the test name is malformed.
     */
    public ServerTestResult test(@NotNull ServerConfig server, @NotNull String testDomain,
                                 @NotNull Duration timeout) throws ValidationException {
        var query = DnsMessages.newQuery(DomainNames.normalize(testDomain), Type.A);
        var connector = _connectors.get(server.protocol());
        if (connector == null)
            return ServerTestResult.failed(server, 0, ErrorKind.CONFIGURATION);

        var start = _ticker.read();
        var deadline = start + timeout.toNanos();
        var open = new AtomicReference<UpstreamConnection>();
        var future = _executor.submit(() -> {
            try (var connection = connector.open(server, timeout)) {
                open.set(connection);
                var remaining = Duration.ofNanos(Math.max(1, deadline - _ticker.read()));
                return DnsMessages.parseResponse(query, connection.exchange(query.toWire(), remaining));
            }
        });

        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            var latencyMicros = elapsedMicros(start);
            Logger.debug("Server {} answered the test query in {} us", server.name(), latencyMicros);
            return ServerTestResult.succeeded(server, latencyMicros);
        } catch (TimeoutException e) {
            abort(future, open);
            Logger.debug("Server {} did not answer the test query within {} ms", server.name(), timeout.toMillis());
            return ServerTestResult.failed(server, elapsedMicros(start), ErrorKind.RESOLUTION_TIMEOUT);
        } catch (InterruptedException e) {
            abort(future, open);
            Thread.currentThread().interrupt();
            return ServerTestResult.failed(server, elapsedMicros(start), ErrorKind.RESOLUTION_FAILURE);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            Logger.debug("Server {} failed the test query: {}", server.name(), cause.getClass().getSimpleName());
            var kind = cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException
                    ? ErrorKind.RESOLUTION_TIMEOUT
                    : ErrorKind.RESOLUTION_FAILURE;
            return ServerTestResult.failed(server, elapsedMicros(start), kind);
        }
    }

    private long elapsedMicros(long start) {
        return TimeUnit.NANOSECONDS.toMicros(_ticker.read() - start);
    }

    private static void abort(Future<?> future, AtomicReference<UpstreamConnection> open) {
        future.cancel(true);
        var connection = open.get();
        if (connection != null)
            connection.abort();
    }
}
