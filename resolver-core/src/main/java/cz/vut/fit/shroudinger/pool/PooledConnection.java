package cz.vut.fit.shroudinger.pool;

import com.google.common.base.Ticker;
import cz.vut.fit.shroudinger.models.Protocol;
import cz.vut.fit.shroudinger.models.ServerConfig;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection owned by the {@link ConnectionPool}. Between {@link ConnectionPool#acquire} and
 * {@link ConnectionPool#release} it is used by exactly one caller.
 */
public final class PooledConnection {
    private final ServerConfig _server;
    private final Protocol _protocol;
    private final UpstreamConnection _connection;
    private final Ticker _ticker;
    private final AtomicBoolean _inUse = new AtomicBoolean();

    private volatile long _lastUsedNanos;
    private volatile long _lastLatencyNanos;
    private volatile CircuitBreaker.Permit _permit = CircuitBreaker.Permit.REGULAR;

    PooledConnection(@NotNull ServerConfig server, @NotNull Protocol protocol,
                     @NotNull UpstreamConnection connection, @NotNull Ticker ticker) {
        _server = server;
        _protocol = protocol;
        _connection = connection;
        _ticker = ticker;
        _lastUsedNanos = ticker.read();
    }

    /**
     * Sends the query and measures the round trip.
     */
    public byte @NotNull [] exchange(byte @NotNull [] query, @NotNull Duration timeout) throws IOException {
        var start = _ticker.read();
        var response = _connection.exchange(query, timeout);
        _lastLatencyNanos = _ticker.read() - start;
        return response;
    }

    /**
     * Closes the underlying connection, possibly while another thread is blocked in {@link #exchange}.
     */
    public void abort() {
        _connection.abort();
    }

    public ServerConfig server() {
        return _server;
    }

    public Protocol protocol() {
        return _protocol;
    }

    boolean markAcquired(@NotNull CircuitBreaker.Permit permit) {
        _lastLatencyNanos = 0;
        _permit = permit;
        return _inUse.compareAndSet(false, true);
    }

    /**
     * @return The circuit breaker permit under which the current holder uses the connection.
     */
    CircuitBreaker.Permit permit() {
        return _permit;
    }

    boolean markReleased() {
        if (!_inUse.compareAndSet(true, false))
            return false;
        _lastUsedNanos = _ticker.read();
        return true;
    }

    boolean isUsable(long nowNanos, long idleTimeoutNanos) {
        return _connection.isOpen() && nowNanos - _lastUsedNanos < idleTimeoutNanos;
    }

    long lastLatencyNanos() {
        return _lastLatencyNanos;
    }

    void close() {
        _connection.close();
    }
}
