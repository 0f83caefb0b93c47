package cz.vut.fit.shroudinger.pool;

import cz.vut.fit.shroudinger.models.ServerConfig;
import cz.vut.fit.shroudinger.models.ServerHealthView;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The circuit breaker of a server together with a moving average of its response latency.
 */
public class ServerHealth {
    // Weight of the newest sample in the exponential moving average, in 1/8
    private static final int EWMA_NEW_SAMPLE_WEIGHT = 2;

    private final ServerConfig _server;
    private final CircuitBreaker _breaker;
    private final AtomicLong _latencyNanos = new AtomicLong();

    public ServerHealth(@NotNull ServerConfig server, @NotNull CircuitBreaker breaker) {
        _server = server;
        _breaker = breaker;
    }

    public void onSuccess(@NotNull CircuitBreaker.Permit permit, long latencyNanos) {
        _breaker.onSuccess(permit);
        recordLatency(latencyNanos);
    }

    public void onFailure(@NotNull CircuitBreaker.Permit permit) {
        _breaker.onFailure(permit);
    }

    /**
     * Adds a latency sample without reporting an outcome to the circuit breaker.
     */
    public void recordLatency(long latencyNanos) {
        if (latencyNanos > 0) {
            _latencyNanos.updateAndGet(previous -> previous == 0
                    ? latencyNanos
                    : (previous * (8 - EWMA_NEW_SAMPLE_WEIGHT) + latencyNanos * EWMA_NEW_SAMPLE_WEIGHT) / 8);
        }
    }

    public CircuitBreaker breaker() {
        return _breaker;
    }

    public ServerConfig server() {
        return _server;
    }

    public long latencyMicros() {
        return _latencyNanos.get() / 1000;
    }

    public ServerHealthView view() {
        return new ServerHealthView(_server.name(), _server.protocol(), _breaker.state(),
                _breaker.consecutiveFailures(), latencyMicros(), _breaker.sinceLastTransition());
    }
}
