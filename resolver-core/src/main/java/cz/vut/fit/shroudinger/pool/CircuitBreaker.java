package cz.vut.fit.shroudinger.pool;

import com.google.common.base.Ticker;
import cz.vut.fit.shroudinger.models.CircuitState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * The health state machine of one upstream server.
 * <ul>
 *     <li>{@code CLOSED}: requests flow. After {@code failureThreshold} consecutive failures the circuit opens.</li>
 *     <li>{@code OPEN}: requests are refused until the cool-down has elapsed, then the circuit becomes half-open.</li>
 *     <li>{@code HALF_OPEN}: exactly one trial request is admitted. Its success closes the circuit and resets the
 *     cool-down; its failure re-opens the circuit with the cool-down doubled, up to the maximum.</li>
 * </ul>
 * The transition from {@code OPEN} to {@code HALF_OPEN} happens when the first permit is requested after the
 * cool-down, so an idle server stays reported as open.
 * <p>
 * Every admitted request holds a {@link Permit} and reports its outcome with it. While the circuit is half-open
 * only the outcome of the {@link Permit#TRIAL} permit changes the state; requests admitted before the circuit
 * opened may still complete then and are ignored.
 */
public class CircuitBreaker {
    public enum Permit {
        REGULAR,
        TRIAL
    }

    private final Ticker _ticker;
    private final int _failureThreshold;
    private final long _baseCooldownNanos;
    private final long _maxCooldownNanos;
    private final Consumer<CircuitState> _transitionListener;

    private CircuitState _state = CircuitState.CLOSED;
    private int _consecutiveFailures;
    private long _openedAtNanos;
    private long _cooldownNanos;
    private boolean _trialInFlight;
    private boolean _transitioned;
    private long _lastTransitionNanos;

    public CircuitBreaker(int failureThreshold, @NotNull Duration cooldown, @NotNull Duration maxCooldown,
                          @NotNull Ticker ticker, @NotNull Consumer<CircuitState> transitionListener) {
        _ticker = ticker;
        _failureThreshold = Math.max(1, failureThreshold);
        _baseCooldownNanos = cooldown.toNanos();
        _maxCooldownNanos = Math.max(_baseCooldownNanos, maxCooldown.toNanos());
        _cooldownNanos = _baseCooldownNanos;
        _transitionListener = transitionListener;
    }

    /**
     * Asks for permission to send a request.
     *
     * @return The permit to report the outcome with, or null if the request must not be sent. In the half-open
     * state, only the first caller gets a permit and it is the trial.
     */
    public synchronized @Nullable Permit tryAcquirePermission() {
        switch (_state) {
            case CLOSED:
                return Permit.REGULAR;
            case OPEN:
                if (_ticker.read() - _openedAtNanos < _cooldownNanos)
                    return null;
                transitionTo(CircuitState.HALF_OPEN);
                _trialInFlight = true;
                return Permit.TRIAL;
            case HALF_OPEN:
            default:
                if (_trialInFlight)
                    return null;
                _trialInFlight = true;
                return Permit.TRIAL;
        }
    }

    /**
     * Gives back a permit whose request was never sent, e.g. because no pooled connection became free in time.
     */
    public synchronized void releasePermission(@NotNull Permit permit) {
        if (isTrial(permit))
            _trialInFlight = false;
    }

    public synchronized void onSuccess(@NotNull Permit permit) {
        switch (_state) {
            case CLOSED -> _consecutiveFailures = 0;
            case HALF_OPEN -> {
                if (!isTrial(permit))
                    return;
                _consecutiveFailures = 0;
                _cooldownNanos = _baseCooldownNanos;
                _trialInFlight = false;
                transitionTo(CircuitState.CLOSED);
            }
            case OPEN -> {
            }
        }
    }

    public synchronized void onFailure(@NotNull Permit permit) {
        switch (_state) {
            case CLOSED -> {
                _consecutiveFailures++;
                if (_consecutiveFailures >= _failureThreshold)
                    open();
            }
            case HALF_OPEN -> {
                if (!isTrial(permit))
                    return;
                _consecutiveFailures++;
                _cooldownNanos = Math.min(_cooldownNanos * 2, _maxCooldownNanos);
                _trialInFlight = false;
                open();
            }
            case OPEN -> {
            }
        }
    }

    private boolean isTrial(Permit permit) {
        return permit == Permit.TRIAL && _state == CircuitState.HALF_OPEN;
    }

    private void open() {
        _openedAtNanos = _ticker.read();
        transitionTo(CircuitState.OPEN);
    }

    private void transitionTo(CircuitState state) {
        _state = state;
        _transitioned = true;
        _lastTransitionNanos = _ticker.read();
        _transitionListener.accept(state);
    }

    public synchronized CircuitState state() {
        return _state;
    }

    /**
     * @return True if a permit would currently be granted.
     */
    public synchronized boolean isAvailable() {
        return switch (_state) {
            case CLOSED -> true;
            case OPEN -> _ticker.read() - _openedAtNanos >= _cooldownNanos;
            case HALF_OPEN -> !_trialInFlight;
        };
    }

    public synchronized int consecutiveFailures() {
        return _consecutiveFailures;
    }

    public synchronized Duration currentCooldown() {
        return Duration.ofNanos(_cooldownNanos);
    }

    /**
     * @return The time elapsed since the last state change, or null if the circuit has never left its initial
     * closed state.
     */
    public synchronized @Nullable Duration sinceLastTransition() {
        return _transitioned ? Duration.ofNanos(_ticker.read() - _lastTransitionNanos) : null;
    }
}
