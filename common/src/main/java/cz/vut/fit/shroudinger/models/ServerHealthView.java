package cz.vut.fit.shroudinger.models;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * A read-only view of the health of one upstream server.
 *
 * @param sinceLastTransition The time since the circuit last changed state, or null if it never left the initial
 *                            closed state.
 */
public record ServerHealthView(String name,
                               Protocol protocol,
                               CircuitState state,
                               int consecutiveFailures,
                               long latencyMicros,
                               @Nullable Duration sinceLastTransition) {
}
