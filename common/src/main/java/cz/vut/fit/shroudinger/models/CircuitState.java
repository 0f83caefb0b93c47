package cz.vut.fit.shroudinger.models;

/**
 * The health state of an upstream server.
 */
public enum CircuitState {
    /**
     * Healthy, requests are routed normally.
     */
    CLOSED,
    /**
     * Failing, no requests are routed until the cool-down elapses.
     */
    OPEN,
    /**
     * Cooled down, a single trial request decides the next state.
     */
    HALF_OPEN
}
