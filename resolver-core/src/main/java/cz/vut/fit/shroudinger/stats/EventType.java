package cz.vut.fit.shroudinger.stats;

public enum EventType {
    LOOKUP,
    BLOCKED,
    CACHE_HIT,
    CACHE_MISS,
    RESOLUTION_SUCCESS,
    RESOLUTION_FAILURE,
    RESOLUTION_TIMEOUT,
    VALIDATION_ERROR,
    CIRCUIT_TRANSITION,
    STAGE_LATENCY
}
