package cz.vut.fit.shroudinger.errors;

/**
 * Structured error kinds reported by the resolver core. None of them carries query content.
 */
public enum ErrorKind {
    /**
     * Malformed domain name, query type or other input. Rejected immediately.
     */
    VALIDATION,
    /**
     * A blocklist source could not be fetched or parsed. Isolated to that source.
     */
    SOURCE_FETCH,
    /**
     * The deadline expired before an upstream server answered.
     */
    RESOLUTION_TIMEOUT,
    /**
     * All eligible upstream servers were exhausted or all of them are open-circuited.
     */
    RESOLUTION_FAILURE,
    /**
     * A cache or a pool reached its capacity. Handled by eviction or by waiting for a slot.
     */
    CAPACITY_EXCEEDED,
    /**
     * No snapshot has been published yet.
     */
    NOT_READY,
    /**
     * Invalid core configuration.
     */
    CONFIGURATION
}
