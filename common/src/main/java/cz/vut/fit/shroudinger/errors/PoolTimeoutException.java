package cz.vut.fit.shroudinger.errors;

/**
 * No pooled connection became available within the acquire timeout.
 */
public class PoolTimeoutException extends ShroudingerException {
    public PoolTimeoutException(String serverName) {
        super(ErrorKind.RESOLUTION_TIMEOUT, "No connection available for server " + serverName, null, false);
    }
}
