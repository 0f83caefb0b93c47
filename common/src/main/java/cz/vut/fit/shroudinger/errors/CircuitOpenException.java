package cz.vut.fit.shroudinger.errors;

/**
 * The circuit of the requested server does not currently admit requests.
 */
public class CircuitOpenException extends ShroudingerException {
    public CircuitOpenException(String serverName) {
        super(ErrorKind.RESOLUTION_FAILURE, "Circuit open for server " + serverName, null, false);
    }
}
