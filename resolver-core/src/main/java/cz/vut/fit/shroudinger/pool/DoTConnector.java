package cz.vut.fit.shroudinger.pool;

import com.google.common.net.InetAddresses;
import cz.vut.fit.shroudinger.Common;
import cz.vut.fit.shroudinger.models.ServerConfig;
import org.jetbrains.annotations.NotNull;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.*;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

/**
 * Opens DNS-over-TLS connections (RFC 7858). Messages are framed with a two-byte length prefix.
 * The server certificate is verified against the configured TLS host name.
 */
public class DoTConnector implements UpstreamConnector {
    public static final String COMPONENT_NAME = "dot-connector";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(DoTConnector.class);

    private static final String[] PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    private final SSLSocketFactory _socketFactory;

    public DoTConnector() {
        this((SSLSocketFactory) SSLSocketFactory.getDefault());
    }

    public DoTConnector(@NotNull SSLSocketFactory socketFactory) {
        _socketFactory = socketFactory;
    }

    @Override
    public @NotNull UpstreamConnection open(@NotNull ServerConfig server, @NotNull Duration connectTimeout)
            throws IOException {
        var socket = (SSLSocket) _socketFactory.createSocket();
        try {
            var parameters = socket.getSSLParameters();
            parameters.setProtocols(PROTOCOLS);
            parameters.setEndpointIdentificationAlgorithm("HTTPS");
            if (!InetAddresses.isInetAddress(server.hostname()))
                parameters.setServerNames(List.of(new SNIHostName(server.hostname())));
            socket.setSSLParameters(parameters);

            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(server.address(), server.port()), (int) connectTimeout.toMillis());
            socket.setSoTimeout((int) connectTimeout.toMillis());
            socket.startHandshake();
            return new DoTConnection(socket);
        } catch (IOException | RuntimeException e) {
            socket.close();
            throw e;
        }
    }

    static final class DoTConnection implements UpstreamConnection {
        private final SSLSocket _socket;
        private final DataInputStream _input;
        private final DataOutputStream _output;

        DoTConnection(SSLSocket socket) throws IOException {
            _socket = socket;
            _input = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            _output = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        }

        @Override
        public synchronized byte @NotNull [] exchange(byte @NotNull [] query, @NotNull Duration timeout)
                throws IOException {
            if (query.length > 0xFFFF)
                throw new IOException("Query too large");

            _socket.setSoTimeout((int) Math.max(1, timeout.toMillis()));
            _output.writeShort(query.length);
            _output.write(query);
            _output.flush();

            var length = _input.readUnsignedShort();
            var response = new byte[length];
            _input.readFully(response);
            return response;
        }

        @Override
        public boolean isOpen() {
            return !_socket.isClosed() && _socket.isConnected();
        }

        @Override
        public void abort() {
            close();
        }

        @Override
        public void close() {
            try {
                _socket.close();
            } catch (IOException e) {
                Logger.debug("Error while closing a DoT socket: {}", e.getMessage());
            }
        }
    }
}
