package io.reminder4j.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * Sends one {@link Request} to a {@link ReminderServer} and reads its {@link Response}.
 */
public class ReminderClient {

    private final ObjectMapper objectMapper;
    private final InetSocketAddress daemonAddress;
    private final Duration timeout;

    public ReminderClient(ObjectMapper objectMapper, InetSocketAddress daemonAddress, Duration timeout) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.daemonAddress = Objects.requireNonNull(daemonAddress, "daemonAddress must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public Response send(Request request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        try (Socket socket = new Socket()) {
            socket.connect(daemonAddress, (int) timeout.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());

            OutputStream out = socket.getOutputStream();
            objectMapper.writeValue(out, request);
            out.flush();
            socket.shutdownOutput();

            return objectMapper.readValue(socket.getInputStream(), Response.class);
        }
    }
}
