package io.reminder4j.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daemon endpoint: one JSON {@link Request} per connection, answered by one JSON
 * {@link Response}. Connections are served one at a time on the acceptor thread.
 */
public class ReminderServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReminderServer.class);

    private final ReminderService service;
    private final ObjectMapper objectMapper;
    private final InetSocketAddress bindAddress;
    private final Duration readTimeout;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ServerSocket serverSocket;
    private Thread acceptorThread;

    public ReminderServer(ReminderService service, ObjectMapper objectMapper, InetSocketAddress bindAddress, Duration readTimeout) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress must not be null");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout must not be null");
    }

    /**
     * Bind and start accepting. Idempotent.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        try {
            socket.bind(bindAddress);
        } catch (IOException e) {
            started.set(false);
            socket.close();
            throw e;
        }
        serverSocket = socket;

        acceptorThread = new Thread(this::acceptLoop);
        acceptorThread.setName("reminder.server");
        acceptorThread.setDaemon(true);
        acceptorThread.start();
        log.info("Reminder server listening on {}", socket.getLocalSocketAddress());
    }

    /**
     * Port actually bound, useful when started on port 0.
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("server is not started");
        }
        return socket.getLocalPort();
    }

    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Reminder server stopping...");
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("fail to close server socket msg={}", e.getMessage());
        }
        if (acceptorThread != null) {
            acceptorThread.interrupt();
            acceptorThread = null;
        }
        log.info("Reminder server stopped.");
    }

    private void acceptLoop() {
        while (started.get()) {
            try (Socket client = serverSocket.accept()) {
                client.setSoTimeout((int) readTimeout.toMillis());
                serve(client);
            } catch (SocketException e) {
                if (started.get()) {
                    log.error("reminder server socket failed msg={}", e.getMessage(), e);
                }
            } catch (IOException e) {
                log.error("reminder server connection failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void serve(Socket client) throws IOException {
        InputStream in = client.getInputStream();
        OutputStream out = client.getOutputStream();

        Response response;
        try {
            Request request = objectMapper.readValue(in, Request.class);
            log.debug("received request {} from {}", request, client.getRemoteSocketAddress());
            response = service.handle(request);
        } catch (JsonProcessingException e) {
            log.warn("malformed request from {} msg={}", client.getRemoteSocketAddress(), e.getOriginalMessage());
            response = new Response.Fail("malformed request: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("fail to handle request msg={}", e.getMessage(), e);
            response = new Response.Fail(String.valueOf(e.getMessage()));
        }

        objectMapper.writeValue(out, response);
        out.flush();
    }
}
