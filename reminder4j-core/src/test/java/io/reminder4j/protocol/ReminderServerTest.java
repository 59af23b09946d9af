package io.reminder4j.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.reminder4j.core.ClockType;
import io.reminder4j.core.SchedulerOptions;
import io.reminder4j.core.Task;
import io.reminder4j.internal.DefaultReminderScheduler;
import io.reminder4j.internal.InMemoryTaskStore;
import io.reminder4j.notify.LoggingNotifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReminderServerTest {

    private final ObjectMapper objectMapper = ProtocolMapper.create();
    private DefaultReminderScheduler scheduler;
    private ReminderServer server;
    private ReminderClient client;

    @BeforeEach
    void setUp() throws Exception {
        InMemoryTaskStore store = new InMemoryTaskStore();
        scheduler = new DefaultReminderScheduler(
                SchedulerOptions.defaults().withUtcOffset(ZoneOffset.UTC),
                new LoggingNotifier(),
                store.removalListener());
        ReminderService service = new ReminderService(scheduler, store);

        InetAddress loopback = InetAddress.getLoopbackAddress();
        server = new ReminderServer(service, objectMapper, new InetSocketAddress(loopback, 0), Duration.ofSeconds(2));
        server.start();
        client = new ReminderClient(objectMapper, new InetSocketAddress(loopback, server.getPort()), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.close();
        scheduler.close();
    }

    @Test
    void addShowAndCancelOverTheWire() throws Exception {
        Response added = client.send(new Request.Add("stretch", new ClockType.Period(Duration.ofMinutes(30)), null, null));
        String taskId = assertInstanceOf(Response.AddSuccess.class, added).taskId();

        Response.GetTasks listed = assertInstanceOf(Response.GetTasks.class, client.send(new Request.Show()));
        assertEquals(1, listed.tasks().size());
        Task task = listed.tasks().get(0);
        assertEquals(taskId, task.taskId());
        assertEquals(new ClockType.Period(Duration.ofMinutes(30)), task.clockType());

        assertEquals(new Response.RemoveSuccess(taskId), client.send(new Request.Cancel(taskId)));
        assertInstanceOf(Response.Fail.class, client.send(new Request.Cancel(taskId)));
    }

    @Test
    void finishedOnceTasksDisappearFromTheListing() throws Exception {
        client.send(new Request.Add("past", new ClockType.Once(Instant.now().minusSeconds(5)), null, null));

        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        boolean empty = false;
        while (!empty && System.nanoTime() < deadline) {
            Response.GetTasks listed = (Response.GetTasks) client.send(new Request.Show());
            empty = listed.tasks().isEmpty();
            Thread.sleep(50);
        }
        assertTrue(empty);
    }

    @Test
    void malformedRequestGetsFail() throws Exception {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getPort())) {
            OutputStream out = socket.getOutputStream();
            out.write("{\"type\":\"launch-rockets\"}".getBytes(StandardCharsets.UTF_8));
            out.flush();
            socket.shutdownOutput();

            InputStream in = socket.getInputStream();
            Response response = objectMapper.readValue(in, Response.class);
            assertInstanceOf(Response.Fail.class, response);
        }
    }

    @Test
    void rejectsInvalidClockRulesOnTheWire() throws Exception {
        String payload = "{\"type\":\"add\",\"description\":\"x\",\"clockType\":{\"kind\":\"oncePerDay\",\"hour\":25,\"minute\":0}}";
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getPort())) {
            socket.getOutputStream().write(payload.getBytes(StandardCharsets.UTF_8));
            socket.shutdownOutput();

            Response response = objectMapper.readValue(socket.getInputStream(), Response.class);
            assertInstanceOf(Response.Fail.class, response);
        }
    }
}
