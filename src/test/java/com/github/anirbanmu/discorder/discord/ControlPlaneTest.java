package com.github.anirbanmu.discorder.discord;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.discorder.config.ControlPlaneTimings;
import com.github.anirbanmu.discorder.config.DiscorderConfig;
import com.github.anirbanmu.discorder.config.MissingCredentialsException;
import com.github.anirbanmu.discorder.discord.json.GatewayEvent;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ControlPlaneTest {
    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String BASE_URL = "wss://gateway.test";

    // hands out prepared sockets in order, fails once they run out
    private static final class ScriptedConnector implements SocketConnector {
        final BlockingQueue<FakeGatewaySocket> sockets = new LinkedBlockingQueue<>();
        final List<String> urls = new CopyOnWriteArrayList<>();

        ScriptedConnector(FakeGatewaySocket... prepared) {
            sockets.addAll(List.of(prepared));
        }

        @Override
        public GatewaySocket connect(String url) throws IOException {
            urls.add(url);
            FakeGatewaySocket next = sockets.poll();
            if (next == null) {
                throw new IOException("connection refused");
            }
            return next;
        }
    }

    private static ControlPlane controlPlane(SocketConnector connector) {
        return controlPlane(connector, () -> "secret-token");
    }

    private static ControlPlane controlPlane(SocketConnector connector, Supplier<String> token) {
        return new ControlPlane(TestTimings.CONFIG, () -> BASE_URL, connector, token, () -> 0.5);
    }

    private static void awaitCondition(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    private static Thread startLoop(ControlPlane controlPlane, AtomicReference<Throwable> failure) {
        Thread loop = new Thread(() -> {
            try {
                controlPlane.run();
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "test-loop");
        loop.start();
        return loop;
    }

    @Test
    void identifyIsSentBeforeAnyHeartbeat() throws Exception {
        FakeGatewaySocket socket = new FakeGatewaySocket(FakeGatewaySocket.HELLO);
        ScriptedConnector connector = new ScriptedConnector(socket);
        ControlPlane controlPlane = controlPlane(connector);

        AttemptResult result = controlPlane.startControlPlane();

        AttemptResult.Started started = assertInstanceOf(AttemptResult.Started.class, result);
        SessionTracker tracker = started.tracker();
        assertTrue(tracker.isReady());
        assertEquals(41250, tracker.heartbeatIntervalMs());
        assertEquals(BASE_URL + "?v=10&encoding=json", connector.urls.get(0));

        String identify = socket.awaitSent(WAIT);
        assertTrue(identify.startsWith("{\"op\":2,\"d\":{"), identify);
        assertTrue(identify.contains("\"token\":\"secret-token\""), identify);
        assertTrue(identify.contains("\"intents\":513"), identify);
        assertTrue(identify.contains("\"os\":\"linux\""), identify);
        assertTrue(identify.contains("\"browser\":\"discorder\""), identify);
        assertEquals("{\"op\":1,\"d\":null}", socket.awaitSent(WAIT));

        controlPlane.shutdown(tracker);
        tracker.completion().get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertTrue(socket.wasClosed());
    }

    @Test
    void readyOnlyAfterBothWorkersScheduled() throws Exception {
        ControlPlane controlPlane = controlPlane(new ScriptedConnector(new FakeGatewaySocket(FakeGatewaySocket.HELLO)));

        SessionTracker tracker = ((AttemptResult.Started) controlPlane.startControlPlane()).tracker();

        assertTrue(tracker.isReady());
        assertTrue(tracker.worker(WorkerKind.HEARTBEAT).isScheduled());
        assertTrue(tracker.worker(WorkerKind.PROCESSOR).isScheduled());
        assertTrue(tracker.worker(WorkerKind.DOCTOR).isScheduled());

        controlPlane.shutdown(tracker);
    }

    @Test
    void dispatchUpdatesSequenceAndQueuesOneEvent() throws Exception {
        FakeGatewaySocket socket = new FakeGatewaySocket(FakeGatewaySocket.HELLO,
            "{\"op\":0,\"s\":3,\"t\":\"MESSAGE_CREATE\",\"d\":{\"id\":\"m1\",\"channel_id\":\"c1\",\"content\":\"hello\"}}");
        ControlPlane controlPlane = controlPlane(new ScriptedConnector(socket));

        SessionTracker tracker = ((AttemptResult.Started) controlPlane.startControlPlane()).tracker();

        GatewayEvent event = tracker.nextEvent(WAIT).orElseThrow();
        assertEquals("MESSAGE_CREATE", event.name());
        assertEquals(3, tracker.sequence());
        assertTrue(tracker.nextEvent(Duration.ofMillis(100)).isEmpty());

        controlPlane.shutdown(tracker);
    }

    @Test
    void emptyFirstFrameFailsAttempt() {
        FakeGatewaySocket socket = new FakeGatewaySocket("");
        ControlPlane controlPlane = controlPlane(new ScriptedConnector(socket));

        AttemptResult result = controlPlane.startControlPlane();

        AttemptResult.Failed failed = assertInstanceOf(AttemptResult.Failed.class, result);
        assertInstanceOf(GatewayException.class, failed.cause());
        assertTrue(socket.wasClosed());
        assertTrue(socket.sentFrames().isEmpty());
        assertNull(controlPlane.current());
    }

    @Test
    void wrongFirstOpcodeFailsAttempt() {
        FakeGatewaySocket socket = new FakeGatewaySocket("{\"op\":11}");
        ControlPlane controlPlane = controlPlane(new ScriptedConnector(socket));

        AttemptResult.Failed failed = assertInstanceOf(AttemptResult.Failed.class, controlPlane.startControlPlane());

        GatewayException ex = assertInstanceOf(GatewayException.class, failed.cause());
        assertTrue(ex.getMessage().contains("HEARTBEAT_ACK"), ex.getMessage());
        assertTrue(socket.sentFrames().isEmpty());
    }

    @Test
    void transportFailureFailsAttempt() {
        ControlPlane controlPlane = controlPlane(new ScriptedConnector());

        AttemptResult.Failed failed = assertInstanceOf(AttemptResult.Failed.class, controlPlane.startControlPlane());

        assertInstanceOf(IOException.class, failed.cause());
        assertEquals(1, failed.attempt());
    }

    @Test
    void urlLookupFailureFailsAttempt() {
        ControlPlane controlPlane = new ControlPlane(TestTimings.CONFIG,
            () -> {
                throw new IOException("lookup failed");
            },
            new ScriptedConnector(), () -> "token", () -> 0.5);

        AttemptResult.Failed failed = assertInstanceOf(AttemptResult.Failed.class, controlPlane.startControlPlane());
        assertEquals("lookup failed", failed.cause().getMessage());
    }

    @Test
    void silentGatewayTimesOutWaitingForHello() {
        FakeGatewaySocket socket = new FakeGatewaySocket();
        ControlPlane controlPlane = controlPlane(new ScriptedConnector(socket));

        AttemptResult.Failed failed = assertInstanceOf(AttemptResult.Failed.class, controlPlane.startControlPlane());

        GatewayException ex = assertInstanceOf(GatewayException.class, failed.cause());
        assertTrue(ex.getMessage().startsWith("No hello within"), ex.getMessage());
        assertTrue(socket.wasClosed());
        assertTrue(socket.sentFrames().isEmpty());
    }

    @Test
    void silentGatewayIsRetried() throws Exception {
        FakeGatewaySocket silent = new FakeGatewaySocket();
        ScriptedConnector connector = new ScriptedConnector(silent, new FakeGatewaySocket(FakeGatewaySocket.HELLO));
        ControlPlane controlPlane = controlPlane(connector);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);

        awaitCondition(() -> controlPlane.current() != null && controlPlane.current().isReady(), "silent gateway was not retried");
        assertEquals(2, controlPlane.current().attempt());
        assertTrue(silent.wasClosed());

        controlPlane.shutdown();
        loop.join(WAIT.toMillis());
        assertFalse(loop.isAlive());
        assertNull(failure.get());
    }

    @Test
    void shutdownDuringHandshakeEndsLoop() throws Exception {
        // hello timeout is long enough that only shutdown() can end this attempt in time
        ControlPlaneTimings slowHello = new ControlPlaneTimings(
            TestTimings.FAST.doctorPollInterval(),
            TestTimings.FAST.doctorGracePeriod(),
            TestTimings.FAST.stopTimeout(),
            TestTimings.FAST.stopPollInterval(),
            TestTimings.FAST.scheduleTimeout(),
            Duration.ofMinutes(5),
            TestTimings.FAST.reconnectBaseDelay(),
            TestTimings.FAST.reconnectMaxDelay());
        DiscorderConfig config = new DiscorderConfig(TestTimings.GATEWAY, slowHello, Level.INFO);
        FakeGatewaySocket silent = new FakeGatewaySocket();
        ScriptedConnector connector = new ScriptedConnector(silent, new FakeGatewaySocket(FakeGatewaySocket.HELLO));
        ControlPlane controlPlane = new ControlPlane(config, () -> BASE_URL, connector, () -> "token", () -> 0.5);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);
        awaitCondition(() -> connector.urls.size() == 1, "attempt never connected");
        Thread.sleep(100);

        controlPlane.shutdown();
        loop.join(WAIT.toMillis());

        assertFalse(loop.isAlive(), "run() still blocked in handshake after shutdown()");
        assertNull(failure.get());
        assertTrue(silent.wasClosed());
        assertEquals(1, connector.urls.size());
        assertNull(controlPlane.current());
    }

    @Test
    void missingTokenEndsLoop() throws Exception {
        FakeGatewaySocket socket = new FakeGatewaySocket(FakeGatewaySocket.HELLO);
        ScriptedConnector connector = new ScriptedConnector(socket, new FakeGatewaySocket(FakeGatewaySocket.HELLO));
        ControlPlane controlPlane = controlPlane(connector, () -> {
            throw new MissingCredentialsException("no token");
        });

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);
        loop.join(WAIT.toMillis());

        assertFalse(loop.isAlive());
        assertInstanceOf(MissingCredentialsException.class, failure.get());
        assertEquals(1, connector.urls.size());
        assertTrue(socket.wasClosed());
        assertTrue(controlPlane.isTerminated());
    }

    @Test
    void emptyFrameMidSessionRestartsWithFreshTracker() throws Exception {
        FakeGatewaySocket first = new FakeGatewaySocket(FakeGatewaySocket.HELLO);
        FakeGatewaySocket second = new FakeGatewaySocket(FakeGatewaySocket.HELLO);
        ScriptedConnector connector = new ScriptedConnector(first, second);
        ControlPlane controlPlane = controlPlane(connector);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);

        awaitCondition(() -> controlPlane.current() != null && controlPlane.current().isReady(), "first attempt never came up");
        SessionTracker firstTracker = controlPlane.current();
        first.push("");

        awaitCondition(() -> controlPlane.current() != firstTracker && controlPlane.current() != null, "no new attempt was started");
        SessionTracker secondTracker = controlPlane.current();
        assertEquals(2, secondTracker.attempt());
        assertEquals(SessionTracker.NO_SEQUENCE, secondTracker.sequence());
        assertTrue(firstTracker.completion().isDone());
        assertTrue(first.wasClosed());
        assertFalse(firstTracker.isWorkerRunning(WorkerKind.HEARTBEAT));

        controlPlane.shutdown();
        loop.join(WAIT.toMillis());
        assertFalse(loop.isAlive());
        assertNull(failure.get());
    }

    @Test
    void shutdownStopsSessionWithoutRestart() throws Exception {
        FakeGatewaySocket socket = new FakeGatewaySocket(FakeGatewaySocket.HELLO);
        ScriptedConnector connector = new ScriptedConnector(socket, new FakeGatewaySocket(FakeGatewaySocket.HELLO));
        ControlPlane controlPlane = controlPlane(connector);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);
        awaitCondition(() -> controlPlane.current() != null && controlPlane.current().isReady(), "attempt never came up");
        SessionTracker tracker = controlPlane.current();

        controlPlane.shutdown(tracker);

        assertTrue(tracker.isTerminateRequested());
        loop.join(WAIT.toMillis());
        assertFalse(loop.isAlive());
        assertNull(failure.get());
        assertEquals(1, connector.urls.size());
        assertNull(tracker.worker(WorkerKind.HEARTBEAT));
        assertNull(tracker.worker(WorkerKind.PROCESSOR));
        assertNull(tracker.worker(WorkerKind.DOCTOR));
        assertTrue(socket.wasClosed());
    }

    @Test
    void shutdownIsIdempotent() throws Exception {
        ScriptedConnector connector = new ScriptedConnector(
            new FakeGatewaySocket(FakeGatewaySocket.HELLO), new FakeGatewaySocket(FakeGatewaySocket.HELLO));
        ControlPlane controlPlane = controlPlane(connector);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);
        awaitCondition(() -> controlPlane.current() != null && controlPlane.current().isReady(), "attempt never came up");
        SessionTracker tracker = controlPlane.current();

        controlPlane.shutdown(tracker);
        controlPlane.shutdown(tracker);
        loop.join(WAIT.toMillis());

        assertFalse(loop.isAlive());
        assertNull(failure.get());
        assertEquals(1, connector.urls.size());
        assertTrue(tracker.isTerminateRequested());
    }

    @Test
    void shutdownBetweenFailedAttemptsEndsLoop() throws Exception {
        ScriptedConnector connector = new ScriptedConnector();
        ControlPlane controlPlane = controlPlane(connector);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = startLoop(controlPlane, failure);
        awaitCondition(() -> connector.urls.size() >= 2, "failed attempts were not retried");

        controlPlane.shutdown();
        loop.join(WAIT.toMillis());

        assertFalse(loop.isAlive());
        assertNull(failure.get());
        assertNull(controlPlane.current());
    }
}
