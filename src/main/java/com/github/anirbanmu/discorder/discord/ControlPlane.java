package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.config.ControlPlaneTimings;
import com.github.anirbanmu.discorder.config.DiscorderConfig;
import com.github.anirbanmu.discorder.config.GatewayConfig;
import com.github.anirbanmu.discorder.config.MissingCredentialsException;
import com.github.anirbanmu.discorder.discord.json.Envelope;
import com.github.anirbanmu.discorder.discord.json.GatewayOpcode;
import com.github.anirbanmu.discorder.discord.json.Hello;
import com.github.anirbanmu.discorder.discord.json.Identify;
import com.github.anirbanmu.discorder.discord.json.PayloadCodec;
import com.github.anirbanmu.discorder.log.Log;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

// brings up one attempt at a time (socket, hello, identify, heartbeat, processor, doctor) and
// restarts it whenever it winds down, until shutdown(). each attempt's supervisor runs on its
// own control-plane-N thread, owns the socket and closes it once heartbeat and processor stop.
public final class ControlPlane {
    private final GatewayConfig gateway;
    private final ControlPlaneTimings timings;
    private final GatewayUrlResolver urlResolver;
    private final SocketConnector connector;
    private final Supplier<String> token;
    private final DoubleSupplier jitter;
    private final PayloadCodec codec = new PayloadCodec();
    private final WorkerCanceller canceller;
    private final AtomicInteger attempts = new AtomicInteger();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile SessionTracker current;
    // socket of an attempt still in its handshake, so shutdown() can abort it
    private volatile GatewaySocket connecting;

    public ControlPlane(DiscorderConfig config, GatewayUrlResolver urlResolver, SocketConnector connector, Supplier<String> token) {
        this(config, urlResolver, connector, token, () -> ThreadLocalRandom.current().nextDouble());
    }

    ControlPlane(DiscorderConfig config, GatewayUrlResolver urlResolver, SocketConnector connector, Supplier<String> token, DoubleSupplier jitter) {
        this.gateway = config.gateway();
        this.timings = config.timings();
        this.urlResolver = urlResolver;
        this.connector = connector;
        this.token = token;
        this.jitter = jitter;
        this.canceller = new WorkerCanceller(timings);
    }

    // tracker of the latest attempt that got past the handshake, or null
    public SessionTracker current() {
        return current;
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    // blocks until shutdown() (or shutdown(tracker) on the current tracker) and the last attempt
    // has wound down. a missing token ends it with MissingCredentialsException, never retried.
    public void run() {
        int consecutive = 0;
        try {
            while (!isTerminated()) {
                Log.info("control_plane.new_attempt", "attempt", attempts.get() + 1);
                AttemptResult result = startControlPlane();

                if (result instanceof AttemptResult.Started started) {
                    SessionTracker tracker = started.tracker();
                    current = tracker;
                    if (isTerminated()) {
                        // shutdown() ran while this attempt was coming up
                        shutdown(tracker);
                    }
                    tracker.completion().join();
                    Log.info("control_plane.attempt_finished", "attempt", tracker.attempt(), "tracker", tracker);
                    if (tracker.isTerminateRequested()) {
                        break;
                    }
                    if (tracker.isReady()) {
                        consecutive = 0;
                    }
                } else if (result instanceof AttemptResult.Failed failed
                    && failed.cause() instanceof MissingCredentialsException missing) {
                    terminated.countDown();
                    throw missing;
                }

                consecutive++;
                Duration delay = timings.reconnectDelay(consecutive);
                Log.info("control_plane.restart_scheduled", "consecutive", consecutive, "delay_ms", delay.toMillis());
                if (terminated.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            Log.warn("control_plane.interrupted");
        }
        Log.info("control_plane.shut_down", "attempts", attempts.get());
    }

    // waits for the handshake, then for heartbeat and processor to be scheduled, marks the
    // tracker ready and launches the doctor
    public AttemptResult startControlPlane() {
        long start = System.nanoTime();
        AttemptResult result = runOneAttempt().join();
        if (!(result instanceof AttemptResult.Started started)) {
            return result;
        }

        SessionTracker tracker = started.tracker();
        try {
            boolean heartbeatUp = awaitScheduled(tracker, WorkerKind.HEARTBEAT);
            boolean processorUp = awaitScheduled(tracker, WorkerKind.PROCESSOR);
            if (heartbeatUp && processorUp) {
                tracker.markReady();
            }

            if (tracker.isTerminateRequested()) {
                Log.info("control_plane.doctor_skipped", "attempt", tracker.attempt());
                return result;
            }

            tracker.setWorker(WorkerKind.DOCTOR,
                Worker.start("doctor-" + tracker.attempt(), new Doctor(tracker, canceller, timings)));
            awaitScheduled(tracker, WorkerKind.DOCTOR);

            Log.info("control_plane.started", "attempt", tracker.attempt(), "ready", tracker.isReady(),
                "elapsed_ms", (System.nanoTime() - start) / 1_000_000);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            Log.warn("control_plane.bootstrap_interrupted", "attempt", tracker.attempt());
        }
        return result;
    }

    // the returned future fires exactly once: Started after identify was sent and the core
    // workers were launched, or Failed with whatever ended the attempt before that
    CompletableFuture<AttemptResult> runOneAttempt() {
        int attempt = attempts.incrementAndGet();
        CompletableFuture<AttemptResult> ready = new CompletableFuture<>();
        Thread supervisor = new Thread(() -> supervise(attempt, ready), "control-plane-" + attempt);
        supervisor.setDaemon(true);
        supervisor.start();
        return ready;
    }

    // request stop of the given attempt and no restart after it. safe to call repeatedly.
    public void shutdown(SessionTracker tracker) {
        if (tracker.requestTermination()) {
            Log.info("control_plane.shutdown_requested", "attempt", tracker.attempt());
        } else {
            Log.debug("control_plane.shutdown_repeated", "attempt", tracker.attempt());
        }
        canceller.stopSession(tracker);
        canceller.stopWorker(tracker, WorkerKind.DOCTOR);
    }

    // stops the loop, including while it is between attempts
    public void shutdown() {
        terminated.countDown();
        GatewaySocket pending = connecting;
        if (pending != null) {
            Log.info("control_plane.handshake_aborted");
            pending.close();
        }
        SessionTracker tracker = current;
        if (tracker != null) {
            shutdown(tracker);
        }
    }

    private void supervise(int attempt, CompletableFuture<AttemptResult> ready) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        GatewaySocket socket = null;
        Worker heartbeat;
        Worker processor;
        try {
            String url = gateway.connectionUrl(urlResolver.resolveGatewayUrl());
            Log.info("gateway.connecting", "attempt", attempt, "url", url);
            socket = connector.connect(url);
            connecting = socket;
            if (isTerminated()) {
                throw new GatewayException("Shut down while connecting");
            }

            SessionTracker tracker = handshake(attempt, socket, completion);
            sendIdentify(tracker);

            heartbeat = Worker.start("heartbeat-" + attempt, new HeartbeatWorker(tracker, codec, jitter));
            tracker.setWorker(WorkerKind.HEARTBEAT, heartbeat);
            processor = Worker.start("processor-" + attempt, new ProcessorWorker(tracker, codec));
            tracker.setWorker(WorkerKind.PROCESSOR, processor);

            connecting = null;
            ready.complete(new AttemptResult.Started(tracker));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail(attempt, ex, socket, ready, completion);
            return;
        } catch (Exception ex) {
            fail(attempt, ex, socket, ready, completion);
            return;
        }

        try {
            CompletableFuture.allOf(heartbeat.completion(), processor.completion()).join();
        } finally {
            socket.close();
            Log.info("control_plane.attempt_closed", "attempt", attempt);
            completion.complete(null);
        }
    }

    private SessionTracker handshake(int attempt, GatewaySocket socket, CompletableFuture<Void> completion) throws Exception {
        String frame = socket.read(timings.helloTimeout());
        if (frame == null) {
            throw new GatewayException("No hello within " + timings.helloTimeout().toMillis() + "ms");
        }
        if (frame.isEmpty()) {
            throw new GatewayException("No data was received");
        }

        Envelope envelope = codec.decode(frame);
        if (envelope.opcode() != GatewayOpcode.HELLO) {
            throw new GatewayException("Wrong opcode: " + envelope.opcode());
        }

        Hello hello = codec.decodeData(envelope.data(), Hello.class);
        if (hello.heartbeatInterval() <= 0) {
            throw new GatewayException("Invalid heartbeat interval: " + hello.heartbeatInterval());
        }
        Log.info("gateway.hello", "attempt", attempt, "interval_ms", hello.heartbeatInterval());
        return new SessionTracker(attempt, socket, hello.heartbeatInterval(), completion);
    }

    // https://discord.com/developers/docs/topics/gateway#identifying
    private void sendIdentify(SessionTracker tracker) throws Exception {
        Identify identify = Identify.create(token.get(), gateway);
        tracker.socket().send(codec.identify(identify));
        Log.info("gateway.identify_sent", "attempt", tracker.attempt(), "intents", gateway.intents());
    }

    private void fail(int attempt, Exception ex, GatewaySocket socket, CompletableFuture<AttemptResult> ready, CompletableFuture<Void> completion) {
        Log.error("control_plane.start_failed", ex, "attempt", attempt);
        connecting = null;
        if (socket != null) {
            socket.close();
        }
        completion.complete(null);
        ready.complete(new AttemptResult.Failed(attempt, ex));
    }

    private boolean awaitScheduled(SessionTracker tracker, WorkerKind kind) throws InterruptedException {
        Worker worker = tracker.worker(kind);
        if (worker == null) {
            Log.warn("control_plane.worker_missing", "attempt", tracker.attempt(), "worker", kind.label());
            return false;
        }
        long start = System.nanoTime();
        if (worker.awaitScheduled(timings.scheduleTimeout())) {
            Log.info("control_plane.worker_scheduled", "attempt", tracker.attempt(), "worker", kind.label(),
                "elapsed_us", (System.nanoTime() - start) / 1_000);
            return true;
        }
        Log.warn("control_plane.worker_never_scheduled", "attempt", tracker.attempt(), "worker", kind.label(),
            "timeout_ms", timings.scheduleTimeout().toMillis());
        return false;
    }
}
