package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.discord.json.GatewayEvent;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

// shared state of one connection attempt, never reused across attempts. the processor is the
// only writer of the sequence; worker handles are cleared only by WorkerCanceller.
public final class SessionTracker {
    public static final int EVENT_QUEUE_CAPACITY = 100;
    public static final long NO_SEQUENCE = -1;

    private final int attempt;
    private final GatewaySocket socket;
    private final long heartbeatIntervalMs;
    private final CompletableFuture<Void> completion;
    private final BlockingQueue<GatewayEvent> events = new ArrayBlockingQueue<>(EVENT_QUEUE_CAPACITY);
    private final AtomicBoolean terminateRequested = new AtomicBoolean(false);

    private volatile long sequence = NO_SEQUENCE;
    private volatile boolean ready;

    private volatile Worker heartbeat;
    private volatile Worker processor;
    private volatile Worker doctor;

    public SessionTracker(int attempt, GatewaySocket socket, long heartbeatIntervalMs, CompletableFuture<Void> completion) {
        if (heartbeatIntervalMs <= 0) {
            throw new IllegalArgumentException("heartbeat interval must be positive: " + heartbeatIntervalMs);
        }
        this.attempt = attempt;
        this.socket = socket;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.completion = completion;
    }

    public int attempt() {
        return attempt;
    }

    public GatewaySocket socket() {
        return socket;
    }

    public long heartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    // NO_SEQUENCE until the first sequenced frame arrives
    public long sequence() {
        return sequence;
    }

    void updateSequence(long seq) {
        sequence = seq;
    }

    public boolean isReady() {
        return ready;
    }

    void markReady() {
        ready = true;
    }

    public boolean isTerminateRequested() {
        return terminateRequested.get();
    }

    // true only for the first caller
    boolean requestTermination() {
        return terminateRequested.compareAndSet(false, true);
    }

    public boolean isConnected() {
        return socket.isOpen();
    }

    public Worker worker(WorkerKind kind) {
        return switch (kind) {
            case HEARTBEAT -> heartbeat;
            case PROCESSOR -> processor;
            case DOCTOR -> doctor;
        };
    }

    void setWorker(WorkerKind kind, Worker worker) {
        switch (kind) {
            case HEARTBEAT -> heartbeat = worker;
            case PROCESSOR -> processor = worker;
            case DOCTOR -> doctor = worker;
        }
    }

    void clearWorker(WorkerKind kind) {
        setWorker(kind, null);
    }

    // started and not yet finished. a cleared handle is not running.
    public boolean isWorkerRunning(WorkerKind kind) {
        Worker w = worker(kind);
        return w != null && w.isRunning();
    }

    // decoded events in arrival order. a fresh queue exists per attempt.
    public BlockingQueue<GatewayEvent> events() {
        return events;
    }

    public Optional<GatewayEvent> nextEvent(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(events.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    // nothing more will ever be queued and nothing is left to take
    public boolean isDrained() {
        return !isWorkerRunning(WorkerKind.PROCESSOR) && events.isEmpty();
    }

    // completes once heartbeat and processor have stopped and the socket is closed
    public CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return "SessionTracker[attempt=" + attempt
            + ", seq=" + sequence
            + ", ready=" + ready
            + ", terminate=" + terminateRequested.get()
            + ", heartbeat=" + heartbeat
            + ", processor=" + processor
            + ", doctor=" + doctor + "]";
    }
}
