package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.discord.json.PayloadCodec;
import com.github.anirbanmu.discorder.log.Log;
import java.util.function.DoubleSupplier;

// https://discord.com/developers/docs/topics/gateway#sending-heartbeats
// every beat, not only the first, sleeps interval * jitter with jitter in [0, 1).
final class HeartbeatWorker implements Runnable {
    private final SessionTracker tracker;
    private final PayloadCodec codec;
    private final DoubleSupplier jitter;

    HeartbeatWorker(SessionTracker tracker, PayloadCodec codec, DoubleSupplier jitter) {
        this.tracker = tracker;
        this.codec = codec;
        this.jitter = jitter;
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                long seq = tracker.sequence();
                tracker.socket().send(codec.heartbeat(seq));

                long nap = (long) (tracker.heartbeatIntervalMs() * jitter.getAsDouble());
                Log.info("heartbeat.sent", "attempt", tracker.attempt(), "seq", seq, "nap_ms", nap);
                Thread.sleep(nap);
            }
            Log.info("heartbeat.stopped", "attempt", tracker.attempt());
        } catch (InterruptedException ex) {
            Log.info("heartbeat.stopped", "attempt", tracker.attempt());
        } catch (Exception ex) {
            // no self-restart; the doctor notices and the supervise loop recovers
            Log.error("heartbeat.error", ex, "attempt", tracker.attempt());
        }
    }
}
