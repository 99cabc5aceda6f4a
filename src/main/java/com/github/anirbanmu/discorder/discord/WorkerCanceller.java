package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.config.ControlPlaneTimings;
import com.github.anirbanmu.discorder.log.Log;

// cooperative cancellation of tracker workers. interrupts repeatedly until the worker
// reports completion or the stop budget runs out.
public final class WorkerCanceller {
    private final ControlPlaneTimings timings;

    public WorkerCanceller(ControlPlaneTimings timings) {
        this.timings = timings;
    }

    // true once the worker is gone and its handle cleared. false if it ignored cancellation for
    // the whole budget, in which case the handle stays in place.
    public boolean stopWorker(SessionTracker tracker, WorkerKind kind) {
        Worker worker = tracker.worker(kind);
        if (worker == null) {
            Log.info("worker.already_stopped", "attempt", tracker.attempt(), "worker", kind.label());
            return true;
        }

        Log.info("worker.stopping", "attempt", tracker.attempt(), "worker", kind.label());
        long deadline = System.nanoTime() + timings.stopTimeout().toNanos();
        try {
            do {
                worker.interrupt();
                if (worker.awaitDone(timings.stopPollInterval())) {
                    tracker.clearWorker(kind);
                    Log.info("worker.stopped", "attempt", tracker.attempt(), "worker", kind.label());
                    return true;
                }
                Log.debug("worker.still_running", "attempt", tracker.attempt(), "worker", kind.label());
            } while (System.nanoTime() - deadline < 0);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            Log.warn("worker.stop_interrupted", "attempt", tracker.attempt(), "worker", kind.label());
            return false;
        }

        // attempt stays unhealthy without progressing; only an external shutdown moves it now
        Log.error("worker.stop_timeout", "attempt", tracker.attempt(), "worker", kind.label(),
            "timeout_ms", timings.stopTimeout().toMillis());
        return false;
    }

    // stops processor then heartbeat. true if both are gone.
    public boolean stopSession(SessionTracker tracker) {
        boolean processorStopped = stopWorker(tracker, WorkerKind.PROCESSOR);
        boolean heartbeatStopped = stopWorker(tracker, WorkerKind.HEARTBEAT);
        return processorStopped && heartbeatStopped;
    }
}
