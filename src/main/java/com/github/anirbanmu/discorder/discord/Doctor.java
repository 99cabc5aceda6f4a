package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.config.ControlPlaneTimings;
import com.github.anirbanmu.discorder.log.Log;

// watches one attempt. once it looks unhealthy, waits out the grace period, tears the
// session down and exits; the supervise loop then starts a fresh attempt.
final class Doctor implements Runnable {
    private final SessionTracker tracker;
    private final WorkerCanceller canceller;
    private final ControlPlaneTimings timings;

    Doctor(SessionTracker tracker, WorkerCanceller canceller, ControlPlaneTimings timings) {
        this.tracker = tracker;
        this.canceller = canceller;
        this.timings = timings;
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                if (!isOperational(tracker)) {
                    Log.warn("doctor.unhealthy", "attempt", tracker.attempt(),
                        "grace_ms", timings.doctorGracePeriod().toMillis(), "tracker", tracker);
                    Thread.sleep(timings.doctorGracePeriod().toMillis());
                    canceller.stopSession(tracker);
                    break;
                }
                Thread.sleep(timings.doctorPollInterval().toMillis());
            }
            Log.info("doctor.stopped", "attempt", tracker.attempt());
        } catch (InterruptedException ex) {
            Log.info("doctor.stopped", "attempt", tracker.attempt());
        } catch (Exception ex) {
            Log.error("doctor.error", ex, "attempt", tracker.attempt());
        }
    }

    static boolean isOperational(SessionTracker tracker) {
        if (!tracker.isConnected()) {
            Log.error("doctor.socket_closed", "attempt", tracker.attempt());
            return false;
        }
        if (!tracker.isWorkerRunning(WorkerKind.HEARTBEAT)) {
            Log.error("doctor.worker_not_running", "attempt", tracker.attempt(), "worker", WorkerKind.HEARTBEAT.label());
            return false;
        }
        if (!tracker.isWorkerRunning(WorkerKind.PROCESSOR)) {
            Log.error("doctor.worker_not_running", "attempt", tracker.attempt(), "worker", WorkerKind.PROCESSOR.label());
            return false;
        }
        return true;
    }
}
