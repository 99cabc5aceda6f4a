package com.github.anirbanmu.discorder.discord;

import com.github.anirbanmu.discorder.log.Log;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

// cancellable background loop on its own daemon thread. "scheduled" flips once the body starts,
// "done" once it returns for any reason. interrupt() only sets the flag; the body has to notice.
public final class Worker {
    private final String name;
    private final Thread thread;
    private final CountDownLatch scheduled = new CountDownLatch(1);
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private Worker(String name, Runnable body) {
        this.name = name;
        this.thread = new Thread(() -> {
            scheduled.countDown();
            try {
                body.run();
            } catch (RuntimeException ex) {
                Log.error("worker.crashed", ex, "worker", name);
            } finally {
                completion.complete(null);
            }
        }, name);
        this.thread.setDaemon(true);
    }

    public static Worker start(String name, Runnable body) {
        Worker worker = new Worker(name, body);
        worker.thread.start();
        return worker;
    }

    public String name() {
        return name;
    }

    public boolean isScheduled() {
        return scheduled.getCount() == 0;
    }

    public boolean isRunning() {
        return isScheduled() && !completion.isDone();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public void interrupt() {
        thread.interrupt();
    }

    public boolean awaitScheduled(Duration timeout) throws InterruptedException {
        return scheduled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean awaitDone(Duration timeout) throws InterruptedException {
        try {
            completion.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException ex) {
            return false;
        } catch (ExecutionException ex) {
            // completion is only ever completed normally
            throw new IllegalStateException(ex);
        }
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return name + (isDone() ? "[done]" : isScheduled() ? "[running]" : "[pending]");
    }
}
