package io.walletbridge.core.page;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded cooperative loop for the page context.
 *
 * Channel deliveries and deadline timers for one provider run here, one task
 * at a time, in submission order. Tasks that throw are logged; the loop keeps
 * running.
 */
public final class EventLoop implements AutoCloseable {
    private static final Logger log = Logger.getLogger(EventLoop.class.getName());

    private final ScheduledExecutorService executor;

    public EventLoop(String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public void execute(Runnable task) {
        executor.execute(() -> runSafe(task));
    }

    /** Schedule a cancellable one-shot task after {@code delay}. */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return executor.schedule(() -> runSafe(task), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static void runSafe(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "event loop task failed", e);
        }
    }
}
