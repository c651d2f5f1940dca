package webqa.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs browser work on a dedicated thread with a hard upper bound per task.
 *
 * <p>A task that overruns is cancelled (its thread interrupted) and the
 * runner shuts down, waiting up to {@code grace} for the thread to stop. The
 * caller gets a {@link StepTimeoutException} telling it whether the task is
 * still running, in which case the browser must not be touched again from
 * another thread. One runner serves one run; close it when the run ends.
 */
public class BoundedStepRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedStepRunner.class);

    static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    private final Duration timeout;
    private final Duration grace;
    private final ExecutorService executor;

    public BoundedStepRunner(Duration timeout, String threadName) {
        this(timeout, DEFAULT_GRACE, threadName);
    }

    public BoundedStepRunner(Duration timeout, Duration grace, String threadName) {
        this.timeout  = timeout;
        this.grace    = grace;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code task} and waits at most the configured timeout for it.
     *
     * @param description used in the timeout message, e.g. {@code "step 3 (CLICK)"}
     * @throws StepTimeoutException if the task does not finish in time
     * @throws RuntimeException     whatever unchecked exception the task threw
     */
    public <T> T submit(Callable<T> task, String description) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            boolean stillRunning = !stop();
            log.error("BoundedStepRunner: {} exceeded {}s, cancelled{}", description, timeout.toSeconds(),
                    stillRunning ? "; task ignored the interrupt and is still running" : "");
            throw new StepTimeoutException(description + " did not complete within " + timeout.toSeconds() + "s",
                    stillRunning);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new StepFailureException(description + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepFailureException(description + " interrupted", e);
        }
    }

    /** Shuts the executor down and waits for its thread; {@code true} once it has stopped. */
    private boolean stop() {
        executor.shutdownNow();
        try {
            return executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
