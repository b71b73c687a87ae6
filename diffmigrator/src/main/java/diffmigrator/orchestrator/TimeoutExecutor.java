package diffmigrator.orchestrator;

import diffmigrator.exceptions.MigrationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Runs a blocking operation with a timeout.
 *
 * <p>The operation runs on a shared pool of daemon threads. On timeout or
 * interruption of the caller the operation's thread is interrupted; whether it
 * stops depends on the operation.
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "diffmigrator-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {
    }

    /**
     * An operation that may throw one checked exception type.
     */
    @FunctionalInterface
    public interface CheckedSupplier<T, E extends Exception> {
        T get() throws E, InterruptedException;
    }

    /**
     * A null, zero or negative timeout disables timeout protection.
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Executes an operation with a timeout.
     *
     * @param operation name for messages
     * @param timeout the timeout, or null/zero to run directly
     * @param action the operation
     * @return the operation's result
     * @throws MigrationTimeoutException if the timeout elapses
     * @throws E if the operation throws it
     * @throws InterruptedException if the caller is interrupted
     */
    public static <T, E extends Exception> T executeWithTimeout(String operation, Duration timeout,
                                                                 CheckedSupplier<T, E> action)
            throws E, InterruptedException {
        if (!isEnabled(timeout)) {
            return action.get();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());
        Future<T> future = EXECUTOR.submit(action::get);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            } else if (cause instanceof Error err) {
                throw err;
            } else if (cause instanceof InterruptedException ie) {
                throw ie;
            }
            // action.get() only declares E besides the cases above
            @SuppressWarnings("unchecked")
            E checked = (E) cause;
            throw checked;
        }
    }
}
