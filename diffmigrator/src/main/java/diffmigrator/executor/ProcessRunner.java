package diffmigrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external processes with a timeout.
 *
 * <p>Standard output and standard error are drained on their own threads so
 * a chatty process cannot block on a full pipe. On timeout or interruption
 * the whole process tree is killed; an interrupted caller gets the
 * {@link InterruptedException} back after the kill.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final long DRAIN_JOIN_MS = 2000;

    /**
     * Runs a command to completion or until the timeout expires.
     *
     * @param command program and arguments
     * @param workDir working directory
     * @param timeout maximum run time; zero or null waits indefinitely
     * @return the outcome, with {@code timedOut} set if the process was killed
     * @throws IOException if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted; the process tree is killed first
     */
    public ProcessOutcome run(List<String> command, Path workDir, Duration timeout)
            throws IOException, InterruptedException {

        long start = System.nanoTime();
        log.debug("Executing: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        Process process = builder.start();
        process.getOutputStream().close();

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread outThread = drain(process.getInputStream(), stdout, "stdout");
        Thread errThread = drain(process.getErrorStream(), stderr, "stderr");

        boolean finished;
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            killTree(process);
            throw e;
        }

        if (!finished) {
            killTree(process);
            log.warn("Process timed out after {} ms: {}", timeout.toMillis(), command.get(0));
        }

        outThread.join(DRAIN_JOIN_MS);
        errThread.join(DRAIN_JOIN_MS);

        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        int exitCode = finished ? process.exitValue() : -1;
        return new ProcessOutcome(exitCode, text(stdout), text(stderr), !finished, elapsed);
    }

    private static Thread drain(InputStream in, ByteArrayOutputStream sink, String name) {
        Thread t = new Thread(() -> {
            try (in) {
                in.transferTo(sink);
            } catch (IOException e) {
                log.debug("Stream {} closed early: {}", name, e.getMessage());
            }
        }, "process-" + name + "-drain");
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static String text(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /** Kills the process and every descendant it spawned. */
    static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_JOIN_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
