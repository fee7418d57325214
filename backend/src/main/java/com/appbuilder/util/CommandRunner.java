package com.appbuilder.util;

import com.appbuilder.platform.Platform;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs external tools. {@link #run} never throws: non-zero exits, timeouts and
 * launch failures all come back as a {@link CommandResult}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRunner {

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(10);
    private static final long DRAIN_GRACE_SECONDS = 5;
    private static final String SECRET_PREFIX = "pass:";

    private final Platform platform;

    private final AtomicInteger readerCount = new AtomicInteger();
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "command-output-" + readerCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
    }

    /** Command line for logging, with inline {@code pass:} secrets masked. */
    static String describeCommand(List<String> command) {
        return command.stream()
                .map(arg -> arg.startsWith(SECRET_PREFIX) ? SECRET_PREFIX + "****" : arg)
                .collect(Collectors.joining(" "));
    }

    // ── Synchronous execution ─────────────────────────────────────────────

    public CommandResult run(List<String> command, Path cwd, Map<String, String> env, Duration timeout) {
        return run(command, cwd, env, timeout, null);
    }

    /**
     * Runs {@code command} to completion or until {@code timeout} elapses. A null timeout
     * waits indefinitely. {@code onStart}, when given, receives the live process right after
     * launch so callers can track it for cancellation.
     */
    public CommandResult run(List<String> command, Path cwd, Map<String, String> env,
                             Duration timeout, Consumer<Process> onStart) {
        log.debug("Running command: {} (cwd={})", describeCommand(command), cwd);
        Process process;
        try {
            process = start(command, cwd, env);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to launch '{}': {}", command.get(0), e.getMessage());
            return new CommandResult(CommandResult.NOT_COMPLETED, "", describe(e));
        }

        if (onStart != null) {
            onStart.accept(process);
        }

        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Future<?> outReader = streamReaders.submit(() -> drain(process.getInputStream(), stdout));
        Future<?> errReader = streamReaders.submit(() -> drain(process.getErrorStream(), stderr));

        try {
            boolean finished;
            if (timeout == null) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            if (!finished) {
                log.warn("Command '{}' timed out after {} seconds, killing process tree",
                        command.get(0), timeout.toSeconds());
                killProcessTree(process.pid());
                awaitReader(outReader);
                awaitReader(errReader);
                String message = "Command timed out after " + timeout.toSeconds() + " seconds";
                String partial = stderr.toString();
                return new CommandResult(CommandResult.NOT_COMPLETED, stdout.toString(),
                        partial.isBlank() ? message : partial + "\n" + message);
            }

            awaitReader(outReader);
            awaitReader(errReader);
            return new CommandResult(process.exitValue(), stdout.toString(), stderr.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killProcessTree(process.pid());
            return new CommandResult(CommandResult.NOT_COMPLETED, stdout.toString(), "Command interrupted");
        }
    }

    /**
     * Starts a process without waiting for it. Output is left to the caller.
     */
    public Process runAsync(List<String> command, Path cwd, Map<String, String> env) throws IOException {
        return start(command, cwd, env);
    }

    // ── Process control ───────────────────────────────────────────────────

    /**
     * Forcibly terminates {@code pid} and all of its descendants.
     * Returns false when the process no longer exists or could not be signalled.
     */
    public boolean killProcessTree(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return false;
        }
        try {
            // children first so nothing gets re-parented mid-kill
            handle.get().descendants().forEach(ProcessHandle::destroyForcibly);
            boolean signalled = handle.get().destroyForcibly();
            log.debug("Killed process tree rooted at {}", pid);
            return signalled;
        } catch (SecurityException | UnsupportedOperationException e) {
            log.warn("Failed to kill process tree {}: {}", pid, e.getMessage());
            return false;
        }
    }

    // ── Probes ────────────────────────────────────────────────────────────

    public boolean commandExists(String name) {
        CommandResult result = run(platform.lookupCommand(name), null, null, LOOKUP_TIMEOUT);
        return result.isSuccess();
    }

    public Optional<String> getVersion(String name, String flag) {
        CommandResult result = run(List.of(name, flag), null, null, VERSION_TIMEOUT);
        if (!result.isSuccess()) {
            return Optional.empty();
        }
        String out = result.stdout().strip();
        return out.isEmpty() ? Optional.empty() : Optional.of(out);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Process start(List<String> command, Path cwd, Map<String, String> env) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (cwd != null) {
            builder.directory(cwd.toFile());
        }
        if (env != null && !env.isEmpty()) {
            // merged over the inherited environment
            builder.environment().putAll(env);
        }
        return builder.start();
    }

    private void drain(InputStream stream, StringBuffer sink) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (sink.length() > 0) sink.append('\n');
                sink.append(line);
            }
        } catch (IOException e) {
            // stream closed by a kill; whatever was read so far is kept
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private void awaitReader(Future<?> reader) throws InterruptedException {
        try {
            reader.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            // a detached grandchild may still hold the pipe open
            reader.cancel(true);
        } catch (ExecutionException e) {
            log.debug("Output reader failed: {}", e.getCause().getMessage());
        }
    }

    private String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
