package com.codeoptimizer.plugins.javascript;

import java.io.OutputStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;

import com.codeoptimizer.api.error.ValidationTimeoutException;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Runs untrusted JavaScript with GraalJS. Every execution gets a fresh context without host,
 * IO or thread access, and is cancelled once the timeout elapses.
 */
public class ScriptSandbox implements AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(ScriptSandbox.class);

    private final Engine engine;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final AtomicInteger operationCount = new AtomicInteger(0);
    private volatile boolean closed = false;

    public ScriptSandbox(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
        this.engine = Engine.newBuilder("js")
                .option("engine.WarnInterpreterOnly", "false")
                .out(OutputStream.nullOutputStream())
                .err(OutputStream.nullOutputStream())
                .build();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "script-sandbox");
            thread.setDaemon(true);
            return thread;
        });
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * Evaluates the script and returns its completion value as a string. A script that throws
     * yields a failed result.
     *
     * @throws ValidationTimeoutException when the script is still running after the timeout
     */
    public ScriptResult execute(String name, String script) throws ValidationTimeoutException {
        if (closed) {
            throw new IllegalStateException("Script sandbox has been closed");
        }

        operationCount.incrementAndGet();
        AtomicReference<Context> running = new AtomicReference<>();
        Future<ScriptResult> future = executor.submit(() -> _evaluate(name, script, running));

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            _cancel(running.get());
            future.cancel(true);
            logger.fine("Script " + name + " cancelled after " + timeoutMs + " ms");
            throw new ValidationTimeoutException(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            _cancel(running.get());
            future.cancel(true);
            throw new ValidationTimeoutException(timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.FINE, "Script " + name + " could not be executed", cause);
            return ScriptResult.failure(String.valueOf(cause.getMessage()));
        }
    }

    private ScriptResult _evaluate(String name, String script, AtomicReference<Context> running) {
        try (Context context = Context.newBuilder("js")
                .engine(engine)
                .allowHostAccess(HostAccess.NONE)
                .allowIO(IOAccess.NONE)
                .allowCreateThread(false)
                .allowNativeAccess(false)
                .build()) {
            running.set(context);
            Value value = context.eval(Source.newBuilder("js", script, name).buildLiteral());
            return ScriptResult.success(value.isString() ? value.asString() : value.toString());
        } catch (PolyglotException e) {
            if (e.isCancelled()) {
                return ScriptResult.failure("cancelled");
            }
            return ScriptResult.failure(String.valueOf(e.getMessage()));
        }
    }

    private static void _cancel(Context context) {
        if (context == null) {
            return;
        }
        try {
            context.close(true);
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Error cancelling script context", e);
        }
    }

    public int getOperationCount() {
        return operationCount.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdownNow();
        try {
            engine.close(true);
            logger.fine("Script sandbox closed after " + operationCount.get() + " executions");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error closing script sandbox", e);
        }
    }
}
