/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.fspec.lock;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * File-based implementation of {@link LockedFileManager} for JSON content.
 * <p>
 * Every operation runs through three layers:
 * <ol>
 *   <li>{@link InterProcessLock} - lock file beside the managed file, excludes other processes</li>
 *   <li>{@link InProcessLock} - readers-writer lock, shared for reads, exclusive for writes</li>
 *   <li>{@link AtomicWriter} - temp file and atomic rename for every write</li>
 * </ol>
 * Locks are released in reverse order in {@code finally} blocks, so a failing
 * read or a throwing mutation never leaves a path locked.
 * <p>
 * <b>Thread Safety:</b> all methods may be called from any thread. The
 * {@code *Async} methods run on a fixed pool of daemon worker threads.
 *
 * @see LockConfig
 */
public final class JsonLockedFileManager implements LockedFileManager {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLockedFileManager.class);

    private final LockConfig config;
    private final InterProcessLock interProcessLock;
    private final InProcessLock inProcessLock;
    private final AtomicWriter atomicWriter;
    private final LockMetrics metrics;
    private final JsonCodec codec;
    private final ExecutorService workers;
    private volatile boolean closed = false;

    /**
     * Creates a manager with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     */
    public JsonLockedFileManager() {
        this(LockConfig.load());
    }

    public JsonLockedFileManager(LockConfig config) {
        this.config = config;
        this.interProcessLock = new InterProcessLock(config);
        this.inProcessLock = new InProcessLock();
        this.atomicWriter = new AtomicWriter(config.syncEnabled());
        this.metrics = new LockMetrics(config.debugLocks());
        this.codec = new JsonCodec();

        AtomicInteger threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), r -> {
            Thread t = new Thread(r, "locked-file-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.info("JsonLockedFileManager initialized: {}", config);
    }

    /** Returns the configuration used by this manager. */
    public LockConfig config() {
        return config;
    }

    /**
     * Clears all in-process lock state. Only for test isolation, while no
     * operation is in flight.
     */
    public void resetLockState() {
        inProcessLock.reset();
    }

    InProcessLock inProcessLock() {
        return inProcessLock;
    }

    AtomicWriter atomicWriter() {
        return atomicWriter;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public <T> T readJson(Path path, Class<T> type, T defaultValue) {
        return readJson(path, codec.type(type), defaultValue);
    }

    @Override
    public <T> T readJson(Path path, TypeReference<T> type, T defaultValue) {
        return readJson(path, codec.type(type), defaultValue);
    }

    private <T> T readJson(Path path, JavaType type, T defaultValue) {
        ensureOpen();
        Path target = canonical(path);
        long startNanos = System.nanoTime();

        InterProcessLock.Handle handle = interProcessLock.acquire(target);
        try {
            inProcessLock.acquireRead(target);
            try {
                long holdNanos = System.nanoTime();
                byte[] content = readIfExists(target);
                if (content != null) {
                    T data = codec.read(target, content, type);
                    metrics.record(LockType.READ, target,
                            elapsedMs(startNanos, holdNanos), elapsedMs(holdNanos, System.nanoTime()),
                            handle.retries());
                    return data;
                }
            } finally {
                inProcessLock.releaseRead(target);
            }
        } finally {
            handle.release();
        }

        LOG.debug("{} does not exist, creating it under write lock", target);
        return createIfAbsent(target, type, defaultValue);
    }

    /**
     * Second half of a read that found no file. Re-checks under the write lock
     * because another caller may have created the file after our read lock was dropped.
     */
    private <T> T createIfAbsent(Path target, JavaType type, T defaultValue) {
        long startNanos = System.nanoTime();

        InterProcessLock.Handle handle = interProcessLock.acquire(target);
        try {
            inProcessLock.acquireWrite(target);
            try {
                long holdNanos = System.nanoTime();
                byte[] content = readIfExists(target);
                if (content != null) {
                    LOG.debug("{} was created concurrently, using its content", target);
                    return codec.read(target, content, type);
                }

                byte[] initial = codec.write(target, defaultValue);
                handle.ensureValid();
                atomicWriter.write(target, initial);
                LOG.debug("Created {} with default content ({} bytes)", target, initial.length);

                metrics.record(LockType.WRITE, target,
                        elapsedMs(startNanos, holdNanos), elapsedMs(holdNanos, System.nanoTime()),
                        handle.retries());
                return defaultValue;
            } finally {
                inProcessLock.releaseWrite(target);
            }
        } finally {
            handle.release();
        }
    }

    // ========================================================================
    // Transactions
    // ========================================================================

    @Override
    public <T, X extends Exception> void transaction(Path path, Class<T> type, Mutation<T, X> mutation) throws X {
        transaction(path, codec.type(type), mutation);
    }

    @Override
    public <T, X extends Exception> void transaction(Path path, TypeReference<T> type, Mutation<T, X> mutation)
            throws X {
        transaction(path, codec.type(type), mutation);
    }

    private <T, X extends Exception> void transaction(Path path, JavaType type, Mutation<T, X> mutation) throws X {
        Objects.requireNonNull(mutation, "mutation");
        ensureOpen();
        Path target = canonical(path);
        long startNanos = System.nanoTime();

        InterProcessLock.Handle handle = interProcessLock.acquire(target);
        try {
            inProcessLock.acquireWrite(target);
            try {
                long holdNanos = System.nanoTime();
                byte[] content = readIfExists(target);
                T data = content != null
                        ? codec.read(target, content, type)
                        : codec.<T>empty(target, type);

                // Throwing here skips the write: the file stays as it was
                mutation.mutate(data);

                byte[] updated = codec.write(target, data);
                handle.ensureValid();
                atomicWriter.write(target, updated);
                LOG.trace("Transaction committed on {} ({} bytes)", target, updated.length);

                metrics.record(LockType.WRITE, target,
                        elapsedMs(startNanos, holdNanos), elapsedMs(holdNanos, System.nanoTime()),
                        handle.retries());
            } finally {
                inProcessLock.releaseWrite(target);
            }
        } finally {
            handle.release();
        }
    }

    // ========================================================================
    // Async
    // ========================================================================

    @Override
    public <T> CompletableFuture<T> readJsonAsync(Path path, Class<T> type, T defaultValue) {
        return submit(() -> readJson(path, type, defaultValue));
    }

    @Override
    public <T> CompletableFuture<Void> transactionAsync(Path path, Class<T> type, Mutation<T, ?> mutation) {
        return submit(() -> {
            transaction(path, type, mutation);
            return null;
        });
    }

    private <R> CompletableFuture<R> submit(Callable<R> task) {
        ensureOpen();
        CompletableFuture<R> future = new CompletableFuture<>();
        workers.execute(() -> {
            try {
                future.complete(task.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future;
    }

    // ========================================================================
    // Close
    // ========================================================================

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Manager already closed, ignoring duplicate close()");
            return;
        }
        closed = true;

        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.staleMs(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Worker pool did not drain within {} ms", config.staleMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for worker pool to drain");
        }
        interProcessLock.close();
        LOG.info("JsonLockedFileManager closed");
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("JsonLockedFileManager is closed");
        }
    }

    private static Path canonical(Path path) {
        return Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
    }

    /**
     * Reads the whole file.
     *
     * @return the content, or {@code null} if the file does not exist
     */
    private static byte[] readIfExists(Path target) {
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", target, e.getMessage(), e);
            throw new LockedFileException("Failed to read " + target, e);
        }
    }

    private static long elapsedMs(long fromNanos, long toNanos) {
        return TimeUnit.NANOSECONDS.toMillis(toNanos - fromNanos);
    }
}
