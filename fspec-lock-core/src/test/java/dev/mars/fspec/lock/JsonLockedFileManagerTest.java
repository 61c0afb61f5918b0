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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.fspec.lock.InterProcessLock.LockOwner;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JsonLockedFileManager}: reads with defaults, transactions,
 * rollback, concurrency between callers and interaction with foreign lock files.
 */
class JsonLockedFileManagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private JsonLockedFileManager manager;
    private Path file;

    /** Simple document used by the typed tests. */
    public static class Counter {
        public int count;
    }

    @BeforeEach
    void setUp() {
        manager = new JsonLockedFileManager(config(50, false));
        file = tempDir.resolve("counter.json");
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Nested
    @DisplayName("readJson")
    class ReadTests {

        @Test
        @DisplayName("Existing content is returned and left untouched")
        void testReadExisting() throws Exception {
            Files.writeString(file, "{\"count\": 5}");

            ObjectNode node = manager.readJson(file, ObjectNode.class, MAPPER.createObjectNode());

            assertEquals(5, node.get("count").asInt());
            assertEquals("{\"count\": 5}", Files.readString(file));
        }

        @Test
        @DisplayName("Missing file is created from the default")
        void testReadCreatesDefault() throws Exception {
            ObjectNode defaults = MAPPER.createObjectNode().put("count", 0);

            ObjectNode node = manager.readJson(file, ObjectNode.class, defaults);

            assertSame(defaults, node);
            String written = Files.readString(file);
            assertTrue(written.startsWith("{\n  "), written);
            assertTrue(written.contains("\"count\": 0"), written);
            assertFalse(Files.exists(InterProcessLock.lockFileFor(file)));
        }

        @Test
        @DisplayName("Content maps onto a class")
        void testReadPojo() throws Exception {
            Files.writeString(file, "{\"count\": 7}");

            Counter counter = manager.readJson(file, Counter.class, new Counter());

            assertEquals(7, counter.count);
        }

        @Test
        @DisplayName("Content maps onto a generic type")
        void testReadTypeReference() {
            TypeReference<List<String>> listOfStrings = new TypeReference<>() {
            };
            manager.readJson(file, listOfStrings, List.of("a", "b"));

            List<String> read = manager.readJson(file, listOfStrings, List.of());

            assertEquals(List.of("a", "b"), read);
        }

        @Test
        @DisplayName("Invalid JSON raises FileParseException and keeps the file")
        void testReadInvalidJson() throws Exception {
            Files.writeString(file, "{not json");

            FileParseException e = assertThrows(FileParseException.class,
                    () -> manager.readJson(file, ObjectNode.class, MAPPER.createObjectNode()));

            assertEquals(file.toAbsolutePath().normalize(), e.path());
            assertEquals("{not json", Files.readString(file));
            assertFalse(Files.exists(InterProcessLock.lockFileFor(file)));
        }

        @Test
        @DisplayName("JSON of the wrong shape raises FileParseException")
        void testReadTypeMismatch() throws Exception {
            Files.writeString(file, "{\"count\": \"many\"}");

            assertThrows(FileParseException.class, () -> manager.readJson(file, Counter.class, new Counter()));
            assertEquals("{\"count\": \"many\"}", Files.readString(file));
        }

        @Test
        @DisplayName("A directory in place of the file raises LockedFileException")
        void testReadDirectory() throws Exception {
            Path dir = Files.createDirectory(tempDir.resolve("dir.json"));

            assertThrows(LockedFileException.class,
                    () -> manager.readJson(dir, ObjectNode.class, MAPPER.createObjectNode()));
        }

        @Test
        @DisplayName("Concurrent first reads create the file exactly once")
        void testConcurrentCreateWritesOnce() throws Exception {
            manager.close();
            manager = new JsonLockedFileManager(config(50, true));

            Logger metricsLogger = (Logger) LoggerFactory.getLogger(LockMetrics.class);
            Level previous = metricsLogger.getLevel();
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            metricsLogger.setLevel(Level.DEBUG);
            metricsLogger.addAppender(appender);
            try {
                List<ObjectNode> results = runConcurrently(3,
                        () -> manager.readJson(file, ObjectNode.class, MAPPER.createObjectNode().put("count", 0)));

                for (ObjectNode result : results) {
                    assertEquals(0, result.get("count").asInt());
                }
                long writes = appender.list.stream()
                        .filter(e -> e.getFormattedMessage().startsWith("[LOCK] Acquired WRITE"))
                        .count();
                assertEquals(1, writes);
            } finally {
                metricsLogger.detachAppender(appender);
                metricsLogger.setLevel(previous);
            }
        }
    }

    // ========================================================================
    // Transactions
    // ========================================================================

    @Nested
    @DisplayName("transaction")
    class TransactionTests {

        @Test
        @DisplayName("Transaction on a missing file starts from an empty object")
        void testTransactionOnMissingFile() throws Exception {
            manager.transaction(file, node -> node.put("count", 1));

            ObjectNode node = (ObjectNode) MAPPER.readTree(file.toFile());
            assertEquals(1, node.get("count").asInt());
        }

        @Test
        @DisplayName("Typed transaction updates the file")
        void testTypedTransaction() {
            manager.transaction(file, Counter.class, c -> c.count += 2);
            manager.transaction(file, Counter.class, c -> c.count += 3);

            assertEquals(5, manager.readJson(file, Counter.class, new Counter()).count);
        }

        @Test
        @DisplayName("Generic transaction updates the file")
        void testTypeReferenceTransaction() {
            TypeReference<List<String>> listOfStrings = new TypeReference<>() {
            };
            manager.readJson(file, listOfStrings, new ArrayList<>());

            manager.transaction(file, listOfStrings, list -> list.add("first"));
            manager.transaction(file, listOfStrings, list -> list.add("second"));

            assertEquals(List.of("first", "second"), manager.readJson(file, listOfStrings, List.of()));
        }

        @Test
        @DisplayName("Updates to several files in sequence all land")
        void testSequentialMultiFile() {
            Path units = tempDir.resolve("work-units.json");
            Path epics = tempDir.resolve("epics.json");

            manager.transaction(units, Counter.class, c -> c.count = 10);
            manager.transaction(epics, Counter.class, c -> c.count = 20);
            manager.transaction(units, Counter.class, c -> c.count++);

            assertEquals(11, manager.readJson(units, Counter.class, new Counter()).count);
            assertEquals(20, manager.readJson(epics, Counter.class, new Counter()).count);
        }

        @Test
        @DisplayName("Invalid JSON aborts the transaction before the mutation runs")
        void testTransactionOnInvalidJson() throws Exception {
            Files.writeString(file, "[1, 2");

            assertThrows(FileParseException.class,
                    () -> manager.transaction(file, Counter.class, c -> fail("mutation must not run")));
            assertEquals("[1, 2", Files.readString(file));
        }
    }

    // ========================================================================
    // Rollback
    // ========================================================================

    @Nested
    @DisplayName("Rollback")
    class RollbackTests {

        @Test
        @DisplayName("A throwing mutation leaves the file byte-identical")
        void testRuntimeExceptionRollsBack() throws Exception {
            manager.transaction(file, Counter.class, c -> c.count = 3);
            byte[] before = Files.readAllBytes(file);
            IllegalStateException boom = new IllegalStateException("boom");

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> manager.transaction(file, Counter.class, c -> {
                        c.count = 99;
                        throw boom;
                    }));

            assertSame(boom, thrown);
            assertArrayEquals(before, Files.readAllBytes(file));
        }

        @Test
        @DisplayName("Checked exceptions propagate unchanged")
        void testCheckedExceptionPropagates() throws Exception {
            manager.transaction(file, Counter.class, c -> c.count = 1);
            byte[] before = Files.readAllBytes(file);
            IOException failure = new IOException("upstream unavailable");

            IOException thrown = assertThrows(IOException.class,
                    () -> manager.transaction(file, Counter.class, c -> {
                        throw failure;
                    }));

            assertSame(failure, thrown);
            assertArrayEquals(before, Files.readAllBytes(file));
        }

        @Test
        @DisplayName("Locks are released after a failed transaction")
        void testLocksReleasedAfterFailure() {
            Path target = file.toAbsolutePath().normalize();

            assertThrows(IllegalStateException.class, () -> manager.transaction(file, Counter.class, c -> {
                throw new IllegalStateException("boom");
            }));

            assertFalse(manager.inProcessLock().isWriteLocked(target));
            assertEquals(0, manager.inProcessLock().readerCount(target));
            assertFalse(Files.exists(InterProcessLock.lockFileFor(target)));

            manager.transaction(file, Counter.class, c -> c.count = 4);
            assertEquals(4, manager.readJson(file, Counter.class, new Counter()).count);
        }

        @Test
        @DisplayName("A rolled back first transaction creates no file")
        void testRollbackOnMissingFile() {
            assertThrows(IllegalStateException.class, () -> manager.transaction(file, Counter.class, c -> {
                throw new IllegalStateException("boom");
            }));

            assertFalse(Files.exists(file));
        }
    }

    // ========================================================================
    // Concurrency
    // ========================================================================

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Readers are not blocked by a held read lock")
        void testReadersShare() throws Exception {
            Files.writeString(file, "{\"count\": 1}");
            Path target = file.toAbsolutePath().normalize();

            manager.inProcessLock().acquireRead(target);
            try {
                Counter counter = manager.readJsonAsync(file, Counter.class, new Counter())
                        .get(5, TimeUnit.SECONDS);
                assertEquals(1, counter.count);
            } finally {
                manager.inProcessLock().releaseRead(target);
            }
        }

        @Test
        @DisplayName("A writer waits for a held read lock")
        void testWriterWaitsForReader() throws Exception {
            Files.writeString(file, "{\"count\": 1}");
            Path target = file.toAbsolutePath().normalize();

            manager.inProcessLock().acquireRead(target);
            CompletableFuture<Void> write;
            try {
                write = manager.transactionAsync(file, Counter.class, c -> c.count++);
                Thread.sleep(200);
                assertFalse(write.isDone(), "Writer must wait while a reader holds the lock");
            } finally {
                manager.inProcessLock().releaseRead(target);
            }

            write.get(5, TimeUnit.SECONDS);
            assertEquals(2, manager.readJson(file, Counter.class, new Counter()).count);
        }

        @Test
        @DisplayName("Concurrent increments are never lost")
        void testCounterStorm() throws Exception {
            int threads = 8;
            int increments = 25;

            runConcurrently(threads, () -> {
                for (int i = 0; i < increments; i++) {
                    manager.transaction(file, Counter.class, c -> c.count++);
                }
                return null;
            });

            assertEquals(threads * increments, manager.readJson(file, Counter.class, new Counter()).count);
            assertEquals(List.of("counter.json"), listDir());
        }

        @Test
        @DisplayName("A read started during a write sees the written value")
        void testReadDuringWriteSeesResult() throws Exception {
            manager.transaction(file, Counter.class, c -> c.count = 0);
            CountDownLatch inMutation = new CountDownLatch(1);

            CompletableFuture<Void> writer = manager.transactionAsync(file, Counter.class, c -> {
                inMutation.countDown();
                Thread.sleep(100);
                c.count = 1;
            });
            assertTrue(inMutation.await(5, TimeUnit.SECONDS));

            Counter seen = manager.readJson(file, Counter.class, new Counter());

            assertEquals(1, seen.count);
            writer.get(5, TimeUnit.SECONDS);
        }

        @Test
        @DisplayName("A fast writer queued behind a slow writer has the last word")
        void testSlowAndFastWriters() throws Exception {
            manager.transaction(file, node -> node.put("value", "orig"));
            CountDownLatch slowStarted = new CountDownLatch(1);
            AtomicReference<String> fastSaw = new AtomicReference<>();

            CompletableFuture<Void> slow = manager.transactionAsync(file, ObjectNode.class, node -> {
                slowStarted.countDown();
                Thread.sleep(100);
                node.put("value", "W1");
            });
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
            CompletableFuture<Void> fast = manager.transactionAsync(file, ObjectNode.class, node -> {
                fastSaw.set(node.path("value").asText());
                node.put("value", "W2");
            });

            CompletableFuture.allOf(slow, fast).get(5, TimeUnit.SECONDS);
            assertEquals("W1", fastSaw.get(), "Second writer must start from the first writer's result");
            ObjectNode result = manager.readJson(file, ObjectNode.class, MAPPER.createObjectNode());
            assertEquals("W2", result.path("value").asText());
        }

        @Test
        @DisplayName("A write lock on one file does not block another file")
        void testPathsAreIndependent() throws Exception {
            Path held = tempDir.resolve("held.json").toAbsolutePath().normalize();
            Path other = tempDir.resolve("other.json");

            manager.inProcessLock().acquireWrite(held);
            try {
                manager.transactionAsync(other, Counter.class, c -> c.count = 8).get(5, TimeUnit.SECONDS);
            } finally {
                manager.inProcessLock().releaseWrite(held);
            }
            assertEquals(8, manager.readJson(other, Counter.class, new Counter()).count);
        }

        @Test
        @DisplayName("resetLockState clears in-process locks")
        void testResetLockState() {
            Path target = file.toAbsolutePath().normalize();
            manager.inProcessLock().acquireWrite(target);

            manager.resetLockState();

            assertFalse(manager.inProcessLock().isWriteLocked(target));
            manager.transaction(file, Counter.class, c -> c.count = 1);
        }
    }

    // ========================================================================
    // Async & Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Async and lifecycle")
    class AsyncTests {

        @Test
        @DisplayName("Async operations run on worker threads")
        void testAsyncRunsOnWorkers() throws Exception {
            AtomicReference<String> threadName = new AtomicReference<>();

            manager.transactionAsync(file, Counter.class, c -> {
                threadName.set(Thread.currentThread().getName());
                c.count = 6;
            }).get(5, TimeUnit.SECONDS);

            assertTrue(threadName.get().startsWith("locked-file-worker-"), threadName.get());
            assertEquals(6, manager.readJsonAsync(file, Counter.class, new Counter()).get(5, TimeUnit.SECONDS).count);
        }

        @Test
        @DisplayName("Async failure carries the original exception")
        void testAsyncFailure() throws Exception {
            IOException failure = new IOException("nope");

            CompletableFuture<Void> future = manager.transactionAsync(file, Counter.class, c -> {
                throw failure;
            });

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertSame(failure, e.getCause());
            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("close is idempotent and later calls fail")
        void testClose() {
            manager.close();
            manager.close();

            assertThrows(IllegalStateException.class, () -> manager.readJson(file, Counter.class, new Counter()));
            assertThrows(IllegalStateException.class, () -> manager.transaction(file, Counter.class, c -> c.count++));
            assertThrows(IllegalStateException.class, () -> manager.readJsonAsync(file, Counter.class, new Counter()));
        }
    }

    // ========================================================================
    // Foreign Lock Files
    // ========================================================================

    @Nested
    @DisplayName("Foreign lock files")
    class ForeignLockTests {

        @Test
        @DisplayName("A live foreign lock times out the operation")
        void testForeignLockTimesOut() throws Exception {
            manager.close();
            manager = new JsonLockedFileManager(config(2, false));
            writeForeignLock(System.currentTimeMillis());

            LockTimeoutException e = assertThrows(LockTimeoutException.class,
                    () -> manager.transaction(file, Counter.class, c -> c.count++));

            assertEquals(3, e.attempts());
            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("A stale foreign lock is reclaimed")
        void testStaleForeignLockReclaimed() throws Exception {
            writeForeignLock(System.currentTimeMillis() - 60_000);

            manager.transaction(file, Counter.class, c -> c.count = 1);

            assertEquals(1, manager.readJson(file, Counter.class, new Counter()).count);
            assertFalse(Files.exists(InterProcessLock.lockFileFor(file)));
        }

        @Test
        @DisplayName("Losing the lock file during a mutation aborts the write")
        void testCompromisedLockAbortsWrite() throws Exception {
            manager.transaction(file, Counter.class, c -> c.count = 1);
            byte[] before = Files.readAllBytes(file);
            Path lockFile = InterProcessLock.lockFileFor(file);

            assertThrows(LockCompromisedException.class, () -> manager.transaction(file, Counter.class, c -> {
                Files.delete(lockFile);
                c.count = 2;
            }));

            assertArrayEquals(before, Files.readAllBytes(file));
            manager.transaction(file, Counter.class, c -> c.count = 3);
            assertEquals(3, manager.readJson(file, Counter.class, new Counter()).count);
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static LockConfig config(int retries, boolean debugLocks) {
        return LockConfig.builder()
                .staleMs(10_000)
                .retries(retries)
                .minRetryMs(5)
                .maxRetryMs(50)
                .retryFactor(2.0)
                .debugLocks(debugLocks)
                .workerThreads(4)
                .build();
    }

    private void writeForeignLock(long modifiedMillis) throws Exception {
        Path lockFile = InterProcessLock.lockFileFor(file);
        LockOwner owner = new LockOwner(ProcessHandle.current().pid(), "elsewhere",
                UUID.randomUUID().toString(), modifiedMillis);
        Files.write(lockFile, MAPPER.writeValueAsString(owner).getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(lockFile, FileTime.fromMillis(modifiedMillis));
    }

    private List<String> listDir() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private static <R> List<R> runConcurrently(int threads, Callable<R> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<R>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<R> results = new ArrayList<>();
            for (Future<R> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
