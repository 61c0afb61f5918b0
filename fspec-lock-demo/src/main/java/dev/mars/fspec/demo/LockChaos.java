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
package dev.mars.fspec.demo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.fspec.lock.AtomicWriter;
import dev.mars.fspec.lock.InterProcessLock;
import dev.mars.fspec.lock.InterProcessLock.LockOwner;
import dev.mars.fspec.lock.JsonLockedFileManager;
import dev.mars.fspec.lock.LockCompromisedException;
import dev.mars.fspec.lock.LockConfig;
import dev.mars.fspec.lock.LockTimeoutException;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chaos testing for the locked file manager.
 * <p>
 * This class throws contention and failure scenarios at shared JSON files:
 * <ul>
 *   <li>Thread storms incrementing one counter</li>
 *   <li>Readers racing writers</li>
 *   <li>Several JVMs updating the same file</li>
 *   <li>Abandoned, dead-owner and stolen lock files</li>
 *   <li>Failing transactions and leftover temp files</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl fspec-lock-demo -am
 *
 * # Run all chaos tests
 * java -cp $CLASSPATH dev.mars.fspec.demo.LockChaos
 *
 * # Run specific group
 * java -cp $CLASSPATH dev.mars.fspec.demo.LockChaos threads
 * java -cp $CLASSPATH dev.mars.fspec.demo.LockChaos processes
 * java -cp $CLASSPATH dev.mars.fspec.demo.LockChaos recovery
 * </pre>
 * The {@code processes} group starts copies of this class in {@code worker}
 * mode, using the current JVM's executable and classpath.
 *
 * @see JsonLockedFileManager
 */
public class LockChaos {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public LockChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        if (args.length > 0 && args[0].equals("worker")) {
            runWorker(Path.of(args[1]), Integer.parseInt(args[2]));
            return;
        }

        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║              LOCK CHAOS TESTING SUITE                         ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("lock-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        LockChaos chaos = new LockChaos(chaosDir);

        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "threads" -> chaos.runThreadTests();
                case "processes" -> chaos.runProcessTests();
                case "recovery" -> chaos.runRecoveryTests();
                case "all" -> {
                    chaos.runThreadTests();
                    chaos.runProcessTests();
                    chaos.runRecoveryTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: threads, processes, recovery, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // THREAD CHAOS
    // =========================================================================

    private void runThreadTests() throws Exception {
        printSection("THREAD CHAOS");

        chaosTest("Counter Storm (16 threads × 50 increments)", this::threadCounterStorm);
        chaosTest("Readers Racing Writers", this::readersRacingWriters);
        chaosTest("Async Fan-Out (10 files × 20 updates)", this::asyncFanOut);
    }

    private void threadCounterStorm() throws Exception {
        Path file = createTestDir("thread-storm").resolve("counter.json");
        int numThreads = 16;
        int incrementsPerThread = 50;

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            runThreads(numThreads, () -> {
                for (int i = 0; i < incrementsPerThread; i++) {
                    files.transaction(file, LockChaos::increment);
                }
            });
        }

        expectCount(file, numThreads * incrementsPerThread);
    }

    private void readersRacingWriters() throws Exception {
        Path file = createTestDir("readers-writers").resolve("counter.json");
        int writers = 4;
        int readers = 8;
        int incrementsPerWriter = 50;
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger reads = new AtomicInteger();

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            files.readJson(file, ObjectNode.class, counter(0));

            ExecutorService pool = Executors.newFixedThreadPool(readers);
            List<CompletableFuture<Void>> readerTasks = new ArrayList<>();
            for (int r = 0; r < readers; r++) {
                readerTasks.add(CompletableFuture.runAsync(() -> {
                    int last = 0;
                    while (writing.get()) {
                        int seen = files.readJson(file, ObjectNode.class, counter(0)).path("count").asInt();
                        if (seen < last) {
                            throw new AssertionError("Counter went backwards: " + last + " -> " + seen);
                        }
                        last = seen;
                        reads.incrementAndGet();
                        // Readers are favoured; back-to-back reads would starve the writers
                        pause(2);
                    }
                }, pool));
            }

            try {
                runThreads(writers, () -> {
                    for (int i = 0; i < incrementsPerWriter; i++) {
                        files.transaction(file, LockChaos::increment);
                    }
                });
            } finally {
                writing.set(false);
                pool.shutdown();
            }
            CompletableFuture.allOf(readerTasks.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);
        }

        expectCount(file, writers * incrementsPerWriter);
        if (reads.get() == 0) {
            throw new AssertionError("Readers never completed a read");
        }
    }

    private void asyncFanOut() throws Exception {
        Path dir = createTestDir("fan-out");
        int numFiles = 10;
        int updatesPerFile = 20;

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            List<CompletableFuture<Void>> updates = new ArrayList<>();
            for (int u = 0; u < updatesPerFile; u++) {
                for (int f = 0; f < numFiles; f++) {
                    updates.add(files.transactionAsync(dir.resolve("file-" + f + ".json"), ObjectNode.class,
                            LockChaos::increment));
                }
            }
            CompletableFuture.allOf(updates.toArray(new CompletableFuture[0])).get(60, TimeUnit.SECONDS);
        }

        for (int f = 0; f < numFiles; f++) {
            expectCount(dir.resolve("file-" + f + ".json"), updatesPerFile);
        }
    }

    // =========================================================================
    // PROCESS CHAOS
    // =========================================================================

    private void runProcessTests() throws Exception {
        printSection("PROCESS CHAOS");

        chaosTest("Process Storm (4 JVMs × 50 increments)", this::processStorm);
        chaosTest("Processes and Threads Together", this::processesAndThreads);
    }

    private void processStorm() throws Exception {
        Path dir = createTestDir("process-storm");
        Path file = dir.resolve("counter.json");
        int numWorkers = 4;
        int incrementsPerWorker = 50;

        List<Process> workers = new ArrayList<>();
        for (int w = 0; w < numWorkers; w++) {
            workers.add(startWorker(file, incrementsPerWorker, dir.resolve("worker-" + w + ".log")));
        }
        awaitWorkers(workers, dir);

        expectCount(file, numWorkers * incrementsPerWorker);
    }

    private void processesAndThreads() throws Exception {
        Path dir = createTestDir("mixed");
        Path file = dir.resolve("counter.json");
        int numWorkers = 2;
        int numThreads = 4;
        int increments = 30;

        List<Process> workers = new ArrayList<>();
        for (int w = 0; w < numWorkers; w++) {
            workers.add(startWorker(file, increments, dir.resolve("worker-" + w + ".log")));
        }
        try (JsonLockedFileManager files = new JsonLockedFileManager(patientConfig())) {
            runThreads(numThreads, () -> {
                for (int i = 0; i < increments; i++) {
                    files.transaction(file, LockChaos::increment);
                }
            });
        }
        awaitWorkers(workers, dir);

        expectCount(file, (numWorkers + numThreads) * increments);
    }

    private static void runWorker(Path file, int increments) {
        try (JsonLockedFileManager files = new JsonLockedFileManager()) {
            for (int i = 0; i < increments; i++) {
                files.transaction(file, LockChaos::increment);
            }
        }
    }

    private static Process startWorker(Path file, int increments, Path log) throws IOException {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        ProcessBuilder builder = new ProcessBuilder(
                java,
                "-cp", System.getProperty("java.class.path"),
                "-Dfspec.lock.retries=400",
                "-Dfspec.lock.minRetryMs=5",
                "-Dfspec.lock.maxRetryMs=50",
                LockChaos.class.getName(), "worker", file.toString(), String.valueOf(increments));
        builder.redirectErrorStream(true);
        builder.redirectOutput(log.toFile());
        return builder.start();
    }

    private static void awaitWorkers(List<Process> workers, Path dir) throws Exception {
        for (int w = 0; w < workers.size(); w++) {
            Process worker = workers.get(w);
            if (!worker.waitFor(120, TimeUnit.SECONDS)) {
                worker.destroyForcibly();
                throw new AssertionError("Worker " + w + " did not finish");
            }
            if (worker.exitValue() != 0) {
                String log = Files.readString(dir.resolve("worker-" + w + ".log"));
                throw new AssertionError("Worker " + w + " exited with " + worker.exitValue() + ":\n" + log);
            }
        }
    }

    // =========================================================================
    // RECOVERY CHAOS
    // =========================================================================

    private void runRecoveryTests() throws Exception {
        printSection("RECOVERY CHAOS");

        chaosTest("Abandoned Lock File Is Reclaimed", this::abandonedLockReclaimed);
        chaosTest("Dead Owner's Lock File Is Reclaimed", this::deadOwnerReclaimed);
        chaosTest("Live Foreign Lock Times Out", this::liveLockTimesOut);
        chaosTest("Stolen Lock Aborts the Write", this::stolenLockAbortsWrite);
        chaosTest("Failing Transactions Leave No Trace", this::failingTransactions);
        chaosTest("Leftover Temp Files Are Swept", this::leftoverTempFilesSwept);
    }

    private void abandonedLockReclaimed() throws Exception {
        Path file = createTestDir("abandoned").resolve("counter.json");
        writeForeignLock(file, ProcessHandle.current().pid(), System.currentTimeMillis() - 60_000);

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            files.transaction(file, LockChaos::increment);
        }

        expectCount(file, 1);
        expectNoLockFile(file);
    }

    private void deadOwnerReclaimed() throws Exception {
        Path file = createTestDir("dead-owner").resolve("counter.json");
        Process finished = new ProcessBuilder(
                Path.of(System.getProperty("java.home"), "bin", "java").toString(), "-version")
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        finished.waitFor(30, TimeUnit.SECONDS);
        writeForeignLock(file, finished.pid(), System.currentTimeMillis());

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            files.transaction(file, LockChaos::increment);
        }

        expectCount(file, 1);
    }

    private void liveLockTimesOut() throws Exception {
        Path file = createTestDir("live-lock").resolve("counter.json");
        writeForeignLock(file, ProcessHandle.current().pid(), System.currentTimeMillis());

        LockConfig config = LockConfig.builder().retries(3).minRetryMs(10).maxRetryMs(20).build();
        try (JsonLockedFileManager files = new JsonLockedFileManager(config)) {
            files.transaction(file, LockChaos::increment);
            throw new AssertionError("Transaction should not get past a live lock");
        } catch (LockTimeoutException e) {
            if (e.attempts() != 4) {
                throw new AssertionError("Expected 4 attempts, got " + e.attempts());
            }
        }
        if (Files.exists(file)) {
            throw new AssertionError("File written without the lock");
        }
    }

    private void stolenLockAbortsWrite() throws Exception {
        Path file = createTestDir("stolen").resolve("counter.json");

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            files.transaction(file, LockChaos::increment);
            byte[] before = Files.readAllBytes(file);
            try {
                files.transaction(file, doc -> {
                    writeForeignLock(file, 4242, System.currentTimeMillis());
                    increment(doc);
                });
                throw new AssertionError("Write should have been refused");
            } catch (LockCompromisedException e) {
                if (!Arrays.equals(before, Files.readAllBytes(file))) {
                    throw new AssertionError("File changed under a stolen lock");
                }
            }
            if (InterProcessLock.readOwner(InterProcessLock.lockFileFor(file)).pid() != 4242) {
                throw new AssertionError("New owner's lock file was removed");
            }
        }
    }

    private void failingTransactions() throws Exception {
        Path dir = createTestDir("failing");
        Path file = dir.resolve("counter.json");

        try (JsonLockedFileManager files = new JsonLockedFileManager(fastConfig())) {
            files.transaction(file, LockChaos::increment);
            byte[] before = Files.readAllBytes(file);

            for (int i = 0; i < 50; i++) {
                try {
                    files.transaction(file, doc -> {
                        increment(doc);
                        throw new IOException("boom");
                    });
                    throw new AssertionError("Transaction should have failed");
                } catch (IOException e) {
                    if (!"boom".equals(e.getMessage())) {
                        throw new AssertionError("Unexpected failure: " + e, e);
                    }
                }
            }

            if (!Arrays.equals(before, Files.readAllBytes(file))) {
                throw new AssertionError("Failed transaction changed the file");
            }
            files.transaction(file, LockChaos::increment);
        }

        expectCount(file, 2);
        try (var entries = Files.list(dir)) {
            long extra = entries.filter(p -> !p.getFileName().toString().equals("counter.json")).count();
            if (extra != 0) {
                throw new AssertionError(extra + " leftover files next to counter.json");
            }
        }
    }

    private void leftoverTempFilesSwept() throws Exception {
        Path file = createTestDir("sweep").resolve("counter.json");
        Path oldTemp = file.resolveSibling("counter.json.tmp." + UUID.randomUUID());
        Path freshTemp = file.resolveSibling("counter.json.tmp." + UUID.randomUUID());
        Files.writeString(oldTemp, "{\"count\": ");
        Files.writeString(freshTemp, "{\"count\": ");
        Files.setLastModifiedTime(oldTemp, FileTime.fromMillis(System.currentTimeMillis() - 3_600_000));

        int deleted = new AtomicWriter(false).deleteStaleTempFiles(file, Duration.ofMinutes(10));

        if (deleted != 1 || Files.exists(oldTemp) || !Files.exists(freshTemp)) {
            throw new AssertionError("Expected only the old temp file to be swept, deleted=" + deleted);
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private static void increment(ObjectNode doc) {
        doc.put("count", doc.path("count").asInt() + 1);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", e);
        }
    }

    private static ObjectNode counter(int count) {
        return MAPPER.createObjectNode().put("count", count);
    }

    private static LockConfig fastConfig() {
        return LockConfig.builder()
                .retries(100)
                .minRetryMs(5)
                .maxRetryMs(50)
                .build();
    }

    private static LockConfig patientConfig() {
        return LockConfig.builder()
                .retries(400)
                .minRetryMs(5)
                .maxRetryMs(50)
                .build();
    }

    private static void expectCount(Path file, int expected) throws IOException {
        int actual = MAPPER.readTree(file.toFile()).path("count").asInt();
        if (actual != expected) {
            throw new AssertionError("Expected count " + expected + " in " + file.getFileName() + ", got " + actual);
        }
    }

    private static void expectNoLockFile(Path file) {
        if (Files.exists(InterProcessLock.lockFileFor(file))) {
            throw new AssertionError("Lock file left behind for " + file.getFileName());
        }
    }

    private static void writeForeignLock(Path file, long pid, long modifiedMillis) throws IOException {
        Path lockFile = InterProcessLock.lockFileFor(file);
        LockOwner owner = new LockOwner(pid, localHost(), UUID.randomUUID().toString(), modifiedMillis);
        Files.write(lockFile, MAPPER.writeValueAsString(owner).getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(lockFile, FileTime.fromMillis(modifiedMillis));
    }

    private static String localHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    private static void runThreads(int numThreads, ChaosTestRunnable body) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicReference<Throwable> firstError = new AtomicReference<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>();

        for (int t = 0; t < numThreads; t++) {
            tasks.add(CompletableFuture.runAsync(() -> {
                try {
                    startLatch.await(); // All threads start together
                    body.run();
                } catch (Throwable e) {
                    firstError.compareAndSet(null, e);
                }
            }, executor));
        }

        startLatch.countDown(); // GO!
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get(120, TimeUnit.SECONDS);
        executor.shutdown();

        if (firstError.get() != null) {
            throw new AssertionError("Worker thread failed: " + firstError.get(), firstError.get());
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(LockChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Could not clean up " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }
}
