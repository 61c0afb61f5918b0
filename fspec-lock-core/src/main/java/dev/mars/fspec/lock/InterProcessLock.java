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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory lock shared by cooperating processes, based on a lock file.
 * <p>
 * Holding the lock on {@code data.json} means owning {@code data.json.lock}.
 * The file is created with {@link StandardOpenOption#CREATE_NEW}, so exactly one
 * process can create it, and holds the owner's {@link LockOwner} as JSON.
 * <p>
 * <b>Staleness:</b> the owner refreshes the lock file's modification time every
 * {@link LockConfig#heartbeatMs()}. A lock file older than {@link LockConfig#staleMs()},
 * or owned by a process on this host that no longer exists, is treated as
 * abandoned and reclaimed.
 * <p>
 * <b>Retry:</b> a held lock is retried up to {@link LockConfig#retries()} times
 * with exponential backoff, then {@link LockTimeoutException} is thrown.
 * <p>
 * <b>Compromise:</b> if the lock file disappears or is taken over while held,
 * {@link Handle#ensureValid()} throws {@link LockCompromisedException}.
 * <p>
 * <b>Within one JVM</b> the lock on a path is taken once and shared by all
 * threads that ask for it; the lock file is removed when the last of them
 * releases. Arbitration between those threads belongs to {@link InProcessLock}.
 * A steady stream of overlapping holders in one JVM can therefore keep other
 * processes waiting until they time out.
 */
public final class InterProcessLock implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(InterProcessLock.class);

    /** Suffix appended to the managed file name to form the lock file name. */
    public static final String LOCK_SUFFIX = ".lock";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LockConfig config;
    private final long pid = ProcessHandle.current().pid();
    private final String host = localHostName();
    private final ConcurrentHashMap<Path, Holder> holders = new ConcurrentHashMap<>();
    private final ScheduledExecutorService heartbeat;
    private final LockFileOpener opener;
    private volatile boolean closed = false;

    public InterProcessLock(LockConfig config) {
        this(config, path -> FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
    }

    InterProcessLock(LockConfig config, LockFileOpener opener) {
        this.config = config;
        this.opener = opener;
        this.heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lock-heartbeat");
            t.setDaemon(true);
            return t;
        });
        LOG.debug("InterProcessLock initialized: pid={}, host={}, staleMs={}, retries={}",
                pid, host, config.staleMs(), config.retries());
    }

    /**
     * Creates a lock file exclusively, failing with {@link FileAlreadyExistsException}
     * if it exists.
     */
    @FunctionalInterface
    interface LockFileOpener {
        FileChannel open(Path lockFile) throws IOException;
    }

    /**
     * Owner record stored in a lock file.
     *
     * @param pid        process id of the owner
     * @param host       host name of the owner
     * @param token      random id of this particular acquisition
     * @param acquiredAt epoch millis of acquisition
     */
    public record LockOwner(long pid, String host, String token, long acquiredAt) {
    }

    /**
     * Acquires the lock on {@code path}, blocking through the retry schedule.
     *
     * @return handle that must be released exactly once, typically in a {@code finally}
     * @throws LockTimeoutException if the lock is still held by another process after all retries
     * @throws LockedFileException  if the lock file cannot be created for another reason
     */
    public Handle acquire(Path path) {
        if (closed) {
            throw new IllegalStateException("InterProcessLock is closed");
        }
        Path target = path.toAbsolutePath().normalize();
        Holder holder = holders.computeIfAbsent(target, Holder::new);

        int retries = 0;
        holder.guard.lock();
        try {
            if (holder.holdCount == 0) {
                retries = lockFile(holder);
            } else {
                LOG.trace("Joining existing hold on {} (holders={})", holder.lockFile, holder.holdCount);
            }
            holder.holdCount++;
        } finally {
            holder.guard.unlock();
        }
        return new Handle(holder, retries);
    }

    /**
     * Path of the lock file that guards {@code path}.
     */
    public static Path lockFileFor(Path path) {
        Path target = path.toAbsolutePath().normalize();
        return target.resolveSibling(target.getFileName().toString() + LOCK_SUFFIX);
    }

    /**
     * Reads the owner record of a lock file.
     *
     * @return the owner, or {@code null} if the file is missing or not (yet) a complete record
     */
    public static LockOwner readOwner(Path lockFile) {
        try {
            return MAPPER.readValue(Files.readAllBytes(lockFile), LockOwner.class);
        } catch (IOException e) {
            LOG.trace("No readable owner in {}: {}", lockFile, e.getMessage());
            return null;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        heartbeat.shutdownNow();
        LOG.debug("InterProcessLock closed");
    }

    // ========================================================================
    // Acquisition
    // ========================================================================

    /**
     * Creates the lock file, retrying with backoff. Caller holds {@code holder.guard}.
     *
     * @return number of retries used
     */
    private int lockFile(Holder holder) {
        int attempt = 0;
        while (true) {
            String token = UUID.randomUUID().toString();
            if (tryCreate(holder.lockFile, token)) {
                holder.token = token;
                holder.compromisedReason = null;
                holder.heartbeatTask = heartbeat.scheduleWithFixedDelay(
                        () -> refresh(holder, token),
                        config.heartbeatMs(), config.heartbeatMs(), TimeUnit.MILLISECONDS);
                LOG.debug("Lock acquired: {} (retries={})", holder.lockFile, attempt);
                return attempt;
            }

            if (reclaimIfStale(holder.lockFile)) {
                continue;
            }

            if (attempt >= config.retries()) {
                LOG.debug("Giving up on {} after {} attempts", holder.lockFile, attempt + 1);
                throw new LockTimeoutException(holder.target, attempt + 1);
            }

            long backoff = config.backoffMs(attempt);
            LOG.trace("Lock {} busy, retry {} in {} ms", holder.lockFile, attempt + 1, backoff);
            sleep(backoff, holder.target);
            attempt++;
        }
    }

    private boolean tryCreate(Path lockFile, String token) {
        byte[] content;
        try {
            content = MAPPER.writeValueAsBytes(new LockOwner(pid, host, token, System.currentTimeMillis()));
        } catch (IOException e) {
            throw new LockedFileException("Failed to encode lock owner for " + lockFile, e);
        }

        final FileChannel ch;
        try {
            ch = opener.open(lockFile);
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            // Not created by us, so nothing to remove
            LOG.error("Failed to create lock file {}: {}", lockFile, e.getMessage(), e);
            throw new LockedFileException("Failed to create lock file " + lockFile, e);
        }

        try (ch) {
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            return true;
        } catch (IOException e) {
            LOG.error("Failed to write lock file {}: {}", lockFile, e.getMessage(), e);
            deleteQuietly(lockFile);
            throw new LockedFileException("Failed to write lock file " + lockFile, e);
        }
    }

    /**
     * Removes {@code lockFile} if its owner is presumed dead.
     * <p>
     * The file judged stale is identified by file key, modification time and
     * owner token before it is moved aside. If the file that was moved turns out to be a different one (another
     * contender reclaimed the stale file and created a fresh lock in between), it
     * is linked back into place, which never replaces an existing file.
     *
     * @return true if the caller should retry immediately
     */
    private boolean reclaimIfStale(Path lockFile) {
        BasicFileAttributes judged;
        try {
            judged = Files.readAttributes(lockFile, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            throw new LockedFileException("Failed to inspect lock file " + lockFile, e);
        }

        LockOwner owner = readOwner(lockFile);
        long ageMs = System.currentTimeMillis() - judged.lastModifiedTime().toMillis();
        String reason = null;
        if (ageMs > config.staleMs()) {
            reason = "not refreshed for " + ageMs + " ms";
        } else {
            if (owner != null && host.equals(owner.host()) && owner.pid() != pid && !isAlive(owner.pid())) {
                reason = "owner process " + owner.pid() + " is gone";
            }
        }
        if (reason == null) {
            return false;
        }

        Path graveyard = lockFile.resolveSibling(lockFile.getFileName() + ".stale." + UUID.randomUUID());
        try {
            Files.move(lockFile, graveyard, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            throw new LockedFileException("Failed to reclaim stale lock file " + lockFile, e);
        }

        if (!isSameFile(judged, owner, graveyard)) {
            LOG.debug("Lock {} was replaced before it could be reclaimed, putting it back", lockFile);
            restore(graveyard, lockFile);
            return false;
        }
        LOG.warn("Reclaimed stale lock {}: {}", lockFile, reason);
        deleteQuietly(graveyard);
        return true;
    }

    /**
     * Whether {@code moved} is the file that was judged stale: same file key where
     * the file system has them, same modification time and same owner token.
     * A freed file key can be reused by the next lock file, hence the other two.
     */
    private static boolean isSameFile(BasicFileAttributes judged, LockOwner judgedOwner, Path moved) {
        BasicFileAttributes actual;
        try {
            actual = Files.readAttributes(moved, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new LockedFileException("Failed to inspect reclaimed lock file " + moved, e);
        }
        if (judged.fileKey() != null && !judged.fileKey().equals(actual.fileKey())) {
            return false;
        }
        if (!judged.lastModifiedTime().equals(actual.lastModifiedTime())) {
            return false;
        }
        LockOwner movedOwner = readOwner(moved);
        String judgedToken = judgedOwner == null ? null : judgedOwner.token();
        String movedToken = movedOwner == null ? null : movedOwner.token();
        return Objects.equals(judgedToken, movedToken);
    }

    /**
     * Puts a live lock file that was moved aside by mistake back in place.
     * If a third contender has already created a new lock file, the moved one is
     * dropped and its owner finds its lock compromised.
     */
    private static void restore(Path moved, Path lockFile) {
        try {
            Files.createLink(lockFile, moved);
        } catch (FileAlreadyExistsException e) {
            LOG.warn("Could not restore live lock {}: a new lock file exists", lockFile);
        } catch (UnsupportedOperationException | IOException e) {
            LOG.debug("Hard link unavailable for {}, moving back instead: {}", lockFile, e.getMessage());
            try {
                Files.move(moved, lockFile);
                return;
            } catch (FileAlreadyExistsException ex) {
                LOG.warn("Could not restore live lock {}: a new lock file exists", lockFile);
            } catch (IOException ex) {
                throw new LockedFileException("Failed to restore lock file " + lockFile, ex);
            }
        }
        deleteQuietly(moved);
    }

    private static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static void sleep(long millis, Path target) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockedFileException("Interrupted while waiting for lock on " + target, e);
        }
    }

    // ========================================================================
    // Heartbeat & Release
    // ========================================================================

    private void refresh(Holder holder, String token) {
        if (!token.equals(holder.token)) {
            return;
        }
        LockOwner owner = readOwner(holder.lockFile);
        if (owner == null || !token.equals(owner.token())) {
            markCompromised(holder, token, owner == null ? "lock file removed" : "lock file taken over by pid " + owner.pid());
            return;
        }
        try {
            Files.setLastModifiedTime(holder.lockFile, FileTime.fromMillis(System.currentTimeMillis()));
            LOG.trace("Refreshed lock {}", holder.lockFile);
        } catch (IOException e) {
            LOG.warn("Could not refresh lock {}: {}", holder.lockFile, e.getMessage());
        }
    }

    private void markCompromised(Holder holder, String token, String reason) {
        if (token.equals(holder.token) && holder.compromisedReason == null) {
            holder.compromisedReason = reason;
            LOG.error("Lock compromised on {}: {}", holder.target, reason);
        }
    }

    private void release(Holder holder) {
        holder.guard.lock();
        try {
            if (holder.holdCount == 0) {
                throw new IllegalMonitorStateException("Lock not held: " + holder.lockFile);
            }
            holder.holdCount--;
            if (holder.holdCount > 0) {
                return;
            }

            if (holder.heartbeatTask != null) {
                holder.heartbeatTask.cancel(false);
                holder.heartbeatTask = null;
            }
            String token = holder.token;
            holder.token = null;

            if (holder.compromisedReason != null) {
                LOG.warn("Not removing {} on release: {}", holder.lockFile, holder.compromisedReason);
                return;
            }
            LockOwner owner = readOwner(holder.lockFile);
            if (owner == null || !token.equals(owner.token())) {
                LOG.warn("Lock file {} no longer ours at release, leaving it", holder.lockFile);
                return;
            }
            try {
                Files.deleteIfExists(holder.lockFile);
                LOG.debug("Lock released: {}", holder.lockFile);
            } catch (IOException e) {
                // The file ages out and is reclaimed as stale
                LOG.warn("Could not remove lock file {}: {}", holder.lockFile, e.getMessage());
            }
        } finally {
            holder.guard.unlock();
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.debug("Could not resolve local host name: {}", e.getMessage());
            return "localhost";
        }
    }

    // ========================================================================
    // Holder & Handle
    // ========================================================================

    /**
     * This JVM's hold on one lock file.
     */
    private static final class Holder {
        private final Path target;
        private final Path lockFile;
        private final ReentrantLock guard = new ReentrantLock();

        // guarded by guard
        private int holdCount;
        private ScheduledFuture<?> heartbeatTask;

        private volatile String token;
        private volatile String compromisedReason;

        Holder(Path target) {
            this.target = target;
            this.lockFile = lockFileFor(target);
        }
    }

    /**
     * One caller's share of a held lock.
     */
    public final class Handle implements AutoCloseable {
        private final Holder holder;
        private final int retries;
        private final String token;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Handle(Holder holder, int retries) {
            this.holder = holder;
            this.retries = retries;
            this.token = holder.token;
        }

        /** The managed file this lock guards. */
        public Path path() {
            return holder.target;
        }

        /** Retries spent acquiring; zero when an existing hold of this JVM was joined. */
        public int retries() {
            return retries;
        }

        /**
         * Verifies that the lock file is still ours.
         *
         * @throws LockCompromisedException if it was removed or taken over
         * @throws IllegalStateException    if this handle was already released
         */
        public void ensureValid() {
            if (released.get()) {
                throw new IllegalStateException("Lock handle already released: " + holder.lockFile);
            }
            String reason = holder.compromisedReason;
            if (reason == null) {
                LockOwner owner = readOwner(holder.lockFile);
                if (owner != null && token.equals(owner.token())) {
                    return;
                }
                reason = owner == null ? "lock file removed" : "lock file taken over by pid " + owner.pid();
                markCompromised(holder, token, reason);
            }
            throw new LockCompromisedException(holder.target, reason);
        }

        /**
         * Releases this share of the lock. Calling it again has no effect.
         */
        public void release() {
            if (released.compareAndSet(false, true)) {
                InterProcessLock.this.release(holder);
            }
        }

        @Override
        public void close() {
            release();
        }
    }
}
