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

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory readers-writer lock keyed by absolute file path.
 * <p>
 * Coordinates the threads of one process. Separate processes are kept apart
 * by {@link InterProcessLock}, which is acquired first.
 * <p>
 * <b>Per path:</b>
 * <ul>
 *   <li>Readers never block readers. A reader waits only while a writer holds the lock.</li>
 *   <li>A writer waits until there are no readers and no writer, re-checking after every wake-up.</li>
 *   <li>When the last reader leaves, exactly one waiting writer is woken.</li>
 *   <li>When a writer leaves, all waiting readers are admitted together; the next
 *       waiting writer is woken only if no reader was waiting.</li>
 * </ul>
 * <p>
 * <b>Wake-up policy:</b> draining the reader queue before the writer queue is
 * intentional. It keeps read-heavy workloads fast, and under sustained read
 * pressure it can starve writers. New readers also enter while writers are
 * queued, as long as no writer holds the lock.
 * <p>
 * <b>Thread Safety:</b> the registry is a {@link ConcurrentHashMap}; each path's
 * state is guarded by its own {@link ReentrantLock}, and every waiter parks on
 * its own {@link Condition}. Waits are uninterruptible.
 */
public final class InProcessLock {

    private final ConcurrentHashMap<Path, LockState> registry = new ConcurrentHashMap<>();

    public void acquireRead(Path path) {
        state(path).acquireRead();
    }

    /**
     * @throws IllegalMonitorStateException if no read lock is held on {@code path}
     */
    public void releaseRead(Path path) {
        state(path).releaseRead();
    }

    public void acquireWrite(Path path) {
        state(path).acquireWrite();
    }

    /**
     * @throws IllegalMonitorStateException if the write lock on {@code path} is not held
     */
    public void releaseWrite(Path path) {
        state(path).releaseWrite();
    }

    /**
     * Drops every path's state.
     * <p>
     * Only for test isolation: threads still waiting on a dropped state are never woken.
     */
    public void reset() {
        registry.clear();
    }

    int readerCount(Path path) {
        return state(path).readerCount();
    }

    boolean isWriteLocked(Path path) {
        return state(path).writerHeld();
    }

    int queuedReaders(Path path) {
        return state(path).queuedReaders();
    }

    int queuedWriters(Path path) {
        return state(path).queuedWriters();
    }

    private LockState state(Path path) {
        return registry.computeIfAbsent(path.toAbsolutePath().normalize(), p -> new LockState());
    }

    /**
     * Lock state of one path.
     * <p>
     * <b>INVARIANT:</b> {@code writerHeld} implies {@code readerCount == 0}.
     */
    private static final class LockState {
        private final ReentrantLock mutex = new ReentrantLock();
        private final ArrayDeque<Waiter> waitingReaders = new ArrayDeque<>();
        private final ArrayDeque<Waiter> waitingWriters = new ArrayDeque<>();
        private int readerCount;
        private boolean writerHeld;

        void acquireRead() {
            mutex.lock();
            try {
                if (!writerHeld) {
                    readerCount++;
                    return;
                }
                Waiter waiter = new Waiter(mutex.newCondition());
                waitingReaders.addLast(waiter);
                // releaseWrite() counts us in before signalling
                waiter.await();
            } finally {
                mutex.unlock();
            }
        }

        void releaseRead() {
            mutex.lock();
            try {
                if (readerCount == 0) {
                    throw new IllegalMonitorStateException("Read lock not held");
                }
                readerCount--;
                if (readerCount == 0) {
                    wakeNextWriter();
                }
            } finally {
                mutex.unlock();
            }
        }

        void acquireWrite() {
            mutex.lock();
            try {
                while (readerCount > 0 || writerHeld) {
                    Waiter waiter = new Waiter(mutex.newCondition());
                    waitingWriters.addLast(waiter);
                    waiter.await();
                }
                writerHeld = true;
            } finally {
                mutex.unlock();
            }
        }

        void releaseWrite() {
            mutex.lock();
            try {
                if (!writerHeld) {
                    throw new IllegalMonitorStateException("Write lock not held");
                }
                writerHeld = false;

                if (!waitingReaders.isEmpty()) {
                    readerCount += waitingReaders.size();
                    Waiter reader;
                    while ((reader = waitingReaders.pollFirst()) != null) {
                        reader.wake();
                    }
                } else {
                    wakeNextWriter();
                }
            } finally {
                mutex.unlock();
            }
        }

        private void wakeNextWriter() {
            Waiter writer = waitingWriters.pollFirst();
            if (writer != null) {
                writer.wake();
            }
        }

        int readerCount() {
            mutex.lock();
            try {
                return readerCount;
            } finally {
                mutex.unlock();
            }
        }

        boolean writerHeld() {
            mutex.lock();
            try {
                return writerHeld;
            } finally {
                mutex.unlock();
            }
        }

        int queuedReaders() {
            mutex.lock();
            try {
                return waitingReaders.size();
            } finally {
                mutex.unlock();
            }
        }

        int queuedWriters() {
            mutex.lock();
            try {
                return waitingWriters.size();
            } finally {
                mutex.unlock();
            }
        }
    }

    /**
     * A parked thread. Guarded by the owning state's mutex.
     */
    private static final class Waiter {
        private final Condition condition;
        private boolean woken;

        Waiter(Condition condition) {
            this.condition = condition;
        }

        void await() {
            while (!woken) {
                condition.awaitUninterruptibly();
            }
        }

        void wake() {
            woken = true;
            condition.signal();
        }
    }
}
