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
/**
 * Locked JSON file manager.
 * <p>
 * Safe concurrent access to JSON state files read and mutated by several
 * processes and, within each process, by several threads:
 * <ul>
 *   <li>{@link dev.mars.fspec.lock.LockedFileManager} - the {@code readJson} / {@code transaction} API</li>
 *   <li>{@link dev.mars.fspec.lock.JsonLockedFileManager} - implementation tying the layers together</li>
 *   <li>{@link dev.mars.fspec.lock.InterProcessLock} - lock file with staleness detection and backoff</li>
 *   <li>{@link dev.mars.fspec.lock.InProcessLock} - per-path readers-writer lock</li>
 *   <li>{@link dev.mars.fspec.lock.AtomicWriter} - temp file and atomic rename</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>No partial files:</b> readers see the old or the new content, never a mix</li>
 *   <li><b>Rollback:</b> a transaction whose mutation throws writes nothing</li>
 *   <li><b>Crash tolerance:</b> lock files of dead processes are reclaimed once stale</li>
 *   <li><b>One file at a time:</b> multi-file updates are sequential transactions, not atomic</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * spec/
 *  ├─ work-units.json                 // managed file
 *  ├─ work-units.json.lock            // present while a process holds the lock
 *  └─ work-units.json.tmp.{uuid}      // present only during a write
 * </pre>
 *
 * @see dev.mars.fspec.lock.LockedFileManager
 */
package dev.mars.fspec.lock;
