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
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Locked access to JSON state files shared between threads and processes.
 * <p>
 * Each operation works on a single file. A caller that updates two files runs
 * two sequential transactions; there is no atomicity across files.
 * <p>
 * One instance is created per process by the entry point and handed to the
 * components that need durable state.
 * <p>
 * <b>Lock order:</b> the inter-process lock is taken before the in-process lock
 * and released after it, on every exit path.
 *
 * @see JsonLockedFileManager
 */
public interface LockedFileManager extends Closeable {

    /**
     * Reads a JSON file under a shared lock, creating it if it does not exist.
     * <p>
     * If the file is missing, the shared lock is dropped, an exclusive lock is
     * taken, and the file is created with {@code defaultValue} unless another
     * caller created it in the meantime. The content found, or
     * {@code defaultValue}, is returned.
     *
     * @param path         the managed file
     * @param type         the type to bind the content to
     * @param defaultValue initial content written if the file does not exist
     * @return the file's content
     * @throws FileParseException    if the file is not valid JSON of {@code type}
     * @throws LockTimeoutException  if the inter-process lock could not be acquired
     * @throws LockedFileException   on I/O failure
     */
    <T> T readJson(Path path, Class<T> type, T defaultValue);

    /**
     * Generic-type variant of {@link #readJson(Path, Class, Object)}.
     */
    <T> T readJson(Path path, TypeReference<T> type, T defaultValue);

    /**
     * Runs a read-mutate-write cycle under an exclusive lock.
     * <p>
     * The current content (an empty object if the file does not exist) is bound
     * to {@code type} and passed to {@code mutation}, which changes it in place.
     * The result then atomically replaces the file. If the mutation throws,
     * nothing is written and its exception is rethrown as is.
     *
     * @throws X                        whatever {@code mutation} throws
     * @throws FileParseException       if the existing content is not valid JSON of {@code type}
     * @throws LockTimeoutException     if the inter-process lock could not be acquired
     * @throws LockCompromisedException if the inter-process lock was lost before the write
     * @throws LockedFileException      on I/O failure
     */
    <T, X extends Exception> void transaction(Path path, Class<T> type, Mutation<T, X> mutation) throws X;

    /**
     * Generic-type variant of {@link #transaction(Path, Class, Mutation)}.
     */
    <T, X extends Exception> void transaction(Path path, TypeReference<T> type, Mutation<T, X> mutation) throws X;

    /**
     * Transaction over the file's JSON tree.
     */
    default <X extends Exception> void transaction(Path path, Mutation<ObjectNode, X> mutation) throws X {
        transaction(path, ObjectNode.class, mutation);
    }

    /**
     * Runs {@link #readJson(Path, Class, Object)} on the manager's worker pool.
     */
    <T> CompletableFuture<T> readJsonAsync(Path path, Class<T> type, T defaultValue);

    /**
     * Runs {@link #transaction(Path, Class, Mutation)} on the manager's worker pool.
     * <p>
     * The future fails with the mutation's own exception if it throws.
     */
    <T> CompletableFuture<Void> transactionAsync(Path path, Class<T> type, Mutation<T, ?> mutation);

    /**
     * Stops the worker pool and the lock heartbeat. Idempotent.
     */
    @Override
    void close();
}
