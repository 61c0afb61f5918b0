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

/**
 * In-place mutation applied to a file's content inside a transaction.
 * <p>
 * If {@link #mutate} throws, the transaction writes nothing and the exception
 * reaches the caller of {@link LockedFileManager#transaction} unchanged.
 *
 * @param <T> the content type
 * @param <X> the exception type the mutation may throw
 */
@FunctionalInterface
public interface Mutation<T, X extends Exception> {

    void mutate(T data) throws X;
}
