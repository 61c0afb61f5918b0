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
 * Exception thrown when a locked file operation fails.
 * <p>
 * Base type for every failure the manager surfaces. I/O failures are wrapped
 * with the original {@link java.io.IOException} as the cause.
 */
public class LockedFileException extends RuntimeException {

    public LockedFileException(String message) {
        super(message);
    }

    public LockedFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
