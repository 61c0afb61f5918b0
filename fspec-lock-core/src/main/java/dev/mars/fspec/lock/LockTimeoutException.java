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

/**
 * The inter-process lock could not be acquired within the retry budget.
 * <p>
 * The caller may retry the whole operation.
 */
public class LockTimeoutException extends LockedFileException {

    private final Path path;
    private final int attempts;

    public LockTimeoutException(Path path, int attempts) {
        super("Timed out acquiring lock on " + path + " after " + attempts + " attempts");
        this.path = path;
        this.attempts = attempts;
    }

    /** The managed file whose lock could not be acquired. */
    public Path path() {
        return path;
    }

    /** Number of acquisition attempts made, including the first. */
    public int attempts() {
        return attempts;
    }
}
