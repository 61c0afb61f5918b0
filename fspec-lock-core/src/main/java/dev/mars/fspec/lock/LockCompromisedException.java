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
 * The inter-process lock was taken away while held: the lock file was removed,
 * or replaced by another owner that judged it stale.
 */
public class LockCompromisedException extends LockedFileException {

    private final Path path;

    public LockCompromisedException(Path path, String reason) {
        super("Lock compromised on " + path + ": " + reason);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
