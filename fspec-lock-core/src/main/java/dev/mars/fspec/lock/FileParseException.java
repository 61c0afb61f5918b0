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
 * A managed file does not hold valid JSON, or its JSON does not map onto the
 * requested type.
 */
public class FileParseException extends LockedFileException {

    private final Path path;

    public FileParseException(Path path, Throwable cause) {
        super("Invalid JSON in " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    /** The file whose content could not be parsed. */
    public Path path() {
        return path;
    }
}
