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
package dev.mars.fspec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.fspec.lock.JsonLockedFileManager;
import dev.mars.fspec.lock.LockedFileManager;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Demo entry point for the locked file manager.
 * <p>
 * This demonstrates basic operations:
 * <ul>
 *   <li>Creating a file on first read</li>
 *   <li>Mutating it in a transaction</li>
 *   <li>Rollback when the mutation fails</li>
 * </ul>
 */
public class Main {

    public static void main(String[] args) throws Exception {
        System.out.println("Locked File Manager Demo");
        System.out.println("========================\n");

        Path dataDir = Path.of(args.length > 0 ? args[0] : "data/fspec");
        Files.createDirectories(dataDir);
        Path counterFile = dataDir.resolve("counter.json");

        try (LockedFileManager files = new JsonLockedFileManager()) {
            // First read creates the file
            ObjectNode defaults = new ObjectMapper().createObjectNode().put("count", 0);
            ObjectNode initial = files.readJson(counterFile, ObjectNode.class, defaults);
            System.out.println("✓ Read " + counterFile.toAbsolutePath() + ": " + initial);

            // Increment under the write lock
            files.transaction(counterFile, data -> data.put("count", data.path("count").asInt() + 1));
            ObjectNode updated = files.readJson(counterFile, ObjectNode.class, initial);
            System.out.println("✓ Incremented count to " + updated.path("count").asInt());

            // A failing mutation leaves the file untouched
            try {
                files.transaction(counterFile, data -> {
                    data.put("count", -1);
                    throw new IllegalStateException("validation failed");
                });
            } catch (IllegalStateException e) {
                ObjectNode after = files.readJson(counterFile, ObjectNode.class, initial);
                System.out.println("✓ Rolled back (" + e.getMessage() + "), count is still " + after.path("count").asInt());
            }

            System.out.println("\n✓ Demo complete!");
        }
    }
}
