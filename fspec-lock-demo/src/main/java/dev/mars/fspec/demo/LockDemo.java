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
package dev.mars.fspec.demo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.fspec.lock.JsonLockedFileManager;
import dev.mars.fspec.lock.LockConfig;
import dev.mars.fspec.lock.LockedFileManager;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Demo entry point for the locked file manager.
 * <p>
 * This demonstrates the manager on a small work-unit store:
 * <ul>
 *   <li>Reading a file that does not exist yet (created from a default)</li>
 *   <li>Appending a work unit in a transaction</li>
 *   <li>A failing transaction that leaves the file untouched</li>
 *   <li>Reading the result back on the next run</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link LockConfig} with the following priority:
 * <ol>
 *   <li>System properties: {@code -Dfspec.lock.staleMs=20000 -Dfspec.debugLocks=true ...}</li>
 *   <li>Environment variables: {@code FSPEC_LOCK_STALE_MS, FSPEC_DEBUG_LOCKS, ...}</li>
 *   <li>Properties file: {@code fspec-lock.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 * The first command-line argument, if present, is the directory holding the files.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl fspec-lock-demo -am
 *
 * # Run with default configuration (classpath: demo JAR, core JAR, Jackson, SLF4J, Logback)
 * java -cp $CLASSPATH dev.mars.fspec.demo.LockDemo
 *
 * # Run against another directory, logging lock metrics
 * FSPEC_DEBUG_LOCKS=1 java -cp $CLASSPATH dev.mars.fspec.demo.LockDemo /path/to/spec
 * </pre>
 *
 * @see LockConfig
 */
public class LockDemo {

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Locked File Manager Demo       |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        Path specDir = Path.of(args.length > 0 && !args[0].isBlank() ? args[0] : "data/spec");
        Files.createDirectories(specDir);
        Path workUnits = specDir.resolve("work-units.json");

        LockConfig config = LockConfig.load();
        System.out.println("Configuration: " + config);
        System.out.println();

        ObjectMapper mapper = new ObjectMapper();

        try (LockedFileManager files = new JsonLockedFileManager(config)) {
            // Read, creating the store on first run
            ObjectNode defaults = mapper.createObjectNode();
            defaults.putArray("workUnits");
            ObjectNode store = files.readJson(workUnits, ObjectNode.class, defaults);
            System.out.println("[OK] Loaded " + workUnits.toAbsolutePath() + ": "
                    + store.path("workUnits").size() + " work units");

            // Append a work unit
            files.transaction(workUnits, doc -> {
                ArrayNode units = doc.has("workUnits") ? (ArrayNode) doc.get("workUnits") : doc.putArray("workUnits");
                String id = "WU-" + (units.size() + 1);
                units.addObject()
                        .put("id", id)
                        .put("status", "backlog")
                        .put("createdAt", Instant.now().toString());
                System.out.println("[OK] Added " + id);
            });

            // A failing transaction changes nothing
            try {
                files.transaction(workUnits, doc -> {
                    ((ArrayNode) doc.get("workUnits")).removeAll();
                    throw new IllegalStateException("validation failed, discarding changes");
                });
            } catch (IllegalStateException e) {
                System.out.println("[OK] Rolled back: " + e.getMessage());
            }

            // Show the store
            ObjectNode result = files.readJson(workUnits, ObjectNode.class, defaults);
            System.out.println("\n  Work units on disk:");
            for (var unit : result.path("workUnits")) {
                System.out.printf("    %s  %-8s %s%n",
                        unit.path("id").asText(), unit.path("status").asText(), unit.path("createdAt").asText());
            }

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to append another unit.    |");
            System.out.println("+---------------------------------------+");
        }
    }
}
