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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Write-to-temp-then-rename.
 * <p>
 * The new content goes to {@code {target}.tmp.{uuid}} in the target's directory
 * and is then moved over the target with {@link StandardCopyOption#ATOMIC_MOVE}.
 * A concurrent reader opening the target sees either the complete old content or
 * the complete new content, never a prefix of either.
 * <p>
 * <b>Durability:</b> with {@code syncEnabled} the temp file is forced before the
 * rename and the directory after it. Without it the guarantee is "no partial
 * file", not "no data loss on power failure".
 */
public final class AtomicWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicWriter.class);

    /** Infix between the target file name and the unique suffix of a temp file. */
    static final String TMP_INFIX = ".tmp.";

    private final boolean syncEnabled;

    public AtomicWriter(boolean syncEnabled) {
        this.syncEnabled = syncEnabled;
    }

    /**
     * Replaces the content of {@code target} with {@code content}.
     *
     * @throws LockedFileException if writing or renaming fails; the target is then unchanged
     */
    public void write(Path target, byte[] content) {
        Path tmpPath = tempPathFor(target);
        try {
            LOG.trace("Writing {} bytes to temp file {}", content.length, tmpPath);
            ByteBuffer buf = ByteBuffer.wrap(content);
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmpPath);
                }
            }

            Files.move(tmpPath, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, target);

            if (syncEnabled) {
                syncDirectory(target.getParent());
            }
        } catch (IOException e) {
            LOG.error("Failed to write {}: {}", target, e.getMessage(), e);
            abandon(tmpPath);
            throw new LockedFileException("Failed to write " + target, e);
        }
    }

    /**
     * Deletes temp files of {@code target} left behind by writers that died
     * between creating and renaming them.
     *
     * @param olderThan only files whose modification time is at least this old are removed
     * @return number of files deleted
     */
    public int deleteStaleTempFiles(Path target, Duration olderThan) {
        Path dir = target.toAbsolutePath().getParent();
        String prefix = target.getFileName().toString() + TMP_INFIX;
        Instant cutoff = Instant.now().minus(olderThan);
        int deleted = 0;

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, prefix + "*")) {
            for (Path candidate : stream) {
                try {
                    if (Files.getLastModifiedTime(candidate).toInstant().isAfter(cutoff)) {
                        continue;
                    }
                    if (Files.deleteIfExists(candidate)) {
                        deleted++;
                        LOG.debug("Deleted stale temp file {}", candidate);
                    }
                } catch (IOException e) {
                    LOG.warn("Could not delete stale temp file {}: {}", candidate, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new LockedFileException("Failed to scan " + dir + " for temp files", e);
        }

        if (deleted > 0) {
            LOG.info("Removed {} stale temp file(s) of {}", deleted, target);
        }
        return deleted;
    }

    static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + TMP_INFIX + UUID.randomUUID());
    }

    private void abandon(Path tmpPath) {
        try {
            if (Files.deleteIfExists(tmpPath)) {
                LOG.debug("Removed abandoned temp file {}", tmpPath);
            }
        } catch (IOException e) {
            LOG.warn("Could not remove abandoned temp file {}: {}", tmpPath, e.getMessage());
        }
    }

    /**
     * Fsyncs a directory so the rename itself is durable.
     * <p>
     * On Windows, this may fail or be a no-op.
     */
    private void syncDirectory(Path dir) {
        if (dir == null || System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
