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

import java.nio.file.Path;

/**
 * Debug logging of lock wait time, hold duration and retries.
 * <p>
 * Disabled unless {@code FSPEC_DEBUG_LOCKS} (or {@code fspec.debugLocks}) is set,
 * in which case every completed acquisition produces one DEBUG line:
 * <pre>
 * [LOCK] Acquired WRITE lock on /work/spec/work-units.json (waited 3ms, held 1ms, retries 0)
 * </pre>
 * When disabled, {@link #record} returns before formatting anything.
 */
public final class LockMetrics {

    private static final Logger LOG = LoggerFactory.getLogger(LockMetrics.class);

    private final boolean enabled;

    public LockMetrics(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean enabled() {
        return enabled;
    }

    public void record(LockType lockType, Path path, long waitMs, long holdMs, int retries) {
        if (!enabled) {
            return;
        }
        LOG.debug("[LOCK] Acquired {} lock on {} (waited {}ms, held {}ms, retries {})",
                lockType, path, waitMs, holdMs, retries);
    }
}
