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

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LockConfig} resolution, validation and derived values.
 */
class LockConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("fspec.lock.staleMs");
        System.clearProperty("fspec.lock.retries");
        System.clearProperty("fspec.lock.minRetryMs");
        System.clearProperty("fspec.lock.maxRetryMs");
        System.clearProperty("fspec.lock.retryFactor");
        System.clearProperty("fspec.lock.syncEnabled");
        System.clearProperty("fspec.lock.workerThreads");
        System.clearProperty("fspec.debugLocks");
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void testDefaults() {
        LockConfig config = LockConfig.load();

        assertEquals(10_000, config.staleMs());
        assertEquals(10, config.retries());
        assertEquals(50, config.minRetryMs());
        assertEquals(500, config.maxRetryMs());
        assertEquals(2.0, config.retryFactor());
        assertFalse(config.syncEnabled());
        assertEquals(4, config.workerThreads());
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property staleMs is respected")
        void testStaleMsSystemProperty() {
            System.setProperty("fspec.lock.staleMs", "20000");

            assertEquals(20_000, LockConfig.builder().build().staleMs());
        }

        @Test
        @DisplayName("System property retries is respected")
        void testRetriesSystemProperty() {
            System.setProperty("fspec.lock.retries", " 25 ");

            assertEquals(25, LockConfig.builder().build().retries());
        }

        @Test
        @DisplayName("System property retryFactor is respected")
        void testRetryFactorSystemProperty() {
            System.setProperty("fspec.lock.retryFactor", "1.5");

            assertEquals(1.5, LockConfig.builder().build().retryFactor());
        }

        @Test
        @DisplayName("System property syncEnabled=true is respected")
        void testSyncEnabledSystemProperty() {
            System.setProperty("fspec.lock.syncEnabled", "true");

            assertTrue(LockConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("System property debugLocks is respected")
        void testDebugLocksSystemProperty() {
            System.setProperty("fspec.debugLocks", "true");
            assertTrue(LockConfig.builder().build().debugLocks());

            System.setProperty("fspec.debugLocks", "false");
            assertFalse(LockConfig.builder().build().debugLocks());
        }

        @Test
        @DisplayName("Invalid integer system property falls back to default")
        void testInvalidLongSystemProperty() {
            System.setProperty("fspec.lock.staleMs", "not-a-number");

            assertEquals(10_000, LockConfig.builder().build().staleMs());
        }

        @Test
        @DisplayName("Out-of-range integer system properties fall back to default")
        void testOutOfRangeIntSystemProperty() {
            System.setProperty("fspec.lock.retries", "4294967297");
            System.setProperty("fspec.lock.workerThreads", "2147483648");

            LockConfig config = LockConfig.builder().build();

            assertEquals(10, config.retries());
            assertEquals(4, config.workerThreads());
        }

        @Test
        @DisplayName("Invalid decimal system property falls back to default")
        void testInvalidDoubleSystemProperty() {
            System.setProperty("fspec.lock.retryFactor", "fast");

            assertEquals(2.0, LockConfig.builder().build().retryFactor());
        }

        @Test
        @DisplayName("Blank system property is ignored")
        void testBlankSystemProperty() {
            System.setProperty("fspec.lock.retries", "   ");

            assertEquals(10, LockConfig.builder().build().retries());
        }
    }

    // ========================================================================
    // Builder Tests
    // ========================================================================

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Builder values override system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("fspec.lock.staleMs", "20000");
            System.setProperty("fspec.debugLocks", "true");

            LockConfig config = LockConfig.builder()
                    .staleMs(3_000)
                    .debugLocks(false)
                    .build();

            assertEquals(3_000, config.staleMs());
            assertFalse(config.debugLocks());
        }

        @Test
        @DisplayName("toString lists every setting")
        void testToString() {
            String text = LockConfig.builder().retries(7).workerThreads(2).build().toString();

            assertTrue(text.contains("retries=7"));
            assertTrue(text.contains("workerThreads=2"));
        }

        @Test
        @DisplayName("Non-positive staleMs is rejected")
        void testRejectsNonPositiveStaleMs() {
            assertThrows(IllegalArgumentException.class, () -> LockConfig.builder().staleMs(0).build());
        }

        @Test
        @DisplayName("Negative retries are rejected")
        void testRejectsNegativeRetries() {
            assertThrows(IllegalArgumentException.class, () -> LockConfig.builder().retries(-1).build());
        }

        @Test
        @DisplayName("Inverted backoff range is rejected")
        void testRejectsInvertedBackoff() {
            assertThrows(IllegalArgumentException.class,
                    () -> LockConfig.builder().minRetryMs(600).maxRetryMs(500).build());
        }

        @Test
        @DisplayName("Shrinking retry factor is rejected")
        void testRejectsShrinkingFactor() {
            assertThrows(IllegalArgumentException.class, () -> LockConfig.builder().retryFactor(0.5).build());
        }

        @Test
        @DisplayName("Empty worker pool is rejected")
        void testRejectsEmptyPool() {
            assertThrows(IllegalArgumentException.class, () -> LockConfig.builder().workerThreads(0).build());
        }
    }

    // ========================================================================
    // Derived Values
    // ========================================================================

    @Nested
    @DisplayName("Derived values")
    class DerivedTests {

        @Test
        @DisplayName("Backoff doubles from the minimum and stops at the maximum")
        void testBackoffSequence() {
            LockConfig config = LockConfig.builder()
                    .minRetryMs(50).maxRetryMs(500).retryFactor(2.0).build();

            long[] expected = {50, 100, 200, 400, 500, 500};
            for (int retry = 0; retry < expected.length; retry++) {
                assertEquals(expected[retry], config.backoffMs(retry), "retry " + retry);
            }
        }

        @Test
        @DisplayName("Factor of one gives a constant backoff")
        void testConstantBackoff() {
            LockConfig config = LockConfig.builder()
                    .minRetryMs(30).maxRetryMs(500).retryFactor(1.0).build();

            assertEquals(30, config.backoffMs(0));
            assertEquals(30, config.backoffMs(9));
        }

        @Test
        @DisplayName("Heartbeat runs at half the stale threshold")
        void testHeartbeatInterval() {
            assertEquals(5_000, LockConfig.builder().staleMs(10_000).build().heartbeatMs());
            assertEquals(1, LockConfig.builder().staleMs(1).build().heartbeatMs());
        }
    }
}
