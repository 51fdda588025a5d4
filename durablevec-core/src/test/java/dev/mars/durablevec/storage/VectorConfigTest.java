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
package dev.mars.durablevec.storage;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VectorConfig}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Resolution from system properties, with invalid values falling back</li>
 *   <li>Defaults and builder priority</li>
 *   <li>Validation of the sync period and batch wake count</li>
 * </ul>
 */
class VectorConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("durablevec.dataDir");
        System.clearProperty("durablevec.syncEnabled");
        System.clearProperty("durablevec.syncPeriodMs");
        System.clearProperty("durablevec.batchWakeCount");
        System.clearProperty("durablevec.idRecycling");
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property dataDir is respected")
        void testDataDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-data");
            System.setProperty("durablevec.dataDir", customDir.toString());

            VectorConfig config = VectorConfig.builder().build();
            assertEquals(customDir, config.dataDir());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemProperty() {
            System.setProperty("durablevec.syncEnabled", "false");

            assertFalse(VectorConfig.load().syncEnabled());
        }

        @Test
        @DisplayName("System property syncPeriodMs is respected")
        void testSyncPeriodSystemProperty() {
            System.setProperty("durablevec.syncPeriodMs", "250");

            assertEquals(Duration.ofMillis(250), VectorConfig.load().syncPeriod());
        }

        @Test
        @DisplayName("System property batchWakeCount is respected")
        void testBatchWakeCountSystemProperty() {
            System.setProperty("durablevec.batchWakeCount", " 0 ");

            assertEquals(0, VectorConfig.load().batchWakeCount());
        }

        @Test
        @DisplayName("System property idRecycling=false is respected")
        void testIdRecyclingSystemProperty() {
            System.setProperty("durablevec.idRecycling", "false");

            assertFalse(VectorConfig.load().idRecycling());
        }

        @Test
        @DisplayName("Invalid number falls back to the default")
        void testInvalidNumberFallsBack() {
            System.setProperty("durablevec.syncPeriodMs", "soon");
            System.setProperty("durablevec.batchWakeCount", "many");

            VectorConfig config = VectorConfig.load();
            assertEquals(Duration.ofSeconds(1), config.syncPeriod());
            assertEquals(256, config.batchWakeCount());
        }

        @Test
        @DisplayName("Non-boolean syncEnabled falls back to the default instead of disabling fsync")
        void testInvalidBooleanFallsBack() {
            System.setProperty("durablevec.syncEnabled", "yes");
            System.setProperty("durablevec.idRecycling", "0");

            VectorConfig config = VectorConfig.load();
            assertTrue(config.syncEnabled());
            assertTrue(config.idRecycling());
        }

        @Test
        @DisplayName("Boolean values are case-insensitive")
        void testBooleanCaseInsensitive() {
            System.setProperty("durablevec.syncEnabled", "FALSE");

            assertFalse(VectorConfig.load().syncEnabled());
        }

        @Test
        @DisplayName("Blank value falls back to the default")
        void testBlankFallsBack() {
            System.setProperty("durablevec.batchWakeCount", "   ");

            assertEquals(256, VectorConfig.load().batchWakeCount());
        }
    }

    // ========================================================================
    // Builder Tests
    // ========================================================================

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Defaults apply when nothing is set")
        void testDefaults() {
            VectorConfig config = VectorConfig.builder().build();

            assertEquals(Path.of(System.getProperty("user.home"), ".durablevec", "data"), config.dataDir());
            assertTrue(config.syncEnabled());
            assertEquals(Duration.ofMillis(1000), config.syncPeriod());
            assertEquals(256, config.batchWakeCount());
            assertTrue(config.idRecycling());
        }

        @Test
        @DisplayName("Builder values take priority over system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("durablevec.dataDir", "/from/property");
            System.setProperty("durablevec.syncPeriodMs", "5000");

            VectorConfig config = VectorConfig.builder()
                    .dataDir(tempDir)
                    .syncPeriod(Duration.ofMillis(50))
                    .build();

            assertEquals(tempDir, config.dataDir());
            assertEquals(Duration.ofMillis(50), config.syncPeriod());
        }

        @Test
        @DisplayName("String dataDir is converted to a Path")
        void testStringDataDir() {
            VectorConfig config = VectorConfig.builder().dataDir(tempDir.toString()).build();

            assertEquals(tempDir, config.dataDir());
        }

        @Test
        @DisplayName("toBuilder copies every value")
        void testToBuilder() {
            VectorConfig original = VectorConfig.builder()
                    .dataDir(tempDir)
                    .syncEnabled(false)
                    .syncPeriod(Duration.ofMillis(42))
                    .batchWakeCount(7)
                    .idRecycling(false)
                    .build();

            VectorConfig copy = original.toBuilder().build();

            assertEquals(original.dataDir(), copy.dataDir());
            assertEquals(original.syncEnabled(), copy.syncEnabled());
            assertEquals(original.syncPeriod(), copy.syncPeriod());
            assertEquals(original.batchWakeCount(), copy.batchWakeCount());
            assertEquals(original.idRecycling(), copy.idRecycling());
        }

        @Test
        @DisplayName("toString names every setting")
        void testToString() {
            String text = VectorConfig.builder().dataDir(tempDir).batchWakeCount(3).build().toString();

            assertTrue(text.contains("dataDir=" + tempDir));
            assertTrue(text.contains("syncPeriod=1000ms"));
            assertTrue(text.contains("batchWakeCount=3"));
        }
    }

    // ========================================================================
    // Validation Tests
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Zero sync period is rejected")
        void testZeroPeriod() {
            assertThrows(IllegalArgumentException.class,
                    () -> VectorConfig.builder().syncPeriod(Duration.ZERO).build());
        }

        @Test
        @DisplayName("Negative sync period from a property is rejected")
        void testNegativePeriodProperty() {
            System.setProperty("durablevec.syncPeriodMs", "-10");

            assertThrows(IllegalArgumentException.class, VectorConfig::load);
        }

        @Test
        @DisplayName("Negative batch wake count is rejected")
        void testNegativeBatchWakeCount() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> VectorConfig.builder().batchWakeCount(-1).build());

            assertTrue(e.getMessage().contains("batchWakeCount"));
        }
    }
}
