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
package dev.mars.durablevec.demo;

import dev.mars.durablevec.storage.DurableVector.Item;
import dev.mars.durablevec.storage.FileDurableVector;
import dev.mars.durablevec.storage.ReplaySummary;
import dev.mars.durablevec.storage.VectorConfig;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

/**
 * Demo entry point for the durable vector.
 * <p>
 * This demonstrates basic vector operations:
 * <ul>
 *   <li>Opening (and replaying) a vector</li>
 *   <li>Appending values</li>
 *   <li>Erasing the oldest value once the vector grows</li>
 *   <li>Replay on restart</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link VectorConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Ddurablevec.dataDir=/path -Ddurablevec.syncPeriodMs=500 ...}</li>
 *   <li>Environment variables: {@code DURABLEVEC_DATA_DIR, DURABLEVEC_SYNC_PERIOD_MS, ...}</li>
 *   <li>Properties file: {@code durablevec.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl durablevec-demo -am
 *
 * # Run with default configuration (core jar and slf4j on the classpath)
 * java -cp $CP dev.mars.durablevec.demo.VectorDemo
 *
 * # Run with CLI data directory override
 * java -cp $CP dev.mars.durablevec.demo.VectorDemo /path/to/data
 *
 * # Run with system properties
 * java -Ddurablevec.dataDir=/path/to/data -Ddurablevec.batchWakeCount=0 -cp $CP dev.mars.durablevec.demo.VectorDemo
 * </pre>
 *
 * @see VectorConfig
 */
public class VectorDemo {

    private static final int KEEP_AT_MOST = 10;

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|         Durable Vector Demo           |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        VectorConfig config = args.length > 0 && !args[0].isBlank()
                ? VectorConfig.builder().dataDir(args[0]).build()
                : VectorConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (FileDurableVector vector = FileDurableVector.open(config)) {
            ReplaySummary summary = vector.replaySummary();
            System.out.println("[OK] Vector opened at: " + vector.logPath().toAbsolutePath());
            System.out.println("[OK] Replayed " + summary.appends() + " appends and "
                    + summary.tombstones() + " tombstones in " + summary.elapsedMillis() + " ms");
            if (summary.tornTailDiscarded()) {
                System.out.println("[!!] Discarded a torn tail of " + summary.discardedBytes() + " bytes");
            }

            List<Item> items = vector.items();
            if (!items.isEmpty()) {
                System.out.println("\n  Current items:");
                for (int i = 0; i < items.size(); i++) {
                    Item item = items.get(i);
                    System.out.printf("    [%d] id=%d: %s%n", i, item.id(),
                            new String(item.value(), StandardCharsets.UTF_8));
                }
            }

            long first = vector.pushBack(("visit at " + Instant.now()).getBytes(StandardCharsets.UTF_8));
            long second = vector.pushBack(("size was " + items.size()).getBytes(StandardCharsets.UTF_8));
            System.out.println("\n[OK] Appended 2 items (ids " + first + ", " + second + ")");

            while (vector.size() > KEEP_AT_MOST) {
                long id = vector.idAt(0);
                vector.erase(0);
                System.out.println("[OK] Erased oldest item (id " + id + ")");
            }

            vector.sync(); // Durability barrier
            System.out.println("[OK] Synced " + vector.size() + " items, next id " + vector.nextId());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Vector demo complete!                |");
            System.out.println("|  Run again to see items replayed.     |");
            System.out.println("+---------------------------------------+");
        }
    }
}
