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

import dev.mars.durablevec.storage.DurableVector;
import dev.mars.durablevec.storage.FileDurableVector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Self-test and write-path benchmark for the durable vector.
 * <p>
 * Runs four phases against one directory, reopening the vector between them:
 * <ol>
 *   <li>push "foo", a 256-byte string of every byte value, then N small values</li>
 *   <li>reopen, verify, erase index 873</li>
 *   <li>reopen, verify the erase survived, erase index 873 again</li>
 *   <li>reopen, erase everything from the back, push N values of 4 KiB</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * java -cp $CP dev.mars.durablevec.demo.VectorBenchmark [dataDir] [loopCount]
 * </pre>
 * Exits with status 1 if any check fails.
 */
public class VectorBenchmark {

    private static final int DEFAULT_LOOP_COUNT = 100_000;
    private static final long TARGET_MILLIS = 1000;

    private final Path dataDir;
    private final int loopCount;
    private int checks;
    private int failures;

    public VectorBenchmark(Path dataDir, int loopCount) {
        this.dataDir = dataDir;
        this.loopCount = loopCount;
    }

    public static void main(String[] args) throws IOException {
        Path dataDir = args.length > 0 ? Path.of(args[0]) : Path.of("data_dir");
        int loopCount = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_LOOP_COUNT;

        System.out.println("+---------------------------------------+");
        System.out.println("|      Durable Vector Benchmark         |");
        System.out.println("+---------------------------------------+");
        System.out.println("Data directory: " + dataDir.toAbsolutePath());
        System.out.println("Loop count:     " + loopCount);
        System.out.println();

        deleteRecursively(dataDir);
        Files.createDirectories(dataDir);

        VectorBenchmark benchmark = new VectorBenchmark(dataDir, loopCount);
        benchmark.phaseOne();
        benchmark.phaseTwo();
        benchmark.phaseThree();
        benchmark.phaseFour();

        System.out.println();
        System.out.printf("RESULTS: %d checks, %d failed%n", benchmark.checks, benchmark.failures);
        System.exit(benchmark.failures > 0 ? 1 : 0);
    }

    void phaseOne() {
        System.out.println("[1] Fresh vector: small values");
        try (DurableVector v = FileDurableVector.open(dataDir)) {
            v.pushBack(utf8("foo"));
            check("at(0) == foo", Arrays.equals(v.at(0), utf8("foo")));
            check("size() == 1", v.size() == 1);

            v.pushBack(allByteValues());
            check("at(1) == all byte values", Arrays.equals(v.at(1), allByteValues()));
            check("size() == 2", v.size() == 2);

            long start = System.nanoTime();
            for (int i = 0; i < loopCount; i++) {
                v.pushBack(utf8("loop " + i));
            }
            report("pushed " + loopCount + " small values", start);
            check("size() == N + 2", v.size() == loopCount + 2);
        }
    }

    void phaseTwo() {
        System.out.println("[2] Reopen: erase(873)");
        try (DurableVector v = FileDurableVector.open(dataDir)) {
            check("size() == N + 2", v.size() == loopCount + 2);
            check("at(0) == foo", Arrays.equals(v.at(0), utf8("foo")));
            check("at(1) == all byte values", Arrays.equals(v.at(1), allByteValues()));
            check("at(873) == loop 871", Arrays.equals(v.at(873), utf8("loop 871")));

            v.erase(873);
            check("size() == N + 1", v.size() == loopCount + 1);
            check("at(873) == loop 872", Arrays.equals(v.at(873), utf8("loop 872")));
        }
    }

    void phaseThree() {
        System.out.println("[3] Reopen: erase survived, erase(873) again");
        try (DurableVector v = FileDurableVector.open(dataDir)) {
            check("size() == N + 1", v.size() == loopCount + 1);
            check("at(0) == foo", Arrays.equals(v.at(0), utf8("foo")));
            check("at(1) == all byte values", Arrays.equals(v.at(1), allByteValues()));
            check("at(873) == loop 872", Arrays.equals(v.at(873), utf8("loop 872")));

            v.erase(873);
            check("size() == N", v.size() == loopCount);
            check("at(873) == loop 873", Arrays.equals(v.at(873), utf8("loop 873")));
        }
    }

    void phaseFour() {
        System.out.println("[4] Reopen: clear, then 4 KiB values");
        try (DurableVector v = FileDurableVector.open(dataDir)) {
            long start = System.nanoTime();
            for (int size = v.size(); size > 0; size = v.size()) {
                v.erase(size - 1);
            }
            report("erased everything", start);

            start = System.nanoTime();
            boolean allMatch = true;
            for (int i = 0; i < loopCount; i++) {
                byte[] value = filled4k((byte) i);
                v.pushBack(value);
                allMatch &= Arrays.equals(v.at(i), value) && v.size() == i + 1;
            }
            report("pushed " + loopCount + " 4 KiB values", start);
            check("every 4 KiB value reads back", allMatch);
            check("size() == N", v.size() == loopCount);
        }
    }

    private void check(String description, boolean ok) {
        checks++;
        if (!ok) {
            failures++;
            System.out.println("    [FAIL] " + description);
        }
    }

    private static void report(String what, long startNanos) {
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        System.out.printf("    %s in %d ms%s%n", what, millis, millis >= TARGET_MILLIS ? " (slower than 1 s)" : "");
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    static byte[] allByteValues() {
        byte[] all = new byte[256];
        for (int i = 0; i < all.length; i++) {
            all[i] = (byte) (i - 128);
        }
        return all;
    }

    private static byte[] filled4k(byte b) {
        byte[] value = new byte[DurableVector.MAX_VALUE_SIZE];
        Arrays.fill(value, b);
        return value;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
        System.out.println("Directory removed.");
    }
}
