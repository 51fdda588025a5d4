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
/**
 * Durable vector - a persisted list backed by an append-only log.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link dev.mars.durablevec.storage.DurableVector} - The vector interface</li>
 *   <li>{@link dev.mars.durablevec.storage.FileDurableVector} - File-based implementation</li>
 *   <li>{@link dev.mars.durablevec.storage.VectorConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Log-before-visible:</b> A mutation is written to the log before the index shows it</li>
 *   <li><b>Background durability:</b> A daemon thread forces the log to disk on a timer</li>
 *   <li><b>Sequential replay:</b> The vector is fully reconstructed from the log on open</li>
 *   <li><b>Torn-tail tolerance:</b> A partial final record is trimmed, never replayed</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  └─ .vector.bin   // append-only log with APPEND and TOMBSTONE records
 * </pre>
 *
 * @see dev.mars.durablevec.storage.DurableVector
 */
package dev.mars.durablevec.storage;
