/**
 * In-memory sink adapters for the daily check.
 *
 * <h2>Components</h2>
 *
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.sink.InMemoryResultSink}: new items and downloaded attachments per entity</li>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.sink.InMemoryTelemetrySink}: one record per gateway call</li>
 *   <li>{@link com.ryuqq.registry.adapter.inmemory.sink.InMemoryNotificationSink}: run summaries and run-level failures</li>
 * </ul>
 *
 * <h2>Concurrency Model</h2>
 *
 * <p>All sinks are written from worker threads of the batch pool and the gateway's
 * telemetry thread:</p>
 * <ul>
 *   <li><strong>ConcurrentHashMap:</strong> per-entity buckets created atomically</li>
 *   <li><strong>CopyOnWriteArrayList:</strong> append-only records with snapshot iteration</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Single JVM:</strong> No shared storage between processes</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.sink;
