/**
 * In-memory QueueStorage adapter providing thread-safe per-destination queues for testing and reference.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.queuestore.core.spi.QueueStorage} SPI using in-memory data structures.</p>
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li><strong>Destination Map:</strong> {@link java.util.concurrent.ConcurrentHashMap} keyed by destination name</li>
 *   <li><strong>Destination Queue:</strong> {@link java.util.ArrayDeque} behind a per-destination
 *       {@link java.util.concurrent.locks.ReentrantLock}</li>
 * </ul>
 *
 * <h2>Frame Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │   enqueue   │ → assign message-id if absent → append at tail
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │   dequeue   │ → remove head (or Optional.empty())
 * └──────┬──────┘
 *        │
 *        ├──► delivered ───────────────────────────► [Owned by broker]
 *        │
 *        └──► requeue (delivery failed) ───────────► [Head of queue, same message-id]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> All frames are discarded on stop or process exit</li>
 *   <li><strong>Single JVM:</strong> No replication</li>
 * </ul>
 *
 * @see com.ryuqq.queuestore.core.spi.QueueStorage
 * @see com.ryuqq.queuestore.adapter.inmemory.storage.InMemoryQueueStorage
 * @author QueueStore Team
 * @since 1.0.0
 */
package com.ryuqq.queuestore.adapter.inmemory.storage;
