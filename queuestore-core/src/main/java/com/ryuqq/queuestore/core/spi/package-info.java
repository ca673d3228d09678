/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by storage adapters
 * to provide concrete queue storage for the broker core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuestore.core.spi.QueueStorage} - Enqueue, requeue, dequeue and lifecycle</li>
 *   <li>{@link com.ryuqq.queuestore.core.spi.QueueMaintenance} - Eviction of empty, idle destination entries</li>
 *   <li>{@link com.ryuqq.queuestore.core.spi.MessageIdGenerator} - message-id allocation strategy</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., queuestore-adapter-inmemory, or a file-backed write-ahead log adapter)
 * provide concrete implementations. Every {@code QueueStorage} implementation should pass
 * {@code AbstractQueueStorageContractTest} from queuestore-testkit.</p>
 *
 * <h2>Durable Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Recovery:</strong> After restart, reconstruct every frame enqueued and not yet dequeued</li>
 *   <li><strong>Failures:</strong> Report medium errors as {@code StorageFailureException}</li>
 *   <li><strong>Deadlines:</strong> Honor caller deadlines with {@code StorageCancelledException}, leaving no partial append and no lost frame</li>
 * </ul>
 *
 * @since 1.0.0
 * @author QueueStore Team
 */
package com.ryuqq.queuestore.core.spi;
