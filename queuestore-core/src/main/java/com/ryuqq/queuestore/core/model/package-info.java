/**
 * Core message model: the frame moved between producer, storage and consumer.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuestore.core.model.Frame} - Headers and body of one message (mutable, single owner)</li>
 *   <li>{@link com.ryuqq.queuestore.core.model.MessageId} - Storage-assigned unique identifier</li>
 *   <li>{@link com.ryuqq.queuestore.core.model.Destination} - Validated destination queue name</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Value Objects:</strong> MessageId and Destination are immutable and validated on construction</li>
 *   <li><strong>Identity:</strong> A frame keeps its message-id across requeue and redelivery</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author QueueStore Team
 */
package com.ryuqq.queuestore.core.model;
