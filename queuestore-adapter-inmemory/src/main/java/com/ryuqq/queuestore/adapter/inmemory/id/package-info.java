/**
 * message-id generators for the in-memory adapter.
 *
 * <ul>
 *   <li>{@link com.ryuqq.queuestore.adapter.inmemory.id.UuidMessageIdGenerator} - random UUID (default)</li>
 *   <li>{@link com.ryuqq.queuestore.adapter.inmemory.id.SequenceMessageIdGenerator} - prefixed counter</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.queuestore.adapter.inmemory.id;
