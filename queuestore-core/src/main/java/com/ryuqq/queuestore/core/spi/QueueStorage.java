package com.ryuqq.queuestore.core.spi;

import com.ryuqq.queuestore.core.exception.InvalidDestinationException;
import com.ryuqq.queuestore.core.exception.QueueFullException;
import com.ryuqq.queuestore.core.exception.StorageFailureException;
import com.ryuqq.queuestore.core.exception.StorageNotStartedException;
import com.ryuqq.queuestore.core.model.Frame;
import com.ryuqq.queuestore.core.model.MessageId;

import java.util.Optional;

/**
 * Queue Storage SPI for holding published frames until a consumer retrieves them.
 *
 * <p>This interface lets the broker swap persistence strategies (in-memory,
 * file-backed write-ahead log, embedded database) without changing broker logic.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Appending published frames to the tail of a named destination queue</li>
 *   <li>Returning redelivered frames to the head of their queue</li>
 *   <li>Removing and returning the head frame, or signalling emptiness</li>
 *   <li>Assigning a unique {@code message-id} to every stored frame</li>
 *   <li>Explicit start/stop lifecycle</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All data methods must be safely callable from many threads with no caller-side coordination</li>
 *   <li>Linearizable per destination: concurrent operations on one destination behave as some serial order</li>
 *   <li>Exactly-once queue creation: racing first-time enqueues on one name create a single queue</li>
 *   <li>Non-blocking: {@link #dequeue(String)} on an empty queue returns immediately</li>
 *   <li>No swallowed failures: every operation failure is thrown to the caller</li>
 * </ul>
 *
 * <p><strong>Ordering:</strong> FIFO within one destination, with requeued frames placed
 * ahead of newly published ones. No ordering is guaranteed across destinations.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * storage.start();
 *
 * // Publish path
 * storage.enqueue("orders", frame);
 *
 * // Delivery path
 * Optional&lt;Frame&gt; next = storage.dequeue("orders");
 * next.ifPresent(f -&gt; {
 *     try {
 *         deliver(f);
 *     } catch (ConsumerGoneException e) {
 *         storage.requeue("orders", f); // same message-id, redelivered first
 *     }
 * });
 *
 * storage.stop();
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public interface QueueStorage {

    /**
     * Starts the storage, allocating or loading internal state.
     *
     * <p>Called once at broker launch, before any data operation.</p>
     *
     * @throws StorageFailureException if required resources are unavailable (e.g., backing store cannot be opened)
     * @throws IllegalStateException if the storage is already started
     */
    void start();

    /**
     * Stops the storage, releasing internal state.
     *
     * <p>Called once at broker shutdown, after all data operations. In-memory data is
     * discarded unless the implementation is durable.</p>
     *
     * @throws IllegalStateException if the storage is not started
     */
    void stop();

    /**
     * Returns whether data operations are currently accepted.
     *
     * @return true between a successful {@link #start()} and {@link #stop()}
     */
    boolean isStarted();

    /**
     * Appends a frame to the tail of a destination queue.
     *
     * <p>Assigns a {@code message-id} if the frame has none. The destination queue is
     * created on first use.</p>
     *
     * @param destination destination name
     * @param frame the frame to store (ownership passes to the storage)
     * @return the frame's message id (existing or newly assigned)
     * @throws IllegalArgumentException if frame is null
     * @throws StorageNotStartedException if called before start or after stop
     * @throws InvalidDestinationException if destination fails validation
     * @throws QueueFullException if the destination is at its configured maximum depth
     */
    MessageId enqueue(String destination, Frame frame);

    /**
     * Inserts a frame at the head of a destination queue for redelivery.
     *
     * <p>Never allocates a new {@code message-id} when one is present; assigns one only
     * as a fallback for a frame that lacks it. The destination queue is created if it
     * does not exist yet.</p>
     *
     * @param destination destination name
     * @param frame the frame to return (normally one previously dequeued)
     * @return the frame's message id
     * @throws IllegalArgumentException if frame is null
     * @throws StorageNotStartedException if called before start or after stop
     * @throws InvalidDestinationException if destination fails validation
     * @throws QueueFullException if the destination is at its configured maximum depth
     */
    MessageId requeue(String destination, Frame frame);

    /**
     * Removes and returns the head frame of a destination queue.
     *
     * <p>An empty result means nothing is available right now, which is a normal
     * condition. Genuine storage failures are reported by exception.</p>
     *
     * @param destination destination name
     * @return the head frame, or {@link Optional#empty()} if none is available
     * @throws StorageNotStartedException if called before start or after stop
     * @throws InvalidDestinationException if destination fails validation
     * @throws StorageFailureException on internal failure (never on empty)
     */
    Optional<Frame> dequeue(String destination);

    /**
     * Returns the number of frames currently held for a destination.
     *
     * @param destination destination name
     * @return queue depth (0 for an unknown destination)
     * @throws StorageNotStartedException if called before start or after stop
     * @throws InvalidDestinationException if destination fails validation
     */
    int depth(String destination);
}
