package com.ryuqq.queuestore.application.runtime;

import com.ryuqq.queuestore.core.spi.QueueStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker-facing lifecycle supervisor of a {@link QueueStorage}.
 *
 * <p>The broker starts the storage before accepting connections and stops it after the
 * last connection is gone. The two directions are handled asymmetrically:</p>
 *
 * <ul>
 *   <li><strong>start:</strong> any failure is fatal and surfaces as {@link StorageStartupException}</li>
 *   <li><strong>stop:</strong> a failure is logged at ERROR and swallowed, shutdown always proceeds</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (StorageRuntime runtime = new StorageRuntime(new InMemoryQueueStorage())) {
 *     runtime.start();
 *     QueueStorage storage = runtime.storage();
 *     // serve connections
 * }
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class StorageRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StorageRuntime.class);

    private final QueueStorage storage;

    /**
     * 생성자.
     *
     * @param storage 관리할 큐 저장소
     * @throws IllegalArgumentException storage가 null인 경우
     */
    public StorageRuntime(QueueStorage storage) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.storage = storage;
    }

    /**
     * Starts the wrapped storage.
     *
     * @throws StorageStartupException if the storage fails to start
     */
    public void start() {
        try {
            storage.start();
        } catch (RuntimeException e) {
            throw new StorageStartupException("Failed to start queue storage", e);
        }
        log.info("Queue storage runtime started ({})", storage.getClass().getSimpleName());
    }

    /**
     * Stops the wrapped storage.
     *
     * @return true if the storage stopped cleanly, false if stopping failed
     */
    public boolean stop() {
        try {
            storage.stop();
            log.info("Queue storage runtime stopped");
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to stop queue storage, continuing shutdown", e);
            return false;
        }
    }

    /**
     * Stops the storage if it is still started.
     */
    @Override
    public void close() {
        if (storage.isStarted()) {
            stop();
        }
    }

    /**
     * Returns the wrapped storage.
     *
     * @return queue storage
     */
    public QueueStorage storage() {
        return storage;
    }
}
