package com.ryuqq.queuestore.adapter.inmemory.storage;

import com.ryuqq.queuestore.core.spi.QueueStorage;
import com.ryuqq.queuestore.testkit.contract.AbstractQueueStorageContractTest;

/**
 * Contract Test for InMemoryQueueStorage adapter.
 *
 * <p>This test extends {@link AbstractQueueStorageContractTest} to verify that the
 * InMemoryQueueStorage implementation satisfies all QueueStorage SPI contract requirements:
 * ordering, requeue priority, identity, uniqueness, lifecycle guard and concurrency.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 * @see AbstractQueueStorageContractTest
 */
class InMemoryQueueStorageContractTest extends AbstractQueueStorageContractTest {

    @Override
    protected QueueStorage createStorage() {
        return new InMemoryQueueStorage();
    }
}
