package com.ryuqq.queuestore.adapter.inmemory.id;

import com.ryuqq.queuestore.core.model.MessageId;
import com.ryuqq.queuestore.core.spi.MessageIdGenerator;

import java.util.UUID;

/**
 * {@link MessageIdGenerator} backed by {@link UUID#randomUUID()}.
 *
 * <p>Generated ids are globally unique, so they stay unique across storage restarts
 * and across storage instances. This is the default generator of
 * {@code InMemoryQueueStorage}.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class UuidMessageIdGenerator implements MessageIdGenerator {

    @Override
    public MessageId next() {
        return MessageId.of(UUID.randomUUID().toString());
    }
}
