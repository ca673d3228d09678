package com.ryuqq.queuestore.adapter.inmemory.id;

import com.ryuqq.queuestore.core.model.MessageId;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageIdGenerator implementation tests.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
class MessageIdGeneratorTest {

    @Test
    void sequence_DefaultPrefix_ProducesIncreasingIds() {
        SequenceMessageIdGenerator generator = new SequenceMessageIdGenerator();

        assertThat(generator.next()).isEqualTo(MessageId.of("msg-1"));
        assertThat(generator.next()).isEqualTo(MessageId.of("msg-2"));
        assertThat(generator.allocated()).isEqualTo(2);
    }

    @Test
    void sequence_BlankPrefix_ThrowsException() {
        assertThatThrownBy(() -> new SequenceMessageIdGenerator(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("prefix");
    }

    @Test
    void sequence_ConcurrentCallers_NeverDuplicate() throws Exception {
        SequenceMessageIdGenerator generator = new SequenceMessageIdGenerator("c");
        Set<MessageId> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(8);

        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1_000; i++) {
                    ids.add(generator.next());
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(8_000);
        assertThat(generator.allocated()).isEqualTo(8_000);
    }

    @Test
    void uuid_ProducesDistinctIds() {
        UuidMessageIdGenerator generator = new UuidMessageIdGenerator();

        MessageId first = generator.next();
        MessageId second = generator.next();

        assertThat(first).isNotEqualTo(second);
        assertThat(first.getValue()).hasSize(36);
    }
}
