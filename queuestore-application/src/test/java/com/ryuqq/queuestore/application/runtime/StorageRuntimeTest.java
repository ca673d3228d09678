package com.ryuqq.queuestore.application.runtime;

import com.ryuqq.queuestore.adapter.inmemory.storage.InMemoryQueueStorage;
import com.ryuqq.queuestore.core.model.Frame;
import com.ryuqq.queuestore.core.spi.QueueStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * StorageRuntime 유닛 테스트.
 *
 * <ul>
 *   <li>시작 실패는 StorageStartupException으로 전파</li>
 *   <li>종료 실패는 로깅 후 무시</li>
 *   <li>close()는 시작된 경우에만 stop 호출</li>
 * </ul>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StorageRuntimeTest {

    @Mock
    private QueueStorage storage;

    @Test
    void 생성자_null_저장소는_거부됨() {
        assertThatThrownBy(() -> new StorageRuntime(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("storage");
    }

    @Test
    void start_저장소를_시작함() {
        StorageRuntime runtime = new StorageRuntime(storage);

        runtime.start();

        verify(storage).start();
    }

    @Test
    void start_실패하면_StorageStartupException으로_감싸서_던짐() {
        // given
        IllegalStateException failure = new IllegalStateException("boom");
        doThrow(failure).when(storage).start();
        StorageRuntime runtime = new StorageRuntime(storage);

        // when & then
        assertThatThrownBy(runtime::start)
            .isInstanceOf(StorageStartupException.class)
            .hasCause(failure);
    }

    @Test
    void stop_성공하면_true를_반환함() {
        StorageRuntime runtime = new StorageRuntime(storage);

        assertThat(runtime.stop()).isTrue();
        verify(storage).stop();
    }

    @Test
    void stop_실패해도_예외를_던지지_않고_false를_반환함() {
        // given
        doThrow(new IllegalStateException("not started")).when(storage).stop();
        StorageRuntime runtime = new StorageRuntime(storage);

        // when
        boolean stopped = runtime.stop();

        // then
        assertThat(stopped).isFalse();
    }

    @Test
    void close_시작된_경우에만_stop을_호출함() {
        // given
        when(storage.isStarted()).thenReturn(true, false);
        StorageRuntime runtime = new StorageRuntime(storage);

        // when
        runtime.close();
        runtime.close();

        // then
        verify(storage, times(1)).stop();
    }

    @Test
    void storage_감싼_저장소를_반환함() {
        assertThat(new StorageRuntime(storage).storage()).isSameAs(storage);
    }

    @Test
    void 인메모리_저장소와_함께_시작_사용_종료() {
        // given
        InMemoryQueueStorage inMemory = new InMemoryQueueStorage();

        // when
        try (StorageRuntime runtime = new StorageRuntime(inMemory)) {
            runtime.start();
            runtime.storage().enqueue("/queue/orders", Frame.ofText("hello"));

            // then
            assertThat(runtime.storage().depth("/queue/orders")).isEqualTo(1);
        }
        assertThat(inMemory.isStarted()).isFalse();
    }

    @Test
    void 이미_시작된_저장소를_다시_시작하면_치명적_오류() {
        InMemoryQueueStorage inMemory = new InMemoryQueueStorage();
        StorageRuntime runtime = new StorageRuntime(inMemory);
        runtime.start();

        assertThatThrownBy(runtime::start)
            .isInstanceOf(StorageStartupException.class)
            .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(runtime.stop()).isTrue();
        assertThat(runtime.stop()).isFalse();
    }
}
