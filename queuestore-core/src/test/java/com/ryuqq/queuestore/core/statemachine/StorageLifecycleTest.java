package com.ryuqq.queuestore.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StorageLifecycle 테스트.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
class StorageLifecycleTest {

    @Test
    void constructor_ThrowsUnsupportedOperation() throws Exception {
        var constructor = StorageLifecycle.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Exception exception = assertThrows(Exception.class, constructor::newInstance);
        assertInstanceOf(UnsupportedOperationException.class, exception.getCause());
    }

    @Test
    void transition_NewToStarted_Allowed() {
        assertEquals(StorageState.STARTED, StorageLifecycle.transition(StorageState.NEW, StorageState.STARTED));
    }

    @Test
    void transition_StartedToStopped_Allowed() {
        assertEquals(StorageState.STOPPED, StorageLifecycle.transition(StorageState.STARTED, StorageState.STOPPED));
    }

    @Test
    void transition_StoppedToStarted_AllowedForRestart() {
        assertEquals(StorageState.STARTED, StorageLifecycle.transition(StorageState.STOPPED, StorageState.STARTED));
    }

    @Test
    void validate_NewToStopped_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StorageLifecycle.validate(StorageState.NEW, StorageState.STOPPED)
        );
        assertTrue(exception.getMessage().contains("NEW"));
    }

    @Test
    void validate_StartedToStarted_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StorageLifecycle.validate(StorageState.STARTED, StorageState.STARTED));
    }

    @Test
    void validate_StoppedToStopped_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StorageLifecycle.validate(StorageState.STOPPED, StorageState.STOPPED));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StorageLifecycle.validate(null, StorageState.STARTED));
        assertThrows(IllegalArgumentException.class, () -> StorageLifecycle.validate(StorageState.NEW, null));
    }

    @Test
    void acceptsOperations_OnlyWhenStarted() {
        assertFalse(StorageState.NEW.acceptsOperations());
        assertTrue(StorageState.STARTED.acceptsOperations());
        assertFalse(StorageState.STOPPED.acceptsOperations());
    }
}
