package com.ryuqq.queuestore.application.runtime;

/**
 * Periodic maintenance work run against a started queue storage.
 *
 * <p>Implementations are executed on a background schedule and must tolerate being
 * called while producers and consumers are active.</p>
 *
 * <p><strong>Exception Handling:</strong></p>
 * <ul>
 *   <li>Per-item failures should be caught and logged inside {@link #scan()}</li>
 *   <li>A thrown exception aborts the current run only; the scheduler keeps running</li>
 * </ul>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MaintenanceTask {

    /**
     * Executes one maintenance pass.
     */
    void scan();
}
