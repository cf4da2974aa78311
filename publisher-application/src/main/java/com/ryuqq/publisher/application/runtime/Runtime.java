package com.ryuqq.publisher.application.runtime;

/**
 * Timer runtime driving scheduled work.
 *
 * <p>One runtime per process owns every pending timer (scheduled deliveries,
 * approval prefetches, periodic sweeps). Timers are kept in fire-time order and
 * executed when {@link #pump()} observes that they are due.</p>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked by a single background scheduling thread in production</li>
 *   <li>tests call pump() directly after advancing a manual clock</li>
 *   <li>task bodies may run on a separate executor</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * clock.advance(Duration.ofHours(2));
 * runtime.pump(); // fires every task due at or before clock.instant()
 * </pre>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Fires every task whose fire time is at or before now, in fire-time order.
     *
     * <p>Returns once no due task remains. A task scheduled by another task for a
     * time that is already due is fired in the same call.</p>
     *
     * @return number of tasks fired
     */
    int pump();
}
