package com.timeslice.clock;

/**
 * Source of time for the scheduler.
 * 
 * The scheduler never calls System.currentTimeMillis() or Thread.sleep() directly:
 * every timestamp and every simulated slice goes through a TimeSource.
 * 
 * Two implementations:
 *   - {@link SystemTimeSource}: wall clock, slices really block (production)
 *   - {@link VirtualTimeSource}: virtual clock, slices advance it instantly (tests, dry runs)
 * 
 * All values are expressed in seconds, as doubles.
 */
public interface TimeSource {
    
    /**
     * @return current time in seconds (epoch-based for the system clock)
     */
    double now();
    
    /**
     * Blocks the calling thread for the given amount of simulated work.
     * 
     * @param seconds duration of the slice, negative or zero returns immediately
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(double seconds) throws InterruptedException;
    
    /**
     * @return short name used in logs and CLI output
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
