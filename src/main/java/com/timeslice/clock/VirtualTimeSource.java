package com.timeslice.clock;

/**
 * Virtual clock: sleeping advances the clock instead of blocking.
 * 
 * Ordering and metric computation are identical to the system clock,
 * only the cost in real time disappears. A slice of 2 seconds moves
 * the clock forward by exactly 2.0, which makes metrics deterministic.
 * 
 * Thread-safe: all access is synchronized on the instance.
 */
public class VirtualTimeSource implements TimeSource {
    
    private double currentTime;
    
    /**
     * Creates a virtual clock starting at 0.
     */
    public VirtualTimeSource() {
        this(0.0);
    }
    
    /**
     * @param startTime initial value of the clock, in seconds
     */
    public VirtualTimeSource(double startTime) {
        this.currentTime = startTime;
    }
    
    @Override
    public synchronized double now() {
        return currentTime;
    }
    
    @Override
    public synchronized void sleep(double seconds) {
        if (seconds > 0) {
            currentTime += seconds;
        }
    }
    
    /**
     * Moves the clock forward without any slice being executed.
     * Used to simulate time passing between arrivals.
     * 
     * @param seconds amount to advance, must not be negative
     * @throws IllegalArgumentException if seconds is negative
     */
    public synchronized void advance(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Cannot move a clock backwards: " + seconds);
        }
        currentTime += seconds;
    }
    
    @Override
    public String getName() {
        return "virtual";
    }
}
