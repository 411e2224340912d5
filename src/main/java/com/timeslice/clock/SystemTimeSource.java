package com.timeslice.clock;

/**
 * Wall-clock time source.
 * One second of simulated execution costs one second of real time.
 */
public class SystemTimeSource implements TimeSource {
    
    @Override
    public double now() {
        return System.currentTimeMillis() / 1000.0;
    }
    
    @Override
    public void sleep(double seconds) throws InterruptedException {
        if (seconds <= 0) {
            return;
        }
        long millis = Math.round(seconds * 1000.0);
        Thread.sleep(millis);
    }
    
    @Override
    public String getName() {
        return "system";
    }
}
