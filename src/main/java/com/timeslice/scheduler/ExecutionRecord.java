package com.timeslice.scheduler;

/**
 * One entry of the execution sequence: a single slice given to a task.
 * Times are relative to the scheduler start, in seconds.
 */
public final class ExecutionRecord {
    
    private final String taskId;
    private final double startTime;
    private final double endTime;
    
    public ExecutionRecord(String taskId, double startTime, double endTime) {
        this.taskId = taskId;
        this.startTime = startTime;
        this.endTime = endTime;
    }
    
    public String getTaskId() {
        return taskId;
    }
    
    public double getStartTime() {
        return startTime;
    }
    
    public double getEndTime() {
        return endTime;
    }
    
    /**
     * @return simulated time granted by this slice
     */
    public double getDuration() {
        return endTime - startTime;
    }
    
    @Override
    public String toString() {
        return String.format("ExecutionRecord[task=%s, %.2f -> %.2f]", taskId, startTime, endTime);
    }
}
