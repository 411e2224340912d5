package com.timeslice.scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time statistics of a scheduler.
 * Built by {@link StatsAggregator}; immutable.
 */
public final class SchedulerStats {
    
    private final int totalTasks;
    private final int pendingTasks;
    private final int runningTasks;
    private final int completedTasks;
    private final double avgWaitingTime;
    private final double avgTurnaroundTime;
    private final double avgResponseTime;
    private final double schedulerUptime;
    private final boolean idle;
    
    public SchedulerStats(int totalTasks, int pendingTasks, int runningTasks, int completedTasks,
                          double avgWaitingTime, double avgTurnaroundTime, double avgResponseTime,
                          double schedulerUptime, boolean idle) {
        this.totalTasks = totalTasks;
        this.pendingTasks = pendingTasks;
        this.runningTasks = runningTasks;
        this.completedTasks = completedTasks;
        this.avgWaitingTime = avgWaitingTime;
        this.avgTurnaroundTime = avgTurnaroundTime;
        this.avgResponseTime = avgResponseTime;
        this.schedulerUptime = schedulerUptime;
        this.idle = idle;
    }
    
    public int getTotalTasks() {
        return totalTasks;
    }
    
    public int getPendingTasks() {
        return pendingTasks;
    }
    
    public int getRunningTasks() {
        return runningTasks;
    }
    
    public int getCompletedTasks() {
        return completedTasks;
    }
    
    public double getAvgWaitingTime() {
        return avgWaitingTime;
    }
    
    public double getAvgTurnaroundTime() {
        return avgTurnaroundTime;
    }
    
    public double getAvgResponseTime() {
        return avgResponseTime;
    }
    
    public double getSchedulerUptime() {
        return schedulerUptime;
    }
    
    public boolean isIdle() {
        return idle;
    }
    
    /**
     * @return unmodifiable ordered map, same keys the request layer exposes
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_tasks", totalTasks);
        map.put("pending_tasks", pendingTasks);
        map.put("running_tasks", runningTasks);
        map.put("completed_tasks", completedTasks);
        map.put("avg_waiting_time", avgWaitingTime);
        map.put("avg_turnaround_time", avgTurnaroundTime);
        map.put("avg_response_time", avgResponseTime);
        map.put("scheduler_uptime", schedulerUptime);
        map.put("idle", idle);
        return Collections.unmodifiableMap(map);
    }
    
    @Override
    public String toString() {
        return String.format(
            "SchedulerStats[total=%d, pending=%d, running=%d, completed=%d, " +
            "avgWaiting=%.2fs, avgTurnaround=%.2fs, avgResponse=%.2fs, uptime=%.2fs, idle=%s]",
            totalTasks, pendingTasks, runningTasks, completedTasks,
            avgWaitingTime, avgTurnaroundTime, avgResponseTime, schedulerUptime, idle);
    }
}
