package com.timeslice.scheduler;

import java.util.Collection;
import java.util.List;

/**
 * Derives fleet-level metrics from the task table and the completed list.
 * Holds no state: every call scans its inputs from scratch.
 * 
 * Averages only consider completed tasks. The caller must pass collections
 * that are not being modified concurrently (TaskScheduler holds its lock).
 */
public final class StatsAggregator {
    
    private StatsAggregator() {
    }
    
    /**
     * @param tasks every task known to the scheduler
     * @param completed completed list, in completion order
     * @param uptime seconds since the scheduler started
     * @param idle current idle flag
     * @return computed statistics
     */
    public static SchedulerStats aggregate(Collection<Task> tasks, List<Task> completed,
                                           double uptime, boolean idle) {
        int pending = 0;
        int running = 0;
        for (Task task : tasks) {
            if (task.getStatus() == TaskStatus.PENDING) {
                pending++;
            } else if (task.getStatus() == TaskStatus.RUNNING) {
                running++;
            }
        }
        
        int completedCount = completed.size();
        double avgWaiting = 0;
        double avgTurnaround = 0;
        double avgResponse = 0;
        
        if (completedCount > 0) {
            double waitingSum = 0;
            double turnaroundSum = 0;
            double responseSum = 0;
            for (Task task : completed) {
                waitingSum += task.getWaitingTime();
                turnaroundSum += task.getTurnaroundTime();
                if (task.hasResponseTime()) {
                    responseSum += task.getResponseTime();
                }
            }
            avgWaiting = waitingSum / completedCount;
            avgTurnaround = turnaroundSum / completedCount;
            // N.B.: divided by ALL completed tasks, not only those with a response time.
            // A completed task always ran at least one slice, so both counts match in practice.
            avgResponse = responseSum / completedCount;
        }
        
        return new SchedulerStats(tasks.size(), pending, running, completedCount,
                avgWaiting, avgTurnaround, avgResponse, uptime, idle);
    }
}
