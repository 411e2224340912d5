package com.timeslice.scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of schedulable work.
 *
 * A Task is:
 *  - Created by the caller with its id and scheduling parameters
 *  - Admitted into a {@link TaskScheduler} via {@code addTask()}
 *  - Executed in slices of at most one time quantum
 *  - Finalized once its remaining time reaches zero
 *
 * Only the scheduler mutates a task: every setter is package-private.
 * Callers read it through getters or through the {@link #toMap()} snapshot.
 *
 * N.B.: mutable fields are volatile because callers read them without
 * holding the scheduler lock, while the execution thread writes them.
 */
public class Task {

    /**
     * Sentinel for metrics that have not been recorded yet.
     */
    public static final double NOT_SET = -1.0;

    // ==================== Identity & Parameters ====================

    private final String taskId;
    private final double createdAt;
    private volatile String name;
    private volatile String description;
    private volatile int priority;
    private volatile double burstTime;

    // ==================== Scheduling State ====================

    private volatile double remainingTime;
    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int progress = 0;
    private volatile double lastExecutionTime = 0;

    // ==================== Metrics (write-once) ====================

    private volatile double arrivalTime = 0;
    private volatile double responseTime = NOT_SET;
    private volatile double completionTime = NOT_SET;
    private volatile double turnaroundTime = NOT_SET;
    private volatile double waitingTime = NOT_SET;

    /**
     * Creates a task with empty description, created now (wall clock).
     *
     * @param taskId unique id supplied by the caller
     * @param name non-empty name
     * @param priority higher value = more urgent
     * @param burstTime total execution time required, in seconds
     */
    public Task(String taskId, String name, int priority, double burstTime) {
        this(taskId, name, priority, burstTime, "", System.currentTimeMillis() / 1000.0);
    }

    /**
     * Creates a task with every parameter explicit.
     *
     * @param taskId unique id supplied by the caller
     * @param name non-empty name
     * @param priority higher value = more urgent
     * @param burstTime total execution time required, in seconds
     * @param description free text, null is stored as ""
     * @param createdAt creation timestamp in seconds
     */
    public Task(String taskId, String name, int priority, double burstTime,
                String description, double createdAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.priority = priority;
        this.burstTime = burstTime;
        this.remainingTime = burstTime;
        this.description = description != null ? description : "";
        this.createdAt = createdAt;
    }

    // ==================== Getters ====================

    public String getTaskId() {
        return taskId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public int getPriority() {
        return priority;
    }

    public double getBurstTime() {
        return burstTime;
    }

    public double getCreatedAt() {
        return createdAt;
    }

    public double getArrivalTime() {
        return arrivalTime;
    }

    public double getRemainingTime() {
        return remainingTime;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public double getLastExecutionTime() {
        return lastExecutionTime;
    }

    /**
     * @return time from arrival to first slice, or {@link #NOT_SET}
     */
    public double getResponseTime() {
        return responseTime;
    }

    public double getCompletionTime() {
        return completionTime;
    }

    public double getTurnaroundTime() {
        return turnaroundTime;
    }

    public double getWaitingTime() {
        return waitingTime;
    }

    public boolean hasResponseTime() {
        return responseTime >= 0;
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    // ==================== Mutators (scheduler only) ====================

    void setName(String name) {
        this.name = name;
    }

    void setDescription(String description) {
        this.description = description;
    }

    void setPriority(int priority) {
        this.priority = priority;
    }

    /**
     * Changes the burst time keeping any elapsed deficit:
     * remaining = remaining - oldBurst + newBurst.
     * N.B.: the result is not clamped and can go negative.
     */
    void changeBurstTime(double newBurstTime) {
        double oldBurst = this.burstTime;
        this.burstTime = newBurstTime;
        this.remainingTime = this.remainingTime - oldBurst + newBurstTime;
    }

    void setArrivalTime(double arrivalTime) {
        this.arrivalTime = arrivalTime;
    }

    void setLastExecutionTime(double lastExecutionTime) {
        this.lastExecutionTime = lastExecutionTime;
    }

    /**
     * PENDING → RUNNING. Any other status is left untouched.
     */
    void markRunning() {
        if (status == TaskStatus.PENDING) {
            status = TaskStatus.RUNNING;
        }
    }

    /**
     * Records the response time the first time the task gets the processor.
     *
     * @return true if the value was recorded by this call
     */
    boolean recordResponseTime(double value) {
        if (responseTime != NOT_SET) {
            return false;
        }
        responseTime = value;
        return true;
    }

    /**
     * Consumes executed time and recomputes progress.
     */
    void consume(double executed) {
        remainingTime -= executed;
        progress = computeProgress(burstTime, remainingTime);
    }

    /**
     * Moves the task to COMPLETED and records every completion metric at once.
     *
     * @param now completion time, relative to the scheduler start
     * @throws IllegalStateException if the task was already completed
     */
    void complete(double now) {
        if (completionTime != NOT_SET) {
            throw new IllegalStateException("Task " + taskId + " already completed");
        }
        status = TaskStatus.COMPLETED;
        completionTime = now;
        turnaroundTime = now - arrivalTime;
        waitingTime = turnaroundTime - (burstTime - remainingTime);
        progress = 100;
    }

    /**
     * floor(100 * (burst - remaining) / burst) clamped to [0, 100].
     */
    static int computeProgress(double burstTime, double remainingTime) {
        if (burstTime <= 0) {
            return 0;
        }
        int value = (int) Math.floor((burstTime - remainingTime) / burstTime * 100.0);
        return Math.max(0, Math.min(100, value));
    }

    // ==================== Snapshot ====================

    /**
     * Read-only snapshot of every field, keyed the way external layers expect.
     * Unset completion, turnaround and waiting times are reported as 0,
     * an unset response time as -1.
     *
     * @return unmodifiable ordered map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("task_id", taskId);
        map.put("name", name);
        map.put("description", description);
        map.put("priority", priority);
        map.put("burst_time", burstTime);
        map.put("created_at", createdAt);
        map.put("arrival_time", arrivalTime);
        map.put("remaining_time", remainingTime);
        map.put("waiting_time", orZero(waitingTime));
        map.put("turnaround_time", orZero(turnaroundTime));
        map.put("completion_time", orZero(completionTime));
        map.put("response_time", responseTime);
        map.put("last_execution_time", lastExecutionTime);
        map.put("status", status.getLabel());
        map.put("progress", progress);
        return Collections.unmodifiableMap(map);
    }

    private static double orZero(double value) {
        return value == NOT_SET ? 0.0 : value;
    }

    @Override
    public String toString() {
        return String.format("Task %s: %s (Priority: %d, Remaining: %.2fs, Status: %s)",
                taskId, name, priority, remainingTime, status.getLabel());
    }
}
