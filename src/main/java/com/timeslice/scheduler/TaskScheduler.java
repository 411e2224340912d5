package com.timeslice.scheduler;

import com.timeslice.clock.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TaskScheduler runs tasks on a single virtual processor with a
 * priority-aware, time-sliced round-robin discipline.
 *
 * Architecture:
 *   - tasks: Map<String, Task> - the "truth" of the system, every known task
 *   - readyQueue: pending/running tasks, priority descending, round-robin within a priority
 *   - completedTasks: tasks that finished, in completion order
 *   - executionSequence: audit log, one record per executed slice
 *
 * Lifecycle of a slice (background loop, see {@link #runNextSlice()}):
 * 1. select: take the head of the ready queue, rotate it to the back of its priority group
 * 2. execute: sleep for min(quantum, remaining) through the TimeSource (NO LOCK)
 * 3. finalize: consume the time, complete the task if nothing remains
 *
 * Locking:
 * One ReentrantLock guards every field above. It is held only for short
 * critical sections and NEVER across the execute step, so callers are never
 * blocked by a running slice.
 *
 * N.B.: the running task itself is not locked for the duration of its slice.
 * A concurrent updateTask() or deleteTask() on it is allowed; finalize re-checks
 * membership before touching any list instead of trusting what it read before.
 */
public class TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    // ==================== Configuration ====================

    private final SchedulerConfig config;
    private final TimeSource timeSource;
    private final double timeQuantum;

    // ==================== State (guarded by lock) ====================

    private final ReentrantLock lock = new ReentrantLock();

    // Signalled by addTask() and stop(): wakes the idle loop
    private final Condition workAvailable = lock.newCondition();

    // Signalled whenever the ready queue drains: wakes awaitIdle() callers
    private final Condition drained = lock.newCondition();

    // Insertion-ordered so listTasks() returns tasks in admission order
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final ReadyQueue readyQueue = new ReadyQueue();
    private final List<Task> completedTasks = new ArrayList<>();
    private final List<ExecutionRecord> executionSequence = new ArrayList<>();
    private boolean idle = true;
    private Task currentTask;

    // ==================== Loop control ====================

    private volatile double startTime;
    private volatile boolean running = false;

    // Incremented by every start(): a loop keeps running only while it owns the current value
    private volatile long generation = 0;

    // Guarded by the object monitor (start/stop are synchronized)
    private ExecutorService executor;
    private Future<?> loopFuture;

    /**
     * Creates a scheduler with the default configuration (2s quantum, system clock).
     */
    public TaskScheduler() {
        this(SchedulerConfig.defaults());
    }

    /**
     * Creates a scheduler. The execution loop is NOT started: call {@link #start()}.
     *
     * @param config scheduler configuration
     */
    public TaskScheduler(SchedulerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.timeSource = config.getTimeSource();
        this.timeQuantum = config.getTimeQuantum();
        this.startTime = timeSource.now();
        log.info("TaskScheduler initialized: {}", config);
    }

    /**
     * @return seconds elapsed since the scheduler origin
     */
    private double elapsed() {
        return timeSource.now() - startTime;
    }

    // ==================== Queue management ====================

    /**
     * Admits a task: records its arrival time and puts it in the ready queue.
     *
     * @param task task to add, its id must not be registered already
     * @return the stored task (same instance)
     * @throws IllegalArgumentException if a task with the same id is already registered
     */
    public Task addTask(Task task) {
        Objects.requireNonNull(task, "task cannot be null");
        lock.lock();
        try {
            admit(task);
            workAvailable.signalAll();
            return task;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits several tasks in one critical section, in list order.
     * The loop cannot interleave a slice between two of them.
     *
     * @param batch tasks to add
     * @return the stored tasks, same order
     * @throws IllegalArgumentException if an id is already registered (earlier tasks stay admitted)
     */
    public List<Task> addTasks(List<Task> batch) {
        Objects.requireNonNull(batch, "batch cannot be null");
        lock.lock();
        try {
            List<Task> added = new ArrayList<>(batch.size());
            for (Task task : batch) {
                admit(Objects.requireNonNull(task, "task cannot be null"));
                added.add(task);
            }
            workAvailable.signalAll();
            return added;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void admit(Task task) {
        if (tasks.containsKey(task.getTaskId())) {
            throw new IllegalArgumentException("Task id already registered: " + task.getTaskId());
        }
        task.setArrivalTime(elapsed());
        tasks.put(task.getTaskId(), task);
        readyQueue.add(task);
        idle = false;  // New task added, scheduler is not idle
        log.info("Added: {}", task);
    }

    /**
     * @param taskId task identifier
     * @return the task, or empty if unknown
     */
    public Optional<Task> getTask(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a partial update to a task.
     *
     * Rules:
     *   - completed task: nothing changes (silently ignored), the task is returned as-is
     *   - name, description: applied
     *   - priority: applied, the task is re-queued as a fresh arrival at its new priority
     *   - burstTime: applied only while PENDING, remaining = remaining - oldBurst + newBurst
     *
     * Range validation is the caller's job: values are applied verbatim.
     *
     * @param taskId task identifier
     * @param patch fields to change
     * @return the task after the update, or empty if unknown
     */
    public Optional<Task> updateTask(String taskId, TaskPatch patch) {
        Objects.requireNonNull(patch, "patch cannot be null");
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return Optional.empty();
            }

            if (patch.isEmpty()) {
                log.debug("Empty update for task {}, nothing to apply", taskId);
                return Optional.of(task);
            }

            if (task.isCompleted()) {
                log.debug("Ignoring update of completed task {}: {}", taskId, patch);
                return Optional.of(task);
            }

            patch.getName().ifPresent(task::setName);
            patch.getDescription().ifPresent(task::setDescription);

            if (patch.getPriority().isPresent()) {
                task.setPriority(patch.getPriority().get());
                if (readyQueue.reprioritize(task)) {
                    log.debug("Task {} re-queued at priority {}", taskId, task.getPriority());
                }
            }

            if (patch.getBurstTime().isPresent()) {
                if (task.getStatus() == TaskStatus.PENDING) {
                    task.changeBurstTime(patch.getBurstTime().get());
                } else {
                    log.debug("Ignoring burst time change of task {} (status {})",
                              taskId, task.getStatus().getLabel());
                }
            }

            log.info("Updated: {}", task);
            return Optional.of(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a task from the table and from whichever list holds it.
     * Safe to call while the task is mid-slice.
     *
     * @param taskId task identifier
     * @return true if the task existed, false otherwise
     */
    public boolean deleteTask(String taskId) {
        lock.lock();
        try {
            Task task = tasks.remove(taskId);
            if (task == null) {
                return false;
            }

            // Check both lists: a concurrent slice may have just moved it
            readyQueue.remove(task);
            completedTasks.remove(task);

            if (readyQueue.isEmpty() && currentTask == null) {
                drained.signalAll();
            }
            log.info("Deleted task: {}", taskId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every task, in admission order.
     *
     * Each task is retrieved in its own short critical section. A failure on one
     * task is logged and that task skipped: listing never fails as a whole.
     *
     * @return defensive copy of the task list
     */
    public List<Task> listTasks() {
        List<String> taskKeys;
        lock.lock();
        try {
            // Copy the keys first, then fetch each task individually
            taskKeys = new ArrayList<>(tasks.keySet());
        } finally {
            lock.unlock();
        }

        List<Task> result = new ArrayList<>(taskKeys.size());
        for (String key : taskKeys) {
            lock.lock();
            try {
                Task task = tasks.get(key);
                if (task != null) {  // deleted in the meantime
                    result.add(task);
                }
            } catch (RuntimeException e) {
                log.warn("Error retrieving task {}: {}", key, e.getMessage(), e);
            } finally {
                lock.unlock();
            }
        }
        return result;
    }

    /**
     * Lists tasks matching optional filters.
     *
     * @param status required status, or null for any
     * @param priority required priority, or null for any
     * @return matching tasks, in admission order
     */
    public List<Task> listTasks(TaskStatus status, Integer priority) {
        List<Task> result = new ArrayList<>();
        for (Task task : listTasks()) {
            if (status != null && task.getStatus() != status) {
                continue;
            }
            if (priority != null && task.getPriority() != priority) {
                continue;
            }
            result.add(task);
        }
        return result;
    }

    // ==================== Execution ====================

    /**
     * Executes one scheduling slice on the calling thread.
     *
     * This is the body of the background loop, exposed so that a caller can drive
     * the scheduler step by step (virtual clock, dry runs) without starting it.
     *
     * @return true if a slice was executed, false if the ready queue was empty
     * @throws InterruptedException if interrupted while the slice was executing;
     *         the task keeps its remaining time and stays queued
     */
    public boolean runNextSlice() throws InterruptedException {
        Task task;
        double sliceStart;
        double actualTime;

        // ---- select (short critical section) ----
        lock.lock();
        try {
            task = readyQueue.head();
            if (task == null) {
                markIdle();
                return false;
            }
            idle = false;

            // Round-robin within the same priority level
            if (readyQueue.countWithPriority(task.getPriority()) > 1) {
                readyQueue.rotate(task);
                log.debug("Rotated {} to the back of priority group {}",
                          task.getTaskId(), task.getPriority());
            }
            currentTask = task;

            task.markRunning();
            sliceStart = elapsed();
            if (task.recordResponseTime(sliceStart - task.getArrivalTime())) {
                log.debug("Task {} first response after {}s", task.getTaskId(), task.getResponseTime());
            }
            task.setLastExecutionTime(sliceStart);

            // A negative remaining time (burst shrunk below consumed work) executes nothing
            actualTime = Math.max(0.0, Math.min(timeQuantum, task.getRemainingTime()));
        } finally {
            lock.unlock();
        }

        // ---- execute (NO LOCK) ----
        log.info("Executing: {} for {} seconds", task, String.format("%.2f", actualTime));
        try {
            timeSource.sleep(actualTime);
        } catch (InterruptedException e) {
            lock.lock();
            try {
                currentTask = null;
            } finally {
                lock.unlock();
            }
            throw e;
        }

        // ---- finalize (short critical section) ----
        lock.lock();
        try {
            executionSequence.add(new ExecutionRecord(task.getTaskId(), sliceStart, sliceStart + actualTime));
            task.consume(actualTime);

            if (task.getRemainingTime() <= 0) {
                finalizeCompleted(task);
            }

            currentTask = null;
            if (readyQueue.isEmpty()) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
        return true;
    }

    // Caller holds the lock
    private void finalizeCompleted(Task task) {
        task.complete(elapsed());
        log.info("Completed: {}", task);

        // Re-check membership: the task may have been deleted during its slice
        readyQueue.remove(task);
        if (tasks.get(task.getTaskId()) == task && !completedTasks.contains(task)) {
            completedTasks.add(task);
        } else {
            log.debug("Task {} completed after being deleted, not listed as completed", task.getTaskId());
        }
    }

    // Caller holds the lock
    private void markIdle() {
        if (!idle) {
            log.info("Scheduler idle - waiting for tasks...");
            idle = true;
        }
        if (currentTask == null) {
            drained.signalAll();
        }
    }

    /**
     * Main loop, runs on the scheduler thread until stop() is called
     * or a later start() hands the scheduler to a new loop.
     *
     * @param loopGeneration generation assigned by the start() that submitted this loop
     */
    private void schedulerLoop(long loopGeneration) {
        log.info("Scheduler loop {} started", loopGeneration);
        try {
            while (isCurrentLoop(loopGeneration)) {
                boolean executed;
                try {
                    executed = runNextSlice();
                } catch (RuntimeException e) {
                    log.error("Unexpected error while executing a slice", e);
                    executed = false;
                }

                if (!executed) {
                    awaitWork(loopGeneration);
                } else if (config.getLoopPauseMs() > 0) {
                    // Small pause to prevent CPU hogging between slices
                    Thread.sleep(config.getLoopPauseMs());
                }
            }
        } catch (InterruptedException e) {
            log.warn("Scheduler loop interrupted");
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler loop {} exited", loopGeneration);
    }

    private boolean isCurrentLoop(long loopGeneration) {
        return running && generation == loopGeneration;
    }

    /**
     * Idle wait: releases the lock while waiting, woken by addTask() or stop().
     * Bounded by the idle poll interval so that a missed signal costs one interval at most.
     */
    private void awaitWork(long loopGeneration) throws InterruptedException {
        lock.lock();
        try {
            if (isCurrentLoop(loopGeneration) && readyQueue.isEmpty()) {
                workAvailable.await(config.getIdlePollIntervalMs(), TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the background execution loop on a dedicated daemon thread.
     * Resets the scheduler origin to now.
     *
     * N.B.: if a previous stop() timed out, its loop may still be finishing a slice.
     * start() waits for it (bounded by the stop timeout) and refuses to start
     * while it is alive, so that at most one loop ever executes slices.
     *
     * @return true if a new loop was started, false if already running
     *         or the previous loop did not terminate in time
     */
    public synchronized boolean start() {
        if (running) {
            log.warn("Scheduler already running");
            return false;
        }
        if (!awaitPreviousLoop()) {
            return false;
        }

        long loopGeneration = ++generation;
        running = true;
        startTime = timeSource.now();

        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable);
            t.setName("timeslice-scheduler");
            t.setDaemon(true);  // Don't prevent JVM shutdown
            return t;
        });
        loopFuture = executor.submit(() -> schedulerLoop(loopGeneration));

        log.info("Scheduler started (quantum={}s, clock={})", timeQuantum, timeSource.getName());
        return true;
    }

    // Caller holds the object monitor
    private boolean awaitPreviousLoop() {
        if (loopFuture == null || loopFuture.isDone()) {
            return true;
        }
        try {
            loopFuture.get(config.getStopTimeoutMs(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Previous scheduler loop still finishing a slice, not starting");
            return false;
        } catch (ExecutionException e) {
            log.warn("Previous scheduler loop terminated abnormally", e.getCause());
            return true;
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for the previous scheduler loop");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops the background loop and waits for it to terminate.
     *
     * The wait is bounded by the configured stop timeout. If a slice is still in
     * flight when it expires, a warning is logged and the thread is interrupted:
     * the interrupted task keeps its remaining time and stays queued.
     *
     * @return true if the loop terminated within the timeout (or was not running)
     */
    public synchronized boolean stop() {
        if (!running) {
            return true;
        }
        running = false;

        lock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        boolean terminated = true;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(config.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.warn("Scheduler thread did not terminate within {} ms, interrupting it",
                             config.getStopTimeoutMs());
                    executor.shutdownNow();
                    terminated = false;
                }
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for the scheduler thread to stop");
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                terminated = false;
            }
        }
        log.info("Scheduler stopped");
        return terminated;
    }

    /**
     * Blocks until the ready queue is empty and no slice is in flight.
     *
     * @param timeout maximum time to wait
     * @param unit unit of timeout
     * @return true if the scheduler drained, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!readyQueue.isEmpty() || currentTask != null) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Query Methods ====================

    /**
     * @return statistics computed from the current state
     */
    public SchedulerStats getStats() {
        lock.lock();
        try {
            return StatsAggregator.aggregate(tasks.values(), completedTasks, elapsed(), idle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return copy of the execution sequence, in execution order
     */
    public List<ExecutionRecord> getExecutionSequence() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(executionSequence));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return current ready queue order, head first
     */
    public List<Task> getReadyQueue() {
        lock.lock();
        try {
            return readyQueue.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return completed tasks, in completion order
     */
    public List<Task> getCompletedTasks() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(completedTasks));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the task whose slice is executing right now, if any
     */
    public Optional<Task> getCurrentTask() {
        lock.lock();
        try {
            return Optional.ofNullable(currentTask);
        } finally {
            lock.unlock();
        }
    }

    public boolean isIdle() {
        lock.lock();
        try {
            return idle;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public double getTimeQuantum() {
        return timeQuantum;
    }
}
