package com.timeslice.scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered collection of tasks waiting for (or holding) the processor.
 * 
 * Order invariant:
 *   - priority descending
 *   - among equal priorities, round-robin: the task that just got a slice
 *     sits right after the last task of its own priority group
 *     (back of its group, NOT back of the whole queue)
 * 
 * Insertions append and then stable-sort, so equal priorities keep insertion order.
 * 
 * N.B.: not thread-safe. {@link TaskScheduler} guards every access with its lock.
 */
public class ReadyQueue {
    
    private static final Comparator<Task> BY_PRIORITY_DESC =
            Comparator.comparingInt(Task::getPriority).reversed();
    
    private final List<Task> tasks = new ArrayList<>();
    
    /**
     * Appends a task and restores priority order.
     * List.sort is a stable merge sort, so ties keep their arrival order.
     */
    public void add(Task task) {
        tasks.add(task);
        tasks.sort(BY_PRIORITY_DESC);
    }
    
    /**
     * Re-positions a task after its priority changed.
     * Equivalent to a fresh arrival at the new priority.
     * 
     * @return false if the task was not queued (nothing changes)
     */
    public boolean reprioritize(Task task) {
        if (!tasks.remove(task)) {
            return false;
        }
        add(task);
        return true;
    }
    
    /**
     * @return highest-priority task, or null if the queue is empty
     */
    public Task head() {
        return tasks.isEmpty() ? null : tasks.get(0);
    }
    
    /**
     * @return number of queued tasks sharing the given priority
     */
    public int countWithPriority(int priority) {
        int count = 0;
        for (Task t : tasks) {
            if (t.getPriority() == priority) {
                count++;
            }
        }
        return count;
    }
    
    /**
     * Moves a task to the back of its own priority group.
     * 
     * The task is removed, then re-inserted right after the last remaining
     * task with the same priority. If no other task shares its priority the
     * position does not change.
     * 
     * @return false if the task was not queued
     */
    public boolean rotate(Task task) {
        int index = tasks.indexOf(task);
        if (index < 0) {
            return false;
        }
        tasks.remove(index);
        
        int priority = task.getPriority();
        int insertionIdx = index;  // no peers: put it back where it was
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).getPriority() == priority) {
                insertionIdx = i + 1;
            }
        }
        tasks.add(insertionIdx, task);
        return true;
    }
    
    /**
     * @return true if the task was present and has been removed
     */
    public boolean remove(Task task) {
        return tasks.remove(task);
    }
    
    public int size() {
        return tasks.size();
    }
    
    public boolean isEmpty() {
        return tasks.isEmpty();
    }
    
    /**
     * @return unmodifiable copy of the current order, head first
     */
    public List<Task> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(tasks));
    }
}
