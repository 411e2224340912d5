package com.timeslice.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    @DisplayName("new task starts pending with full remaining time")
    void initialState() {
        Task task = new Task("t-1", "Database Backup", 5, 10.5);

        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(10.5, task.getRemainingTime());
        assertEquals(0, task.getProgress());
        assertEquals("", task.getDescription());
        assertFalse(task.hasResponseTime());
        assertTrue(task.getCreatedAt() > 0);
    }

    @Test
    @DisplayName("snapshot reports unset metrics as 0 and response time as -1")
    void snapshotDefaults() {
        Task task = new Task("t-1", "Backup", 5, 3.0, "nightly", 1650123456.789);
        Map<String, Object> map = task.toMap();

        assertEquals(List.of("task_id", "name", "description", "priority", "burst_time", "created_at",
                "arrival_time", "remaining_time", "waiting_time", "turnaround_time", "completion_time",
                "response_time", "last_execution_time", "status", "progress"), List.copyOf(map.keySet()));
        assertEquals(0.0, map.get("completion_time"));
        assertEquals(0.0, map.get("turnaround_time"));
        assertEquals(0.0, map.get("waiting_time"));
        assertEquals(-1.0, map.get("response_time"));
        assertEquals(0.0, map.get("last_execution_time"));
        assertEquals("pending", map.get("status"));
        assertEquals("nightly", map.get("description"));
        assertThrows(UnsupportedOperationException.class, () -> map.put("name", "x"));
    }

    @Test
    @DisplayName("progress is floored and clamped")
    void progressComputation() {
        assertEquals(66, Task.computeProgress(3.0, 1.0));
        assertEquals(0, Task.computeProgress(3.0, 3.0));
        assertEquals(100, Task.computeProgress(3.0, -1.0));
        assertEquals(0, Task.computeProgress(3.0, 4.0));
        assertEquals(0, Task.computeProgress(0.0, 0.0));
    }

    @Test
    @DisplayName("completion metrics are written once")
    void completionIsWriteOnce() {
        Task task = new Task("t-1", "Backup", 5, 2.0, "", 0.0);
        task.setArrivalTime(1.0);
        task.markRunning();
        task.consume(2.0);
        task.complete(4.0);

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(4.0, task.getCompletionTime());
        assertEquals(3.0, task.getTurnaroundTime());
        assertEquals(1.0, task.getWaitingTime());
        assertEquals(100, task.getProgress());
        assertThrows(IllegalStateException.class, () -> task.complete(5.0));
        assertEquals(4.0, task.getCompletionTime());
    }

    @Test
    @DisplayName("response time is recorded only the first time")
    void responseTimeWriteOnce() {
        Task task = new Task("t-1", "Backup", 5, 2.0, "", 0.0);
        assertTrue(task.recordResponseTime(1.5));
        assertFalse(task.recordResponseTime(9.0));
        assertEquals(1.5, task.getResponseTime());
    }

    @Test
    @DisplayName("status never goes back to pending")
    void statusIsOneWay() {
        Task task = new Task("t-1", "Backup", 5, 2.0, "", 0.0);
        task.markRunning();
        assertEquals(TaskStatus.RUNNING, task.getStatus());
        task.complete(2.0);
        task.markRunning();
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
    }

    @Test
    @DisplayName("burst change keeps the consumed deficit, even below zero")
    void burstChangeFormula() {
        Task task = new Task("t-1", "Backup", 5, 3.0, "", 0.0);
        task.changeBurstTime(5.0);
        assertEquals(5.0, task.getRemainingTime());

        task.consume(2.0);
        task.changeBurstTime(1.0);
        assertEquals(-1.0, task.getRemainingTime(), 1e-9);
    }

    @Test
    @DisplayName("status labels parse both ways")
    void statusLabels() {
        assertEquals("running", TaskStatus.RUNNING.getLabel());
        assertEquals(TaskStatus.COMPLETED, TaskStatus.fromLabel("completed"));
        assertEquals(TaskStatus.PENDING, TaskStatus.fromLabel(" PENDING "));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromLabel("unknown"));
    }
}
