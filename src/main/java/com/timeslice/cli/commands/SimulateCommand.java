package com.timeslice.cli.commands;

import com.timeslice.cli.TimesliceCli;
import com.timeslice.cli.model.TaskDefinition;
import com.timeslice.clock.SystemTimeSource;
import com.timeslice.clock.TimeSource;
import com.timeslice.clock.VirtualTimeSource;
import com.timeslice.scheduler.ExecutionRecord;
import com.timeslice.scheduler.SchedulerConfig;
import com.timeslice.scheduler.SchedulerStats;
import com.timeslice.scheduler.Task;
import com.timeslice.scheduler.TaskScheduler;
import com.timeslice.scheduler.TaskStatus;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.TypeConversionException;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Runs a workload through a scheduler and prints what happened.
 * 
 * Two modes:
 *   - real time (default): the background loop runs, a 3s task takes 3 real seconds
 *   - virtual (--virtual): slices are driven on this thread against a virtual clock,
 *     output is instant and fully deterministic
 * 
 * Example:
 *   timeslice simulate -q 2 -t backup:5:3 -t reindex:5:1 -t report:10:2 --virtual
 *   timeslice simulate -t backup:5:3 --virtual --status completed
 */
@Command(name = "simulate", description = "Run tasks through the round-robin scheduler")
public class SimulateCommand implements Callable<Integer> {
    
    @ParentCommand
    TimesliceCli parent;
    
    @Option(
        names = {"-q", "--quantum"},
        description = "Time quantum in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "2.0"
    )
    double quantum;
    
    @Option(
        names = {"-t", "--task"},
        description = "Task as NAME:PRIORITY:BURST, priority 1-10, burst in seconds (repeatable)",
        required = true,
        converter = TaskDefinition.Converter.class
    )
    List<TaskDefinition> definitions;
    
    @Option(
        names = {"--virtual"},
        description = "Use a virtual clock instead of sleeping in real time"
    )
    boolean virtual;
    
    @Option(
        names = {"--timeout"},
        description = "Maximum real seconds to wait for completion (default: ${DEFAULT-VALUE})",
        defaultValue = "600"
    )
    long timeoutSeconds;
    
    @Option(
        names = {"--status"},
        description = "Only list tasks with this status in the report (pending, running, completed, cancelled)",
        converter = StatusConverter.class
    )
    TaskStatus statusFilter;
    
    PrintStream out = System.out;
    PrintStream err = System.err;
    
    @Override
    public Integer call() throws Exception {
        if (parent != null) {
            parent.applyLogLevel();
        }
        
        // 1. Validation (request-layer responsibility, the scheduler trusts its input)
        boolean valid = true;
        if (!(quantum > 0)) {
            err.println("ERROR: quantum must be positive, got " + quantum);
            valid = false;
        }
        for (TaskDefinition definition : definitions) {
            for (String error : definition.validate()) {
                err.println("ERROR: task '" + definition + "': " + error);
                valid = false;
            }
        }
        if (!valid) {
            return 1;
        }
        
        out.println("========================================");
        out.println("  Timeslice Simulation");
        out.println("========================================");
        
        // 2. Scheduler
        TimeSource timeSource = virtual ? new VirtualTimeSource() : new SystemTimeSource();
        SchedulerConfig config = new SchedulerConfig.Builder()
                .timeQuantum(quantum)
                .timeSource(timeSource)
                .build();
        TaskScheduler scheduler = new TaskScheduler(config);
        out.println("Quantum: " + quantum + "s, clock: " + timeSource.getName());
        
        // 3. Tasks (ids generated here, the scheduler never invents them)
        List<Task> batch = new ArrayList<>();
        for (TaskDefinition definition : definitions) {
            batch.add(new Task(UUID.randomUUID().toString(), definition.getName(),
                    definition.getPriority(), definition.getBurstTime(), "", timeSource.now()));
        }
        
        // 4. Run
        if (virtual) {
            scheduler.addTasks(batch);
            int slices = 0;
            while (scheduler.runNextSlice()) {
                slices++;
            }
            out.println("[OK] " + slices + " slices executed");
        } else {
            scheduler.start();
            try {
                scheduler.addTasks(batch);
                out.println("Running " + batch.size() + " tasks in real time...");
                if (!scheduler.awaitIdle(timeoutSeconds, TimeUnit.SECONDS)) {
                    err.println("Timeout: tasks still queued after " + timeoutSeconds + "s");
                    return 2;
                }
                out.println("[OK] All tasks completed");
            } finally {
                scheduler.stop();
            }
        }
        
        // 5. Report
        printExecutionSequence(scheduler.getExecutionSequence(), batch);
        printTasks(scheduler.listTasks(statusFilter, null));
        printStats(scheduler.getStats());
        return 0;
    }
    
    private void printExecutionSequence(List<ExecutionRecord> sequence, List<Task> tasks) {
        out.println();
        out.println("--- Execution Sequence ---");
        for (ExecutionRecord record : sequence) {
            out.printf("  %7.2f -> %7.2f  %s%n",
                    record.getStartTime(), record.getEndTime(), nameOf(record.getTaskId(), tasks));
        }
    }
    
    private void printTasks(List<Task> tasks) {
        out.println();
        out.println(statusFilter == null ? "--- Tasks ---" : "--- Tasks (" + statusFilter.getLabel() + ") ---");
        out.printf("  %-20s %4s %7s %9s %8s %10s %8s %8s%n",
                "NAME", "PRIO", "BURST", "STATUS", "RESPONSE", "TURNAROUND", "WAITING", "LAST RUN");
        for (Task task : tasks) {
            out.printf("  %-20s %4d %7.2f %9s %8.2f %10.2f %8.2f %8.2f%n",
                    task.getName(), task.getPriority(), task.getBurstTime(), task.getStatus().getLabel(),
                    task.getResponseTime(), task.getTurnaroundTime(), task.getWaitingTime(),
                    task.getLastExecutionTime());
        }
    }
    
    private void printStats(SchedulerStats stats) {
        out.println();
        out.println("--- Statistics ---");
        out.println("  Completed: " + stats.getCompletedTasks() + "/" + stats.getTotalTasks());
        out.printf("  Avg waiting time:    %.2fs%n", stats.getAvgWaitingTime());
        out.printf("  Avg turnaround time: %.2fs%n", stats.getAvgTurnaroundTime());
        out.printf("  Avg response time:   %.2fs%n", stats.getAvgResponseTime());
        out.printf("  Uptime:              %.2fs%n", stats.getSchedulerUptime());
    }
    
    /**
     * Parses --status through the lower-case labels used in task snapshots.
     */
    public static class StatusConverter implements ITypeConverter<TaskStatus> {
        @Override
        public TaskStatus convert(String value) {
            try {
                return TaskStatus.fromLabel(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
    
    private static String nameOf(String taskId, List<Task> tasks) {
        for (Task task : tasks) {
            if (task.getTaskId().equals(taskId)) {
                return task.getName();
            }
        }
        return taskId;
    }
}
