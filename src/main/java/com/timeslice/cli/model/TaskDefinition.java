package com.timeslice.cli.model;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.util.ArrayList;
import java.util.List;

/**
 * A task as typed on the command line: {@code NAME:PRIORITY:BURST}.
 * 
 * The CLI plays the role of the request layer: it validates ranges here,
 * before anything reaches the scheduler, which applies values verbatim.
 */
public final class TaskDefinition {
    
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final double MAX_BURST_TIME = 300.0;  // 5 minutes
    public static final int MAX_NAME_LENGTH = 100;
    
    private final String name;
    private final int priority;
    private final double burstTime;
    
    public TaskDefinition(String name, int priority, double burstTime) {
        this.name = name;
        this.priority = priority;
        this.burstTime = burstTime;
    }
    
    public String getName() {
        return name;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public double getBurstTime() {
        return burstTime;
    }
    
    /**
     * Checks field ranges.
     * 
     * @return list of problems, empty if the definition is valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            errors.add("name must be 1-" + MAX_NAME_LENGTH + " characters");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            errors.add("priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", got " + priority);
        }
        if (!(burstTime > 0) || burstTime > MAX_BURST_TIME) {
            errors.add("burst time must be in (0, " + MAX_BURST_TIME + "], got " + burstTime);
        }
        return errors;
    }
    
    @Override
    public String toString() {
        return name + ":" + priority + ":" + burstTime;
    }
    
    /**
     * Picocli converter for {@code NAME:PRIORITY:BURST}.
     * The name is everything before the last two colons, so it may contain colons itself.
     */
    public static class Converter implements ITypeConverter<TaskDefinition> {
        @Override
        public TaskDefinition convert(String value) {
            int burstSep = value.lastIndexOf(':');
            int prioritySep = burstSep > 0 ? value.lastIndexOf(':', burstSep - 1) : -1;
            if (prioritySep < 0) {
                throw new TypeConversionException(
                    "Invalid task '" + value + "' (expected NAME:PRIORITY:BURST)");
            }
            String name = value.substring(0, prioritySep);
            try {
                int priority = Integer.parseInt(value.substring(prioritySep + 1, burstSep).trim());
                double burst = Double.parseDouble(value.substring(burstSep + 1).trim());
                return new TaskDefinition(name, priority, burst);
            } catch (NumberFormatException e) {
                throw new TypeConversionException(
                    "Invalid task '" + value + "': " + e.getMessage());
            }
        }
    }
}
