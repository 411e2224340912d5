package com.timeslice.scheduler;

import java.util.Optional;

/**
 * Partial update for a {@link Task}.
 * 
 * Every field is either present or absent; absent fields are left untouched.
 * Applied by {@link TaskScheduler#updateTask(String, TaskPatch)} under these rules:
 *   - completed task: the whole patch is ignored
 *   - name, description, priority: applied freely (priority re-sorts the ready queue)
 *   - burstTime: applied only while the task is still PENDING
 * 
 * Example usage:
 * TaskPatch patch = TaskPatch.builder()
 *     .priority(7)
 *     .name("Updated Database Backup")
 *     .build();
 */
public final class TaskPatch {
    
    private final String name;
    private final String description;
    private final Integer priority;
    private final Double burstTime;
    
    private TaskPatch(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.priority = builder.priority;
        this.burstTime = builder.burstTime;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }
    
    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }
    
    public Optional<Integer> getPriority() {
        return Optional.ofNullable(priority);
    }
    
    public Optional<Double> getBurstTime() {
        return Optional.ofNullable(burstTime);
    }
    
    /**
     * @return true if no field is present
     */
    public boolean isEmpty() {
        return name == null && description == null && priority == null && burstTime == null;
    }
    
    @Override
    public String toString() {
        return "TaskPatch{" +
                "name=" + name +
                ", description=" + description +
                ", priority=" + priority +
                ", burstTime=" + burstTime +
                '}';
    }
    
    /**
     * Builder for TaskPatch. Fields never set stay absent.
     */
    public static class Builder {
        private String name;
        private String description;
        private Integer priority;
        private Double burstTime;
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder description(String description) {
            this.description = description;
            return this;
        }
        
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }
        
        public Builder burstTime(double burstTime) {
            this.burstTime = burstTime;
            return this;
        }
        
        public TaskPatch build() {
            return new TaskPatch(this);
        }
    }
}
