package com.whereq.orchestra.queue;

import com.whereq.orchestra.model.JobType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * One task queue per job type
 */
public class TaskQueueRegistry {

    private final Map<JobType, TaskQueue> queues = new EnumMap<>(JobType.class);

    public TaskQueueRegistry(Function<JobType, TaskQueue> factory) {
        for (JobType type : JobType.values()) {
            queues.put(type, factory.apply(type));
        }
    }

    public TaskQueue queueFor(JobType type) {
        return queues.get(type);
    }

    public Collection<TaskQueue> all() {
        return Collections.unmodifiableCollection(queues.values());
    }
}
