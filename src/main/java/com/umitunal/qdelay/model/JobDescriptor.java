package com.umitunal.qdelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A job waiting in the delayed queue: the execution target, the queue it is
 * handed to once due, and its arguments.
 *
 * <p>Instances are immutable. Arguments are opaque to the scheduler and must be
 * JSON-representable (strings, numbers, booleans, lists, maps or null).
 */
public final class JobDescriptor {
    private final String className;
    private final String queue;
    private final List<Object> args;

    @JsonCreator
    public JobDescriptor(@JsonProperty("class") String className,
                         @JsonProperty("queue") String queue,
                         @JsonProperty("args") List<Object> args) {
        this.className = className;
        this.queue = queue;
        this.args = args == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static JobDescriptor of(String className, String queue, Object... args) {
        return new JobDescriptor(className, queue, Arrays.asList(args));
    }

    @JsonProperty("class")
    public String getClassName() {
        return className;
    }

    @JsonProperty("queue")
    public String getQueue() {
        return queue;
    }

    @JsonProperty("args")
    public List<Object> getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDescriptor)) return false;
        JobDescriptor that = (JobDescriptor) o;
        return Objects.equals(className, that.className)
                && Objects.equals(queue, that.queue)
                && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, queue, args);
    }

    @Override
    public String toString() {
        return String.format("JobDescriptor{class='%s', queue='%s', args=%s}", className, queue, args);
    }
}
