package com.umitunal.qdelay.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A named recurring job as kept by the schedule registry.
 *
 * <p>The name is not part of the definition; it is the registry key. When
 * {@code class} is absent the registry substitutes the name.
 *
 * <pre>{@code
 * ScheduleDefinition.builder()
 *         .every("1m")
 *         .args("work on this string")
 *         .description("Makes tea")
 *         .build();
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScheduleDefinition {
    private final String className;
    private final String cron;
    private final String every;
    private final Object args;
    private final String queue;
    private final SortedSet<String> envs;
    private final String description;

    @JsonCreator
    ScheduleDefinition(@JsonProperty("class") String className,
                       @JsonProperty("cron") String cron,
                       @JsonProperty("every") String every,
                       @JsonProperty("args") Object args,
                       @JsonProperty("queue") String queue,
                       @JsonProperty("envs") @JsonAlias("rails_envs")
                       @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                       Collection<String> envs,
                       @JsonProperty("description") String description) {
        this.className = className;
        this.cron = cron;
        this.every = every;
        this.args = args;
        this.queue = queue;
        this.envs = normalizeEnvs(envs);
        this.description = description;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("class")
    public String getClassName() {
        return className;
    }

    @JsonProperty("cron")
    public String getCron() {
        return cron;
    }

    @JsonProperty("every")
    public String getEvery() {
        return every;
    }

    @JsonProperty("args")
    public Object getArgs() {
        return args;
    }

    @JsonProperty("queue")
    public String getQueue() {
        return queue;
    }

    @JsonProperty("envs")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public SortedSet<String> getEnvs() {
        return envs;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    /**
     * The rule a trigger evaluator should fire this definition by. A cron
     * expression takes precedence over an interval.
     */
    @JsonIgnore
    public Optional<Trigger> getTrigger() {
        if (cron != null && !cron.isBlank()) {
            return Optional.of(new Trigger(Trigger.Kind.CRON, cron));
        }
        if (every != null && !every.isBlank()) {
            return Optional.of(new Trigger(Trigger.Kind.EVERY, every));
        }
        return Optional.empty();
    }

    /**
     * Whether this definition should be loaded in the given environment. A
     * definition without environments is enabled everywhere.
     */
    public boolean isEnabledIn(String env) {
        return envs.isEmpty() || envs.contains(env);
    }

    @JsonIgnore
    public boolean hasClassName() {
        return className != null && !className.isEmpty();
    }

    /**
     * Copy of this definition with the execution target replaced.
     */
    public ScheduleDefinition withClassName(String newClassName) {
        return new ScheduleDefinition(newClassName, cron, every, args, queue, envs, description);
    }

    private static SortedSet<String> normalizeEnvs(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptySortedSet();
        }
        TreeSet<String> result = new TreeSet<>();
        for (String value : raw) {
            if (value == null) {
                continue;
            }
            // "production,staging" is accepted as two environments
            for (String part : value.split(",")) {
                String env = part.trim();
                if (!env.isEmpty()) {
                    result.add(env);
                }
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleDefinition)) return false;
        ScheduleDefinition that = (ScheduleDefinition) o;
        return Objects.equals(className, that.className)
                && Objects.equals(cron, that.cron)
                && Objects.equals(every, that.every)
                && Objects.equals(args, that.args)
                && Objects.equals(queue, that.queue)
                && envs.equals(that.envs)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, cron, every, args, queue, envs, description);
    }

    @Override
    public String toString() {
        return String.format("ScheduleDefinition{class='%s', cron='%s', every='%s', queue='%s', envs=%s}",
                className, cron, every, queue, envs);
    }

    /**
     * When and how often a recurring definition fires.
     */
    public static final class Trigger {
        public enum Kind { CRON, EVERY }

        private final Kind kind;
        private final String expression;

        public Trigger(Kind kind, String expression) {
            this.kind = kind;
            this.expression = expression;
        }

        public Kind getKind() { return kind; }
        public String getExpression() { return expression; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Trigger)) return false;
            Trigger that = (Trigger) o;
            return kind == that.kind && expression.equals(that.expression);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, expression);
        }

        @Override
        public String toString() {
            return kind + "(" + expression + ")";
        }
    }

    public static class Builder {
        private String className;
        private String cron;
        private String every;
        private Object args;
        private String queue;
        private Collection<String> envs;
        private String description;

        private Builder() {
        }

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder every(String every) {
            this.every = every;
            return this;
        }

        public Builder args(Object args) {
            this.args = args;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder envs(Collection<String> envs) {
            this.envs = envs;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public ScheduleDefinition build() {
            return new ScheduleDefinition(className, cron, every, args, queue, envs, description);
        }
    }
}
