package triagent.orchestrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model representing a registered worker process.
 */
public final class Worker {
    private final String id;
    private final Long pid;
    private final String host;
    private final Instant processStartedAt;
    private final WorkerStatus status;
    private final String shard;
    private final Set<TaskType> specialization; // empty = accepts every type
    private final String model;
    private final Instant lastHeartbeat;
    private final boolean pauseRequested;
    private final int tasksCompleted;
    private final int tasksFailed;
    private final int crashCount;
    private final Instant registeredAt;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.pid = builder.pid;
        this.host = builder.host;
        this.processStartedAt = builder.processStartedAt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.shard = builder.shard;
        this.specialization = builder.specialization.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.specialization));
        this.model = builder.model;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.pauseRequested = builder.pauseRequested;
        this.tasksCompleted = builder.tasksCompleted;
        this.tasksFailed = builder.tasksFailed;
        this.crashCount = builder.crashCount;
        this.registeredAt = builder.registeredAt;
    }

    public String id() {
        return id;
    }

    public Long pid() {
        return pid;
    }

    /** Host the worker process runs on, as it reported it */
    public String host() {
        return host;
    }

    /** OS start instant of the worker process; with pid and host it identifies the process */
    public Instant processStartedAt() {
        return processStartedAt;
    }

    public WorkerStatus status() {
        return status;
    }

    public String shard() {
        return shard;
    }

    public Set<TaskType> specialization() {
        return specialization;
    }

    public String model() {
        return model;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public boolean pauseRequested() {
        return pauseRequested;
    }

    public int tasksCompleted() {
        return tasksCompleted;
    }

    public int tasksFailed() {
        return tasksFailed;
    }

    public int crashCount() {
        return crashCount;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    /** Worker may still hold or claim tasks */
    public boolean isLive() {
        return !status.isGone() && status != WorkerStatus.STOPPING;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .pid(pid)
                .host(host)
                .processStartedAt(processStartedAt)
                .status(status)
                .shard(shard)
                .specialization(specialization)
                .model(model)
                .lastHeartbeat(lastHeartbeat)
                .pauseRequested(pauseRequested)
                .tasksCompleted(tasksCompleted)
                .tasksFailed(tasksFailed)
                .crashCount(crashCount)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Long pid;
        private String host;
        private Instant processStartedAt;
        private WorkerStatus status = WorkerStatus.STARTING;
        private String shard;
        private Set<TaskType> specialization = EnumSet.noneOf(TaskType.class);
        private String model;
        private Instant lastHeartbeat;
        private boolean pauseRequested;
        private int tasksCompleted;
        private int tasksFailed;
        private int crashCount;
        private Instant registeredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder pid(Long pid) {
            this.pid = pid;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder processStartedAt(Instant processStartedAt) {
            this.processStartedAt = processStartedAt;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder shard(String shard) {
            this.shard = shard;
            return this;
        }

        public Builder specialization(Set<TaskType> specialization) {
            this.specialization = specialization == null ? EnumSet.noneOf(TaskType.class) : specialization;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder pauseRequested(boolean pauseRequested) {
            this.pauseRequested = pauseRequested;
            return this;
        }

        public Builder tasksCompleted(int tasksCompleted) {
            this.tasksCompleted = tasksCompleted;
            return this;
        }

        public Builder tasksFailed(int tasksFailed) {
            this.tasksFailed = tasksFailed;
            return this;
        }

        public Builder crashCount(int crashCount) {
            this.crashCount = crashCount;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", shard='" + shard + "', model='" + model + "'}";
    }
}
