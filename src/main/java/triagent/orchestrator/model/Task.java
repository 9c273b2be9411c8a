package triagent.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a unit of work moving through the lifecycle.
 * Ownership ({@code workerId}) is only meaningful while RUNNING.
 */
public final class Task {
    private final String id;
    private final String name;
    private final TaskType type;
    private final Priority priority;
    private final TaskState state;
    private final String shard;
    private final String assignedModel; // capability hint or null
    private final String lane;
    private final String workerId;
    private final String payload;
    private final String result;
    private final String feedback; // JSON from the last rejection
    private final String error;
    private final String traceId;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant heartbeatAt;
    private final Instant completedAt;
    private final int retryCount;
    private final int maxRetries;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.shard = builder.shard;
        this.assignedModel = builder.assignedModel;
        this.lane = builder.lane;
        this.workerId = builder.workerId;
        this.payload = builder.payload;
        this.result = builder.result;
        this.feedback = builder.feedback;
        this.error = builder.error;
        this.traceId = builder.traceId;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.heartbeatAt = builder.heartbeatAt;
        this.completedAt = builder.completedAt;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public TaskType type() {
        return type;
    }

    public Priority priority() {
        return priority;
    }

    public TaskState state() {
        return state;
    }

    public String shard() {
        return shard;
    }

    public String assignedModel() {
        return assignedModel;
    }

    public String lane() {
        return lane;
    }

    public String workerId() {
        return workerId;
    }

    public String payload() {
        return payload;
    }

    public String result() {
        return result;
    }

    public String feedback() {
        return feedback;
    }

    public String error() {
        return error;
    }

    public String traceId() {
        return traceId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant heartbeatAt() {
        return heartbeatAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /** Another attempt is allowed after a rejection or executor failure */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .priority(priority)
                .state(state)
                .shard(shard)
                .assignedModel(assignedModel)
                .lane(lane)
                .workerId(workerId)
                .payload(payload)
                .result(result)
                .feedback(feedback)
                .error(error)
                .traceId(traceId)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .heartbeatAt(heartbeatAt)
                .completedAt(completedAt)
                .retryCount(retryCount)
                .maxRetries(maxRetries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private TaskType type = TaskType.IMPLEMENTATION;
        private Priority priority = Priority.MEDIUM;
        private TaskState state = TaskState.QUEUED;
        private String shard;
        private String assignedModel;
        private String lane;
        private String workerId;
        private String payload;
        private String result;
        private String feedback;
        private String error;
        private String traceId;
        private Instant createdAt;
        private Instant startedAt;
        private Instant heartbeatAt;
        private Instant completedAt;
        private int retryCount = 0;
        private int maxRetries = 3;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder shard(String shard) {
            this.shard = shard;
            return this;
        }

        public Builder assignedModel(String assignedModel) {
            this.assignedModel = assignedModel;
            return this;
        }

        public Builder lane(String lane) {
            this.lane = lane;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder feedback(String feedback) {
            this.feedback = feedback;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder heartbeatAt(Instant heartbeatAt) {
            this.heartbeatAt = heartbeatAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type=" + type + ", state=" + state + ", workerId='" + workerId + "'}";
    }
}
