package com.openforge.ariste.agent.subagent;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Lifecycle record of one subagent run: PENDING → RUNNING → COMPLETED | FAILED.
 *
 * Owned by the thread running the subagent; not shared.
 */
public class SubAgentExecution {

    private final long         id;
    private final SubAgentTask task;

    private SubAgentStatus status = SubAgentStatus.PENDING;
    private Instant        startTime;
    private Instant        endTime;
    private String         result;
    private String         error;

    public SubAgentExecution(long id, SubAgentTask task) {
        this.id   = id;
        this.task = task;
    }

    public void start() {
        status    = SubAgentStatus.RUNNING;
        startTime = Instant.now();
    }

    public void complete(String result) {
        status      = SubAgentStatus.COMPLETED;
        endTime     = Instant.now();
        this.result = result;
    }

    public void fail(String error) {
        status     = SubAgentStatus.FAILED;
        endTime    = Instant.now();
        this.error = error;
    }

    /** Elapsed so far while running, total once ended, empty before start. */
    public Optional<Duration> duration() {
        if (startTime == null) return Optional.empty();
        return Optional.of(Duration.between(startTime, endTime != null ? endTime : Instant.now()));
    }

    public long durationMillis() {
        return duration().map(Duration::toMillis).orElse(0L);
    }

    public long id()                { return id; }
    public SubAgentTask task()      { return task; }
    public SubAgentStatus status()  { return status; }
    public Optional<String> result(){ return Optional.ofNullable(result); }
    public Optional<String> error() { return Optional.ofNullable(error); }
}
