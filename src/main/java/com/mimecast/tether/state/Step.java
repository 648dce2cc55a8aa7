package com.mimecast.tether.state;

import java.time.Duration;
import java.time.Instant;

/**
 * One named unit of connection progress.
 *
 * <p>Started by {@link StateTracker#start(String)} and finished once, either completed or failed.
 * <br>Later calls to complete or fail are ignored.
 */
public class Step {

    /**
     * Step status.
     */
    public enum Status {
        STARTED,
        COMPLETED,
        FAILED
    }

    private final StateTracker tracker;
    private final String name;
    private final Instant started;
    private volatile Status status = Status.STARTED;
    private volatile String reason;
    private volatile Instant finished;

    /**
     * Constructs a new Step instance.
     *
     * @param tracker StateTracker owning this step.
     * @param name    Step name.
     */
    Step(StateTracker tracker, String name) {
        this.tracker = tracker;
        this.name = name;
        this.started = Instant.now();
    }

    /**
     * Marks step completed.
     */
    public void complete() {
        if (finish(Status.COMPLETED, null)) {
            tracker.onCompleted(this);
        }
    }

    /**
     * Marks step failed.
     *
     * @param reason Failure reason.
     */
    public void fail(String reason) {
        if (finish(Status.FAILED, reason)) {
            tracker.onFailed(this);
        }
    }

    private synchronized boolean finish(Status status, String reason) {
        if (this.status != Status.STARTED) {
            return false;
        }
        this.status = status;
        this.reason = reason;
        this.finished = Instant.now();
        return true;
    }

    public String getName() {
        return name;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Gets failure reason.
     *
     * @return Reason or null.
     */
    public String getReason() {
        return reason;
    }

    public Instant getStarted() {
        return started;
    }

    /**
     * Gets step duration.
     *
     * @return Duration until finished or until now if still running.
     */
    public Duration getDuration() {
        Instant end = finished;
        return Duration.between(started, end != null ? end : Instant.now());
    }

    @Override
    public String toString() {
        return name + " [" + status + (reason != null ? ": " + reason : "") + "]";
    }
}
