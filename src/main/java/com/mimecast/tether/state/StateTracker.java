package com.mimecast.tether.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Connection progress diagnostics.
 *
 * <p>Records named steps of the connection sequence so a stalled or failing setup can be diagnosed.
 * <br>Keeps the most recent steps only.
 *
 * <p><b>Example:</b>
 * <pre>
 *     Step step = tracker.start("Connect securely");
 *     // ...
 *     step.complete();
 * </pre>
 */
public class StateTracker {
    private static final Logger log = LogManager.getLogger(StateTracker.class);

    /**
     * Default number of steps kept.
     */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<Step> steps = new ArrayDeque<>();

    /**
     * Constructs a new StateTracker instance with default capacity.
     */
    public StateTracker() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Constructs a new StateTracker instance.
     *
     * @param capacity Number of steps kept.
     */
    public StateTracker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Starts a step.
     *
     * @param name Step name.
     * @return Step instance.
     */
    public Step start(String name) {
        Step step = new Step(this, name);
        synchronized (steps) {
            if (steps.size() == capacity) {
                steps.removeFirst();
            }
            steps.addLast(step);
        }
        log.debug("Step started: {}", name);
        return step;
    }

    void onCompleted(Step step) {
        log.debug("Step completed: {} in {}ms", step.getName(), step.getDuration().toMillis());
    }

    void onFailed(Step step) {
        log.info("Step failed: {} reason: {}", step.getName(), step.getReason());
    }

    /**
     * Gets recorded steps, oldest first.
     *
     * @return List of Step.
     */
    public List<Step> getSteps() {
        synchronized (steps) {
            return new ArrayList<>(steps);
        }
    }

    /**
     * Gets most recent failed step.
     *
     * @return Optional of Step.
     */
    public Optional<Step> getLastFailure() {
        List<Step> snapshot = getSteps();
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (snapshot.get(i).getStatus() == Step.Status.FAILED) {
                return Optional.of(snapshot.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Gets a one line per step summary.
     *
     * @return String.
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        for (Step step : getSteps()) {
            sb.append(step).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
