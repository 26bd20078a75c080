/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of running a whole symbol sequence through a
 * {@link PushdownAutomaton}.
 */
public final class ProcessResult {

    private final boolean accepted;
    private final String message;
    private final State finalState;
    private final List<Configuration> trace;

    ProcessResult(boolean accepted, String message, State finalState, List<Configuration> trace) {
        this.accepted = accepted;
        this.message = message;
        this.finalState = finalState;
        this.trace = Collections.unmodifiableList(trace);
    }

    public boolean accepted() {
        return accepted;
    }

    public String message() {
        return message;
    }

    public State finalState() {
        return finalState;
    }

    /**
     * @return one configuration per attempted step, in order.
     */
    public List<Configuration> trace() {
        return trace;
    }

    @Override
    public String toString() {
        return (accepted ? "accepted" : "rejected") + ": " + message;
    }
}
