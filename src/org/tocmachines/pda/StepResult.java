/*
 * @LICENSE@
 */

package org.tocmachines.pda;

/**
 * Outcome of a single {@link PushdownAutomaton#step(Object)}.
 */
public final class StepResult {

    static final StepResult OK = new StepResult(true, "");

    private final boolean success;
    private final String message;

    private StepResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    static StepResult failed(String message) {
        assert message != null && message.length() > 0;
        return new StepResult(false, message);
    }

    public boolean success() {
        return success;
    }

    /**
     * @return the failure message; empty on success.
     */
    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return success ? "ok" : "failed: " + message;
    }
}
