/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outcome of validating one expression: the verdict, a specific
 * message, a step by step trace and the name of the final automaton state.
 */
public final class ValidationResult {

    private final boolean valid;
    private final Notation notation;
    private final String message;
    private final List<String> trace;
    private final String finalState;

    ValidationResult(boolean valid, Notation notation, String message,
            List<String> trace, String finalState) {
        assert message != null && message.length() > 0;
        this.valid = valid;
        this.notation = notation;
        this.message = message;
        this.trace = Collections.unmodifiableList(new ArrayList<String>(trace));
        this.finalState = finalState;
    }

    public boolean isValid() {
        return valid;
    }

    public Notation notation() {
        return notation;
    }

    public String message() {
        return message;
    }

    public List<String> trace() {
        return trace;
    }

    public String finalState() {
        return finalState;
    }

    @Override
    public String toString() {
        return notation.label() + (valid ? " valid: " : " invalid: ") + message;
    }
}
