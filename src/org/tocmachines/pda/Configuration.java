/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import java.util.List;

/**
 * An instantaneous description <code>(q, w, γ)</code> of a
 * {@link PushdownAutomaton}, recorded before each step. Used for traces only.
 */
public final class Configuration {

    private final State state;
    private final String input;
    private final List<String> stack;

    Configuration(State state, String input, List<String> stack) {
        this.state = state;
        this.input = input == null ? "" : input;
        this.stack = stack;
    }

    public State state() {
        return state;
    }

    /**
     * @return the symbol about to be consumed, or the empty string.
     */
    public String input() {
        return input;
    }

    /**
     * @return the stack contents, bottom marker first.
     */
    public List<String> stack() {
        return stack;
    }

    @Override
    public String toString() {
        return "(" + state.name() + ", "
                + (input.length() == 0 ? Misc.EPSILON : input) + ", "
                + Misc.stackString(stack) + ")";
    }
}
