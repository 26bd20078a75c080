/*
 * @LICENSE@
 */

package org.tocmachines.pda;

/**
 * A guarded edge of a {@link PushdownAutomaton}: fires from {@link #from()}
 * when the input symbol class and the stack top satisfy their guards, moving
 * to {@link #to()} and applying the {@link StackAction}.
 * 
 * @param <I> the input symbol class type
 */
public final class Transition<I> {

    private final State from;
    private final State to;
    private final Guard<I> input;
    private final Guard<String> stackTop;
    private final StackAction action;
    private final String description;

    Transition(State from, State to, Guard<I> input, Guard<String> stackTop,
            StackAction action, String description) {
        assert from != null && to != null && input != null && stackTop != null && action != null;
        this.from = from;
        this.to = to;
        this.input = input;
        this.stackTop = stackTop;
        this.action = action;
        this.description = description == null ? "" : description;
    }

    public State from() {
        return from;
    }

    public State to() {
        return to;
    }

    public Guard<I> input() {
        return input;
    }

    public Guard<String> stackTop() {
        return stackTop;
    }

    public StackAction action() {
        return action;
    }

    public String description() {
        return description;
    }

    boolean matches(State state, I symbol, String top) {
        return from.equals(state) && input.matches(symbol) && stackTop.matches(top);
    }

    /**
     * @return the edge label, <code>input, top -> action</code>.
     */
    public String label() {
        return input.label(Misc.EPSILON) + ", " + stackTop.label("any") + " -> " + action;
    }

    @Override
    public String toString() {
        return from + " --[" + label() + "]--> " + to;
    }
}
