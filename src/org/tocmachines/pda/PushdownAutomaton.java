/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import static org.tocmachines.pda.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A configurable pushdown automaton driven by discrete input symbol classes.
 * <p>
 * States and transitions are added at configuration time. At run time each
 * call to {@link #step(Object)} selects the <em>first declared</em>
 * transition whose state, input guard and stack top guard all match; a
 * transition with a wildcard input guard therefore acts as an epsilon
 * fallback only when no earlier declared transition applies. Declaration order
 * is part of the contract.
 * <p>
 * Acceptance is decided by {@link #process(List)} purely from the
 * {@linkplain StateKind kind} of the state reached at end of input. Reaching
 * an accepting state earlier has no effect.
 * <p>
 * Instances are not thread safe; each serves one sequential input stream.
 * 
 * @param <I> the input symbol class type, typically an enum
 */
public final class PushdownAutomaton<I> {

    private static final Logger logger = Logger.getLogger("org.tocmachines.pda");
    private static final Level level = Level.FINEST;

    /**
     * Thrown for malformed automaton configurations: unknown or duplicate
     * states, a second initial state.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    private final String name;
    private final Map<String, State> states = new LinkedHashMap<String, State>();
    private final List<Transition<I>> transitions = new ArrayList<Transition<I>>();
    private final Set<I> inputAlphabet = new LinkedHashSet<I>();
    private final Set<String> stackAlphabet = new LinkedHashSet<String>();
    private final PDAStack stack;

    private State initial;
    private State error;
    private State current;

    private final List<Configuration> executionHistory = new ArrayList<Configuration>();
    private final List<Transition<I>> transitionHistory = new ArrayList<Transition<I>>();

    public PushdownAutomaton(String name) {
        this(name, PDAStack.DEFAULT_BOTTOM);
    }

    public PushdownAutomaton(String name, String bottomMarker) {
        this.name = name;
        this.stack = new PDAStack(bottomMarker);
        stackAlphabet.add(bottomMarker);
    }

    public String name() {
        return name;
    }

    /**
     * Adds a state. The single {@link StateKind#INITIAL} state becomes the
     * current state; the first {@link StateKind#ERROR} state becomes the
     * designated error state entered on failed steps.
     */
    public State addState(String name, StateKind kind, String description) {
        if (states.containsKey(name)) {
            throw new ConstructionException("duplicate state: " + name);
        }
        if (kind == StateKind.INITIAL && initial != null) {
            throw new ConstructionException(
                "second initial state " + name + ", already have " + initial);
        }
        State state = new State(name, kind, description);
        states.put(name, state);
        if (kind == StateKind.INITIAL) {
            initial = current = state;
        } else if (kind == StateKind.ERROR && error == null) {
            error = state;
        }
        return state;
    }

    public State addState(String name, StateKind kind) {
        return addState(name, kind, "");
    }

    public Transition<I> addTransition(String from, String to, Guard<I> input,
            Guard<String> stackTop, StackAction action, String description) {
        Transition<I> t = new Transition<I>(
            stateNamed(from), stateNamed(to), input, stackTop, action, description);
        transitions.add(t);
        if (!input.isAny()) {
            inputAlphabet.add(input.required());
        }
        if (!stackTop.isAny()) {
            stackAlphabet.add(stackTop.required());
        }
        if (action.symbol() != null) {
            stackAlphabet.add(action.symbol());
        }
        return t;
    }

    public Transition<I> addTransition(String from, String to, Guard<I> input,
            Guard<String> stackTop, StackAction action) {
        return addTransition(from, to, input, stackTop, action, "");
    }

    private State stateNamed(String name) {
        State state = states.get(name);
        if (state == null) {
            throw new ConstructionException("unknown state: " + name);
        }
        return state;
    }

    /**
     * Returns to the initial state with a bottom-marker-only stack and
     * discards the execution history.
     */
    public void reset() {
        current = initial;
        stack.clear();
        executionHistory.clear();
        transitionHistory.clear();
    }

    /**
     * Consumes one input symbol class.
     * 
     * @return the step outcome; on failure the automaton has moved to the
     *         error state, if one is configured, and must be
     *         {@linkplain #reset() reset} before it is useful again.
     */
    public StepResult step(I symbol) {
        if (initial == null) {
            throw new IllegalStateException("PDA '" + name + "' has no initial state");
        }
        State before = current;
        executionHistory.add(new Configuration(before, String.valueOf(symbol), stack.contents()));

        Transition<I> t = find(symbol);
        if (t == null) {
            enterError();
            return failed("No valid transition for input '" + symbol
                    + "' in state '" + before.name() + "'");
        }
        if (!t.action().apply(stack)) {
            enterError();
            return failed("Stack action '" + t.action() + "' failed in state '"
                    + before.name() + "': stack is empty");
        }
        current = t.to();
        transitionHistory.add(t);
        if (logger.isLoggable(level)) {
            logger.log(level, name + ": " + symbol + ": " + t + " " + stack);
        }
        return StepResult.OK;
    }

    private Transition<I> find(I symbol) {
        String top = stack.peek();
        for (Transition<I> t : transitions) {
            if (t.matches(current, symbol, top)) {
                return t;
            }
        }
        return null;
    }

    private void enterError() {
        if (error != null) {
            current = error;
        }
    }

    private StepResult failed(String message) {
        logger.log(level, name + ": " + message);
        return StepResult.failed(message);
    }

    /**
     * Resets, then steps through every symbol, stopping at the first failed
     * step.
     */
    public ProcessResult process(List<I> symbols) {
        reset();
        for (I symbol : symbols) {
            StepResult r = step(symbol);
            if (!r.success()) {
                return new ProcessResult(false, r.message(), current, executionHistory());
            }
        }
        switch (current.kind()) {
        case ACCEPTING:
            return new ProcessResult(true, "Input accepted", current, executionHistory());
        case ERROR:
            return new ProcessResult(false, "Ended in error state '" + current.name() + "'",
                current, executionHistory());
        default:
            return new ProcessResult(false, "Ended in non-accepting state '" + current.name() + "'",
                current, executionHistory());
        }
    }

    public boolean isAccepting() {
        return current != null && current.kind() == StateKind.ACCEPTING;
    }

    public State currentState() {
        return current;
    }

    public State initialState() {
        return initial;
    }

    /**
     * @return the designated error state, or <code>null</code>.
     */
    public State errorState() {
        return error;
    }

    public State state(String name) {
        return states.get(name);
    }

    public Configuration currentConfiguration() {
        return new Configuration(current, "", stack.contents());
    }

    /**
     * @return the stack contents, bottom marker first.
     */
    public List<String> stackContents() {
        return stack.contents();
    }

    public boolean stackEmpty() {
        return stack.isEmpty();
    }

    public int stackSize() {
        return stack.size();
    }

    /**
     * @return the push / pop operations performed since the last reset.
     */
    public List<String> stackHistory() {
        return stack.history();
    }

    public List<Configuration> executionHistory() {
        return Collections.unmodifiableList(new ArrayList<Configuration>(executionHistory));
    }

    public List<Transition<I>> transitionHistory() {
        return Collections.unmodifiableList(new ArrayList<Transition<I>>(transitionHistory));
    }

    public List<State> states() {
        return Collections.unmodifiableList(new ArrayList<State>(states.values()));
    }

    public List<Transition<I>> transitions() {
        return Collections.unmodifiableList(transitions);
    }

    public Set<I> inputAlphabet() {
        return Collections.unmodifiableSet(inputAlphabet);
    }

    public Set<String> stackAlphabet() {
        return Collections.unmodifiableSet(stackAlphabet);
    }

    public PDADiagram diagram() {
        List<PDADiagram.StateInfo> stateInfos = new ArrayList<PDADiagram.StateInfo>();
        for (State s : states.values()) {
            stateInfos.add(new PDADiagram.StateInfo(s, s.equals(initial)));
        }
        List<PDADiagram.TransitionInfo> transitionInfos = new ArrayList<PDADiagram.TransitionInfo>();
        for (Transition<I> t : transitions) {
            transitionInfos.add(new PDADiagram.TransitionInfo(t));
        }
        List<String> inputs = new ArrayList<String>();
        for (I i : inputAlphabet) {
            inputs.add(String.valueOf(i));
        }
        return new PDADiagram(name, stateInfos, transitionInfos, inputs,
            new ArrayList<String>(stackAlphabet));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PDA '").append(name).append("': ")
            .append(states.size()).append(" states, ")
            .append(transitions.size()).append(" transitions").append(LS);
        for (Transition<I> t : transitions) {
            sb.append("    ").append(t).append(LS);
        }
        return sb.toString();
    }
}
