/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import static org.tocmachines.pda.Misc.LS;

import java.util.Collections;
import java.util.List;

/**
 * Structural export of a {@link PushdownAutomaton} for visualization: states
 * with their flags and transitions with their labels. Carries no behaviour.
 */
public final class PDADiagram {

    public static final class StateInfo {
        public final String name;
        public final StateKind kind;
        public final String description;
        public final boolean initial;
        public final boolean accepting;

        StateInfo(State state, boolean initial) {
            this.name = state.name();
            this.kind = state.kind();
            this.description = state.description();
            this.initial = initial;
            this.accepting = state.kind() == StateKind.ACCEPTING;
        }
    }

    public static final class TransitionInfo {
        public final String from;
        public final String to;
        public final String input;
        public final String stackTop;
        public final String action;
        public final String label;
        public final String description;

        TransitionInfo(Transition<?> t) {
            this.from = t.from().name();
            this.to = t.to().name();
            this.input = labelOf(t.input(), Misc.EPSILON);
            this.stackTop = labelOf(t.stackTop(), "any");
            this.action = t.action().toString();
            this.label = t.label();
            this.description = t.description();
        }

        private static String labelOf(Guard<?> g, String wildcard) {
            return g.isAny() ? wildcard : String.valueOf(g.required());
        }
    }

    private final String name;
    private final List<StateInfo> states;
    private final List<TransitionInfo> transitions;
    private final List<String> inputAlphabet;
    private final List<String> stackAlphabet;

    PDADiagram(String name, List<StateInfo> states, List<TransitionInfo> transitions,
            List<String> inputAlphabet, List<String> stackAlphabet) {
        this.name = name;
        this.states = Collections.unmodifiableList(states);
        this.transitions = Collections.unmodifiableList(transitions);
        this.inputAlphabet = Collections.unmodifiableList(inputAlphabet);
        this.stackAlphabet = Collections.unmodifiableList(stackAlphabet);
    }

    public String name() {
        return name;
    }

    public List<StateInfo> states() {
        return states;
    }

    public List<TransitionInfo> transitions() {
        return transitions;
    }

    public List<String> inputAlphabet() {
        return inputAlphabet;
    }

    public List<String> stackAlphabet() {
        return stackAlphabet;
    }

    /**
     * Renders the diagram in GraphViz dot syntax.
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(name).append("\" {").append(LS);
        sb.append("  rankdir=LR;").append(LS);
        for (StateInfo s : states) {
            sb.append("  \"").append(s.name).append("\" [shape=")
                .append(s.accepting ? "doublecircle" : "circle");
            if (s.kind == StateKind.ERROR) sb.append(",color=red");
            sb.append("];").append(LS);
            if (s.initial) {
                sb.append("  \"_start\" [shape=point];").append(LS);
                sb.append("  \"_start\" -> \"").append(s.name).append("\";").append(LS);
            }
        }
        for (TransitionInfo t : transitions) {
            sb.append("  \"").append(t.from).append("\" -> \"").append(t.to)
                .append("\" [label=\"").append(t.label).append("\"];").append(LS);
        }
        sb.append('}').append(LS);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "PDA '" + name + "': " + states.size() + " states, "
                + transitions.size() + " transitions";
    }
}
