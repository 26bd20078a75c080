/*
 * @LICENSE@
 */

package org.tocmachines.pda;

/**
 * A named state of a {@link PushdownAutomaton}. States are identified by
 * name within their automaton.
 */
public final class State {

    private final String name;
    private final StateKind kind;
    private final String description;

    State(String name, StateKind kind, String description) {
        assert name != null && kind != null;
        this.name = name;
        this.kind = kind;
        this.description = description == null ? "" : description;
    }

    public String name() {
        return name;
    }

    public StateKind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof State && ((State) obj).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
