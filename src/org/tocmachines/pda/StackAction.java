/*
 * @LICENSE@
 */

package org.tocmachines.pda;

/**
 * The effect a {@link Transition} has on the {@link PDAStack}. Instances are
 * created through the static factories, so a push or replace without a
 * symbol cannot be expressed.
 */
public final class StackAction {

    public enum Kind {
        NONE,
        PUSH,
        POP,
        REPLACE;
    }

    private static final StackAction NONE = new StackAction(Kind.NONE, null);
    private static final StackAction POP = new StackAction(Kind.POP, null);

    private final Kind kind;
    private final String symbol;

    private StackAction(Kind kind, String symbol) {
        this.kind = kind;
        this.symbol = symbol;
    }

    public static StackAction none() {
        return NONE;
    }

    public static StackAction pop() {
        return POP;
    }

    public static StackAction push(String symbol) {
        return new StackAction(Kind.PUSH, checked(symbol));
    }

    public static StackAction replace(String symbol) {
        return new StackAction(Kind.REPLACE, checked(symbol));
    }

    private static String checked(String symbol) {
        if (symbol == null || symbol.length() == 0) {
            throw new IllegalArgumentException("stack symbol must be non-empty");
        }
        return symbol;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the pushed symbol for PUSH and REPLACE, <code>null</code>
     *         otherwise.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Applies this action.
     * 
     * @return false if the action needed to pop an empty stack; the stack is
     *         unchanged in that case.
     */
    boolean apply(PDAStack stack) {
        switch (kind) {
        case NONE:
            return true;
        case PUSH:
            stack.push(symbol);
            return true;
        case POP:
            return stack.pop() != null;
        case REPLACE:
            if (stack.isEmpty()) return false;
            stack.pop();
            stack.push(symbol);
            return true;
        default:
            throw new AssertionError(kind);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof StackAction)) return false;
        StackAction other = (StackAction) obj;
        return kind == other.kind
                && (symbol == null ? other.symbol == null : symbol.equals(other.symbol));
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + (symbol == null ? 0 : symbol.hashCode());
    }

    @Override
    public String toString() {
        switch (kind) {
        case NONE:
            return "none";
        case POP:
            return "pop";
        case PUSH:
            return "push:" + symbol;
        default:
            return "replace:" + symbol;
        }
    }
}
