/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The LIFO store of a {@link PushdownAutomaton}. The stack always holds a
 * bottom marker which can never be popped; the stack is <em>empty</em> when
 * only the marker remains.
 * <p>
 * Instances are owned by exactly one automaton and are not thread safe.
 */
public final class PDAStack {

    public static final String DEFAULT_BOTTOM = "Z0";

    private final String bottom;
    private final List<String> symbols = new ArrayList<String>();
    private final List<String> history = new ArrayList<String>();

    public PDAStack() {
        this(DEFAULT_BOTTOM);
    }

    public PDAStack(String bottom) {
        if (bottom == null || bottom.length() == 0) {
            throw new IllegalArgumentException("bottom marker must be non-empty");
        }
        this.bottom = bottom;
        symbols.add(bottom);
    }

    public void push(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("null stack symbol");
        }
        symbols.add(symbol);
        history.add("push:" + symbol);
    }

    /**
     * Removes the top symbol.
     * 
     * @return the removed symbol, or <code>null</code> if only the bottom
     *         marker remains; the stack is then left untouched.
     */
    public String pop() {
        if (isEmpty()) {
            return null;
        }
        String symbol = symbols.remove(symbols.size() - 1);
        history.add("pop:" + symbol);
        return symbol;
    }

    /**
     * @return the top symbol, which is the bottom marker on an empty stack.
     */
    public String peek() {
        return symbols.get(symbols.size() - 1);
    }

    public boolean isEmpty() {
        return symbols.size() == 1;
    }

    /**
     * @return the number of symbols above the bottom marker.
     */
    public int size() {
        return symbols.size() - 1;
    }

    public void clear() {
        symbols.clear();
        symbols.add(bottom);
        history.clear();
    }

    public String bottom() {
        return bottom;
    }

    /**
     * @return a snapshot of the stack, bottom marker first.
     */
    public List<String> contents() {
        return Collections.unmodifiableList(new ArrayList<String>(symbols));
    }

    /**
     * @return the operations performed since the last {@link #clear()}, as
     *         <code>push:X</code> / <code>pop:X</code> strings.
     */
    public List<String> history() {
        return Collections.unmodifiableList(new ArrayList<String>(history));
    }

    @Override
    public String toString() {
        return "Stack: " + symbols;
    }
}
