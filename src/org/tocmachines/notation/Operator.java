/*
 * @LICENSE@
 */

package org.tocmachines.notation;

/**
 * The binary arithmetic operators with their precedence; higher binds
 * tighter. All are left associative.
 */
public enum Operator {
    PLUS('+', 1),
    MINUS('-', 1),
    TIMES('*', 2),
    DIVIDE('/', 2);

    private final char symbol;
    private final int precedence;

    Operator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean leftAssociative() {
        return true;
    }

    /**
     * @return the operator for a single character, or <code>null</code>.
     */
    public static Operator forSymbol(char c) {
        for (Operator op : values()) {
            if (op.symbol == c) return op;
        }
        return null;
    }

    public static Operator forSymbol(String s) {
        return s != null && s.length() == 1 ? forSymbol(s.charAt(0)) : null;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
