/*
 * @LICENSE@
 */

package org.tocmachines.notation;

/**
 * The three supported expression orderings.
 */
public enum Notation {
    /** Operators between operands, parentheses allowed: <code>(3+4)*2</code>. */
    INFIX("infix"),
    /** Reverse Polish notation: <code>3 4 + 2 *</code>. */
    POSTFIX("postfix"),
    /** Polish notation: <code>* + 3 4 2</code>. */
    PREFIX("prefix");

    private final String label;

    Notation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the label with its first letter capitalized.
     */
    String title() {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
