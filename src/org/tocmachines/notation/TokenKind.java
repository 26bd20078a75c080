/*
 * @LICENSE@
 */

package org.tocmachines.notation;

/**
 * The input symbol classes fed to the validator automata. The automata never
 * see raw characters.
 */
public enum TokenKind {
    OPERAND,
    OPERATOR,
    LPAREN,
    RPAREN,
    INVALID;
}
