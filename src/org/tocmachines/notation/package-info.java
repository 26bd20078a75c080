/*
 * @LICENSE@
 */

/**
 * Validation and conversion of arithmetic expressions in infix, postfix and
 * prefix notation.
 * <p>
 * Each notation has a validator backed by a
 * {@link org.tocmachines.pda.PushdownAutomaton} over
 * {@link org.tocmachines.notation.TokenKind}s. The
 * {@link org.tocmachines.notation.ExpressionConverter} validates its input
 * first and then applies Shunting-yard (to postfix and prefix) or a value stack
 * (to infix). Postfix and prefix are converted into each other through infix.
 * <p>
 * Operands are unsigned decimal integers. The operators are <code>+ - * /</code>,
 * all left associative, with <code>* /</code> binding tighter.
 */
package org.tocmachines.notation;
