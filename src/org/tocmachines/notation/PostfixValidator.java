/*
 * @LICENSE@
 */

package org.tocmachines.notation;

/**
 * Validates whitespace separated postfix (reverse Polish) expressions,
 * scanning left to right.
 */
public final class PostfixValidator extends OperandCountingValidator {

    public PostfixValidator() {
        super(Notation.POSTFIX, false);
    }
}
