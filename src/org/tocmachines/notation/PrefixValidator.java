/*
 * @LICENSE@
 */

package org.tocmachines.notation;

/**
 * Validates whitespace separated prefix (Polish) expressions. The operand
 * counting discipline is the postfix one, applied to the reversed token
 * sequence.
 */
public final class PrefixValidator extends OperandCountingValidator {

    public PrefixValidator() {
        super(Notation.PREFIX, true);
    }
}
