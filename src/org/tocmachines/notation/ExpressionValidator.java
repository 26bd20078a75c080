/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.tocmachines.pda.PushdownAutomaton;

/**
 * Validates expressions in any {@link Notation} by delegating to one validator
 * per notation. Not thread safe.
 */
public final class ExpressionValidator {

    private final Map<Notation, NotationValidator> validators =
        new EnumMap<Notation, NotationValidator>(Notation.class);

    public ExpressionValidator() {
        validators.put(Notation.INFIX, new InfixValidator());
        validators.put(Notation.POSTFIX, new PostfixValidator());
        validators.put(Notation.PREFIX, new PrefixValidator());
    }

    public ValidationResult validate(String expression, Notation notation) {
        return validatorFor(notation).validate(expression);
    }

    /**
     * Validates the expression against every notation; useful when the
     * notation is not known.
     */
    public Map<Notation, ValidationResult> validateAll(String expression) {
        Map<Notation, ValidationResult> ret =
            new EnumMap<Notation, ValidationResult>(Notation.class);
        for (Notation n : Notation.values()) {
            ret.put(n, validate(expression, n));
        }
        return Collections.unmodifiableMap(ret);
    }

    public PushdownAutomaton<TokenKind> pdaFor(Notation notation) {
        return validatorFor(notation).pda();
    }

    NotationValidator validatorFor(Notation notation) {
        if (notation == null) {
            throw new IllegalArgumentException("null notation");
        }
        return validators.get(notation);
    }
}
