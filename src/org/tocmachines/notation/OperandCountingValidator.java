/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import static org.tocmachines.pda.Guard.any;
import static org.tocmachines.pda.Guard.of;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.tocmachines.pda.PushdownAutomaton;
import org.tocmachines.pda.StackAction;
import org.tocmachines.pda.StateKind;
import org.tocmachines.pda.StepResult;

/**
 * Validator for the parenthesis free notations. Validity is tracked with a
 * live operand counter: an operand adds one, an operator needs at least two
 * and leaves one result. The automaton mirrors the counter with one
 * <code>X</code> marker per pending operand.
 * <p>
 * Subclasses choose the scan direction.
 */
abstract class OperandCountingValidator extends NotationValidator {

    static final String Q_PROCESSING = "q_processing";

    static final String MARKER = "X";

    private final boolean rightToLeft;

    OperandCountingValidator(Notation notation, boolean rightToLeft) {
        super(notation);
        this.rightToLeft = rightToLeft;
    }

    @Override
    protected void configure(PushdownAutomaton<TokenKind> pda) {
        pda.addState(Q_START, StateKind.INITIAL, "Initial state - expecting first operand");
        pda.addState(Q_PROCESSING, StateKind.NORMAL, "Processing tokens");
        pda.addState(Q_ACCEPT, StateKind.ACCEPTING, "Expression accepted");
        pda.addState(Q_ERROR, StateKind.ERROR, "Invalid expression");

        pda.addTransition(Q_START, Q_PROCESSING, of(TokenKind.OPERAND), any(),
            StackAction.push(MARKER), "Read first operand, push marker");
        pda.addTransition(Q_PROCESSING, Q_PROCESSING, of(TokenKind.OPERAND), any(),
            StackAction.push(MARKER), "Read operand, push marker");
        pda.addTransition(Q_PROCESSING, Q_PROCESSING, of(TokenKind.OPERATOR), of(MARKER),
            StackAction.pop(), "Read operator, two operands become one result");
    }

    @Override
    protected ValidationResult drive(List<Token> tokens) {
        List<Token> scan = tokens;
        if (rightToLeft) {
            scan = new ArrayList<Token>(tokens);
            Collections.reverse(scan);
        }
        String direction = rightToLeft ? " [R->L]" : "";
        List<String> trace = new ArrayList<String>();
        int operands = 0;

        for (Token token : scan) {
            TokenKind kind = token.kind();
            if (kind == TokenKind.LPAREN || kind == TokenKind.RPAREN) {
                return invalid("Parentheses not allowed in " + notation().label() + " notation",
                    trace, Q_ERROR);
            }
            if (kind == TokenKind.OPERATOR && operands < 2) {
                return invalid("Not enough operands for operator '" + token + "'", trace, Q_ERROR);
            }
            String before = pda.currentState().name();
            StepResult r = pda.step(kind);
            if (!r.success()) {
                // the counter guards every operator, so only a broken table gets here
                return invalid(r.message(), trace, Q_ERROR);
            }
            operands += kind == TokenKind.OPERAND ? 1 : -1;
            assert operands == pda.stackSize() : operands + " != " + pda.stackContents();
            trace.add("Token: '" + token + "' (" + kind + ")" + direction
                    + " | State: " + before + " -> " + pda.currentState().name()
                    + " | Operands: " + operands + " | Stack: " + pda.stackContents());
        }

        if (operands == 1) {
            return valid("Valid " + notation().label() + " expression", trace, Q_ACCEPT);
        } else if (operands > 1) {
            return invalid("Too many operands (" + operands + ") - missing operators",
                trace, Q_ERROR);
        } else {
            return invalid("No result - expression is incomplete", trace, Q_ERROR);
        }
    }
}
