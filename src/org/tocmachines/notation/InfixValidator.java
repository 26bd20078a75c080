/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import static org.tocmachines.pda.Guard.any;
import static org.tocmachines.pda.Guard.of;

import java.util.ArrayList;
import java.util.List;

import org.tocmachines.pda.PushdownAutomaton;
import org.tocmachines.pda.StackAction;
import org.tocmachines.pda.StateKind;
import org.tocmachines.pda.StepResult;

/**
 * Validates infix expressions. The automaton alternates between expecting an
 * operand and expecting an operator; the stack matches parentheses.
 * <p>
 * An expression is valid when input ends in <code>q_expect_operator</code>
 * with an empty stack.
 */
public final class InfixValidator extends NotationValidator {

    static final String Q_EXPECT_OPERAND = "q_expect_operand";
    static final String Q_EXPECT_OPERATOR = "q_expect_operator";

    private static final String PAREN = "(";

    public InfixValidator() {
        super(Notation.INFIX);
    }

    @Override
    protected void configure(PushdownAutomaton<TokenKind> pda) {
        pda.addState(Q_START, StateKind.INITIAL, "Initial state - expecting operand or '('");
        pda.addState(Q_EXPECT_OPERAND, StateKind.NORMAL, "Expecting an operand or '('");
        pda.addState(Q_EXPECT_OPERATOR, StateKind.NORMAL, "Expecting an operator, ')' or end");
        pda.addState(Q_ACCEPT, StateKind.ACCEPTING, "Expression accepted");
        pda.addState(Q_ERROR, StateKind.ERROR, "Invalid expression");

        pda.addTransition(Q_START, Q_EXPECT_OPERATOR, of(TokenKind.OPERAND), any(),
            StackAction.none(), "Read operand, expect operator next");
        pda.addTransition(Q_START, Q_EXPECT_OPERAND, of(TokenKind.LPAREN), any(),
            StackAction.push(PAREN), "Read '(', push it, expect operand");

        pda.addTransition(Q_EXPECT_OPERAND, Q_EXPECT_OPERATOR, of(TokenKind.OPERAND), any(),
            StackAction.none(), "Read operand, expect operator next");
        pda.addTransition(Q_EXPECT_OPERAND, Q_EXPECT_OPERAND, of(TokenKind.LPAREN), any(),
            StackAction.push(PAREN), "Read '(', push it, still expect operand");

        pda.addTransition(Q_EXPECT_OPERATOR, Q_EXPECT_OPERAND, of(TokenKind.OPERATOR), any(),
            StackAction.none(), "Read operator, expect operand next");
        pda.addTransition(Q_EXPECT_OPERATOR, Q_EXPECT_OPERATOR, of(TokenKind.RPAREN), of(PAREN),
            StackAction.pop(), "Read ')', pop the matching '('");
    }

    @Override
    protected ValidationResult drive(List<Token> tokens) {
        List<String> trace = new ArrayList<String>();
        for (Token token : tokens) {
            String before = pda.currentState().name();
            StepResult r = pda.step(token.kind());
            trace.add("Token: '" + token + "' (" + token.kind() + ") | State: "
                    + before + " -> " + pda.currentState().name()
                    + " | Stack: " + pda.stackContents());
            if (!r.success()) {
                return invalid(r.message(), trace, pda.currentState().name());
            }
        }
        String last = pda.currentState().name();
        if (!pda.stackEmpty()) {
            return invalid("Unmatched opening parenthesis", trace, last);
        }
        if (last.equals(Q_EXPECT_OPERATOR)) {
            return valid("Valid infix expression", trace, last);
        }
        return invalid("Expression incomplete - ended in state " + last, trace, last);
    }
}
