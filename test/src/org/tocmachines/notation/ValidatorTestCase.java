/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.Map;

import org.tocmachines.AbstractAutomataTestCase;
import org.tocmachines.pda.StateKind;

public class ValidatorTestCase extends AbstractAutomataTestCase {

    private ExpressionValidator validator;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ValidatorTestCase.class);
    }

    public ValidatorTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        validator = new ExpressionValidator();
    }

    private ValidationResult infix(String expr) {
        return validator.validate(expr, Notation.INFIX);
    }

    private ValidationResult postfix(String expr) {
        return validator.validate(expr, Notation.POSTFIX);
    }

    private ValidationResult prefix(String expr) {
        return validator.validate(expr, Notation.PREFIX);
    }

    private static void assertValid(ValidationResult r) {
        assertTrue(r.toString(), r.isValid());
    }

    private static void assertInvalid(String message, ValidationResult r) {
        assertFalse(r.toString(), r.isValid());
        assertEquals(message, r.message());
    }

    public void testInfixValid() {
        assertValid(infix("(3+4)*2"));
        assertValid(infix("5-3/1"));
        assertValid(infix("((2+3)*4)"));
        assertValid(infix("42"));
        assertValid(infix("12 + 345"));
        ValidationResult r = infix("3+4");
        assertEquals("Valid infix expression", r.message());
        assertEquals(Notation.INFIX, r.notation());
        assertEquals(InfixValidator.Q_EXPECT_OPERATOR, r.finalState());
        assertEquals(3, r.trace().size());
        assertEquals("Token: '3' (OPERAND) | State: q_start -> q_expect_operator | Stack: [Z0]",
            r.trace().get(0));
    }

    public void testInfixUnmatchedOpen() {
        assertInvalid("Unmatched opening parenthesis", infix("(3+4"));
        assertInvalid("Unmatched opening parenthesis", infix("(3+4*2"));
        assertInvalid("Unmatched opening parenthesis", infix("((3)"));
    }

    public void testInfixStructural() {
        ValidationResult r = infix("3+4)");
        assertFalse(r.isValid());
        assertEquals("No valid transition for input 'RPAREN' in state 'q_expect_operator'",
            r.message());
        assertEquals("q_error", r.finalState());

        assertInvalid("No valid transition for input 'OPERATOR' in state 'q_start'", infix("+3"));
        assertInvalid("No valid transition for input 'OPERAND' in state 'q_expect_operator'",
            infix("3 4"));
        assertInvalid("No valid transition for input 'RPAREN' in state 'q_expect_operand'",
            infix("()"));
        assertInvalid("Expression incomplete - ended in state q_expect_operand", infix("3+"));
    }

    public void testEmptyAndInvalidTokens() {
        for (Notation n : Notation.values()) {
            ValidationResult r = validator.validate("   ", n);
            assertInvalid("Empty expression", r);
            assertEquals(1, r.trace().size());
            assertEquals("No tokens to process", r.trace().get(0));
        }
        ValidationResult r = infix("3+x");
        assertInvalid("Invalid token: 'x'", r);
        assertTrue(r.trace().isEmpty());
        assertInvalid("Invalid token: '3a'", postfix("3a 4 +"));
        assertInvalid("Invalid token: '%'", prefix("% 3 4"));
    }

    public void testPostfix() {
        assertValid(postfix("3 4 +"));
        assertValid(postfix("3 4 + 2 *"));
        assertValid(postfix("5 3 1 / -"));
        assertValid(postfix("7"));
        assertEquals("Valid postfix expression", postfix("3 4 +").message());
        assertEquals("q_accept", postfix("3 4 +").finalState());

        assertInvalid("Too many operands (2) - missing operators", postfix("3 4"));
        assertInvalid("Not enough operands for operator '+'", postfix("+"));
        assertInvalid("Not enough operands for operator '*'", postfix("3 * 4"));
        assertInvalid("Parentheses not allowed in postfix notation", postfix("( 3 4 + )"));
    }

    public void testPostfixTrace() {
        ValidationResult r = postfix("3 4 +");
        assertEquals(3, r.trace().size());
        assertEquals("Token: '+' (OPERATOR) | State: q_processing -> q_processing"
                + " | Operands: 1 | Stack: [Z0, X]", r.trace().get(2));
    }

    public void testPrefix() {
        assertValid(prefix("+ 3 4"));
        assertValid(prefix("* + 3 4 2"));
        assertValid(prefix("- 5 / 3 1"));
        assertEquals("Valid prefix expression", prefix("+ 3 4").message());

        assertInvalid("Too many operands (2) - missing operators", prefix("3 4"));
        assertInvalid("Not enough operands for operator '+'", prefix("+ 3"));
        assertInvalid("Not enough operands for operator '*'", prefix("3 4 *"));
        assertInvalid("Parentheses not allowed in prefix notation", prefix("( + 3 4 )"));

        ValidationResult r = prefix("+ 3 4");
        assertTrue(r.trace().get(0), r.trace().get(0).startsWith("Token: '4' (OPERAND) [R->L]"));
    }

    public void testReuse() {
        assertFalse(postfix("3 4").isValid());
        assertValid(postfix("3 4 -"));
        assertFalse(infix("(3").isValid());
        assertValid(infix("3"));
    }

    public void testValidateAll() {
        Map<Notation, ValidationResult> all = validator.validateAll("3");
        assertEquals(3, all.size());
        for (ValidationResult r : all.values()) {
            assertValid(r);
        }
        all = validator.validateAll("3 4 +");
        assertFalse(all.get(Notation.INFIX).isValid());
        assertTrue(all.get(Notation.POSTFIX).isValid());
        assertFalse(all.get(Notation.PREFIX).isValid());
    }

    public void testPdaFor() {
        assertEquals("Infix Validator PDA", validator.pdaFor(Notation.INFIX).name());
        assertEquals(5, validator.pdaFor(Notation.INFIX).states().size());
        assertEquals(6, validator.pdaFor(Notation.INFIX).transitions().size());
        assertEquals(StateKind.ERROR, validator.pdaFor(Notation.POSTFIX).errorState().kind());
        assertEquals(3, validator.pdaFor(Notation.PREFIX).transitions().size());
        try {
            validator.validate("3", null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }
}
