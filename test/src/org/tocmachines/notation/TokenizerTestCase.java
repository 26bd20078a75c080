/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

public class TokenizerTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(TokenizerTestCase.class);
    }

    public TokenizerTestCase(String name) {
        super(name);
    }

    private static String kinds(List<Token> tokens) {
        List<TokenKind> ret = new ArrayList<TokenKind>();
        for (Token t : tokens) ret.add(t.kind());
        return ret.toString();
    }

    public void testInfixScanning() {
        List<Token> tokens = Tokenizer.tokenizeInfix("12+(3*45)");
        assertEquals("[12, +, (, 3, *, 45, )]", tokens.toString());
        assertEquals("[OPERAND, OPERATOR, LPAREN, OPERAND, OPERATOR, OPERAND, RPAREN]", kinds(tokens));
        assertEquals(tokens, Tokenizer.tokenizeInfix(" 12 + ( 3 * 45 ) "));
    }

    public void testInfixInvalid() {
        List<Token> tokens = Tokenizer.tokenizeInfix("3+a");
        assertEquals(TokenKind.INVALID, tokens.get(2).kind());
        assertEquals("a", tokens.get(2).text());
        assertEquals(TokenKind.INVALID, Tokenizer.tokenizeInfix("2^3").get(1).kind());
    }

    public void testSpaced() {
        List<Token> tokens = Tokenizer.tokenizeSpaced("  3   4 +\t20 * ");
        assertEquals("[3, 4, +, 20, *]", tokens.toString());
        assertEquals("[OPERAND, OPERAND, OPERATOR, OPERAND, OPERATOR]", kinds(tokens));
        assertTrue(Tokenizer.tokenizeSpaced("   ").isEmpty());
    }

    public void testSpacedClassification() {
        assertEquals(TokenKind.LPAREN, Tokenizer.classify("(").kind());
        assertEquals(TokenKind.RPAREN, Tokenizer.classify(")").kind());
        assertEquals(TokenKind.INVALID, Tokenizer.classify("3+").kind());
        assertEquals(TokenKind.INVALID, Tokenizer.classify("x").kind());
        assertEquals(TokenKind.OPERAND, Tokenizer.classify("007").kind());
    }

    public void testNonAsciiDigitsAreInvalid() {
        // Arabic-Indic three
        assertEquals(TokenKind.INVALID, Tokenizer.classify("٣").kind());
    }

    public void testOperators() {
        assertEquals(Operator.TIMES, Operator.forSymbol('*'));
        assertEquals(Operator.MINUS, Operator.forSymbol("-"));
        assertNull(Operator.forSymbol('%'));
        assertTrue(Operator.TIMES.precedence() > Operator.PLUS.precedence());
        assertEquals(Operator.DIVIDE.precedence(), Operator.TIMES.precedence());
        for (Operator op : Operator.values()) {
            assertTrue(op.leftAssociative());
        }
        assertEquals(Operator.PLUS, Tokenizer.classify("+").operator());
        assertNull(Tokenizer.classify("3").operator());
    }

    public void testJoin() {
        assertEquals("3 4 +", Tokenizer.join(Tokenizer.tokenizeInfix("3 4+")));
        assertEquals("", Tokenizer.join(new ArrayList<Token>()));
    }
}
