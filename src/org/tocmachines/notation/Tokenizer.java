/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits expression strings into classified {@link Token}s. Operands are
 * maximal runs of decimal digits. Characters outside the alphabet become
 * {@link TokenKind#INVALID} tokens rather than errors; rejecting them is up
 * to the validators.
 */
public final class Tokenizer {

    private Tokenizer() {
    } // never instantiated

    public static List<Token> tokenize(String expression, Notation notation) {
        return notation == Notation.INFIX ? tokenizeInfix(expression) : tokenizeSpaced(expression);
    }

    /**
     * Character scanning tokenizer for infix input; whitespace is optional,
     * <code>12+(3*4)</code> and <code>12 + ( 3 * 4 )</code> are equivalent.
     */
    public static List<Token> tokenizeInfix(String expression) {
        List<Token> tokens = new ArrayList<Token>();
        StringBuilder number = new StringBuilder();
        for (int i = 0; i < expression.length(); ++i) {
            char c = expression.charAt(i);
            if (isDigit(c)) {
                number.append(c);
                continue;
            }
            if (number.length() > 0) {
                tokens.add(new Token(number.toString(), TokenKind.OPERAND));
                number.setLength(0);
            }
            if (Character.isWhitespace(c)) {
                continue;
            }
            tokens.add(classifyChar(c));
        }
        if (number.length() > 0) {
            tokens.add(new Token(number.toString(), TokenKind.OPERAND));
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Whitespace separated tokenizer for postfix and prefix input.
     */
    public static List<Token> tokenizeSpaced(String expression) {
        List<Token> tokens = new ArrayList<Token>();
        for (String word : expression.trim().split("\\s+")) {
            if (word.length() == 0) continue;
            tokens.add(classify(word));
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Classifies one whole word.
     */
    public static Token classify(String word) {
        if (word.length() == 1) {
            char c = word.charAt(0);
            if (!isDigit(c)) return classifyChar(c);
        }
        for (int i = 0; i < word.length(); ++i) {
            if (!isDigit(word.charAt(i))) {
                return new Token(word, TokenKind.INVALID);
            }
        }
        return new Token(word, TokenKind.OPERAND);
    }

    private static Token classifyChar(char c) {
        if (c == '(') return Token.LPAREN;
        if (c == ')') return Token.RPAREN;
        if (Operator.forSymbol(c) != null) return new Token(String.valueOf(c), TokenKind.OPERATOR);
        return new Token(String.valueOf(c), TokenKind.INVALID);
    }

    /*
     * ASCII only; Character.isDigit() would admit other scripts
     */
    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * @return the token texts joined with single spaces.
     */
    public static String join(List<?> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Object t : tokens) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(t);
        }
        return sb.toString();
    }
}
