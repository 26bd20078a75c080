/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts expressions between infix, postfix and prefix notation.
 * <p>
 * Every conversion first validates its source with the matching
 * {@link NotationValidator}, so the algorithms below only ever see well formed
 * token streams:
 * <ul>
 * <li>infix to postfix: Shunting-yard;</li>
 * <li>infix to prefix: reverse the tokens, swap parentheses, Shunting-yard
 * popping on strictly greater precedence only, reverse the output;</li>
 * <li>postfix / prefix to infix: a value stack of fully parenthesized
 * sub-expressions;</li>
 * <li>postfix to prefix and back: through infix.</li>
 * </ul>
 * Not thread safe.
 */
public final class ExpressionConverter {

    private static final Logger logger = Logger.getLogger("org.tocmachines.notation");
    private static final Level level = Level.FINER;

    static final String SAME_NOTATION = "No conversion needed - same notation";

    private final ExpressionValidator validator;

    public ExpressionConverter() {
        this(new ExpressionValidator());
    }

    public ExpressionConverter(ExpressionValidator validator) {
        this.validator = validator;
    }

    public ExpressionValidator validator() {
        return validator;
    }

    public ConversionResult convert(String expression, Notation source, Notation target) {
        if (source == target) {
            return ConversionResult.succeeded(source, target, expression, expression,
                Collections.singletonList(SAME_NOTATION));
        }
        ConversionResult r;
        switch (source) {
        case INFIX:
            r = target == Notation.POSTFIX ? infixToPostfix(expression) : infixToPrefix(expression);
            break;
        case POSTFIX:
            r = target == Notation.INFIX ? postfixToInfix(expression) : postfixToPrefix(expression);
            break;
        case PREFIX:
            r = target == Notation.INFIX ? prefixToInfix(expression) : prefixToPostfix(expression);
            break;
        default:
            throw new AssertionError(source);
        }
        logger.log(level, r.toString());
        return r;
    }

    /**
     * Converts into every notation, the source notation included.
     */
    public Map<Notation, ConversionResult> convertToAll(String expression, Notation source) {
        Map<Notation, ConversionResult> ret =
            new EnumMap<Notation, ConversionResult>(Notation.class);
        for (Notation target : Notation.values()) {
            ret.put(target, convert(expression, source, target));
        }
        return Collections.unmodifiableMap(ret);
    }

    public ConversionResult infixToPostfix(String expression) {
        ValidationResult v = validator.validate(expression, Notation.INFIX);
        if (!v.isValid()) {
            return rejected(v, Notation.POSTFIX, expression);
        }
        List<Token> tokens = Tokenizer.tokenizeInfix(expression);
        List<String> steps = new ArrayList<String>();
        steps.add("Input tokens: " + tokens);

        List<Token> output = new ArrayList<Token>();
        Stack<Token> operators = new Stack<Token>();
        for (Token token : tokens) {
            switch (token.kind()) {
            case OPERAND:
                output.add(token);
                steps.add("Operand '" + token + "' -> Output: " + output + ", Stack: " + operators);
                break;
            case OPERATOR:
                Operator op = token.operator();
                while (!operators.isEmpty() && pops(operators.peek(), op, true)) {
                    output.add(operators.pop());
                }
                operators.push(token);
                steps.add("Operator '" + token + "' -> Output: " + output + ", Stack: " + operators);
                break;
            case LPAREN:
                operators.push(token);
                steps.add("'(' -> Output: " + output + ", Stack: " + operators);
                break;
            case RPAREN:
                popToOpenParen(operators, output);
                steps.add("')' -> Output: " + output + ", Stack: " + operators);
                break;
            default:
                throw new AssertionError(token.kind());
            }
        }
        while (!operators.isEmpty()) {
            output.add(operators.pop());
        }
        String result = Tokenizer.join(output);
        steps.add("Final result: " + result);
        return ConversionResult.succeeded(Notation.INFIX, Notation.POSTFIX, expression, result, steps);
    }

    public ConversionResult infixToPrefix(String expression) {
        ValidationResult v = validator.validate(expression, Notation.INFIX);
        if (!v.isValid()) {
            return rejected(v, Notation.PREFIX, expression);
        }
        List<Token> tokens = Tokenizer.tokenizeInfix(expression);
        List<String> steps = new ArrayList<String>();
        steps.add("Input tokens: " + tokens);

        List<Token> reversed = new ArrayList<Token>(tokens);
        Collections.reverse(reversed);
        steps.add("Reversed: " + reversed);

        List<Token> swapped = new ArrayList<Token>(reversed.size());
        for (Token token : reversed) {
            swapped.add(token.mirrored());
        }
        steps.add("Swapped parentheses: " + swapped);

        List<Token> output = new ArrayList<Token>();
        Stack<Token> operators = new Stack<Token>();
        for (Token token : swapped) {
            switch (token.kind()) {
            case OPERAND:
                output.add(token);
                break;
            case OPERATOR:
                Operator op = token.operator();
                while (!operators.isEmpty() && pops(operators.peek(), op, false)) {
                    output.add(operators.pop());
                }
                operators.push(token);
                break;
            case LPAREN:
                operators.push(token);
                break;
            case RPAREN:
                popToOpenParen(operators, output);
                break;
            default:
                throw new AssertionError(token.kind());
            }
        }
        while (!operators.isEmpty()) {
            output.add(operators.pop());
        }
        steps.add("After Shunting-yard: " + output);

        Collections.reverse(output);
        String result = Tokenizer.join(output);
        steps.add("Final result (reversed): " + result);
        return ConversionResult.succeeded(Notation.INFIX, Notation.PREFIX, expression, result, steps);
    }

    /*
     * Shunting-yard pop condition for an incoming operator. With
     * onEqualLeftAssoc false only strictly higher precedence pops, which is
     * what the reversed scan of infix-to-prefix needs.
     */
    private static boolean pops(Token top, Operator incoming, boolean onEqualLeftAssoc) {
        Operator stacked = top.operator();
        if (stacked == null) {
            return false; // '('
        }
        if (stacked.precedence() > incoming.precedence()) {
            return true;
        }
        return onEqualLeftAssoc
                && stacked.precedence() == incoming.precedence()
                && incoming.leftAssociative();
    }

    private static void popToOpenParen(Stack<Token> operators, List<Token> output) {
        while (!operators.isEmpty() && operators.peek().kind() != TokenKind.LPAREN) {
            output.add(operators.pop());
        }
        assert !operators.isEmpty() : "validated input has balanced parentheses";
        if (!operators.isEmpty()) {
            operators.pop();
        }
    }

    public ConversionResult postfixToInfix(String expression) {
        ValidationResult v = validator.validate(expression, Notation.POSTFIX);
        if (!v.isValid()) {
            return rejected(v, Notation.INFIX, expression);
        }
        List<Token> tokens = Tokenizer.tokenizeSpaced(expression);
        List<String> steps = new ArrayList<String>();
        steps.add("Input tokens: " + tokens);
        return buildInfix(Notation.POSTFIX, expression, tokens, steps);
    }

    public ConversionResult prefixToInfix(String expression) {
        ValidationResult v = validator.validate(expression, Notation.PREFIX);
        if (!v.isValid()) {
            return rejected(v, Notation.INFIX, expression);
        }
        List<Token> tokens = new ArrayList<Token>(Tokenizer.tokenizeSpaced(expression));
        Collections.reverse(tokens);
        List<String> steps = new ArrayList<String>();
        steps.add("Input tokens (reversed): " + tokens);
        return buildInfix(Notation.PREFIX, expression, tokens, steps);
    }

    /*
     * Value stack evaluation shared by postfix and (reversed) prefix input.
     * Postfix pops the right operand first; the reversed prefix scan pops the
     * left operand first.
     */
    private ConversionResult buildInfix(Notation source, String expression,
            List<Token> tokens, List<String> steps) {
        Stack<String> values = new Stack<String>();
        for (Token token : tokens) {
            if (token.kind() == TokenKind.OPERAND) {
                values.push(token.text());
                steps.add("Push operand '" + token + "' -> Stack: " + values);
                continue;
            }
            assert token.kind() == TokenKind.OPERATOR : token;
            if (values.size() < 2) {
                return ConversionResult.failed(source, Notation.INFIX, expression, steps,
                    "Not enough operands for operator '" + token + "'");
            }
            String left, right;
            if (source == Notation.POSTFIX) {
                right = values.pop();
                left = values.pop();
            } else {
                left = values.pop();
                right = values.pop();
            }
            String sub = "(" + left + token + right + ")";
            values.push(sub);
            steps.add("Apply '" + token + "' to " + left + ", " + right
                    + " -> '" + sub + "' -> Stack: " + values);
        }
        if (values.size() != 1) {
            return ConversionResult.failed(source, Notation.INFIX, expression, steps,
                "Invalid expression - stack should have exactly one element, has "
                        + values.size());
        }
        String result = values.peek();
        steps.add("Final result: " + result);
        return ConversionResult.succeeded(source, Notation.INFIX, expression, result, steps);
    }

    public ConversionResult postfixToPrefix(String expression) {
        return viaInfix(expression, Notation.POSTFIX, Notation.PREFIX);
    }

    public ConversionResult prefixToPostfix(String expression) {
        return viaInfix(expression, Notation.PREFIX, Notation.POSTFIX);
    }

    private ConversionResult viaInfix(String expression, Notation source, Notation target) {
        assert source != Notation.INFIX && target != Notation.INFIX;
        ConversionResult first = source == Notation.POSTFIX
                ? postfixToInfix(expression)
                : prefixToInfix(expression);
        List<String> steps = new ArrayList<String>(first.steps());
        if (!first.success()) {
            steps.add("Conversion aborted - infix to " + target.label() + " step not run");
            return ConversionResult.failed(source, target, expression, steps, first.errorMessage());
        }
        ConversionResult second = target == Notation.PREFIX
                ? infixToPrefix(first.resultExpression())
                : infixToPostfix(first.resultExpression());
        steps.add("--- Converting Infix to " + target.title() + " ---");
        steps.addAll(second.steps());
        if (!second.success()) {
            return ConversionResult.failed(source, target, expression, steps, second.errorMessage());
        }
        return ConversionResult.succeeded(source, target, expression,
            second.resultExpression(), steps);
    }

    private static ConversionResult rejected(ValidationResult v, Notation target, String expression) {
        List<String> steps = new ArrayList<String>();
        steps.add("Validation failed: " + v.message());
        steps.addAll(v.trace());
        return ConversionResult.failed(v.notation(), target, expression, steps, v.message());
    }
}
