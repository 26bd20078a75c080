/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tocmachines.pda.PushdownAutomaton;

/**
 * Base class of the per-notation validators: a fixed {@link PushdownAutomaton}
 * configuration plus a notation specific driver feeding it token kinds.
 * <p>
 * Validators keep their automaton between calls and are therefore not thread
 * safe; construct one per thread.
 */
public abstract class NotationValidator {

    protected static final Logger logger = Logger.getLogger("org.tocmachines.notation");
    protected static final Level level = Level.FINER;

    static final String Q_START = "q_start";
    static final String Q_ACCEPT = "q_accept";
    static final String Q_ERROR = "q_error";

    static final String EMPTY_EXPRESSION = "Empty expression";

    protected final PushdownAutomaton<TokenKind> pda;
    private final Notation notation;

    protected NotationValidator(Notation notation) {
        this.notation = notation;
        this.pda = new PushdownAutomaton<TokenKind>(notation.title() + " Validator PDA");
        configure(pda);
    }

    /**
     * Declares the states and transitions of the automaton; called once from
     * the constructor.
     */
    protected abstract void configure(PushdownAutomaton<TokenKind> pda);

    /**
     * Runs the tokens, which are non-empty and free of invalid tokens, through
     * the automaton.
     */
    protected abstract ValidationResult drive(List<Token> tokens);

    public final ValidationResult validate(String expression) {
        pda.reset();
        List<Token> tokens = Tokenizer.tokenize(expression, notation);
        ValidationResult result;
        if (tokens.isEmpty()) {
            result = invalid(EMPTY_EXPRESSION,
                Collections.singletonList("No tokens to process"), Q_ERROR);
        } else {
            Token bad = firstInvalid(tokens);
            result = bad != null
                    ? invalid("Invalid token: '" + bad.text() + "'",
                        Collections.<String>emptyList(), Q_ERROR)
                    : drive(tokens);
        }
        logger.log(level, notation.label() + " '" + expression + "': " + result.message());
        return result;
    }

    private static Token firstInvalid(List<Token> tokens) {
        for (Token t : tokens) {
            if (t.kind() == TokenKind.INVALID) return t;
        }
        return null;
    }

    public final Notation notation() {
        return notation;
    }

    /**
     * @return the underlying automaton, for diagram export and inspection.
     */
    public final PushdownAutomaton<TokenKind> pda() {
        return pda;
    }

    protected final ValidationResult valid(String message, List<String> trace, String finalState) {
        return new ValidationResult(true, notation, message, trace, finalState);
    }

    protected final ValidationResult invalid(String message, List<String> trace, String finalState) {
        return new ValidationResult(false, notation, message, trace, finalState);
    }
}
