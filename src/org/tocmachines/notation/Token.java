/*
 * @LICENSE@
 */

package org.tocmachines.notation;

/**
 * A classified piece of an expression.
 */
public final class Token {

    static final Token LPAREN = new Token("(", TokenKind.LPAREN);
    static final Token RPAREN = new Token(")", TokenKind.RPAREN);

    private final String text;
    private final TokenKind kind;

    Token(String text, TokenKind kind) {
        assert text != null && text.length() > 0;
        this.text = text;
        this.kind = kind;
    }

    public String text() {
        return text;
    }

    public TokenKind kind() {
        return kind;
    }

    /**
     * @return the operator for an OPERATOR token, <code>null</code> otherwise.
     */
    public Operator operator() {
        return kind == TokenKind.OPERATOR ? Operator.forSymbol(text) : null;
    }

    /**
     * @return the token with its parenthesis direction swapped; other tokens
     *         are returned unchanged.
     */
    Token mirrored() {
        switch (kind) {
        case LPAREN:
            return RPAREN;
        case RPAREN:
            return LPAREN;
        default:
            return this;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Token)) return false;
        Token other = (Token) obj;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode() * 31 + kind.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
