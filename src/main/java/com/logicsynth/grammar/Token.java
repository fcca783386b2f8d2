package com.logicsynth.grammar;

/**
 * A lexeme with its decoded text and the offset where it starts.
 * For strings and bytes {@code text} holds the unescaped content.
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return (type == TokenType.IDENT || type == TokenType.VARIABLE) && keyword.equals(text);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
