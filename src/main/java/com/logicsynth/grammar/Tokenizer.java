package com.logicsynth.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits rule text into tokens. {@code #} starts a comment that runs to the end of the line.
 */
public final class Tokenizer {

    private final String src;
    private int pos;

    private Tokenizer(String src) {
        this.src = src;
    }

    public static List<Token> tokenize(String src) {
        return new Tokenizer(src).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipBlankAndComments();
            if (pos >= src.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipBlankAndComments() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private Token next() {
        int start = pos;
        char c = src.charAt(pos);
        char la = peek(1);

        if (c == 'b' && la == '"') {
            pos++;
            return new Token(TokenType.BYTES, quoted(), start);
        }
        if (c == '"') {
            return new Token(TokenType.STRING, quoted(), start);
        }
        if (c == '/') {
            return new Token(TokenType.NAME, name(), start);
        }
        if (Character.isDigit(c) || (c == '-' && Character.isDigit(la))) {
            return number();
        }
        if (Character.isUpperCase(c) || (c == '_' && !isIdentChar(la))) {
            return new Token(TokenType.VARIABLE, identifier(false), start);
        }
        if (Character.isLowerCase(c) || c == '_' || (c == ':' && Character.isLowerCase(la))) {
            return new Token(TokenType.IDENT, identifier(true), start);
        }

        pos++;
        switch (c) {
            case '(': return new Token(TokenType.LPAREN, "(", start);
            case ')': return new Token(TokenType.RPAREN, ")", start);
            case '[': return new Token(TokenType.LBRACKET, "[", start);
            case ']': return new Token(TokenType.RBRACKET, "]", start);
            case '{': return new Token(TokenType.LBRACE, "{", start);
            case '}': return new Token(TokenType.RBRACE, "}", start);
            case ',': return new Token(TokenType.COMMA, ",", start);
            case '.': return new Token(TokenType.DOT, ".", start);
            case '?': return new Token(TokenType.QUESTION, "?", start);
            case '=': return new Token(TokenType.EQUAL, "=", start);
            case '!':
                if (la == '=') {
                    pos++;
                    return new Token(TokenType.NOT_EQUAL, "!=", start);
                }
                return new Token(TokenType.BANG, "!", start);
            case ':':
                if (la == '-') {
                    pos++;
                    return new Token(TokenType.IMPLIES, ":-", start);
                }
                return new Token(TokenType.COLON, ":", start);
            case '|':
                if (la == '>') {
                    pos++;
                    return new Token(TokenType.PIPE, "|>", start);
                }
                break;
            default:
                break;
        }
        throw new ParseException("unexpected character '" + c + "'", start);
    }

    /** Predicates and functions may contain ':' and dotted segments; variables may not. */
    private String identifier(boolean qualified) {
        int start = pos;
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (isIdentChar(c) || (qualified && c == ':' && isIdentChar(peek(1)))) {
                pos++;
            } else if (qualified && c == '.' && isIdentChar(peek(1))) {
                pos++;
            } else {
                break;
            }
        }
        return src.substring(start, pos);
    }

    private String name() {
        int start = pos;
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (isNameChar(c) && c != '.') {
                pos++;
            } else if (c == '.' && isNameChar(peek(1))) {
                pos++;
            } else {
                break;
            }
        }
        if (pos == start + 1) {
            throw new ParseException("empty name constant", start);
        }
        return src.substring(start, pos);
    }

    private Token number() {
        int start = pos;
        if (src.charAt(pos) == '-') {
            pos++;
        }
        boolean isFloat = false;
        digits();
        if (pos < src.length() && src.charAt(pos) == '.' && Character.isDigit(peek(1))) {
            isFloat = true;
            pos++;
            digits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            isFloat = true;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '-' || src.charAt(pos) == '+')) {
                pos++;
            }
            digits();
        }
        String text = src.substring(start, pos);
        return new Token(isFloat ? TokenType.FLOAT : TokenType.NUMBER, text, start);
    }

    private void digits() {
        while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
            pos++;
        }
    }

    private String quoted() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < src.length()) {
            char c = src.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= src.length()) {
                break;
            }
            char esc = src.charAt(pos++);
            switch (esc) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                default -> throw new ParseException("unknown escape '\\" + esc + "'", pos - 2);
            }
        }
        throw new ParseException("unterminated string literal", start);
    }

    private char peek(int offset) {
        int at = pos + offset;
        return at < src.length() ? src.charAt(at) : '\0';
    }

    private static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '~' || c == '%' || c == '/';
    }
}
