package com.logicsynth.grammar;

import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Bound;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.ComparisonOp;
import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Declaration;
import com.logicsynth.ir.Header;
import com.logicsynth.ir.Lexicon;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.Transform;
import com.logicsynth.ir.TransformStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for rule text. This is the authority on what the rule language
 * accepts; everything the renderer writes must read back through here.
 *
 * <pre>
 * program   := (header | decl | clause)*
 * header    := ("Package" | "Use") ident atomList? "!"
 * decl      := "Decl" atom ("descr" atomList | "bound" termList | "inclusion" atomList)* "."
 * clause    := atom (":-" premise ("," premise)*)? ("|>" stmt ("," stmt)*)? "."
 * premise   := "!" atom | atom | term ("=" | "!=") term
 * stmt      := "do" apply | "let" VAR "=" apply
 * query     := "?"? atom "."?
 * </pre>
 */
public final class ProgramParser {

    private final List<Token> tokens;
    private int pos;

    private ProgramParser(String src) {
        this.tokens = Tokenizer.tokenize(src);
    }

    public static Program parseProgram(String src) {
        return new ProgramParser(src).program();
    }

    /** Parses a single goal such as {@code ?p(X, /a).} */
    public static Atom parseQuery(String src) {
        ProgramParser parser = new ProgramParser(src);
        parser.accept(TokenType.QUESTION);
        Atom goal = parser.atom();
        parser.accept(TokenType.DOT);
        parser.expect(TokenType.EOF, "end of query");
        return goal;
    }

    private Program program() {
        Header pkg = null;
        List<Header> uses = new ArrayList<>();
        List<Declaration> decls = new ArrayList<>();
        List<Clause> clauses = new ArrayList<>();

        while (!peek().is(TokenType.EOF)) {
            Token t = peek();
            if (t.isKeyword("Package")) {
                if (pkg != null) {
                    throw error("duplicate Package header", t);
                }
                pkg = header();
            } else if (t.isKeyword("Use")) {
                uses.add(header());
            } else if (t.isKeyword("Decl")) {
                decls.add(decl());
            } else {
                clauses.add(clause());
            }
        }
        return new Program(pkg, uses, decls, clauses);
    }

    private Header header() {
        advance();
        String name = expect(TokenType.IDENT, "header name").text();
        List<Atom> atoms = peek().is(TokenType.LBRACKET) ? atomList() : List.of();
        expect(TokenType.BANG, "'!' after header");
        return new Header(name, atoms);
    }

    private Declaration decl() {
        advance();
        Atom atom = atom();
        List<Atom> descr = new ArrayList<>();
        List<Bound> bounds = new ArrayList<>();
        List<Atom> inclusion = new ArrayList<>();
        while (!peek().is(TokenType.DOT)) {
            Token t = peek();
            if (t.isKeyword("descr")) {
                advance();
                descr.addAll(atomList());
            } else if (t.isKeyword("bound")) {
                advance();
                bounds.add(new Bound(termList()));
            } else if (t.isKeyword("inclusion")) {
                advance();
                inclusion.addAll(atomList());
            } else {
                throw error("expected descr, bound, inclusion or '.'", t);
            }
        }
        advance();
        return new Declaration(atom, descr, bounds, inclusion);
    }

    private Clause clause() {
        Atom head = atom();
        List<Premise> body = new ArrayList<>();
        Transform transform = null;
        if (accept(TokenType.IMPLIES)) {
            do {
                body.add(premise());
            } while (accept(TokenType.COMMA));
        }
        if (accept(TokenType.PIPE)) {
            List<TransformStatement> statements = new ArrayList<>();
            do {
                statements.add(statement());
            } while (accept(TokenType.COMMA));
            transform = new Transform(statements);
        }
        expect(TokenType.DOT, "'.' at end of clause");
        return new Clause(head, body, transform);
    }

    private Premise premise() {
        if (accept(TokenType.BANG)) {
            return new Premise.Negated(atom());
        }
        Token t = peek();
        if (t.is(TokenType.IDENT) && !t.text().startsWith(Lexicon.FUNCTION_PREFIX)
                && peekAt(1).is(TokenType.LPAREN)) {
            Atom atom = atom();
            Optional<ComparisonOp> op = ComparisonOp.fromBuiltin(atom.predicate());
            if (op.isPresent() && atom.arity() == 2) {
                return new Premise.Comparison(op.get(), atom.args().get(0), atom.args().get(1));
            }
            return new Premise.Positive(atom);
        }
        Term left = term();
        if (accept(TokenType.EQUAL)) {
            return new Premise.Equality(left, term());
        }
        if (accept(TokenType.NOT_EQUAL)) {
            return new Premise.Inequality(left, term());
        }
        throw error("expected '=' or '!=' after term", peek());
    }

    private TransformStatement statement() {
        Token t = peek();
        if (t.isKeyword("do")) {
            advance();
            return TransformStatement.doing(apply());
        }
        if (t.isKeyword("let")) {
            advance();
            String variable = expect(TokenType.VARIABLE, "variable after let").text();
            expect(TokenType.EQUAL, "'=' in let");
            return TransformStatement.let(variable, apply());
        }
        throw error("expected do or let", t);
    }

    private Term.Apply apply() {
        Token t = expect(TokenType.IDENT, "function application");
        if (!t.text().startsWith(Lexicon.FUNCTION_PREFIX)) {
            throw error("expected a function application", t);
        }
        return call(t);
    }

    private Term.Apply call(Token function) {
        expect(TokenType.LPAREN, "'(' after function");
        return new Term.Apply(function.text(), arguments(TokenType.RPAREN), null);
    }

    private Atom atom() {
        Token name = expect(TokenType.IDENT, "predicate");
        if (name.text().startsWith(Lexicon.FUNCTION_PREFIX)) {
            throw error("function " + name.text() + " used as a predicate", name);
        }
        expect(TokenType.LPAREN, "'(' after predicate");
        List<Term> args = arguments(TokenType.RPAREN);
        return new Atom(name.text(), args);
    }

    private List<Atom> atomList() {
        expect(TokenType.LBRACKET, "'['");
        List<Atom> atoms = new ArrayList<>();
        if (!accept(TokenType.RBRACKET)) {
            do {
                atoms.add(atom());
            } while (accept(TokenType.COMMA));
            expect(TokenType.RBRACKET, "']'");
        }
        return atoms;
    }

    private List<Term> termList() {
        expect(TokenType.LBRACKET, "'['");
        return arguments(TokenType.RBRACKET);
    }

    /** Comma-separated terms up to and including {@code close}. */
    private List<Term> arguments(TokenType close) {
        List<Term> args = new ArrayList<>();
        if (accept(close)) {
            return args;
        }
        do {
            args.add(term());
        } while (accept(TokenType.COMMA));
        expect(close, "'" + closeText(close) + "'");
        return args;
    }

    private Term term() {
        Token t = advance();
        switch (t.type()) {
            case VARIABLE:
                return new Term.Variable(t.text());
            case NAME:
                return new Term.Name(t.text());
            case STRING:
                return new Term.Text(t.text());
            case BYTES:
                return new Term.Bytes(t.text());
            case NUMBER:
                try {
                    return new Term.Number(Long.parseLong(t.text()));
                } catch (NumberFormatException ex) {
                    throw error("integer out of range", t);
                }
            case FLOAT:
                return new Term.Float64(Double.parseDouble(t.text()));
            case IDENT:
                if (!t.text().startsWith(Lexicon.FUNCTION_PREFIX)) {
                    throw error("expected a term", t);
                }
                Term.Apply call = call(t);
                Optional<CompositeKind> literal = CompositeKind.fromFunction(call.function());
                if (literal.isPresent()) {
                    return new Term.Composite(literal.get(), call.args());
                }
                return call;
            case LBRACKET:
                return bracket();
            case LBRACE:
                return new Term.Composite(CompositeKind.STRUCT, pairs(TokenType.RBRACE));
            default:
                throw error("expected a term", t);
        }
    }

    /** {@code [a, b]} is a list, {@code [k: v, ...]} a map. */
    private Term bracket() {
        if (accept(TokenType.RBRACKET)) {
            return new Term.Composite(CompositeKind.LIST, List.of());
        }
        Term first = term();
        if (!peek().is(TokenType.COLON)) {
            List<Term> items = new ArrayList<>();
            items.add(first);
            while (accept(TokenType.COMMA)) {
                items.add(term());
            }
            expect(TokenType.RBRACKET, "']'");
            return new Term.Composite(CompositeKind.LIST, items);
        }
        List<Term> args = new ArrayList<>();
        args.add(first);
        advance();
        args.add(term());
        while (accept(TokenType.COMMA)) {
            args.add(term());
            expect(TokenType.COLON, "':' in map entry");
            args.add(term());
        }
        expect(TokenType.RBRACKET, "']'");
        return new Term.Composite(CompositeKind.MAP, args);
    }

    private List<Term> pairs(TokenType close) {
        List<Term> args = new ArrayList<>();
        if (accept(close)) {
            return args;
        }
        do {
            args.add(term());
            expect(TokenType.COLON, "':' in entry");
            args.add(term());
        } while (accept(TokenType.COMMA));
        expect(close, "'" + closeText(close) + "'");
        return args;
    }

    private static String closeText(TokenType close) {
        return switch (close) {
            case RPAREN -> ")";
            case RBRACKET -> "]";
            case RBRACE -> "}";
            default -> close.name();
        };
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (!t.is(TokenType.EOF)) {
            pos++;
        }
        return t;
    }

    private boolean accept(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        Token t = peek();
        if (!t.is(type)) {
            throw error("expected " + what + ", found " + t, t);
        }
        return advance();
    }

    private static ParseException error(String message, Token at) {
        return new ParseException(message, at.position());
    }
}
