package com.logicsynth.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire shape of a synthesis request. Every field is optional at the binding layer;
 * presence and shape are enforced by {@link ProgramSpecValidator} so that each
 * violation can be reported with its field path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SynthesisDocument(
    @JsonProperty("format") String format,
    @JsonProperty("program") ProgramSpec program
) {

    public static final String FORMAT_V1 = "v1";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProgramSpec(
        @JsonProperty("package") HeaderSpec packageSpec,
        @JsonProperty("use") List<HeaderSpec> use,
        @JsonProperty("decls") List<DeclSpec> decls,
        @JsonProperty("clauses") List<ClauseSpec> clauses
    ) {
        public ProgramSpec {
            use = orEmpty(use);
            decls = orEmpty(decls);
            clauses = orEmpty(clauses);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HeaderSpec(
        @JsonProperty("name") String name,
        @JsonProperty("atoms") List<AtomSpec> atoms
    ) {
        public HeaderSpec {
            atoms = orEmpty(atoms);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeclSpec(
        @JsonProperty("atom") AtomSpec atom,
        @JsonProperty("descr") List<AtomSpec> descr,
        @JsonProperty("bounds") List<BoundSpec> bounds,
        @JsonProperty("inclusion") List<AtomSpec> inclusion
    ) {
        public DeclSpec {
            descr = orEmpty(descr);
            bounds = orEmpty(bounds);
            inclusion = orEmpty(inclusion);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BoundSpec(@JsonProperty("terms") List<ExprSpec> terms) {
        public BoundSpec {
            terms = orEmpty(terms);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClauseSpec(
        @JsonProperty("head") AtomSpec head,
        @JsonProperty("body") List<TermSpec> body,
        @JsonProperty("transform") TransformSpec transform
    ) {
        public ClauseSpec {
            body = orEmpty(body);
        }
    }

    /** Body element: kind is one of atom, not, eq, neq, cmp. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TermSpec(
        @JsonProperty("kind") String kind,
        @JsonProperty("atom") AtomSpec atom,
        @JsonProperty("left") ExprSpec left,
        @JsonProperty("right") ExprSpec right,
        @JsonProperty("op") String op
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AtomSpec(
        @JsonProperty("pred") String pred,
        @JsonProperty("args") List<ExprSpec> args
    ) {
        public AtomSpec {
            args = orEmpty(args);
        }
    }

    /**
     * Expression: kind is one of var, name, string, bytes, number, float, apply, list, map, struct.
     * Numeric literals are kept as text so the validator decides whether they parse.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExprSpec(
        @JsonProperty("kind") String kind,
        @JsonProperty("value") String value,
        @JsonProperty("number") String number,
        @JsonProperty("float") String floatValue,
        @JsonProperty("function") String function,
        @JsonProperty("args") List<ExprSpec> args,
        @JsonProperty("arity") Integer arity
    ) {
        public ExprSpec {
            args = orEmpty(args);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransformSpec(@JsonProperty("statements") List<TransformStmtSpec> statements) {
        public TransformSpec {
            statements = orEmpty(statements);
        }
    }

    /** kind is "do" or "let"; var is required for let. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransformStmtSpec(
        @JsonProperty("kind") String kind,
        @JsonProperty("var") String var,
        @JsonProperty("fn") ExprSpec fn
    ) {}

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
