package com.logicsynth.contract;

import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Declaration;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Program;
import com.logicsynth.ir.Safety;
import com.logicsynth.schema.SchemaRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Clause-level invariants checked on the bound IR: declaration uniqueness, arity agreement,
 * range restriction (safety), transform rebinding and, optionally, schema drift.
 */
@Component
public class SemanticChecker {

    public List<Diagnostic> check(Program program, CompileOptions options, SchemaRegistry schema) {
        List<Diagnostic> out = new ArrayList<>();
        Map<String, Integer> arities = new HashMap<>();
        Set<String> declared = new HashSet<>();

        for (int i = 0; i < program.decls().size(); i++) {
            Declaration decl = program.decls().get(i);
            String path = "program.decls[" + i + "].atom.pred";
            if (decl.predicate().startsWith(":")) {
                out.add(Diagnostic.schema(path, "built-in predicate " + decl.predicate() + " cannot be declared"));
            }
            if (!declared.add(decl.predicate())) {
                out.add(Diagnostic.schema(path, "predicate " + decl.predicate() + " is declared more than once"));
                continue;
            }
            Optional<Declaration> existing = schema.find(decl.predicate());
            if (existing.isPresent() && !existing.get().equals(decl)) {
                out.add(Diagnostic.schema(path, "predicate " + decl.predicate()
                    + " conflicts with the session declaration of arity " + existing.get().arity()));
            }
            arities.put(decl.predicate(), decl.arity());
        }

        Set<String> defined = new HashSet<>();
        program.clauses().forEach(c -> defined.add(c.head().predicate()));

        for (int i = 0; i < program.clauses().size(); i++) {
            Clause clause = program.clauses().get(i);
            String path = "program.clauses[" + i + "]";

            if (clause.head().predicate().startsWith(":")) {
                out.add(Diagnostic.schema(path + ".head.pred",
                    "built-in predicate " + clause.head().predicate() + " cannot be defined"));
            }
            checkArity(clause.head(), path + ".head", arities, schema, out);

            for (int k = 0; k < clause.body().size(); k++) {
                Premise premise = clause.body().get(k);
                Atom atom = premise instanceof Premise.Positive p ? p.atom()
                    : premise instanceof Premise.Negated n ? n.atom() : null;
                if (atom == null) {
                    continue;
                }
                String atomPath = path + ".body[" + k + "].atom";
                if (atom.predicate().startsWith(":")) {
                    out.add(Diagnostic.schema(atomPath + ".pred",
                        "unknown or non-negatable built-in predicate " + atom.predicate()));
                    continue;
                }
                checkArity(atom, atomPath, arities, schema, out);
                if (options.strictSchema() && !schema.isEmpty()
                        && !schema.isDeclared(atom.predicate())
                        && !declared.contains(atom.predicate())
                        && !defined.contains(atom.predicate())) {
                    out.add(Diagnostic.schema(atomPath + ".pred", "predicate " + atom.predicate()
                        + " is not declared in the schema and not defined by this program"));
                }
            }

            for (Safety.Violation violation : Safety.check(clause)) {
                out.add(Diagnostic.schema(path + "." + violation.location(), violation.message()));
            }
        }
        return out;
    }

    private void checkArity(Atom atom, String path, Map<String, Integer> arities,
                            SchemaRegistry schema, List<Diagnostic> out) {
        Integer expected = arities.get(atom.predicate());
        if (expected == null) {
            expected = schema.arity(atom.predicate()).orElse(null);
        }
        if (expected == null) {
            arities.put(atom.predicate(), atom.arity());
            return;
        }
        if (expected != atom.arity()) {
            out.add(Diagnostic.schema(path + ".args", "predicate " + atom.predicate() + " expects "
                + expected + " args, got " + atom.arity()));
        }
    }
}
