package com.logicsynth.compile;

import com.logicsynth.contract.Diagnostic;
import com.logicsynth.facts.Fact;
import com.logicsynth.facts.FactIngestionService;
import com.logicsynth.facts.FactStore;
import com.logicsynth.facts.FactTypeMismatchException;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Program;
import com.logicsynth.schema.SchemaRegistry;
import com.logicsynth.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a synthesis document against the session schema and, when it verifies, loads it:
 * declarations into the schema registry, rules into the rule index and ground unit
 * clauses into the fact store.
 */
@Service
public class ProgramAcceptService {

    private static final Logger log = LoggerFactory.getLogger(ProgramAcceptService.class);

    private final SynthesisCompiler compiler;
    private final Session session;
    private final FactIngestionService ingestion;
    private final FactStore store;

    public ProgramAcceptService(SynthesisCompiler compiler,
                                Session session,
                                FactIngestionService ingestion,
                                FactStore store) {
        this.compiler = compiler;
        this.session = session;
        this.ingestion = ingestion;
        this.store = store;
    }

    public synchronized CompileResult accept(String raw) {
        CompileResult result = compiler.compile(raw, session.schema());
        if (!result.success()) {
            return result;
        }
        Program program = result.program();
        SchemaRegistry extended;
        try {
            extended = session.schema().withDeclarations(program.decls());
        } catch (IllegalArgumentException ex) {
            log.warn("Verified program conflicts with the session: {}", ex.getMessage());
            return CompileResult.failed(List.of(Diagnostic.schema("program.decls", ex.getMessage())));
        }

        // unit clauses become facts; check them all before anything is loaded
        List<Diagnostic> rejected = new ArrayList<>();
        List<Fact> facts = new ArrayList<>();
        for (int i = 0; i < program.clauses().size(); i++) {
            Clause clause = program.clauses().get(i);
            if (!clause.isUnitFact()) {
                continue;
            }
            Fact fact = Fact.of(clause.head());
            try {
                ingestion.check(fact, extended);
                facts.add(fact);
            } catch (FactTypeMismatchException ex) {
                rejected.add(Diagnostic.schema("program.clauses[" + i + "].head", ex.getMessage()));
            }
        }
        if (!rejected.isEmpty()) {
            return CompileResult.failed(rejected);
        }

        // facts go in as one batch before the rules, so a store rejection leaves the session as it was
        int added;
        try {
            added = store.addAll(facts);
        } catch (FactTypeMismatchException ex) {
            log.warn("Unit facts conflict with the store: {}", ex.getMessage());
            return CompileResult.failed(List.of(Diagnostic.schema("program.clauses", ex.getMessage())));
        }
        session.load(program);
        log.info("Accepted program: {} clause(s), {} new fact(s)", program.clauses().size(), added);
        return result;
    }

    /** Drops every fact, declaration and rule of the session. */
    public synchronized void reset() {
        store.clear();
        session.reset();
    }
}
