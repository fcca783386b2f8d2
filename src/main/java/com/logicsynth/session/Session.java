package com.logicsynth.session;

import com.logicsynth.eval.RuleIndex;
import com.logicsynth.ir.Program;
import com.logicsynth.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Declarations and rules accepted so far. Both are immutable values; loading a program
 * swaps in extended copies, so readers always see a consistent pair.
 */
@Component
public class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private record State(SchemaRegistry schema, RuleIndex rules) {}

    private volatile State state = new State(SchemaRegistry.empty(), RuleIndex.empty());

    public SchemaRegistry schema() {
        return state.schema();
    }

    public RuleIndex rules() {
        return state.rules();
    }

    /**
     * @throws IllegalArgumentException when a declaration conflicts with one already loaded;
     *                                  the session is then unchanged
     */
    public synchronized void load(Program program) {
        State current = state;
        SchemaRegistry schema = current.schema().withDeclarations(program.decls());
        RuleIndex rules = current.rules().with(program.clauses());
        state = new State(schema, rules);
        log.info("Loaded {} declaration(s) and {} clause(s); session has {} predicate(s) declared, {} rule(s)",
            program.decls().size(), program.clauses().size(), schema.predicates().size(), rules.size());
    }

    public synchronized void reset() {
        state = new State(SchemaRegistry.empty(), RuleIndex.empty());
        log.info("Session reset");
    }
}
