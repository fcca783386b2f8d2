package com.logicsynth.query;

import com.logicsynth.eval.GoalSolver;
import com.logicsynth.eval.QueryContext;
import com.logicsynth.facts.Fact;
import com.logicsynth.facts.FactStore;
import com.logicsynth.grammar.ParseException;
import com.logicsynth.grammar.ProgramParser;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Term;
import com.logicsynth.render.ProgramRenderer;
import com.logicsynth.session.Session;
import com.logicsynth.trace.DerivationTrace;
import com.logicsynth.trace.DerivationTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of the session: goal queries and derivation traces over a snapshot of the store.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final FactStore store;
    private final Session session;
    private final DerivationTracer tracer;
    private final Duration defaultTimeout;
    private final ProgramRenderer renderer = new ProgramRenderer();

    public QueryService(FactStore store,
                        Session session,
                        DerivationTracer tracer,
                        @Value("${logicsynth.query.timeout:30s}") Duration defaultTimeout) {
        this.store = store;
        this.session = session;
        this.tracer = tracer;
        this.defaultTimeout = defaultTimeout;
    }

    public QueryResult query(String query) {
        return query(query, defaultTimeout);
    }

    public QueryResult query(String query, Duration timeout) {
        Atom goal = parse(query);
        QueryContext context = QueryContext.withTimeout(effective(timeout));
        GoalSolver solver = new GoalSolver(store.snapshot(), session.rules(), context);

        Set<Map<String, Term>> distinct = new LinkedHashSet<>();
        for (Fact fact : solver.facts(goal)) {
            Map<String, Term> row = new LinkedHashMap<>();
            for (int i = 0; i < goal.arity(); i++) {
                if (goal.args().get(i) instanceof Term.Variable v && !v.isWildcard()) {
                    row.putIfAbsent(v.name(), fact.args().get(i));
                }
            }
            distinct.add(row);
        }

        List<Map<String, String>> rendered = new ArrayList<>();
        for (Map<String, Term> row : distinct) {
            Map<String, String> text = new LinkedHashMap<>();
            row.forEach((k, v) -> text.put(k, renderer.term(v)));
            rendered.add(text);
        }
        log.debug("Query {} returned {} binding(s)", query, rendered.size());
        return new QueryResult(renderer.atom(goal), rendered, new ArrayList<>(distinct));
    }

    public DerivationTrace trace(String query) {
        return trace(query, defaultTimeout);
    }

    public DerivationTrace trace(String query, Duration timeout) {
        Atom goal = parse(query);
        QueryContext context = QueryContext.withTimeout(effective(timeout));
        return tracer.trace(goal, context, store.snapshot(), session.rules());
    }

    private Duration effective(Duration timeout) {
        return Optional.ofNullable(timeout).filter(t -> !t.isNegative() && !t.isZero()).orElse(defaultTimeout);
    }

    static Atom parse(String query) {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException(String.valueOf(query), "query is empty");
        }
        try {
            return ProgramParser.parseQuery(query);
        } catch (ParseException ex) {
            throw new QuerySyntaxException(query, ex.getMessage());
        }
    }
}
