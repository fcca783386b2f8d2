package com.logicsynth.trace;

import com.logicsynth.eval.GoalSolver;
import com.logicsynth.eval.QueryContext;
import com.logicsynth.eval.RuleIndex;
import com.logicsynth.facts.Fact;
import com.logicsynth.facts.FactSnapshot;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Clause;
import com.logicsynth.render.ProgramRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds, after evaluation, why each answer to a query holds.
 *
 * For every answer the tracer looks for the first rule whose premises are satisfied and
 * recurses into the positive premise facts. The active path is tracked so a fact that
 * depends on itself is marked as a cycle instead of expanded again, and expansion stops
 * at the configured depth whatever time remains on the query deadline.
 */
public class DerivationTracer {

    private static final Logger log = LoggerFactory.getLogger(DerivationTracer.class);

    public static final int HARD_CEILING = 64;

    private final int maxDepth;
    private final ProgramRenderer renderer = new ProgramRenderer();

    public DerivationTracer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("trace depth must be at least 1: " + maxDepth);
        }
        this.maxDepth = Math.min(maxDepth, HARD_CEILING);
        if (maxDepth > HARD_CEILING) {
            log.warn("Trace depth {} capped at {}", maxDepth, HARD_CEILING);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public DerivationTrace trace(Atom goal, QueryContext context, FactSnapshot snapshot, RuleIndex rules) {
        long started = System.nanoTime();
        GoalSolver solver = new GoalSolver(snapshot, rules, context);
        List<DerivationNode> roots = new ArrayList<>();
        for (Fact answer : solver.facts(goal)) {
            roots.add(node(answer, 0, new HashSet<>(), solver, snapshot, rules, context));
        }
        long durationMs = (System.nanoTime() - started) / 1_000_000;
        log.debug("Traced {} with {} root(s) in {} ms", renderer.atom(goal), roots.size(), durationMs);
        return new DerivationTrace(renderer.atom(goal), roots, durationMs);
    }

    private DerivationNode node(Fact fact, int depth, Set<Fact> path, GoalSolver solver,
                                FactSnapshot snapshot, RuleIndex rules, QueryContext context) {
        context.checkDeadline();
        String predicate = fact.predicate();

        if (!rules.isDerived(predicate)) {
            Classification kind = snapshot.contains(fact) ? Classification.BASE : Classification.UNKNOWN;
            return DerivationNode.leaf(fact, kind, null, Marker.NONE, depth);
        }
        if (path.contains(fact)) {
            return DerivationNode.leaf(fact, Classification.DERIVED, predicate, Marker.CYCLE, depth);
        }
        if (depth >= maxDepth) {
            return DerivationNode.leaf(fact, Classification.DERIVED, predicate, Marker.DEPTH_LIMIT, depth);
        }

        path.add(fact);
        try {
            for (Clause rule : rules.rulesFor(predicate)) {
                Optional<GoalSolver.Solution> solution = solver.firstSolution(rule, fact);
                if (solution.isEmpty()) {
                    continue;
                }
                List<DerivationNode> children = new ArrayList<>();
                for (Fact premise : solution.get().premises()) {
                    children.add(node(premise, depth + 1, path, solver, snapshot, rules, context));
                }
                return new DerivationNode(fact, Classification.DERIVED, rule.head().predicate(),
                    Marker.NONE, depth, children);
            }
        } finally {
            path.remove(fact);
        }
        log.debug("No consistent premise set for {}", fact);
        return DerivationNode.leaf(fact, Classification.UNKNOWN, null, Marker.NONE, depth);
    }
}
