package com.logicsynth.eval;

import com.logicsynth.facts.Fact;
import com.logicsynth.facts.FactSnapshot;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Premise;
import com.logicsynth.ir.Term;
import com.logicsynth.ir.TransformStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Answers goals against a fact snapshot. A predicate defined by rules is evaluated to its
 * fixpoint over the snapshot, stratum by stratum, starting from the facts stored under it;
 * only the predicates the goal depends on are computed. Results are kept for the lifetime
 * of the solver, which is one query.
 */
public final class GoalSolver {

    private static final Logger log = LoggerFactory.getLogger(GoalSolver.class);

    private final FactSnapshot snapshot;
    private final RuleIndex rules;
    private final QueryContext context;
    private final Map<String, Set<Fact>> model = new HashMap<>();

    /** Bindings of one body solution plus the positive facts it used, in body order. */
    public record Solution(Map<String, Term> bindings, List<Fact> premises) {}

    public GoalSolver(FactSnapshot snapshot, RuleIndex rules, QueryContext context) {
        this.snapshot = snapshot;
        this.rules = rules;
        this.context = context;
    }

    /** Ground answers for {@code goal}, stored facts first. */
    public List<Fact> facts(Atom goal) {
        context.checkDeadline();
        List<Fact> out = new ArrayList<>();
        for (Fact fact : known(goal.predicate())) {
            if (Unifier.match(goal.args(), fact.args(), Map.of()).isPresent()) {
                out.add(fact);
            }
        }
        return out;
    }

    /** Every fact that holds for {@code predicate}: stored ones, plus derived ones when rules define it. */
    private Iterable<Fact> known(String predicate) {
        if (!rules.isDerived(predicate)) {
            return snapshot.facts(predicate);
        }
        if (!model.containsKey(predicate)) {
            evaluate(predicate);
        }
        return model.get(predicate);
    }

    private void evaluate(String predicate) {
        Set<String> pending = dependencies(predicate);
        Map<Integer, List<String>> strata = new TreeMap<>();
        stratify(pending).forEach((p, level) -> strata.computeIfAbsent(level, k -> new ArrayList<>()).add(p));
        for (List<String> stratum : strata.values()) {
            fixpoint(stratum);
        }
    }

    /** Rule-defined predicates reachable from {@code root} that are not yet evaluated. */
    private Set<String> dependencies(String root) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            String p = queue.poll();
            if (!rules.isDerived(p) || model.containsKey(p) || !seen.add(p)) {
                continue;
            }
            for (Clause rule : rules.rulesFor(p)) {
                for (Premise premise : rule.body()) {
                    bodyAtom(premise).ifPresent(a -> queue.add(a.predicate()));
                }
            }
        }
        return seen;
    }

    /**
     * Stratum per predicate: at least that of each body predicate, and strictly above it
     * through negation or aggregation. A verified program is stratified; for one that is
     * not, levels stop growing after one pass per predicate.
     */
    private Map<String, Integer> stratify(Set<String> predicates) {
        Map<String, Integer> level = new HashMap<>();
        predicates.forEach(p -> level.put(p, 0));
        boolean changed = true;
        for (int pass = 0; changed && pass <= predicates.size(); pass++) {
            changed = false;
            for (String p : predicates) {
                for (Clause rule : rules.rulesFor(p)) {
                    boolean aggregates = rule.transformOpt().map(t -> t.aggregates()).orElse(false);
                    for (Premise premise : rule.body()) {
                        Optional<Atom> atom = bodyAtom(premise);
                        if (atom.isEmpty() || !level.containsKey(atom.get().predicate())) {
                            continue;
                        }
                        int required = level.get(atom.get().predicate())
                            + (aggregates || premise instanceof Premise.Negated ? 1 : 0);
                        if (level.get(p) < required) {
                            level.put(p, required);
                            changed = true;
                        }
                    }
                }
            }
        }
        if (changed) {
            log.warn("Rules for {} are not stratified; evaluating with the levels reached", predicates);
        }
        return level;
    }

    /** Applies the rules of one stratum until no new fact appears. */
    private void fixpoint(List<String> stratum) {
        for (String p : stratum) {
            model.put(p, new LinkedHashSet<>(snapshot.facts(p)));
        }
        boolean changed = true;
        int rounds = 0;
        while (changed) {
            context.checkDeadline();
            changed = false;
            rounds++;
            for (String p : stratum) {
                for (Clause rule : rules.rulesFor(p)) {
                    for (Fact fact : fire(rule)) {
                        changed |= model.get(p).add(fact);
                    }
                }
            }
        }
        log.debug("Stratum {} reached its fixpoint after {} round(s)", stratum, rounds);
    }

    private List<Fact> fire(Clause rule) {
        List<Map<String, Term>> rows = new ArrayList<>();
        join(new ArrayList<>(rule.body()), Map.of(), List.of(), s -> {
            rows.add(s.bindings());
            return true;
        });

        List<Map<String, Term>> results = rows;
        if (rule.transform() != null) {
            Optional<List<Map<String, Term>>> transformed = Aggregation.apply(rule.transform(), rows);
            if (transformed.isEmpty()) {
                log.debug("Transform of rule {} is not evaluable here", rule.head().predicate());
                return List.of();
            }
            results = transformed.get();
        }

        List<Fact> out = new ArrayList<>();
        for (Map<String, Term> row : results) {
            Atom head = Unifier.substitute(rule.head(), row);
            Fact fact = new Fact(head.predicate(), head.args());
            if (fact.isGround()) {
                out.add(fact);
            }
        }
        return out;
    }

    /**
     * The first body solution of {@code rule} that derives {@code fact}, with the positive
     * premise facts it used.
     */
    public Optional<Solution> firstSolution(Clause rule, Fact fact) {
        Optional<Map<String, Term>> seed = seed(rule, fact.args());
        if (seed.isEmpty()) {
            return Optional.empty();
        }
        List<Solution> found = new ArrayList<>(1);
        join(new ArrayList<>(rule.body()), seed.get(), List.of(), s -> {
            found.add(s);
            return false;
        });
        return found.stream().findFirst();
    }

    /**
     * Binds the rule head against ground target arguments. Variables assigned by a
     * {@code let} are left free because the body cannot bind them.
     */
    private Optional<Map<String, Term>> seed(Clause rule, List<Term> target) {
        if (rule.head().arity() != target.size()) {
            return Optional.empty();
        }
        Set<String> letVars = new HashSet<>();
        rule.transformOpt().ifPresent(t -> t.statements().stream()
            .filter(TransformStatement::isLet)
            .forEach(s -> letVars.add(s.variable())));

        Map<String, Term> seed = new HashMap<>();
        for (int i = 0; i < target.size(); i++) {
            Term pattern = rule.head().args().get(i);
            Term value = target.get(i);
            if (!value.isGround() || (pattern instanceof Term.Variable v && letVars.contains(v.name()))) {
                continue;
            }
            if (pattern instanceof Term.Apply) {
                continue;
            }
            if (!Unifier.unify(pattern, value, seed)) {
                return Optional.empty();
            }
        }
        return Optional.of(seed);
    }

    /**
     * Backtracking join. Filters run as soon as their variables are bound; otherwise the
     * next positive premise in body order is expanded. {@code sink} returns false to stop.
     *
     * @return false when the sink asked to stop
     */
    private boolean join(List<Premise> pending, Map<String, Term> bindings, List<Fact> used,
                         Predicate<Solution> sink) {
        context.checkDeadline();
        if (pending.isEmpty()) {
            return sink.test(new Solution(bindings, used));
        }

        int next = pickNext(pending, bindings);
        if (next < 0) {
            // nothing can run: an unsafe clause, no solution
            return true;
        }
        Premise premise = pending.get(next);
        List<Premise> rest = new ArrayList<>(pending);
        rest.remove(next);

        if (premise instanceof Premise.Positive p) {
            Atom goal = Unifier.substitute(p.atom(), bindings);
            for (Fact fact : facts(goal)) {
                Optional<Map<String, Term>> extended = Unifier.match(p.atom().args(), fact.args(), bindings);
                if (extended.isPresent()) {
                    List<Fact> withFact = new ArrayList<>(used);
                    withFact.add(fact);
                    if (!join(rest, extended.get(), withFact, sink)) {
                        return false;
                    }
                }
            }
            return true;
        }
        if (premise instanceof Premise.Negated n) {
            Atom goal = Unifier.substitute(n.atom(), bindings);
            return !facts(goal).isEmpty() || join(rest, bindings, used, sink);
        }
        if (premise instanceof Premise.Equality e) {
            Optional<Map<String, Term>> extended = equate(e.left(), e.right(), bindings);
            return extended.isEmpty() || join(rest, extended.get(), used, sink);
        }
        if (premise instanceof Premise.Inequality ne) {
            Term l = Unifier.resolve(ne.left(), bindings);
            Term r = Unifier.resolve(ne.right(), bindings);
            return l == null || r == null || l.equals(r) || join(rest, bindings, used, sink);
        }
        Premise.Comparison c = (Premise.Comparison) premise;
        Term l = Unifier.resolve(c.left(), bindings);
        Term r = Unifier.resolve(c.right(), bindings);
        boolean holds = l != null && r != null
            && Unifier.compareNumbers(l, r).map(c.op()::test).orElse(false);
        return !holds || join(rest, bindings, used, sink);
    }

    private static Optional<Atom> bodyAtom(Premise premise) {
        if (premise instanceof Premise.Positive p) {
            return Optional.of(p.atom());
        }
        if (premise instanceof Premise.Negated n) {
            return Optional.of(n.atom());
        }
        return Optional.empty();
    }

    private static Optional<Map<String, Term>> equate(Term left, Term right, Map<String, Term> bindings) {
        Term l = Unifier.resolve(left, bindings);
        Term r = Unifier.resolve(right, bindings);
        if (l != null && r != null) {
            return l.equals(r) ? Optional.of(bindings) : Optional.empty();
        }
        if (l != null) {
            return Unifier.match(List.of(right), List.of(l), bindings);
        }
        if (r != null) {
            return Unifier.match(List.of(left), List.of(r), bindings);
        }
        return Optional.empty();
    }

    private static int pickNext(List<Premise> pending, Map<String, Term> bindings) {
        int firstPositive = -1;
        for (int i = 0; i < pending.size(); i++) {
            Premise p = pending.get(i);
            if (p instanceof Premise.Positive) {
                if (firstPositive < 0) {
                    firstPositive = i;
                }
            } else if (p instanceof Premise.Equality e) {
                if (Unifier.resolve(e.left(), bindings) != null || Unifier.resolve(e.right(), bindings) != null) {
                    return i;
                }
            } else if (bindings.keySet().containsAll(p.variables())) {
                return i;
            }
        }
        return firstPositive;
    }
}
