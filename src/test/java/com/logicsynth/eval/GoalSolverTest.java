package com.logicsynth.eval;

import com.logicsynth.facts.Fact;
import com.logicsynth.facts.FactSnapshot;
import com.logicsynth.grammar.ProgramParser;
import com.logicsynth.ir.Atom;
import com.logicsynth.ir.Clause;
import com.logicsynth.ir.Term;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GoalSolverTest {

    private static final FactSnapshot GRAPH = FactSnapshot.of(List.of(
        Fact.of("edge", Term.name("/a"), Term.name("/b")),
        Fact.of("edge", Term.name("/b"), Term.name("/c")),
        Fact.of("edge", Term.name("/c"), Term.name("/a")),
        Fact.of("blocked", Term.name("/c")),
        Fact.of("weight", Term.name("/a"), Term.number(5)),
        Fact.of("weight", Term.name("/b"), Term.number(12)),
        Fact.of("weight", Term.name("/c"), Term.number(20))));

    private static GoalSolver solver(String rules) {
        return solver(GRAPH, rules);
    }

    private static GoalSolver solver(FactSnapshot facts, String rules) {
        return new GoalSolver(facts, RuleIndex.of(ProgramParser.parseProgram(rules).clauses()),
            QueryContext.withTimeout(Duration.ofSeconds(5)));
    }

    private static Fact pair(String predicate, String from, String to) {
        return Fact.of(predicate, Term.name(from), Term.name(to));
    }

    private static Set<Fact> answers(GoalSolver solver, String query) {
        return Set.copyOf(solver.facts(ProgramParser.parseQuery(query)));
    }

    @Nested
    @DisplayName("Stored facts")
    class Stored {

        @Test
        void boundArgument_filtersMatches() {
            assertEquals(Set.of(Fact.of("edge", Term.name("/a"), Term.name("/b"))),
                answers(solver(""), "edge(/a, X)"));
        }

        @Test
        void repeatedVariable_mustAgree() {
            assertEquals(Set.of(), answers(solver(""), "edge(X, X)"));
        }

        @Test
        void unknownPredicate_hasNoAnswers() {
            assertEquals(Set.of(), answers(solver(""), "missing(X)"));
        }
    }

    @Nested
    @DisplayName("Rule evaluation")
    class Rules {

        @Test
        void joinAcrossTwoPremises() {
            GoalSolver solver = solver("two_hop(X, Z) :- edge(X, Y), edge(Y, Z).");
            assertTrue(answers(solver, "two_hop(/a, Z)").contains(
                Fact.of("two_hop", Term.name("/a"), Term.name("/c"))));
            assertEquals(3, answers(solver, "two_hop(X, Z)").size());
        }

        @Test
        void negationExcludesMatches() {
            GoalSolver solver = solver("open(X) :- edge(X, _), !blocked(X).");
            assertEquals(Set.of(Fact.of("open", Term.name("/a")), Fact.of("open", Term.name("/b"))),
                answers(solver, "open(X)"));
        }

        @Test
        void comparisonFilters() {
            GoalSolver solver = solver("heavy(X) :- weight(X, W), :gt(W, 10).");
            assertEquals(2, answers(solver, "heavy(X)").size());
        }

        @Test
        void equalityBindsComputedValue() {
            GoalSolver solver = solver("doubled(X, D) :- weight(X, W), D = fn:mult(W, 2).");
            assertEquals(Set.of(Fact.of("doubled", Term.name("/a"), Term.number(10))),
                answers(solver, "doubled(/a, D)"));
        }

        @Test
        void inequalityFilters() {
            GoalSolver solver = solver("not_a(X) :- weight(X, _), X != /a.");
            assertEquals(2, answers(solver, "not_a(X)").size());
        }

        @Test
        void groupByCount() {
            GoalSolver solver = solver("out_degree(X, N) :- edge(X, Y) |> do fn:group_by(X), let N = fn:count().");
            assertEquals(3, answers(solver, "out_degree(X, N)").size());
            assertTrue(answers(solver, "out_degree(/a, N)").contains(
                Fact.of("out_degree", Term.name("/a"), Term.number(1))));
        }

        @Test
        void unsupportedTransform_yieldsNothing() {
            GoalSolver solver = solver("odd(X) :- edge(X, Y) |> do fn:shuffle(X).");
            assertEquals(Set.of(), answers(solver, "odd(X)"));
        }
    }

    @Nested
    @DisplayName("Recursion")
    class Recursion {

        private final FactSnapshot chain = FactSnapshot.of(List.of(
            pair("edge", "/a", "/b"), pair("edge", "/b", "/c")));

        @Test
        void leftRecursiveClosure_isComplete() {
            GoalSolver solver = solver(chain, """
                reach(X, Y) :- edge(X, Y).
                reach(X, Z) :- reach(X, Y), edge(Y, Z).
                """);
            assertEquals(Set.of(pair("reach", "/a", "/b"), pair("reach", "/b", "/c"), pair("reach", "/a", "/c")),
                answers(solver, "reach(X, Y)"));
        }

        @Test
        void rightRecursiveClosure_isComplete() {
            GoalSolver solver = solver(chain, """
                reach(X, Y) :- edge(X, Y).
                reach(X, Z) :- edge(X, Y), reach(Y, Z).
                """);
            assertEquals(Set.of(pair("reach", "/a", "/b"), pair("reach", "/b", "/c"), pair("reach", "/a", "/c")),
                answers(solver, "reach(X, Y)"));
        }

        @Test
        void closureOverACycle_reachesEveryPair() {
            GoalSolver solver = solver("""
                reach(X, Y) :- edge(X, Y).
                reach(X, Z) :- reach(X, Y), reach(Y, Z).
                """);
            Set<Fact> reach = answers(solver, "reach(X, Y)");
            assertEquals(9, reach.size());
            assertTrue(reach.contains(pair("reach", "/a", "/a")));
            assertEquals(Set.of(pair("reach", "/b", "/a"), pair("reach", "/b", "/b"), pair("reach", "/b", "/c")),
                answers(solver, "reach(/b, Y)"));
        }

        @Test
        void negationOverRecursivePredicate_seesTheWholeClosure() {
            GoalSolver solver = solver(chain, """
                reach(X, Y) :- edge(X, Y).
                reach(X, Z) :- reach(X, Y), edge(Y, Z).
                node(X) :- edge(X, _).
                node(Y) :- edge(_, Y).
                unreached(X, Y) :- node(X), node(Y), !reach(X, Y).
                """);
            assertFalse(answers(solver, "unreached(/a, Y)").contains(pair("unreached", "/a", "/c")));
            assertTrue(answers(solver, "unreached(/c, Y)").contains(pair("unreached", "/c", "/a")));
        }
    }

    @Nested
    @DisplayName("Stored and derived facts under one predicate")
    class Mixed {

        private final FactSnapshot facts = FactSnapshot.of(List.of(
            Fact.of("dependency_link", Term.name("/a"), Term.name("/b"), Term.name("/import")),
            Fact.of("modified", Term.name("/b")),
            Fact.of("impacted", Term.name("/z"))));

        @Test
        void storedFactsAndRuleResults_areBothAnswers() {
            GoalSolver solver = solver(facts, "impacted(X) :- dependency_link(X, Y, _), modified(Y).");
            List<Fact> impacted = solver.facts(ProgramParser.parseQuery("impacted(X)"));
            assertEquals(List.of(Fact.of("impacted", Term.name("/z")), Fact.of("impacted", Term.name("/a"))), impacted);
        }

        @Test
        void storedFactsFeedDependentRules() {
            GoalSolver solver = solver(facts, """
                impacted(X) :- dependency_link(X, Y, _), modified(Y).
                flagged(X) :- impacted(X).
                """);
            assertEquals(Set.of(Fact.of("flagged", Term.name("/a")), Fact.of("flagged", Term.name("/z"))),
                answers(solver, "flagged(X)"));
        }
    }

    @Nested
    @DisplayName("Premise recovery")
    class Premises {

        @Test
        void firstSolution_returnsPositivePremisesInBodyOrder() {
            GoalSolver solver = solver("two_hop(X, Z) :- edge(X, Y), edge(Y, Z).");
            Clause rule = ProgramParser.parseProgram("two_hop(X, Z) :- edge(X, Y), edge(Y, Z).").clauses().get(0);
            Optional<GoalSolver.Solution> solution = solver.firstSolution(rule,
                Fact.of("two_hop", Term.name("/a"), Term.name("/c")));
            assertTrue(solution.isPresent());
            assertEquals(List.of(
                Fact.of("edge", Term.name("/a"), Term.name("/b")),
                Fact.of("edge", Term.name("/b"), Term.name("/c"))), solution.get().premises());
        }

        @Test
        void firstSolution_isEmptyWhenTheRuleCannotDeriveTheFact() {
            GoalSolver solver = solver("two_hop(X, Z) :- edge(X, Y), edge(Y, Z).");
            Clause rule = ProgramParser.parseProgram("two_hop(X, Z) :- edge(X, Y), edge(Y, Z).").clauses().get(0);
            assertTrue(solver.firstSolution(rule, Fact.of("two_hop", Term.name("/a"), Term.name("/b"))).isEmpty());
        }
    }

    @Test
    void expiredDeadline_abortsEvaluation() {
        QueryContext context = QueryContext.withTimeout(Duration.ofSeconds(5));
        context.cancel();
        GoalSolver solver = new GoalSolver(GRAPH, RuleIndex.empty(), context);
        assertThrows(QueryTimeoutException.class, () -> solver.facts(Atom.of("edge", Term.var("X"), Term.var("Y"))));
    }
}
