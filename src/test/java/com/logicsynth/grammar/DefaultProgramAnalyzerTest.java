package com.logicsynth.grammar;

import com.logicsynth.ir.Program;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultProgramAnalyzerTest {

    private final DefaultProgramAnalyzer analyzer = new DefaultProgramAnalyzer();

    private List<AnalysisIssue> analyze(String src) {
        return analyzer.analyze(ProgramParser.parseProgram(src));
    }

    @Test
    void wellFormedProgram_hasNoIssues() {
        List<AnalysisIssue> issues = analyze("""
            Decl edge(A, B).
            edge(/a, /b).
            path(X, Y) :- edge(X, Y).
            path(X, Z) :- edge(X, Y), path(Y, Z).
            unreachable(X) :- edge(X, _), !path(/a, X).
            """);
        assertEquals(List.of(), issues);
    }

    @Test
    void negationCycle_isNotStratifiable() {
        List<AnalysisIssue> issues = analyze("""
            p(X) :- base(X), !q(X).
            q(X) :- base(X), !p(X).
            """);
        assertEquals(1, issues.size());
        assertEquals("program", issues.get(0).location());
        assertTrue(issues.get(0).message().contains("not stratifiable"));
    }

    @Test
    void aggregationThroughRecursion_isNotStratifiable() {
        List<AnalysisIssue> issues = analyze("""
            total(N) :- total(M) |> let N = fn:count().
            """);
        assertTrue(issues.stream().anyMatch(i -> i.message().contains("not stratifiable")));
    }

    @Test
    void unknownFunction_isReported() {
        List<AnalysisIssue> issues = analyze("p(Y) :- q(X), Y = fn:frobnicate(X).");
        assertEquals(1, issues.size());
        assertEquals("program.clauses[0].body[1].right", issues.get(0).location());
    }

    @Test
    void fixedArityFunction_isChecked() {
        List<AnalysisIssue> issues = analyze("p(Y) :- q(X), Y = fn:len(X, X).");
        assertTrue(issues.get(0).message().contains("takes 1 args, got 2"));
    }

    @Test
    void inconsistentArity_isReported() {
        List<AnalysisIssue> issues = analyze("p(/a).\np(/a, /b).");
        assertEquals("program.clauses[1].head", issues.get(0).location());
    }

    @Test
    void unsafeClause_isReported() {
        List<AnalysisIssue> issues = analyze("p(X, Y) :- q(X).");
        assertEquals("program.clauses[0].head.args[1]", issues.get(0).location());
    }

    @Test
    void unknownBuiltinPredicate_isReported() {
        List<AnalysisIssue> issues = analyze("p(X) :- q(X), :between(X, 1).");
        assertTrue(issues.stream().anyMatch(i -> i.message().contains("unknown built-in predicate :between")));
    }
}
