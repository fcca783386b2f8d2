package com.logicsynth.grammar;

/**
 * One finding of a {@link ProgramAnalyzer}, located by field path, e.g. {@code program.clauses[1].body[0]}.
 */
public record AnalysisIssue(String location, String message) {}
