package com.logicsynth.grammar;

import com.logicsynth.ir.Program;

import java.util.List;

/**
 * Static analysis applied to parsed rule text before it may be loaded by the engine.
 * An empty result means the program is acceptable.
 */
public interface ProgramAnalyzer {

    List<AnalysisIssue> analyze(Program program);
}
