package com.logicsynth.integration;

import com.logicsynth.compile.CompileResult;
import com.logicsynth.compile.ProgramAcceptService;
import com.logicsynth.facts.FactIngestionService;
import com.logicsynth.facts.FactTypeMismatchException;
import com.logicsynth.query.QueryResult;
import com.logicsynth.query.QueryService;
import com.logicsynth.trace.Classification;
import com.logicsynth.trace.DerivationTrace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Model reply -> compile -> accept -> loose facts -> query -> trace.
 */
@SpringBootTest
class SynthesisPipelineIntegrationTest {

    private static final String MODEL_REPLY = """
        Here is the program you asked for:

        ```json
        {"format":"v1","program":{
          "decls":[{"atom":{"pred":"modified","args":[{"kind":"var","value":"F"}]},
                    "bounds":[{"terms":[{"kind":"name","value":"/name"}]}]}],
          "clauses":[{"head":{"pred":"impacted","args":[{"kind":"var","value":"X"}]},
                      "body":[{"kind":"atom","atom":{"pred":"depends","args":[{"kind":"var","value":"X"},{"kind":"var","value":"Y"}]}},
                              {"kind":"atom","atom":{"pred":"modified","args":[{"kind":"var","value":"Y"}]}}]}]}}
        ```

        Let me know if it needs changes.
        """;

    @Autowired ProgramAcceptService acceptService;
    @Autowired FactIngestionService ingestion;
    @Autowired QueryService queryService;

    @BeforeEach
    void resetSession() {
        acceptService.reset();
    }

    @Test
    @DisplayName("Fenced model reply compiles, loads and answers with a derivation")
    void modelReply_toTracedAnswer() {
        CompileResult compiled = acceptService.accept(MODEL_REPLY);
        assertTrue(compiled.success(), () -> compiled.diagnostics().toString());
        assertEquals("impacted(X) :- depends(X, Y), modified(Y).", compiled.clauses().get(0));

        ingestion.addLoose("depends", List.of("a", "b"));
        ingestion.addLoose("modified", List.of("b"));

        QueryResult answers = queryService.query("impacted(X)");
        assertEquals(List.of(Map.of("X", "/a")), answers.bindings());

        DerivationTrace trace = queryService.trace("impacted(/a)");
        assertEquals(1, trace.roots().size());
        assertEquals(Classification.DERIVED, trace.roots().get(0).classification());
        assertEquals(2, trace.roots().get(0).children().size());
    }

    @Test
    @DisplayName("Declared bound rejects a loose string that cannot be a name")
    void declaredBound_guardsLooseFacts() {
        assertTrue(acceptService.accept(MODEL_REPLY).success());

        assertThrows(FactTypeMismatchException.class,
            () -> ingestion.addLoose("modified", List.of(42)));
        assertEquals(0, queryService.query("modified(X)").count());
    }
}
