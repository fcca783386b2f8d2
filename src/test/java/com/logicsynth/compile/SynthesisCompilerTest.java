package com.logicsynth.compile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicsynth.contract.CompileOptions;
import com.logicsynth.contract.DiagnosticKind;
import com.logicsynth.contract.ProgramBinder;
import com.logicsynth.contract.ProgramSpecValidator;
import com.logicsynth.contract.SemanticChecker;
import com.logicsynth.extract.PayloadExtractor;
import com.logicsynth.grammar.DefaultProgramAnalyzer;
import com.logicsynth.grammar.RoundTripVerifier;
import com.logicsynth.render.ProgramRenderer;
import com.logicsynth.schema.SchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SynthesisCompilerTest {

    static final String SIMPLE_RULE = "{\"format\":\"v1\",\"program\":{\"clauses\":[{\"head\":{\"pred\":\"p\","
        + "\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]},\"body\":[{\"kind\":\"atom\",\"atom\":{\"pred\":\"q\","
        + "\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}}]}]}}";

    private SynthesisCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new SynthesisCompiler(
            new PayloadExtractor(),
            new ObjectMapper(),
            new ProgramSpecValidator(new ProgramBinder(), new SemanticChecker()),
            new ProgramRenderer(),
            new RoundTripVerifier(new DefaultProgramAnalyzer()),
            CompileOptions.defaults());
    }

    @Nested
    @DisplayName("Successful compiles")
    class Success {

        @Test
        void simpleRule_rendersExactly() {
            CompileResult result = compiler.compile(SIMPLE_RULE);
            assertTrue(result.success(), () -> result.diagnostics().toString());
            assertEquals("p(X) :- q(X).", result.source());
            assertEquals(List.of("p(X) :- q(X)."), result.clauses());
            assertEquals(List.of(), result.diagnostics());
        }

        @Test
        void equalityComparisonAndGroupBy_allAppear() {
            String doc = "{\"format\":\"v1\",\"program\":{\"clauses\":[{"
                + "\"head\":{\"pred\":\"big_orders\",\"args\":[{\"kind\":\"var\",\"value\":\"C\"},{\"kind\":\"var\",\"value\":\"N\"}]},"
                + "\"body\":["
                + "{\"kind\":\"atom\",\"atom\":{\"pred\":\"order\",\"args\":[{\"kind\":\"var\",\"value\":\"C\"},{\"kind\":\"var\",\"value\":\"A\"}]}},"
                + "{\"kind\":\"eq\",\"left\":{\"kind\":\"var\",\"value\":\"B\"},\"right\":{\"kind\":\"var\",\"value\":\"A\"}},"
                + "{\"kind\":\"cmp\",\"op\":\"gt\",\"left\":{\"kind\":\"var\",\"value\":\"B\"},\"right\":{\"kind\":\"number\",\"number\":\"100\"}}],"
                + "\"transform\":{\"statements\":["
                + "{\"kind\":\"do\",\"fn\":{\"kind\":\"apply\",\"function\":\"fn:group_by\",\"args\":[{\"kind\":\"var\",\"value\":\"C\"}]}},"
                + "{\"kind\":\"let\",\"var\":\"N\",\"fn\":{\"kind\":\"apply\",\"function\":\"fn:count\"}}]}}]}}";
            CompileResult result = compiler.compile(doc);
            assertTrue(result.success(), () -> result.diagnostics().toString());
            assertTrue(result.source().contains("B = A"));
            assertTrue(result.source().contains(":gt(B, 100)"));
            assertTrue(result.source().contains("|> do fn:group_by(C), let N = fn:count()"));
        }

        @Test
        void fencedEnvelope_compilesLikeTheBareDocument() {
            String fenced = ("```json\n" + SIMPLE_RULE + "\n```").replace("\"", "\\\"").replace("\n", "\\n");
            CompileResult wrapped = compiler.compile("{\"surface_response\":\"" + fenced + "\"}");
            CompileResult direct = compiler.compile(SIMPLE_RULE);
            assertTrue(wrapped.success(), () -> wrapped.diagnostics().toString());
            assertEquals(direct.source(), wrapped.source());
            assertEquals(direct.program(), wrapped.program());
        }

        @Test
        void declarationsRenderBeforeClauses() {
            String doc = "{\"format\":\"v1\",\"program\":{"
                + "\"decls\":[{\"atom\":{\"pred\":\"q\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]},"
                + "\"bounds\":[{\"terms\":[{\"kind\":\"name\",\"value\":\"/name\"}]}]}],"
                + "\"clauses\":[{\"head\":{\"pred\":\"q\",\"args\":[{\"kind\":\"name\",\"value\":\"/a\"}]}}]}}";
            CompileResult result = compiler.compile(doc);
            assertTrue(result.success(), () -> result.diagnostics().toString());
            assertEquals("Decl q(X) bound [/name].\nq(/a).", result.source());
        }
    }

    @Nested
    @DisplayName("Rejected input")
    class Rejected {

        @Test
        void proseOnly_isADecodeFailure() {
            CompileResult result = compiler.compile("Sorry, I cannot help with that.");
            assertFalse(result.success());
            assertNull(result.source());
            assertEquals(DiagnosticKind.DECODE, result.diagnostics().get(0).kind());
        }

        @Test
        void wrongFieldType_isADecodeFailureWithPath() {
            CompileResult result = compiler.compile("{\"format\":\"v1\",\"program\":{\"clauses\":\"oops\"}}");
            assertFalse(result.success());
            assertEquals(DiagnosticKind.DECODE, result.diagnostics().get(0).kind());
            assertEquals("program.clauses", result.diagnostics().get(0).path());
        }

        @Test
        void schemaViolation_isReportedWithPath() {
            CompileResult result = compiler.compile(SIMPLE_RULE.replace("\"value\":\"X\"}]},\"body\"",
                "\"value\":\"lower\"}]},\"body\""));
            assertFalse(result.success());
            assertEquals(DiagnosticKind.SCHEMA, result.diagnostics().get(0).kind());
            assertEquals("program.clauses[0].head.args[0].value", result.diagnostics().get(0).path());
        }

        @Test
        void unknownFunction_isAGrammarFailure() {
            String doc = "{\"format\":\"v1\",\"program\":{\"clauses\":[{"
                + "\"head\":{\"pred\":\"p\",\"args\":[{\"kind\":\"var\",\"value\":\"Y\"}]},"
                + "\"body\":[{\"kind\":\"atom\",\"atom\":{\"pred\":\"q\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}},"
                + "{\"kind\":\"eq\",\"left\":{\"kind\":\"var\",\"value\":\"Y\"},"
                + "\"right\":{\"kind\":\"apply\",\"function\":\"fn:frobnicate\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}}]}]}}";
            CompileResult result = compiler.compile(doc);
            assertFalse(result.success());
            assertEquals(DiagnosticKind.GRAMMAR, result.diagnostics().get(0).kind());
            assertTrue(result.diagnostics().get(0).message().contains("fn:frobnicate"));
        }

        @Test
        void negationCycle_isAGrammarFailure() {
            String doc = "{\"format\":\"v1\",\"program\":{\"clauses\":["
                + "{\"head\":{\"pred\":\"p\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]},\"body\":["
                + "{\"kind\":\"atom\",\"atom\":{\"pred\":\"base\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}},"
                + "{\"kind\":\"not\",\"atom\":{\"pred\":\"q\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}}]},"
                + "{\"head\":{\"pred\":\"q\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]},\"body\":["
                + "{\"kind\":\"atom\",\"atom\":{\"pred\":\"base\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}},"
                + "{\"kind\":\"not\",\"atom\":{\"pred\":\"p\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}}]}]}}";
            CompileResult result = compiler.compile(doc);
            assertFalse(result.success());
            assertEquals("program", result.diagnostics().get(0).path());
            assertEquals(DiagnosticKind.GRAMMAR, result.diagnostics().get(0).kind());
        }

        @Test
        void packageHeader_isRejectedUnderDefaults() {
            String doc = SIMPLE_RULE.replace("\"program\":{", "\"program\":{\"package\":{\"name\":\"demo\"},");
            CompileResult result = compiler.compile(doc);
            assertFalse(result.success());
            assertEquals("program.package", result.diagnostics().get(0).path());
        }

        @Test
        void packageHeader_compilesWhenAllowed() {
            String doc = SIMPLE_RULE.replace("\"program\":{", "\"program\":{\"package\":{\"name\":\"demo\"},");
            CompileResult result = compiler.compile(doc, CompileOptions.permissive(), SchemaRegistry.empty());
            assertTrue(result.success(), () -> result.diagnostics().toString());
            assertEquals("Package demo!\np(X) :- q(X).", result.source());
        }
    }
}
