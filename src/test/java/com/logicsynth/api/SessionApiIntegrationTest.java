package com.logicsynth.api;

import com.logicsynth.compile.ProgramAcceptService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End to end over HTTP: accept a rule, add facts, query and trace the derived answer.
 */
@SpringBootTest
@AutoConfigureMockMvc
class SessionApiIntegrationTest {

    private static final String IMPACT_RULE = "```json\n{\"format\":\"v1\",\"program\":{\"clauses\":[{"
        + "\"head\":{\"pred\":\"impacted\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]},"
        + "\"body\":["
        + "{\"kind\":\"atom\",\"atom\":{\"pred\":\"dependency_link\",\"args\":["
        + "{\"kind\":\"var\",\"value\":\"X\"},{\"kind\":\"var\",\"value\":\"Y\"},{\"kind\":\"var\",\"value\":\"_\"}]}},"
        + "{\"kind\":\"atom\",\"atom\":{\"pred\":\"modified\",\"args\":[{\"kind\":\"var\",\"value\":\"Y\"}]}}]}]}}\n```";

    @Autowired MockMvc mvc;
    @Autowired ProgramAcceptService acceptService;

    @BeforeEach
    void resetSession() {
        acceptService.reset();
    }

    @Test
    @DisplayName("Accept rule → add facts → query → trace")
    void happyPath() throws Exception {
        mvc.perform(post("/v1/programs/accept").contentType(MediaType.TEXT_PLAIN).content(IMPACT_RULE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.source").value("impacted(X) :- dependency_link(X, Y, _), modified(Y)."));

        mvc.perform(post("/v1/facts").contentType(MediaType.APPLICATION_JSON)
                .content("{\"pred\":\"dependency_link\",\"args\":[{\"kind\":\"name\",\"value\":\"/a\"},"
                    + "{\"kind\":\"name\",\"value\":\"/b\"},{\"kind\":\"name\",\"value\":\"/import\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.added").value(true))
            .andExpect(jsonPath("$.fact").value("dependency_link(/a, /b, /import)"));

        mvc.perform(post("/v1/facts/loose").contentType(MediaType.APPLICATION_JSON)
                .content("{\"pred\":\"modified\",\"args\":[\"b\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fact").value("modified(/b)"));

        mvc.perform(get("/v1/query").param("q", "impacted(X)"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.bindings[0].X").value("/a"));

        mvc.perform(get("/v1/trace").param("q", "impacted(X)"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.roots", hasSize(1)))
            .andExpect(jsonPath("$.roots[0].classification").value("derived"))
            .andExpect(jsonPath("$.roots[0].rule").value("impacted"))
            .andExpect(jsonPath("$.roots[0].children[0].classification").value("base"));

        mvc.perform(get("/v1/trace/text").param("q", "impacted(/a)"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("impacted(/a) [DERIVED:impacted]")))
            .andExpect(content().string(containsString("  modified(/b) [BASE]")));

        mvc.perform(get("/v1/facts/stats"))
            .andExpect(jsonPath("$.total_facts").value(2))
            .andExpect(jsonPath("$.by_predicate.modified").value(1));
    }

    @Test
    void failedCompile_returnsDiagnostics() throws Exception {
        mvc.perform(post("/v1/programs/compile").contentType(MediaType.TEXT_PLAIN)
                .content("{\"format\":\"v1\",\"program\":{\"clauses\":[{\"head\":{\"pred\":\"p\","
                    + "\"args\":[{\"kind\":\"var\",\"value\":\"lower\"}]}}]}}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.diagnostics[0].path").value("program.clauses[0].head.args[0].value"))
            .andExpect(jsonPath("$.diagnostics[0].kind").value("schema"));
    }

    @Test
    void factTypeMismatch_isBadRequest() throws Exception {
        mvc.perform(post("/v1/facts").contentType(MediaType.APPLICATION_JSON)
                .content("{\"pred\":\"p\",\"args\":[{\"kind\":\"var\",\"value\":\"X\"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("FACT_TYPE_MISMATCH"));
    }

    @Test
    void missingPredicate_isInvalidArgument() throws Exception {
        mvc.perform(post("/v1/facts/loose").contentType(MediaType.APPLICATION_JSON).content("{\"args\":[1]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void malformedQuery_isInvalidQuery() throws Exception {
        mvc.perform(get("/v1/query").param("q", "impacted(X"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_QUERY"));
    }

    @Test
    void missingQueryParameter_isBadRequest() throws Exception {
        mvc.perform(get("/v1/query"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }

    @Test
    void clearingFacts_reportsHowManyWereRemoved() throws Exception {
        mvc.perform(post("/v1/facts/loose").contentType(MediaType.APPLICATION_JSON)
                .content("{\"pred\":\"p\",\"args\":[\"/alice\"]}"))
            .andExpect(status().isOk());
        mvc.perform(delete("/v1/facts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(1));
    }
}
