package com.logicsynth.api;

import com.logicsynth.query.QueryResult;
import com.logicsynth.query.QueryService;
import com.logicsynth.trace.DerivationTrace;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * GET /v1/query?q=impacted(X)&timeoutMs=500
 * GET /v1/trace?q=impacted(/a)
 * GET /v1/trace/text?q=impacted(/a)
 *
 * A missing or non-positive timeout falls back to {@code logicsynth.query.timeout}.
 */
@RestController
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/v1/query")
    public QueryResult query(@RequestParam("q") String query,
                             @RequestParam(required = false) Long timeoutMs) {
        return queryService.query(query, timeout(timeoutMs));
    }

    @GetMapping("/v1/trace")
    public DerivationTrace trace(@RequestParam("q") String query,
                                 @RequestParam(required = false) Long timeoutMs) {
        return queryService.trace(query, timeout(timeoutMs));
    }

    @GetMapping(value = "/v1/trace/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public String traceText(@RequestParam("q") String query,
                            @RequestParam(required = false) Long timeoutMs) {
        return queryService.trace(query, timeout(timeoutMs)).renderText();
    }

    private static Duration timeout(Long timeoutMs) {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
