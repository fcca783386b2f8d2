package com.logicsynth.api;

import com.logicsynth.facts.FactIngestionService;
import com.logicsynth.facts.FactStore;
import com.logicsynth.facts.FactStoreStats;
import com.logicsynth.facts.IngestedFact;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/facts")
public class FactController {

    private final FactIngestionService ingestion;
    private final FactStore store;

    public FactController(FactIngestionService ingestion, FactStore store) {
        this.ingestion = ingestion;
        this.store = store;
    }

    @PostMapping
    public IngestedFact add(@RequestBody FactRequest request) {
        return ingestion.addTagged(requirePredicate(request.pred()), request.args());
    }

    @PostMapping("/loose")
    public IngestedFact addLoose(@RequestBody LooseFactRequest request) {
        return ingestion.addLoose(requirePredicate(request.pred()), request.args());
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        int removed = store.size();
        store.clear();
        return Map.of("status", "cleared", "removed", removed);
    }

    @GetMapping("/stats")
    public FactStoreStats stats() {
        return store.stats();
    }

    private static String requirePredicate(String pred) {
        if (pred == null || pred.isBlank()) {
            throw new IllegalArgumentException("pred is required");
        }
        return pred;
    }
}
