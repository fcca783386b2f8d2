package com.logicsynth.api;

import com.logicsynth.compile.CompileResult;
import com.logicsynth.compile.ProgramAcceptService;
import com.logicsynth.compile.SynthesisCompiler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Compile and accept endpoints. The body is the raw model output, taken as text so the
 * extractor sees exactly what the model produced (fences, envelopes and all).
 *
 * A failed compile answers 422 with the diagnostics in the usual {@link CompileResult} shape.
 */
@RestController
@RequestMapping("/v1/programs")
public class ProgramController {

    private final SynthesisCompiler compiler;
    private final ProgramAcceptService acceptService;

    public ProgramController(SynthesisCompiler compiler, ProgramAcceptService acceptService) {
        this.compiler = compiler;
        this.acceptService = acceptService;
    }

    @PostMapping(value = "/compile", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<CompileResult> compile(@RequestBody(required = false) String raw) {
        return respond(compiler.compile(raw));
    }

    @PostMapping(value = "/accept", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<CompileResult> accept(@RequestBody(required = false) String raw) {
        return respond(acceptService.accept(raw));
    }

    @DeleteMapping("/session")
    public Map<String, Object> reset() {
        acceptService.reset();
        return Map.of("status", "cleared");
    }

    private static ResponseEntity<CompileResult> respond(CompileResult result) {
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }
}
