package com.logicsynth.compile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicsynth.contract.CompileOptions;
import com.logicsynth.contract.Diagnostic;
import com.logicsynth.contract.ProgramSpecValidator;
import com.logicsynth.contract.SynthesisDocument;
import com.logicsynth.contract.ValidationResult;
import com.logicsynth.extract.ExtractedPayload;
import com.logicsynth.extract.PayloadExtractionException;
import com.logicsynth.extract.PayloadExtractor;
import com.logicsynth.grammar.RoundTripVerifier;
import com.logicsynth.render.ProgramRenderer;
import com.logicsynth.render.RenderedProgram;
import com.logicsynth.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns untrusted model output into verified rule text:
 * extract → decode → validate → render → round-trip verify.
 *
 * Every failure comes back as diagnostics inside a failed {@link CompileResult};
 * nothing is thrown to the caller. Stateless.
 */
@Service
public class SynthesisCompiler {

    private static final Logger log = LoggerFactory.getLogger(SynthesisCompiler.class);

    private final PayloadExtractor extractor;
    private final ObjectMapper objectMapper;
    private final ProgramSpecValidator validator;
    private final ProgramRenderer renderer;
    private final RoundTripVerifier verifier;
    private final CompileOptions defaultOptions;

    public SynthesisCompiler(PayloadExtractor extractor,
                             ObjectMapper objectMapper,
                             ProgramSpecValidator validator,
                             ProgramRenderer renderer,
                             RoundTripVerifier verifier,
                             CompileOptions defaultOptions) {
        this.extractor = extractor;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.renderer = renderer;
        this.verifier = verifier;
        this.defaultOptions = defaultOptions;
    }

    public CompileResult compile(String raw) {
        return compile(raw, defaultOptions, SchemaRegistry.empty());
    }

    public CompileResult compile(String raw, SchemaRegistry schema) {
        return compile(raw, defaultOptions, schema);
    }

    public CompileResult compile(String raw, CompileOptions options, SchemaRegistry schema) {
        ExtractedPayload payload;
        try {
            payload = extractor.extract(raw);
        } catch (PayloadExtractionException ex) {
            log.warn("Extraction failed: {}", ex.getMessage());
            return CompileResult.failed(List.of(Diagnostic.decode("", ex.getMessage())));
        }
        if (payload.envelopeDepth() > 0 || payload.fenced()) {
            log.debug("Recovered document (fenced={}, envelopeDepth={})", payload.fenced(), payload.envelopeDepth());
        }

        SynthesisDocument document;
        try {
            document = objectMapper.treeToValue(payload.document(), SynthesisDocument.class);
        } catch (JsonProcessingException ex) {
            Diagnostic diagnostic = Diagnostic.decode(pathOf(ex), ex.getOriginalMessage());
            log.warn("Rejected synthesis document: {}", diagnostic);
            return CompileResult.failed(List.of(diagnostic));
        }

        ValidationResult validation = validator.validate(document, options, schema);
        if (!validation.valid()) {
            log.warn("Rejected synthesis document with {} diagnostic(s), first: {}",
                validation.diagnostics().size(), validation.diagnostics().get(0));
            return CompileResult.failed(validation.diagnostics());
        }

        RenderedProgram rendered = renderer.render(validation.program());
        List<Diagnostic> grammar = verifier.verify(validation.program(), rendered);
        if (!grammar.isEmpty()) {
            log.warn("Rendered program failed verification with {} diagnostic(s), first: {}",
                grammar.size(), grammar.get(0));
            return CompileResult.failed(grammar);
        }

        log.info("Compiled program with {} declaration(s) and {} clause(s)",
            rendered.decls().size(), rendered.clauses().size());
        return CompileResult.succeeded(validation.program(), rendered);
    }

    /** Renders Jackson's reference chain in the same dotted form the validator uses. */
    static String pathOf(JsonProcessingException ex) {
        if (!(ex instanceof JsonMappingException mapping)) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : mapping.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }
}
