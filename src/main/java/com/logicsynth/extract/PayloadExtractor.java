package com.logicsynth.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers a synthesis document from free-form model output.
 *
 * Stages, each a fallback for the previous one:
 * 1. strip an enclosing fenced code block;
 * 2. locate the balanced top-level {...} objects, ignoring braces inside string literals;
 * 3. decode them directly, preferring the first that carries document or envelope fields;
 * 4. if it is not a document but a known envelope, recurse into the envelope field,
 *    whose value may itself be fenced or string-encoded a second time.
 *
 * Pure: no state is kept between calls.
 */
@Component
public class PayloadExtractor {

    private static final Logger log = LoggerFactory.getLogger(PayloadExtractor.class);

    static final List<String> ENVELOPE_FIELDS = List.of(
        "surface_response", "payload", "content", "response", "document", "spec");

    private static final List<String> DOCUMENT_FIELDS = List.of("format", "program");

    private static final int MAX_ENVELOPE_DEPTH = 4;

    private static final String FENCE = "```";

    private final JsonMapper mapper = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
        .build();

    public ExtractedPayload extract(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PayloadExtractionException(ExtractionFailure.EMPTY_INPUT, null);
        }
        return extractText(raw, 0, false);
    }

    private ExtractedPayload extractText(String raw, int depth, boolean fencedSoFar) {
        String text = raw.trim();
        if (text.isEmpty()) {
            throw new PayloadExtractionException(ExtractionFailure.EMPTY_INPUT, "envelope field is empty");
        }

        boolean fenced = fencedSoFar;
        String unfenced = stripFence(text);
        if (unfenced != null) {
            log.debug("Stripped fenced block at envelope depth {}", depth);
            text = unfenced;
            fenced = true;
        }

        // doubly encoded: the whole text is a JSON string literal holding the document
        if (text.startsWith("\"") && text.endsWith("\"") && depth < MAX_ENVELOPE_DEPTH) {
            String decoded = decodeStringLiteral(text);
            if (decoded != null) {
                return extractText(decoded, depth + 1, fenced);
            }
        }

        List<String> candidates = objectCandidates(text);
        if (candidates.isEmpty()) {
            throw new PayloadExtractionException(ExtractionFailure.NO_OBJECT_FOUND, "no balanced object in input");
        }

        // prose may hold stray braces: take the first candidate that looks like a document or
        // envelope, else the first one that decodes at all
        ObjectNode fallback = null;
        String lastError = "payload is not an object";
        for (String candidate : candidates) {
            JsonNode node;
            try {
                node = mapper.readTree(candidate);
            } catch (JsonProcessingException ex) {
                log.debug("Direct decode failed at envelope depth {}: {}", depth, ex.getOriginalMessage());
                lastError = "object could not be decoded: " + ex.getOriginalMessage();
                continue;
            }
            if (!(node instanceof ObjectNode object)) {
                continue;
            }
            if (isDocument(object) || isEnvelope(object)) {
                return extractNode(object, depth, fenced);
            }
            if (fallback == null) {
                fallback = object;
            }
        }
        if (fallback == null) {
            throw new PayloadExtractionException(ExtractionFailure.NO_OBJECT_FOUND, lastError);
        }
        return extractNode(fallback, depth, fenced);
    }

    private ExtractedPayload extractNode(ObjectNode object, int depth, boolean fenced) {
        if (isDocument(object) || depth >= MAX_ENVELOPE_DEPTH) {
            return new ExtractedPayload(object, fenced, depth);
        }
        for (String field : ENVELOPE_FIELDS) {
            JsonNode inner = object.get(field);
            if (inner == null) {
                continue;
            }
            try {
                if (inner instanceof ObjectNode innerObject) {
                    log.debug("Unwrapping envelope field '{}' (object)", field);
                    return extractNode(innerObject, depth + 1, fenced);
                }
                if (inner.isTextual()) {
                    log.debug("Unwrapping envelope field '{}' (text)", field);
                    return extractText(inner.asText(), depth + 1, fenced);
                }
            } catch (PayloadExtractionException ex) {
                log.debug("Envelope field '{}' held no document: {}", field, ex.getMessage());
            }
        }
        // not a recognised document or envelope; the validator reports what is missing
        return new ExtractedPayload(object, fenced, depth);
    }

    private boolean isDocument(ObjectNode object) {
        return DOCUMENT_FIELDS.stream().anyMatch(object::has);
    }

    private boolean isEnvelope(ObjectNode object) {
        return ENVELOPE_FIELDS.stream().anyMatch(object::has);
    }

    private String decodeStringLiteral(String text) {
        try {
            return mapper.readValue(text, String.class);
        } catch (JsonProcessingException ex) {
            log.debug("Quoted text is not a JSON string literal: {}", ex.getOriginalMessage());
            return null;
        }
    }

    /**
     * Returns the interior of a fenced block that opens before any brace, or null.
     * A fence that only appears inside a quoted field is left for the envelope stage.
     */
    static String stripFence(String text) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return null;
        }
        int brace = text.indexOf('{');
        if (brace >= 0 && brace < open) {
            return null;
        }
        int lineEnd = text.indexOf('\n', open);
        if (lineEnd < 0) {
            return null;
        }
        int close = text.indexOf(FENCE, lineEnd);
        if (close < 0) {
            // unterminated fence: take everything after the opening line
            return text.substring(lineEnd + 1).trim();
        }
        return text.substring(lineEnd + 1, close).trim();
    }

    /**
     * Balanced top-level objects in order of appearance. Braces inside string literals,
     * including escaped quotes, do not count; an unbalanced brace is skipped.
     */
    static List<String> objectCandidates(String text) {
        List<String> out = new ArrayList<>();
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = matchBrace(text, start);
            if (end > 0) {
                out.add(text.substring(start, end + 1));
                start = text.indexOf('{', end + 1);
            } else {
                start = text.indexOf('{', start + 1);
            }
        }
        return out;
    }

    private static int matchBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
