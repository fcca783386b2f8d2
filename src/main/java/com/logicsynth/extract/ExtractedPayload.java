package com.logicsynth.extract;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A recovered document together with how it was found.
 *
 * @param document     the decoded object
 * @param fenced       whether a fenced code block was stripped on the way
 * @param envelopeDepth number of wrapper objects unwrapped to reach the document
 */
public record ExtractedPayload(ObjectNode document, boolean fenced, int envelopeDepth) {

    public String json() {
        return document.toString();
    }
}
