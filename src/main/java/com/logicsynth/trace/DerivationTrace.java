package com.logicsynth.trace;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Proof trees for every answer to one query.
 */
public record DerivationTrace(
    @JsonProperty("query") String query,
    @JsonProperty("roots") List<DerivationNode> roots,
    @JsonProperty("duration_ms") long durationMs
) {

    public DerivationTrace {
        roots = List.copyOf(roots);
    }

    /**
     * Indented text, one fact per line:
     * <pre>
     * impacted(/a) [DERIVED:impacted]
     *   dependency_link(/a, /b, /import) [BASE]
     *   modified(/b) [BASE]
     * </pre>
     */
    public String renderText() {
        StringBuilder sb = new StringBuilder();
        for (DerivationNode root : roots) {
            render(root, 0, sb);
        }
        return sb.toString();
    }

    private static void render(DerivationNode node, int indent, StringBuilder sb) {
        sb.append("  ".repeat(indent)).append(node.fact()).append(" [");
        sb.append(node.classification().name());
        if (node.rule() != null) {
            sb.append(':').append(node.rule());
        }
        sb.append(']');
        if (node.marker() == Marker.CYCLE) {
            sb.append(" (cycle)");
        } else if (node.marker() == Marker.DEPTH_LIMIT) {
            sb.append(" (depth limit)");
        }
        sb.append('\n');
        for (DerivationNode child : node.children()) {
            render(child, indent + 1, sb);
        }
    }
}
