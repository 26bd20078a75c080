/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import static org.tocmachines.trie.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structural snapshot of a {@link TrieMatcher} for rendering.
 */
public final class TrieDiagram {

    public static final class NodeInfo {
        public final int id;
        public final boolean accept;
        /** null unless {@link #accept} */
        public final String label;
        /** symbols from the root, space separated */
        public final String path;

        NodeInfo(int id, boolean accept, String label, String path) {
            this.id = id;
            this.accept = accept;
            this.label = label;
            this.path = path;
        }

        @Override
        public String toString() {
            return "q" + id + (accept ? " [" + label + "]" : "") + " <" + path + ">";
        }
    }

    public static final class EdgeInfo {
        public final int from;
        public final int to;
        public final String input;

        EdgeInfo(int from, int to, String input) {
            this.from = from;
            this.to = to;
            this.input = input;
        }

        @Override
        public String toString() {
            return "q" + from + " -" + input + "-> q" + to;
        }
    }

    private final List<NodeInfo> nodes;
    private final List<EdgeInfo> edges;
    private final int initial;
    private final int total;

    TrieDiagram(List<NodeInfo> nodes, List<EdgeInfo> edges, int initial, int total) {
        this.nodes = Collections.unmodifiableList(new ArrayList<NodeInfo>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<EdgeInfo>(edges));
        this.initial = initial;
        this.total = total;
    }

    public List<NodeInfo> nodes() {
        return nodes;
    }

    public List<EdgeInfo> edges() {
        return edges;
    }

    public int initial() {
        return initial;
    }

    public int total() {
        return total;
    }

    /**
     * @return a GraphViz digraph; accept nodes are double circles labelled
     *         with their pattern.
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph trie {").append(LS);
        sb.append("    rankdir=LR;").append(LS);
        sb.append("    start [shape=point];").append(LS);
        for (NodeInfo n : nodes) {
            sb.append("    q").append(n.id).append(" [shape=")
                .append(n.accept ? "doublecircle" : "circle");
            if (n.accept) {
                sb.append(", label=\"q").append(n.id).append("\\n")
                    .append(n.label.replace("\"", "\\\"")).append('"');
            }
            sb.append("];").append(LS);
        }
        sb.append("    start -> q").append(initial).append(';').append(LS);
        for (EdgeInfo e : edges) {
            sb.append("    q").append(e.from).append(" -> q").append(e.to)
                .append(" [label=\"").append(e.input).append("\"];").append(LS);
        }
        sb.append('}').append(LS);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TrieDiagram[" + total + " nodes, initial q" + initial + "]" + LS
                + nodes + LS + edges;
    }
}
