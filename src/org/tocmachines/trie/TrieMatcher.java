/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tocmachines.trie.Misc.BreadthFirstVisitor;

/**
 * Recognizes registered symbol sequences in a live input stream with a single
 * cursor over a prefix tree.
 * <p>
 * Nodes live in an arena indexed by id; the root is node 0. Each node owns the
 * map from symbol to child, kept in insertion order so that
 * {@link #possibleTransitions()} follows the catalogue's declaration order.
 * <p>
 * {@link #processInput(Object)} moves the cursor along the matching edge. A
 * symbol with no edge from the cursor restarts the attempt from the root if the
 * symbol begins some pattern, and otherwise resets. Reaching an accept node
 * reports its label and resets. The matcher knows nothing about time.
 * <p>
 * Not thread safe.
 * 
 * @param <S> the input symbol type
 */
public final class TrieMatcher<S> {

    private static final Logger logger = Logger.getLogger("org.tocmachines.trie");
    private static final Level level = Level.FINEST;

    static final class Node<S> implements Misc.Vertex<Arc<S>> {

        final int id;
        final Map<S, Node<S>> children = new LinkedHashMap<S, Node<S>>();
        final List<Arc<S>> arcs = new ArrayList<Arc<S>>();
        String label = null;

        Node(int id) {
            this.id = id;
        }

        boolean accept() {
            return label != null;
        }

        Node<S> child(S symbol) {
            return children.get(symbol);
        }

        public Iterable<Arc<S>> edges() {
            return arcs;
        }

        @Override
        public String toString() {
            return "q" + id + (accept() ? "[" + label + "]" : "");
        }
    }

    static final class Arc<S> implements Misc.Edge<Node<S>> {

        final S symbol;
        final Node<S> to;

        Arc(S symbol, Node<S> to) {
            this.symbol = symbol;
            this.to = to;
        }

        public Node<S> vertex() {
            return to;
        }
    }

    private final List<Node<S>> nodes = new ArrayList<Node<S>>();
    private final List<S> history = new ArrayList<S>();
    private PatternCatalogue<S> catalogue;
    private Node<S> current;

    public TrieMatcher(PatternCatalogue<S> catalogue) {
        build(catalogue);
    }

    /**
     * Discards the current trie and builds a new one from
     * <code>catalogue</code>. For two patterns with the same sequence the later
     * label wins; a catalogue with {@link PatternCatalogue.DuplicatePolicy#REJECT}
     * never contains such pairs.
     */
    public void build(PatternCatalogue<S> catalogue) {
        if (catalogue == null) throw new IllegalArgumentException("null catalogue");
        this.catalogue = catalogue;
        nodes.clear();
        Node<S> root = newNode();
        for (Pattern<S> p : catalogue.patterns()) {
            Node<S> node = root;
            for (S symbol : p.sequence()) {
                Node<S> next = node.child(symbol);
                if (next == null) {
                    next = newNode();
                    node.children.put(symbol, next);
                    node.arcs.add(new Arc<S>(symbol, next));
                }
                node = next;
            }
            node.label = p.label();
        }
        reset();
        if (logger.isLoggable(level)) {
            catalogue.log(level);
            logger.log(level, "trie: " + nodes.size() + " nodes" + Misc.LS + toDot());
        }
    }

    private Node<S> newNode() {
        Node<S> node = new Node<S>(nodes.size());
        nodes.add(node);
        return node;
    }

    private Node<S> root() {
        return nodes.get(0);
    }

    /**
     * Feeds one symbol.
     * 
     * @return the label of the pattern just completed, or <code>null</code>.
     */
    public String processInput(S symbol) {
        Node<S> next = current.child(symbol);
        if (next != null) {
            history.add(symbol);
        } else {
            next = root().child(symbol);
            if (next == null) {
                if (logger.isLoggable(level)) {
                    logger.log(level, "no transition for " + symbol + " from " + current + ", reset");
                }
                reset();
                return null;
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "restart from root on " + symbol + ", abandoning " + history);
            }
            history.clear();
            history.add(symbol);
        }
        current = next;
        if (current.accept()) {
            String ret = current.label;
            logger.log(level, "matched '" + ret + "'");
            reset();
            return ret;
        }
        return null;
    }

    /**
     * Returns the cursor to the root and forgets the consumed symbols.
     */
    public void reset() {
        current = root();
        history.clear();
    }

    public boolean hasTransition(S symbol) {
        return current.child(symbol) != null;
    }

    public int currentNodeId() {
        return current.id;
    }

    /**
     * @return the symbols with an edge out of the cursor node, in declaration
     *         order.
     */
    public List<S> possibleTransitions() {
        return Collections.unmodifiableList(new ArrayList<S>(current.children.keySet()));
    }

    /**
     * @return the symbols consumed in the current attempt.
     */
    public List<S> history() {
        return Collections.unmodifiableList(new ArrayList<S>(history));
    }

    /**
     * The consumed symbol count over the length of the longest pattern the
     * consumed symbols are a prefix of. Presentation only.
     * 
     * @return a value in [0, 1); 0 with nothing consumed.
     */
    public double progressFraction() {
        if (history.isEmpty()) return 0.0;
        int longest = catalogue.longestWithPrefix(history);
        return longest == 0 ? 0.0 : (double) history.size() / longest;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public PatternCatalogue<S> catalogue() {
        return catalogue;
    }

    /**
     * Exports the trie structure, nodes in breadth first order from the root.
     */
    public TrieDiagram diagram() {
        final List<TrieDiagram.NodeInfo> states = new ArrayList<TrieDiagram.NodeInfo>();
        final List<TrieDiagram.EdgeInfo> edges = new ArrayList<TrieDiagram.EdgeInfo>();
        final Map<Node<S>, String> paths = new LinkedHashMap<Node<S>, String>();
        paths.put(root(), "");
        new BreadthFirstVisitor<Node<S>, Arc<S>>() {
            @Override
            protected void visit(Node<S> node) {
                states.add(new TrieDiagram.NodeInfo(node.id, node.accept(), node.label,
                    paths.get(node)));
            }

            @Override
            protected void visit(Arc<S> arc, boolean tree) {
                assert tree : "trie nodes have one parent";
                String path = paths.get(current());
                paths.put(arc.to, path.length() == 0
                        ? String.valueOf(arc.symbol)
                        : path + " " + arc.symbol);
                edges.add(new TrieDiagram.EdgeInfo(current().id, arc.to.id,
                    String.valueOf(arc.symbol)));
            }
        }.start(root());
        assert states.size() == nodes.size();
        return new TrieDiagram(states, edges, root().id, nodes.size());
    }

    public String toDot() {
        return diagram().toDot();
    }

    @Override
    public String toString() {
        return "TrieMatcher[" + nodes.size() + " nodes, " + catalogue.size()
                + " patterns, at " + current + ", history " + history + "]";
    }
}
