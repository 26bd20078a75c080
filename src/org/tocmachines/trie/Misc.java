/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.AbstractQueue;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Map;
import java.util.Queue;

/**
 * Static helpers and the generic digraph visitor used to walk tries.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static StringBuilder pad(StringBuilder sb, Object o, int width) {
        int mark = sb.length();
        sb.append(o);
        while (sb.length() - mark < width) {
            sb.append(' ');
        }
        return sb;
    }

    static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; ++i) sb.append(c);
        return sb.toString();
    }

    static final class IdentitySetQueue<E> extends AbstractQueue<E> {

        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            assert list.size() == map.size();
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, null);
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            assert map.containsKey(ret);
            map.remove(ret);
            return ret;
        }
    }

    /*
     * Generic digraph visitor
     */
    interface Vertex<E extends Edge<?>> {
        Iterable<E> edges();
    }

    interface Edge<V extends Vertex<?>> {
        V vertex();
    }

    static abstract class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        final Map<V, Void> black = new IdentityHashMap<V, Void>();
        final Queue<V> gray = new IdentitySetQueue<V>();
        V vertex;

        final BreadthFirstVisitor<V, E> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        protected V current() {
            return vertex;
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                black.put(vertex = gray.remove(), null);
                visit(vertex);
                for (E edge : vertex.edges()) {
                    if (black.containsKey(edge.vertex())) {
                        visit(edge, false);
                    } else {
                        visit(edge, gray.offer(edge.vertex()));
                    }
                }
            }
        }

        /*
         * in a trie every edge is a tree edge; the flag is kept for graphs
         * that share vertices
         */
        protected void visit(E edge, boolean tree) {}
        protected void visit(V vertex) {}
    }
}
