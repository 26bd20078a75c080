/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, non-empty symbol sequence and the label reported when a
 * {@link TrieMatcher} consumes all of it.
 * 
 * @param <S> the input symbol type
 */
public final class Pattern<S> {

    private final List<S> sequence;
    private final String label;

    public Pattern(String label, List<? extends S> sequence) {
        if (label == null || label.length() == 0) {
            throw new IllegalArgumentException("pattern label must not be empty");
        }
        if (sequence == null || sequence.isEmpty()) {
            throw new IllegalArgumentException("empty sequence for pattern '" + label + "'");
        }
        if (sequence.contains(null)) {
            throw new IllegalArgumentException("null symbol in pattern '" + label + "'");
        }
        this.label = label;
        this.sequence = Collections.unmodifiableList(new ArrayList<S>(sequence));
    }

    public static <S> Pattern<S> of(String label, S... sequence) {
        return new Pattern<S>(label, Arrays.asList(sequence));
    }

    public List<S> sequence() {
        return sequence;
    }

    public String label() {
        return label;
    }

    public int length() {
        return sequence.size();
    }

    /**
     * @return true if <code>prefix</code> is a (not necessarily strict)
     *         prefix of this pattern's sequence.
     */
    public boolean startsWith(List<?> prefix) {
        if (prefix.size() > sequence.size()) return false;
        for (int i = 0; i < prefix.size(); ++i) {
            if (!sequence.get(i).equals(prefix.get(i))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Pattern<?>)) return false;
        Pattern<?> other = (Pattern<?>) obj;
        return label.equals(other.label) && sequence.equals(other.sequence);
    }

    @Override
    public int hashCode() {
        return label.hashCode() * 31 + sequence.hashCode();
    }

    @Override
    public String toString() {
        return label + " = " + sequence;
    }
}
