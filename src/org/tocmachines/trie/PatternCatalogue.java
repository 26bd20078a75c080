/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The ordered set of patterns a {@link TrieMatcher} is built from.
 * <p>
 * Patterns may share prefixes, and one sequence may be a strict prefix of
 * another (the shorter one is reported first and the cursor resets, so the
 * longer one is unreachable). Adding the exact same label and sequence twice
 * is always an error. Two different labels on one sequence are governed by
 * the catalogue's {@link DuplicatePolicy}.
 * 
 * @param <S> the input symbol type
 */
public final class PatternCatalogue<S> {

    private static final Logger logger = Logger.getLogger("org.tocmachines.trie");

    /**
     * What to do when a second label is registered for an already registered
     * sequence.
     */
    public enum DuplicatePolicy {
        /** The later label replaces the earlier one in the built trie. Logged. */
        LAST_WINS,
        /** Registration fails with an {@link IllegalArgumentException}. */
        REJECT
    }

    private final List<Pattern<S>> patterns = new ArrayList<Pattern<S>>();
    private final DuplicatePolicy policy;

    public PatternCatalogue() {
        this(DuplicatePolicy.LAST_WINS);
    }

    public PatternCatalogue(DuplicatePolicy policy) {
        if (policy == null) throw new IllegalArgumentException("null policy");
        this.policy = policy;
    }

    public PatternCatalogue<S> add(Pattern<S> pattern) {
        for (Pattern<S> p : patterns) {
            if (!p.sequence().equals(pattern.sequence())) continue;
            if (p.label().equals(pattern.label())) {
                throw new IllegalArgumentException("duplicate pattern: " + pattern);
            }
            if (policy == DuplicatePolicy.REJECT) {
                throw new IllegalArgumentException("sequence " + pattern.sequence()
                        + " of '" + pattern.label() + "' already registered as '"
                        + p.label() + "'");
            }
            logger.warning("'" + pattern.label() + "' overrides '" + p.label()
                    + "' for sequence " + pattern.sequence());
        }
        patterns.add(pattern);
        return this;
    }

    public PatternCatalogue<S> add(String label, S... sequence) {
        return add(Pattern.of(label, sequence));
    }

    public PatternCatalogue<S> add(String label, List<? extends S> sequence) {
        return add(new Pattern<S>(label, sequence));
    }

    /**
     * @return the patterns in registration order.
     */
    public List<Pattern<S>> patterns() {
        return Collections.unmodifiableList(patterns);
    }

    public DuplicatePolicy policy() {
        return policy;
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Case insensitive label lookup.
     * 
     * @return the first pattern with the label, or <code>null</code>.
     */
    public Pattern<S> byLabel(String label) {
        for (Pattern<S> p : patterns) {
            if (p.label().equalsIgnoreCase(label)) return p;
        }
        return null;
    }

    /**
     * @return the length of the longest pattern that starts with
     *         <code>prefix</code>, 0 if there is none.
     */
    int longestWithPrefix(List<?> prefix) {
        int max = 0;
        for (Pattern<S> p : patterns) {
            if (p.length() > max && p.startsWith(prefix)) {
                max = p.length();
            }
        }
        return max;
    }

    void log(Level level) {
        if (!logger.isLoggable(level)) return;
        StringBuilder sb = new StringBuilder("catalogue (" + policy + "):");
        for (Pattern<S> p : patterns) {
            sb.append(Misc.LS).append("    ").append(p);
        }
        logger.log(level, sb.toString());
    }
}
