/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import java.util.List;

/**
 * Small static helpers shared by the automaton classes.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    public static final String EPSILON = "ε";

    /*
     * top of stack first, the way (q, w, gamma) triples are written
     */
    static String stackString(List<String> contents) {
        StringBuilder sb = new StringBuilder();
        for (int i = contents.size() - 1; i >= 0; --i) {
            sb.append(contents.get(i));
        }
        return sb.toString();
    }
}
