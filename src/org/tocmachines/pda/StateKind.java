/*
 * @LICENSE@
 */

package org.tocmachines.pda;

/**
 * The role of a {@link State} with respect to acceptance. Only the kind of
 * the state the automaton is in at end of input decides acceptance.
 */
public enum StateKind {
    INITIAL,
    NORMAL,
    ACCEPTING,
    ERROR;
}
