/*
 * @LICENSE@
 */

package org.tocmachines.trie;

/**
 * Where the current finisher hold duration falls.
 */
public enum ChargeZone {
    /** finisher not held */
    NONE,
    /** releasing now gives a normal combo */
    NORMAL,
    /** between normal and super; releasing now still gives a normal combo */
    CHARGING,
    /** releasing now gives a super combo */
    SUPER,
    /** held too long; the attempt is cancelled */
    CANCEL
}
