/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.List;

/**
 * Receives {@link ComboController} events. All calls happen on the thread
 * driving the controller, from inside <code>keyDown</code>, <code>keyUp</code>,
 * <code>update</code> or <code>reset</code>.
 * 
 * @see ComboAdapter
 */
public interface ComboListener {

    /**
     * @param label the combo label, prefixed with <code>"SUPER "</code> when
     *            charged
     */
    void comboDetected(String label, boolean charged);

    void inputReceived(Input input);

    /**
     * The attempt was reset because inputs came too far apart (or by an
     * explicit reset).
     */
    void timedOut();

    void stateChanged(int nodeId, List<Input> possible);

    /**
     * @param progress hold duration over the charge maximum, capped at 1
     */
    void chargeUpdated(double progress);

    void freezeEnded();

    /**
     * The finisher was held past the charge maximum.
     */
    void comboCancelled();
}
