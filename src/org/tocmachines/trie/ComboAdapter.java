/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.List;

/**
 * No-op {@link ComboListener}, for overriding only the events of interest.
 */
public abstract class ComboAdapter implements ComboListener {

    public void comboDetected(String label, boolean charged) {}

    public void inputReceived(Input input) {}

    public void timedOut() {}

    public void stateChanged(int nodeId, List<Input> possible) {}

    public void chargeUpdated(double progress) {}

    public void freezeEnded() {}

    public void comboCancelled() {}
}
