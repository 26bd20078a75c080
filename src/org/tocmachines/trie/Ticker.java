/*
 * @LICENSE@
 */

package org.tocmachines.trie;

/**
 * Millisecond clock consulted by {@link ComboController}.
 */
public interface Ticker {

    long millis();

    Ticker SYSTEM = new Ticker() {
        public long millis() {
            return System.nanoTime() / 1000000L;
        }
    };
}
