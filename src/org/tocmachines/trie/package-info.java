/*
 * @LICENSE@
 */

/**
 * Trie based recognition of symbol sequences, and a fighting game combo
 * detector built on it.
 * <p>
 * {@link org.tocmachines.trie.TrieMatcher} is alphabet agnostic and untimed.
 * {@link org.tocmachines.trie.ComboController} adds the input timeout, the
 * charged finisher and the post-combo freeze on top of it, reading time from
 * an injectable {@link org.tocmachines.trie.Ticker}.
 */
package org.tocmachines.trie;
