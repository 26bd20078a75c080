/*
 * @LICENSE@
 */

package org.tocmachines.trie;

/**
 * Controller inputs: four directions and the finisher.
 */
public enum Input {
    UP("↑"), DOWN("↓"), LEFT("←"), RIGHT("→"), SPACE("␣");

    private final String glyph;

    Input(String glyph) {
        this.glyph = glyph;
    }

    public String glyph() {
        return glyph;
    }

    /**
     * Parses a name (<code>RIGHT</code>, case insensitive), its one letter
     * abbreviation (<code>R</code>) or its glyph (<code>→</code>).
     * 
     * @return the input, or <code>null</code> if the word means nothing.
     */
    public static Input parse(String word) {
        for (Input in : values()) {
            if (in.name().equalsIgnoreCase(word)
                    || in.glyph.equals(word)
                    || (word.length() == 1 && in.name().charAt(0) == Character.toUpperCase(word.charAt(0)))) {
                return in;
            }
        }
        return null;
    }
}
