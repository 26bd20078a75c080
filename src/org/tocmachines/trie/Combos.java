/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import static org.tocmachines.trie.Misc.LS;
import static org.tocmachines.trie.Misc.pad;
import static org.tocmachines.trie.Misc.repeat;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The fighting game combo catalogue and helpers to display it.
 * <p>
 * Catalogue files hold one combo per line, <code>Label = SYM SYM ...</code>,
 * where each symbol is anything {@link Input#parse(String)} accepts. Blank
 * lines and lines starting with <code>#</code> are ignored.
 */
public final class Combos {

    private static final Logger logger = Logger.getLogger("org.tocmachines.trie");
    private static final Level level = Level.FINE;

    public static final String DEFAULT_RESOURCE = "/resources/combos.txt";

    private Combos() {
    } // never instantiated

    /**
     * @return a fresh copy of the bundled ten-combo catalogue.
     */
    public static PatternCatalogue<Input> defaultCatalogue() {
        return load(DEFAULT_RESOURCE, PatternCatalogue.DuplicatePolicy.LAST_WINS);
    }

    public static PatternCatalogue<Input> load(String resource,
            PatternCatalogue.DuplicatePolicy policy) {
        InputStream in = Combos.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("no such resource: " + resource);
        }
        try {
            try {
                PatternCatalogue<Input> ret = parse(new InputStreamReader(in, "UTF-8"), policy);
                logger.log(level, "loaded " + ret.size() + " combos from " + resource);
                return ret;
            } finally {
                in.close();
            }
        } catch (IOException e) {
            throw new RuntimeException("reading " + resource, e);
        }
    }

    public static PatternCatalogue<Input> parse(Reader reader,
            PatternCatalogue.DuplicatePolicy policy) throws IOException {
        PatternCatalogue<Input> ret = new PatternCatalogue<Input>(policy);
        BufferedReader br = new BufferedReader(reader);
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            ++lineNo;
            line = line.trim();
            if (line.length() == 0 || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("line " + lineNo + ": missing '=': " + line);
            }
            String label = line.substring(0, eq).trim();
            String body = line.substring(eq + 1).trim();
            List<Input> sequence = new ArrayList<Input>();
            if (body.length() > 0) {
                for (String word : body.split("\\s+")) {
                    Input in = Input.parse(word);
                    if (in == null) {
                        throw new IllegalArgumentException(
                            "line " + lineNo + ": unknown input '" + word + "'");
                    }
                    sequence.add(in);
                }
            }
            try {
                ret.add(label, sequence);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("line " + lineNo + ": " + e.getMessage(), e);
            }
        }
        return ret;
    }

    /**
     * Case insensitive lookup.
     * 
     * @return the combo, or <code>null</code>.
     */
    public static Pattern<Input> byName(PatternCatalogue<Input> catalogue, String name) {
        return catalogue.byLabel(name);
    }

    /**
     * @return the glyphs of <code>sequence</code>, space separated.
     */
    public static String display(List<Input> sequence) {
        StringBuilder sb = new StringBuilder();
        for (Input in : sequence) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(in.glyph());
        }
        return sb.toString();
    }

    /**
     * @return a printable, numbered table of the catalogue.
     */
    public static String table(PatternCatalogue<Input> catalogue) {
        String rule = repeat('=', 60);
        StringBuilder sb = new StringBuilder();
        sb.append(rule).append(LS);
        sb.append("COMBO LIST").append(LS);
        sb.append(rule).append(LS);
        pad(pad(pad(sb, "No", 5), "Inputs", 31), "Combo", 20);
        sb.append(LS).append(repeat('-', 60)).append(LS);
        int i = 0;
        for (Pattern<Input> p : catalogue.patterns()) {
            pad(pad(pad(sb, ++i, 5), display(p.sequence()), 31), p.label(), 20);
            sb.append(LS);
        }
        sb.append(rule).append(LS);
        sb.append("Total: ").append(catalogue.size()).append(" combos").append(LS);
        return sb.toString();
    }
}
