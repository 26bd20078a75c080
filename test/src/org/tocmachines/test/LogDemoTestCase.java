/*
 * @LICENSE@
 */

package org.tocmachines.test;

import java.io.File;
import java.util.logging.Level;

import org.tocmachines.AbstractAutomataTestCase;
import org.tocmachines.notation.ExpressionConverter;
import org.tocmachines.notation.ExpressionValidator;
import org.tocmachines.notation.Notation;
import org.tocmachines.trie.Combos;
import org.tocmachines.trie.Input;
import org.tocmachines.trie.TrieMatcher;

/**
 * Runs the automata with FINEST logging into <code>log/LogDemoTestCase/</code>,
 * for reading the step traces and dot output.
 */
public class LogDemoTestCase extends AbstractAutomataTestCase {

    public LogDemoTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logToFile(Level.FINEST);
    }

    private void assertLogged() {
        File f = new File("log" + File.separator + getClass().getSimpleName()
                + File.separator + getName() + ".log");
        assertTrue(f.getPath(), f.exists());
    }

    public void testInfixTrace() {
        new ExpressionValidator().validate("((1+2)*(3-4))/5", Notation.INFIX);
        assertLogged();
    }

    public void testConversions() {
        ExpressionConverter c = new ExpressionConverter();
        c.convertToAll("9 8 / 7 6 * +", Notation.POSTFIX);
        c.convertToAll("- 5 / 3 1", Notation.PREFIX);
        assertLogged();
    }

    public void testComboTrie() {
        TrieMatcher<Input> m = new TrieMatcher<Input>(Combos.defaultCatalogue());
        m.processInput(Input.LEFT);
        m.processInput(Input.UP);
        m.processInput(Input.DOWN);
        assertLogged();
    }

    public void testPdaDiagrams() {
        ExpressionValidator v = new ExpressionValidator();
        for (Notation n : Notation.values()) {
            logger.log(level, v.pdaFor(n).diagram().toDot());
        }
        assertLogged();
    }
}
