/*
 * @LICENSE@
 */

package org.tocmachines;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractAutomataTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.tocmachines.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled) {
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    public AbstractAutomataTestCase(String name) {
        super(name);
    }

    private final Logger rootLogger = Logger.getLogger("org.tocmachines");
    private Handler fileHandler = null;
    private Level savedLevel = null;

    /**
     * Sends everything the automata log at <code>level</code> or above to this
     * test's own file; see {@link LogFileHandler}.
     */
    protected void logToFile(Level level) {
        if (fileHandler != null) return;
        try {
            fileHandler = new LogFileHandler(getClass().getSimpleName(), getName());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        fileHandler.setLevel(level);
        savedLevel = rootLogger.getLevel();
        rootLogger.setLevel(level);
        rootLogger.addHandler(fileHandler);
    }

    protected void logToFile() {
        logToFile(level);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(getClass().getSimpleName(), getName());
    }

    protected void tearDown() throws Exception {
        if (fileHandler != null) {
            fileHandler.flush();
            fileHandler.close();
            rootLogger.removeHandler(fileHandler);
            rootLogger.setLevel(savedLevel);
            fileHandler = null;
        }
        logger.exiting(getClass().getSimpleName(), getName());
        super.tearDown();
        result.delete(0, result.length());
    }

    protected final StringBuilder result = new StringBuilder();
}
