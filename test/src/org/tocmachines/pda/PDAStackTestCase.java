/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import java.util.Arrays;

import junit.framework.TestCase;

public class PDAStackTestCase extends TestCase {

    private PDAStack stack;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PDAStackTestCase.class);
    }

    public PDAStackTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        stack = new PDAStack();
    }

    public void testFresh() {
        assertTrue(stack.isEmpty());
        assertEquals(0, stack.size());
        assertEquals("Z0", stack.peek());
        assertEquals(Arrays.asList("Z0"), stack.contents());
    }

    public void testPushPop() {
        stack.push("a");
        stack.push("b");
        assertFalse(stack.isEmpty());
        assertEquals(2, stack.size());
        assertEquals("b", stack.peek());
        assertEquals(Arrays.asList("Z0", "a", "b"), stack.contents());
        assertEquals("b", stack.pop());
        assertEquals("a", stack.pop());
        assertTrue(stack.isEmpty());
    }

    public void testPopBelowBottom() {
        assertNull(stack.pop());
        assertTrue(stack.isEmpty());
        assertEquals("Z0", stack.peek());
        assertTrue(stack.history().isEmpty());

        stack.push("a");
        stack.pop();
        assertNull(stack.pop());
        assertEquals(Arrays.asList("push:a", "pop:a"), stack.history());
    }

    public void testClear() {
        stack.push("a");
        stack.push("b");
        stack.clear();
        assertTrue(stack.isEmpty());
        assertTrue(stack.history().isEmpty());
        assertEquals("Stack: [Z0]", stack.toString());
    }

    public void testCustomBottom() {
        PDAStack s = new PDAStack("$");
        assertEquals("$", s.bottom());
        assertEquals("$", s.peek());
        try {
            new PDAStack("");
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            s.push(null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testSnapshotsAreDetached() {
        stack.push("a");
        java.util.List<String> snap = stack.contents();
        stack.push("b");
        assertEquals(2, snap.size());
        try {
            snap.add("c");
            fail();
        } catch (UnsupportedOperationException e) {
        }
    }
}
