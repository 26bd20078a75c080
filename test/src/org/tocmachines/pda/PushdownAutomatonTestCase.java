/*
 * @LICENSE@
 */

package org.tocmachines.pda;

import static org.tocmachines.pda.Guard.any;
import static org.tocmachines.pda.Guard.of;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;

import org.tocmachines.AbstractAutomataTestCase;

/**
 * Exercises the engine with a balanced parentheses recognizer over
 * {@link Sym} and a few purpose built tables.
 */
public class PushdownAutomatonTestCase extends AbstractAutomataTestCase {

    enum Sym { OPEN, CLOSE, OTHER }

    private PushdownAutomaton<Sym> pda;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PushdownAutomatonTestCase.class);
    }

    public PushdownAutomatonTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        pda = new PushdownAutomaton<Sym>("balanced");
        pda.addState("q0", StateKind.INITIAL, "outside");
        pda.addState("q1", StateKind.NORMAL, "inside");
        pda.addState("ok", StateKind.ACCEPTING);
        pda.addState("err", StateKind.ERROR);
        pda.addTransition("q0", "q1", of(Sym.OPEN), any(), StackAction.push("("));
        pda.addTransition("q1", "q1", of(Sym.OPEN), any(), StackAction.push("("));
        pda.addTransition("q1", "q1", of(Sym.CLOSE), of("("), StackAction.pop());
        pda.addTransition("q1", "ok", Guard.<Sym>any(), of("Z0"), StackAction.none(), "epsilon to accept");
    }

    private static List<Sym> syms(Sym... s) {
        return Arrays.asList(s);
    }

    public void testAccepts() {
        logToFile(Level.FINEST);
        // the trailing OTHER drives the wildcard edge once the stack is back at Z0
        ProcessResult r = pda.process(syms(Sym.OPEN, Sym.OPEN, Sym.CLOSE, Sym.CLOSE, Sym.OTHER));
        assertTrue(r.message(), r.accepted());
        assertEquals("Input accepted", r.message());
        assertEquals("ok", r.finalState().name());
        assertEquals(5, r.trace().size());
        assertTrue(pda.isAccepting());
        assertTrue(pda.stackEmpty());
    }

    public void testAcceptingMidStreamIsNotAcceptance() {
        pda.addTransition("ok", "q1", of(Sym.OPEN), any(), StackAction.push("("));
        ProcessResult r = pda.process(syms(Sym.OPEN, Sym.CLOSE, Sym.OTHER, Sym.OPEN));
        assertFalse(r.accepted());
        assertEquals("Ended in non-accepting state 'q1'", r.message());
    }

    public void testNoTransition() {
        StepResult r = pda.step(Sym.CLOSE);
        assertFalse(r.success());
        assertEquals("No valid transition for input 'CLOSE' in state 'q0'", r.message());
        assertEquals("err", pda.currentState().name());

        ProcessResult pr = pda.process(syms(Sym.OPEN, Sym.OTHER, Sym.OTHER));
        assertFalse(pr.accepted());
        assertEquals("err", pr.finalState().name());
        assertTrue(pr.message(), pr.message().startsWith("No valid transition"));
    }

    public void testFirstDeclaredWins() {
        PushdownAutomaton<Sym> p = new PushdownAutomaton<Sym>("order");
        p.addState("s", StateKind.INITIAL);
        p.addState("a", StateKind.ACCEPTING);
        p.addState("b", StateKind.NORMAL);
        p.addTransition("s", "a", Guard.<Sym>any(), any(), StackAction.none());
        p.addTransition("s", "b", of(Sym.OPEN), any(), StackAction.none());
        assertTrue(p.step(Sym.OPEN).success());
        assertEquals("a", p.currentState().name());

        PushdownAutomaton<Sym> q = new PushdownAutomaton<Sym>("order2");
        q.addState("s", StateKind.INITIAL);
        q.addState("a", StateKind.ACCEPTING);
        q.addState("b", StateKind.NORMAL);
        q.addTransition("s", "b", of(Sym.OPEN), any(), StackAction.none());
        q.addTransition("s", "a", Guard.<Sym>any(), any(), StackAction.none());
        assertTrue(q.step(Sym.OPEN).success());
        assertEquals("b", q.currentState().name());
        q.reset();
        assertTrue(q.step(Sym.CLOSE).success());
        assertEquals("a", q.currentState().name());
    }

    public void testFailedPopKeepsBottom() {
        PushdownAutomaton<Sym> p = new PushdownAutomaton<Sym>("pop");
        p.addState("s", StateKind.INITIAL);
        p.addState("e", StateKind.ERROR);
        p.addTransition("s", "s", of(Sym.CLOSE), any(), StackAction.pop());
        p.addTransition("s", "s", of(Sym.OTHER), any(), StackAction.replace("x"));
        StepResult r = p.step(Sym.CLOSE);
        assertFalse(r.success());
        assertEquals("Stack action 'pop' failed in state 's': stack is empty", r.message());
        assertTrue(p.stackEmpty());
        assertEquals("e", p.currentState().name());

        p.reset();
        r = p.step(Sym.OTHER);
        assertFalse(r.success());
        assertTrue(p.stackEmpty());
        assertEquals(Collections.singletonList("Z0"), p.stackContents());
    }

    public void testReplace() {
        PushdownAutomaton<Sym> p = new PushdownAutomaton<Sym>("replace");
        p.addState("s", StateKind.INITIAL);
        p.addTransition("s", "s", of(Sym.OPEN), any(), StackAction.push("a"));
        p.addTransition("s", "s", of(Sym.OTHER), of("a"), StackAction.replace("b"));
        assertTrue(p.step(Sym.OPEN).success());
        assertTrue(p.step(Sym.OTHER).success());
        assertEquals(Arrays.asList("Z0", "b"), p.stackContents());
        assertEquals(Arrays.asList("push:a", "pop:a", "push:b"), p.stackHistory());
        // no error state: a failed step leaves the current state alone
        StepResult r = p.step(Sym.OTHER);
        assertFalse(r.success());
        assertEquals("s", p.currentState().name());
    }

    public void testResetAndHistory() {
        pda.step(Sym.OPEN);
        pda.step(Sym.OPEN);
        assertEquals(2, pda.executionHistory().size());
        assertEquals(2, pda.transitionHistory().size());
        assertEquals("(q0, OPEN, Z0)", pda.executionHistory().get(0).toString());
        assertEquals("(q1, OPEN, (Z0)", pda.executionHistory().get(1).toString());
        assertEquals(2, pda.stackSize());
        pda.reset();
        assertEquals("q0", pda.currentState().name());
        assertTrue(pda.stackEmpty());
        assertTrue(pda.executionHistory().isEmpty());
        assertTrue(pda.transitionHistory().isEmpty());
    }

    public void testConstructionErrors() {
        try {
            pda.addState("q0", StateKind.NORMAL);
            fail();
        } catch (PushdownAutomaton.ConstructionException e) {
        }
        try {
            pda.addState("q9", StateKind.INITIAL);
            fail();
        } catch (PushdownAutomaton.ConstructionException e) {
        }
        try {
            pda.addTransition("q0", "nowhere", of(Sym.OPEN), any(), StackAction.none());
            fail();
        } catch (PushdownAutomaton.ConstructionException e) {
        }
        try {
            new PushdownAutomaton<Sym>("empty").step(Sym.OPEN);
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void testAlphabetsAndDiagram() {
        assertEquals(2, pda.inputAlphabet().size());
        assertTrue(pda.inputAlphabet().contains(Sym.OPEN));
        assertTrue(pda.stackAlphabet().contains("Z0"));
        assertTrue(pda.stackAlphabet().contains("("));

        PDADiagram d = pda.diagram();
        assertEquals("balanced", d.name());
        assertEquals(4, d.states().size());
        assertTrue(d.states().get(0).initial);
        assertTrue(d.states().get(2).accepting);
        assertEquals(4, d.transitions().size());
        PDADiagram.TransitionInfo close = d.transitions().get(2);
        assertEquals("q1", close.from);
        assertEquals("CLOSE, ( -> pop", close.label);
        String dot = d.toDot();
        assertTrue(dot, dot.startsWith("digraph"));
        assertTrue(dot, dot.contains("q1"));
    }
}
