/*
 * @LICENSE@
 */

/**
 * <h3>A generic pushdown automaton engine.</h3>
 * <p>
 * A {@link org.tocmachines.pda.PushdownAutomaton} is configured with named
 * states and guarded transitions, then driven one input symbol class at a
 * time. A transition fires when its source state matches, its input
 * {@link org.tocmachines.pda.Guard} accepts the symbol and its stack top guard
 * accepts the top of the {@link org.tocmachines.pda.PDAStack}. The first
 * declared such transition wins. Its {@link org.tocmachines.pda.StackAction}
 * then runs.
 * <p>
 * Bad input never throws. Each step returns a
 * {@link org.tocmachines.pda.StepResult} and a whole run returns a
 * {@link org.tocmachines.pda.ProcessResult}, both with a message. Bad
 * configuration (unknown states, two initial states) throws
 * {@link org.tocmachines.pda.PushdownAutomaton.ConstructionException}.
 * <p>
 * Steps are logged to the <code>org.tocmachines.pda</code> logger at
 * <code>FINEST</code>.
 */
package org.tocmachines.pda;
