/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the timing rules of a fighting game to a {@link TrieMatcher} over
 * {@link Input}s. The matcher sees only discrete symbols; every timestamp lives
 * here and is read from a {@link Ticker}.
 * <p>
 * Rules:
 * <ul>
 * <li>a direction arriving more than {@link ComboTiming#timeout()} after the
 * previous input first resets the attempt;</li>
 * <li>{@link Input#SPACE} is the finisher. Pressing it is ignored unless it is
 * a valid next symbol, and it is fed to the matcher on release. The hold
 * duration decides the outcome: up to {@link ComboTiming#chargeMin()} a normal
 * combo, from there to {@link ComboTiming#chargeMax()} a
 * <code>"SUPER "</code> combo, beyond that the attempt is cancelled. The
 * timeout clock stops while the finisher is held;</li>
 * <li>after a combo all input is ignored for {@link ComboTiming#freeze()}.</li>
 * </ul>
 * Time based transitions (timeout, over-hold, end of freeze) happen in
 * {@link #update()}, which the host calls once per frame.
 * <p>
 * Not thread safe.
 */
public final class ComboController {

    private static final Logger logger = Logger.getLogger("org.tocmachines.trie");
    private static final Level level = Level.FINER;

    public static final String SUPER_PREFIX = "SUPER ";

    private static final long NEVER = Long.MIN_VALUE;

    private final TrieMatcher<Input> matcher;
    private final ComboTiming timing;
    private final Ticker ticker;
    private final List<ComboListener> listeners = new ArrayList<ComboListener>();

    private long lastInputTime = NEVER;
    private long spacePressTime = NEVER;
    private boolean spaceHeld = false;

    private boolean frozen = false;
    private long freezeStart = NEVER;
    private int frozenNodeId = 0;
    private List<Input> frozenHistory = new ArrayList<Input>();

    private final List<Input> displayHistory = new ArrayList<Input>();

    /**
     * A controller over the bundled combo catalogue with timing from
     * {@link ComboTiming#load()} and the system clock.
     */
    public ComboController() {
        this(new TrieMatcher<Input>(Combos.defaultCatalogue()), ComboTiming.load(), Ticker.SYSTEM);
    }

    public ComboController(TrieMatcher<Input> matcher, ComboTiming timing, Ticker ticker) {
        this.matcher = matcher;
        this.timing = timing;
        this.ticker = ticker;
    }

    public void addListener(ComboListener l) {
        listeners.add(l);
    }

    public void removeListener(ComboListener l) {
        listeners.remove(l);
    }

    public TrieMatcher<Input> matcher() {
        return matcher;
    }

    public ComboTiming timing() {
        return timing;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean isSpaceHeld() {
        return spaceHeld;
    }

    /**
     * @return whether pressing the finisher now would be accepted.
     */
    public boolean isSpaceAvailable() {
        return !frozen && matcher.hasTransition(Input.SPACE);
    }

    /**
     * A key went down.
     * 
     * @return the label of a combo completed by this key, <code>null</code>
     *         otherwise (always for {@link Input#SPACE}, whose combo completes
     *         on release).
     */
    public String keyDown(Input key) {
        if (frozen) return null;
        long now = ticker.millis();

        if (key == Input.SPACE) {
            // key repeat while held must not restart the charge
            if (spaceHeld || !isSpaceAvailable()) return null;
            spacePressTime = now;
            spaceHeld = true;
            logger.log(level, "finisher down");
            return null;
        }

        if (lastInputTime != NEVER && now - lastInputTime > timing.timeout()) {
            logger.log(level, "timeout before " + key);
            resetWithCallback();
        }
        return feed(key, now, false);
    }

    /**
     * A key came up. Only the release of a held finisher does anything.
     * 
     * @return the combo label completed by the release, prefixed with
     *         {@link #SUPER_PREFIX} when charged, or <code>null</code>.
     */
    public String keyUp(Input key) {
        if (frozen) {
            spaceHeld = false;
            return null;
        }
        if (key != Input.SPACE || !spaceHeld) return null;

        long now = ticker.millis();
        long held = now - spacePressTime;
        spaceHeld = false;

        if (held > timing.chargeMax()) {
            cancel(held);
            return null;
        }
        return feed(Input.SPACE, now, timing.chargeMin() <= held);
    }

    private String feed(Input key, long now, boolean charged) {
        lastInputTime = now;
        displayHistory.add(key);
        for (ComboListener l : listeners) l.inputReceived(key);

        String result = matcher.processInput(key);
        notifyStateChange();
        if (result == null) return null;

        String label = charged ? SUPER_PREFIX + result : result;
        logger.log(level, "combo: " + label);
        startFreeze(now);
        for (ComboListener l : listeners) l.comboDetected(label, charged);
        return label;
    }

    private void cancel(long held) {
        logger.log(level, "finisher held " + held + "ms, cancelled");
        resetWithCallback();
        for (ComboListener l : listeners) l.comboCancelled();
    }

    /**
     * Per frame housekeeping: ends an expired freeze, cancels an over-held
     * finisher, applies the input timeout and reports charge progress.
     */
    public void update() {
        checkFreezeTimeout();
        checkSpaceOverhold();
        if (!frozen) {
            checkTimeout();
        }
        if (spaceHeld) {
            double progress = chargeProgress();
            for (ComboListener l : listeners) l.chargeUpdated(progress);
        }
    }

    /**
     * Resets the attempt if the last input is older than the timeout. Never
     * fires while frozen or while the finisher is held.
     * 
     * @return whether a reset happened.
     */
    public boolean checkTimeout() {
        if (frozen || spaceHeld || lastInputTime == NEVER) return false;
        if (ticker.millis() - lastInputTime > timing.timeout()) {
            logger.log(level, "timeout");
            resetWithCallback();
            return true;
        }
        return false;
    }

    private void checkFreezeTimeout() {
        if (frozen && ticker.millis() - freezeStart >= timing.freeze()) {
            endFreeze();
        }
    }

    private void checkSpaceOverhold() {
        if (!spaceHeld) return;
        long held = ticker.millis() - spacePressTime;
        if (held > timing.chargeMax()) {
            spaceHeld = false;
            cancel(held);
        }
    }

    private void startFreeze(long now) {
        frozen = true;
        freezeStart = now;
        frozenNodeId = matcher.currentNodeId();
        frozenHistory = new ArrayList<Input>(displayHistory);
    }

    private void endFreeze() {
        frozen = false;
        clearAttempt();
        logger.log(level, "freeze ended");
        for (ComboListener l : listeners) l.freezeEnded();
        notifyStateChange();
    }

    private void resetWithCallback() {
        if (frozen) return;
        clearAttempt();
        for (ComboListener l : listeners) l.timedOut();
        notifyStateChange();
    }

    private void clearAttempt() {
        matcher.reset();
        displayHistory.clear();
        lastInputTime = NEVER;
    }

    private void notifyStateChange() {
        if (listeners.isEmpty()) return;
        int id = matcher.currentNodeId();
        List<Input> possible = matcher.possibleTransitions();
        for (ComboListener l : listeners) l.stateChanged(id, possible);
    }

    /**
     * Abandons the attempt (or ends the freeze) and releases the finisher.
     */
    public void reset() {
        if (frozen) {
            endFreeze();
        } else {
            resetWithCallback();
        }
        spaceHeld = false;
        spacePressTime = NEVER;
    }

    /**
     * @return finisher hold time over {@link ComboTiming#chargeMax()}, capped
     *         at 1; 0 when not held or frozen.
     */
    public double chargeProgress() {
        if (!spaceHeld || frozen) return 0.0;
        double held = ticker.millis() - spacePressTime;
        return Math.min(1.0, held / timing.chargeMax());
    }

    public ChargeZone chargeZone() {
        if (!spaceHeld || frozen) return ChargeZone.NONE;
        return timing.zoneOf(ticker.millis() - spacePressTime);
    }

    public boolean isInChargeZone() {
        return chargeZone() == ChargeZone.SUPER;
    }

    /**
     * @return milliseconds left before the attempt times out; the full timeout
     *         when nothing is pending, the clock is stopped or frozen.
     */
    public long timeUntilTimeout() {
        if (frozen || spaceHeld || lastInputTime == NEVER) return timing.timeout();
        return Math.max(0L, timing.timeout() - (ticker.millis() - lastInputTime));
    }

    public long freezeTimeRemaining() {
        if (!frozen) return 0L;
        return Math.max(0L, timing.freeze() - (ticker.millis() - freezeStart));
    }

    /**
     * @return the matcher's progress, or 1 while frozen after a combo.
     */
    public double currentProgress() {
        return frozen ? 1.0 : matcher.progressFraction();
    }

    /**
     * @return the inputs of the current attempt; while frozen, those of the
     *         combo just completed.
     */
    public List<Input> displayHistory() {
        return Collections.unmodifiableList(
            new ArrayList<Input>(frozen ? frozenHistory : displayHistory));
    }

    /**
     * @return the trie node the completed combo ended on, while frozen.
     */
    public int frozenNodeId() {
        return frozenNodeId;
    }

    @Override
    public String toString() {
        return "ComboController[" + (frozen ? "frozen, " : "") + (spaceHeld ? "charging, " : "")
                + "history " + displayHistory + ", " + matcher + "]";
    }
}
