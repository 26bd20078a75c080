/*
 * @LICENSE@
 */

package org.tocmachines.trie;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Timing limits for {@link ComboController}, all in milliseconds.
 * <p>
 * {@link #load()} reads <code>/resources/combo-timing.properties</code>; any
 * key may be overridden by a system property of the same name prefixed with
 * <code>org.tocmachines.combo.</code>, e.g.
 * <code>-Dorg.tocmachines.combo.timeout=1500</code>.
 */
public final class ComboTiming {

    private static final Logger logger = Logger.getLogger("org.tocmachines.trie");
    private static final Level level = Level.CONFIG;

    public static final String RESOURCE = "/resources/combo-timing.properties";
    public static final String PREFIX = "org.tocmachines.combo.";

    public static final String TIMEOUT = "timeout";
    public static final String NORMAL_MAX = "normal.max";
    public static final String CHARGE_MIN = "charge.min";
    public static final String CHARGE_MAX = "charge.max";
    public static final String FREEZE = "freeze";

    public static final ComboTiming DEFAULTS = new ComboTiming(1000, 1900, 2000, 3000, 1000);

    private final long timeout;
    private final long normalMax;
    private final long chargeMin;
    private final long chargeMax;
    private final long freeze;

    /**
     * @param timeout longest allowed gap between inputs
     * @param normalMax finisher holds shorter than this are in the normal zone
     * @param chargeMin shortest finisher hold giving a super combo
     * @param chargeMax longest finisher hold giving a super combo; longer
     *            cancels
     * @param freeze input is ignored for this long after a combo
     */
    public ComboTiming(long timeout, long normalMax, long chargeMin, long chargeMax, long freeze) {
        if (timeout <= 0 || freeze < 0) {
            throw new IllegalArgumentException("bad timeout/freeze: " + timeout + "/" + freeze);
        }
        if (!(0 < normalMax && normalMax <= chargeMin && chargeMin <= chargeMax)) {
            throw new IllegalArgumentException("need 0 < normal.max <= charge.min <= charge.max: "
                    + normalMax + ", " + chargeMin + ", " + chargeMax);
        }
        this.timeout = timeout;
        this.normalMax = normalMax;
        this.chargeMin = chargeMin;
        this.chargeMax = chargeMax;
        this.freeze = freeze;
    }

    public static ComboTiming load() {
        Properties props = new Properties();
        InputStream in = ComboTiming.class.getResourceAsStream(RESOURCE);
        if (in != null) {
            try {
                try {
                    props.load(in);
                } finally {
                    in.close();
                }
            } catch (IOException e) {
                throw new RuntimeException("reading " + RESOURCE, e);
            }
        } else {
            logger.log(level, RESOURCE + " not found, using defaults");
        }
        return from(props, System.getProperties());
    }

    /**
     * @param props keys without prefix
     * @param overrides keys with {@link #PREFIX}; these win
     */
    static ComboTiming from(Properties props, Properties overrides) {
        ComboTiming ret = new ComboTiming(
            get(TIMEOUT, props, overrides, DEFAULTS.timeout),
            get(NORMAL_MAX, props, overrides, DEFAULTS.normalMax),
            get(CHARGE_MIN, props, overrides, DEFAULTS.chargeMin),
            get(CHARGE_MAX, props, overrides, DEFAULTS.chargeMax),
            get(FREEZE, props, overrides, DEFAULTS.freeze));
        logger.log(level, ret.toString());
        return ret;
    }

    private static long get(String key, Properties props, Properties overrides, long dflt) {
        String s = overrides.getProperty(PREFIX + key, props.getProperty(key));
        if (s == null) return dflt;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad value for " + key + ": '" + s + "'", e);
        }
    }

    public long timeout() {
        return timeout;
    }

    public long normalMax() {
        return normalMax;
    }

    public long chargeMin() {
        return chargeMin;
    }

    public long chargeMax() {
        return chargeMax;
    }

    public long freeze() {
        return freeze;
    }

    /**
     * Classifies a finisher hold duration.
     */
    public ChargeZone zoneOf(long held) {
        if (held < normalMax) return ChargeZone.NORMAL;
        if (held < chargeMin) return ChargeZone.CHARGING;
        if (held <= chargeMax) return ChargeZone.SUPER;
        return ChargeZone.CANCEL;
    }

    @Override
    public String toString() {
        return "ComboTiming[timeout=" + timeout + ", normal.max=" + normalMax
                + ", charge.min=" + chargeMin + ", charge.max=" + chargeMax
                + ", freeze=" + freeze + "]";
    }
}
