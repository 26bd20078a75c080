/*
 * @LICENSE@
 */

package org.tocmachines.notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outcome of converting one expression between notations. A
 * failed conversion has an empty result expression and a non-empty error
 * message.
 */
public final class ConversionResult {

    private final boolean success;
    private final Notation source;
    private final Notation target;
    private final String sourceExpression;
    private final String resultExpression;
    private final List<String> steps;
    private final String errorMessage;

    private ConversionResult(boolean success, Notation source, Notation target,
            String sourceExpression, String resultExpression, List<String> steps,
            String errorMessage) {
        this.success = success;
        this.source = source;
        this.target = target;
        this.sourceExpression = sourceExpression;
        this.resultExpression = resultExpression;
        this.steps = Collections.unmodifiableList(new ArrayList<String>(steps));
        this.errorMessage = errorMessage;
    }

    static ConversionResult succeeded(Notation source, Notation target,
            String sourceExpression, String resultExpression, List<String> steps) {
        return new ConversionResult(true, source, target, sourceExpression,
            resultExpression, steps, "");
    }

    static ConversionResult failed(Notation source, Notation target,
            String sourceExpression, List<String> steps, String errorMessage) {
        assert errorMessage != null && errorMessage.length() > 0;
        return new ConversionResult(false, source, target, sourceExpression,
            "", steps, errorMessage);
    }

    public boolean success() {
        return success;
    }

    public Notation source() {
        return source;
    }

    public Notation target() {
        return target;
    }

    public String sourceExpression() {
        return sourceExpression;
    }

    /**
     * @return the converted expression; empty if the conversion failed.
     */
    public String resultExpression() {
        return resultExpression;
    }

    public List<String> steps() {
        return steps;
    }

    /**
     * @return the reason for failure; empty on success.
     */
    public String errorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return source.label() + " -> " + target.label() + ": '" + sourceExpression + "' => "
                + (success ? "'" + resultExpression + "'" : "failed: " + errorMessage);
    }
}
