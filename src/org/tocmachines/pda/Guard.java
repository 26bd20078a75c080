/*
 * @LICENSE@
 */

package org.tocmachines.pda;

/**
 * An optional precondition on a {@link Transition}: either a required value,
 * or {@linkplain #any() any} value. Used both for the input symbol class
 * (where <em>any</em> is the epsilon / wildcard guard) and for the stack top.
 * 
 * @param <T> the guarded value type
 */
public final class Guard<T> {

    private static final Guard<Object> ANY = new Guard<Object>(null);

    private final T required;

    private Guard(T required) {
        this.required = required;
    }

    @SuppressWarnings("unchecked")
    public static <T> Guard<T> any() {
        return (Guard<T>) ANY;
    }

    public static <T> Guard<T> of(T required) {
        if (required == null) {
            throw new IllegalArgumentException("use Guard.any() for a wildcard");
        }
        return new Guard<T>(required);
    }

    public boolean isAny() {
        return required == null;
    }

    /**
     * @return the required value; only meaningful when not {@link #isAny()}.
     */
    public T required() {
        if (required == null) {
            throw new IllegalStateException("wildcard guard has no value");
        }
        return required;
    }

    public boolean matches(T value) {
        return required == null || required.equals(value);
    }

    /**
     * @param wildcard the label to use for the wildcard guard
     */
    String label(String wildcard) {
        return required == null ? wildcard : String.valueOf(required);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Guard<?>)) return false;
        Object other = ((Guard<?>) obj).required;
        return required == null ? other == null : required.equals(other);
    }

    @Override
    public int hashCode() {
        return required == null ? 0 : required.hashCode();
    }

    @Override
    public String toString() {
        return label("*");
    }
}
