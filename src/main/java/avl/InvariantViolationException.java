package avl;

/**
 * Raised by {@link InvariantChecker} when a tree breaks one of its structural invariants.
 * Never thrown by the tree operations themselves.
 */
public class InvariantViolationException extends RuntimeException {

    public enum Invariant {
        COUNT,
        BALANCE_RANGE,
        BALANCE_HEIGHT,
        ORDERING,
        PARENT_LINK,
    }

    private final Invariant invariant;
    private final Object value;

    public InvariantViolationException(final Invariant invariant, final Object value, final String message) {
        super(message);
        this.invariant = invariant;
        this.value = value;
    }

    public Invariant getInvariant() {
        return invariant;
    }

    /** Value held by the offending node. */
    public Object getValue() {
        return value;
    }
}
