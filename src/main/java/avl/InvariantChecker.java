package avl;

import avl.AvlTree.Node;
import avl.InvariantViolationException.Invariant;

/**
 * Verification-only walk over an {@link AvlTree}.
 *
 * Recomputes the true height of every subtree bottom-up and cross-checks it against the
 * stored balance factors, together with ordering, counts and parent references. Meant
 * for tests and debugging; the tree operations never call it.
 */
public final class InvariantChecker {

    private InvariantChecker() {
    }

    /**
     * Returns an empty string when every invariant holds, otherwise a description of the
     * first violation found.
     */
    public static <T extends Comparable<? super T>> String diagnose(final AvlTree<T> tree) {
        try {
            verifiedHeight(tree);
            return "";
        } catch (InvariantViolationException e) {
            return e.getMessage();
        }
    }

    public static <T extends Comparable<? super T>> void verify(final AvlTree<T> tree) {
        verifiedHeight(tree);
    }

    /**
     * True height of the tree (0 when empty, 1 for a single node).
     *
     * @throws InvariantViolationException on the first violation found
     */
    public static <T extends Comparable<? super T>> int verifiedHeight(final AvlTree<T> tree) {
        if (tree.root != null && tree.root.parent != null) {
            throw new InvariantViolationException(Invariant.PARENT_LINK, tree.root.value,
                    "root " + tree.root + " has parent " + tree.root.parent);
        }
        return check(tree.root, null, null);
    }

    // lower and upper are exclusive bounds inherited from the ancestors, null when open
    private static <T extends Comparable<? super T>> int check(final Node<T> node, final T lower, final T upper) {
        if (node == null) return 0;

        if (node.count < 1) {
            throw new InvariantViolationException(Invariant.COUNT, node.value,
                    "node " + node + " has count " + node.count);
        }
        if (node.balance < AvlTree.SMALLER_HEAVY || node.balance > AvlTree.BIGGER_HEAVY) {
            throw new InvariantViolationException(Invariant.BALANCE_RANGE, node.value,
                    "node " + node + " has balance " + node.balance + " outside [-1, 1]");
        }
        if (lower != null && node.value.compareTo(lower) <= 0) {
            throw new InvariantViolationException(Invariant.ORDERING, node.value,
                    "node " + node + " is not bigger than ancestor value " + lower);
        }
        if (upper != null && node.value.compareTo(upper) >= 0) {
            throw new InvariantViolationException(Invariant.ORDERING, node.value,
                    "node " + node + " is not smaller than ancestor value " + upper);
        }
        checkParent(node, node.smaller);
        checkParent(node, node.bigger);

        final int hs = check(node.smaller, lower, node.value);
        final int hb = check(node.bigger, node.value, upper);
        if (hb - hs != node.balance) {
            throw new InvariantViolationException(Invariant.BALANCE_HEIGHT, node.value,
                    "node " + node + " stores balance " + node.balance
                            + " but subtree heights are " + hs + " (smaller) and " + hb + " (bigger)");
        }
        return 1 + Math.max(hs, hb);
    }

    private static <T extends Comparable<? super T>> void checkParent(final Node<T> node, final Node<T> child) {
        if (child != null && child.parent != node) {
            throw new InvariantViolationException(Invariant.PARENT_LINK, child.value,
                    "node " + child + " is a child of " + node + " but points to parent " + child.parent);
        }
    }
}
