package avl;

import java.util.Objects;

/**
 * AVL tree holding ordered values with a multiplicity per value.
 *
 * The tree only locates the mutation point and performs the local edit (attach or
 * splice); balance bookkeeping and rotations are done by the node chain, walking
 * parent references upward until the height change is absorbed.
 *
 * Not thread-safe.
 */
public class AvlTree<T extends Comparable<? super T>> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    static final int SMALLER = -1;
    static final int BIGGER = 1;

    static final int SMALLER_HEAVY = -1;
    static final int BALANCED = 0;
    static final int BIGGER_HEAVY = 1;

    static final class Node<E extends Comparable<? super E>> {
        E value;
        int count;
        // height(bigger) - height(smaller); +-2 only while a rebalance is in progress
        int balance;
        Node<E> smaller;
        Node<E> bigger;
        // lookup only, the owner is whoever holds this node in smaller/bigger (or the tree)
        Node<E> parent;

        Node(final E value, final Node<E> parent) {
            this.value = value;
            this.count = 1;
            this.balance = BALANCED;
            this.parent = parent;
        }

        /**
         * Iterative descent from this node. Returns the node holding {@code key}, or
         * the last node visited when no node holds it (the parent of the insertion
         * point). Callers tell the two apart by comparing the returned node's value.
         */
        Node<E> locate(final E key) {
            Node<E> curr = this;
            while (true) {
                final int cmp = key.compareTo(curr.value);
                if (cmp == 0) return curr;
                final Node<E> next = (cmp < 0) ? curr.smaller : curr.bigger;
                if (next == null) return curr;
                curr = next;
            }
        }

        boolean holds(final E key) {
            return key.compareTo(value) == 0;
        }

        Node<E> min() {
            Node<E> curr = this;
            while (curr.smaller != null) curr = curr.smaller;
            return curr;
        }

        /** SMALLER or BIGGER, depending on which slot of the parent holds this node. */
        int side() {
            return (parent.smaller == this) ? SMALLER : BIGGER;
        }

        Node<E> child(final int side) {
            return (side == SMALLER) ? smaller : bigger;
        }

        void setChild(final int side, final Node<E> child) {
            if (side == SMALLER) smaller = child;
            else bigger = child;
            if (child != null) child.parent = this;
        }

        //--------------------------------------------------------------------------------
        // Upward propagation
        //--------------------------------------------------------------------------------

        /**
         * The subtree on {@code side} of this node got one level taller.
         */
        void grew(final int side) {
            Node<E> node = this;
            int delta = side;
            while (true) {
                // 0 -> +-1 is the only transition that makes this subtree taller
                final boolean keepGoing = node.balance == BALANCED;
                node.balance += delta;
                if (node.balance == 2 * BIGGER_HEAVY) {
                    node.rotateToSmaller();
                    return;
                }
                if (node.balance == 2 * SMALLER_HEAVY) {
                    node.rotateToBigger();
                    return;
                }
                if (!keepGoing || node.parent == null) return;
                delta = node.side();
                node = node.parent;
            }
        }

        /**
         * The subtree on {@code side} of this node got one level shorter.
         */
        void shrank(final int side) {
            Node<E> node = this;
            int delta = -side;
            while (true) {
                node.balance += delta;
                if (node.balance == 2 * BIGGER_HEAVY) {
                    node.rotateToSmaller();
                } else if (node.balance == 2 * SMALLER_HEAVY) {
                    node.rotateToBigger();
                }
                // +-1 means the other side still holds the old height
                if (node.balance != BALANCED || node.parent == null) return;
                delta = -node.side();
                node = node.parent;
            }
        }

        //--------------------------------------------------------------------------------
        // Rotations
        //
        // The node in the subtree root position keeps its slot: the slot belongs to the
        // parent (or to the tree), so the rotation swaps value and count with the heavy
        // child and rewires the four subtree references underneath instead.
        //--------------------------------------------------------------------------------

        /** Fixes a balance of +2. */
        void rotateToSmaller() {
            if (bigger.balance == SMALLER_HEAVY) {
                bigger.singleRotateToBigger();
            }
            singleRotateToSmaller();
        }

        /** Fixes a balance of -2. */
        void rotateToBigger() {
            if (smaller.balance == BIGGER_HEAVY) {
                smaller.singleRotateToSmaller();
            }
            singleRotateToBigger();
        }

        private void singleRotateToSmaller() {
            final Node<E> pivot = bigger;
            swapContent(pivot);

            final Node<E> outer = smaller;
            bigger = pivot.bigger;
            pivot.bigger = pivot.smaller;
            pivot.smaller = outer;
            smaller = pivot;
            if (outer != null) outer.parent = pivot;
            if (bigger != null) bigger.parent = this;

            // pivot now holds this node's old content one level down
            final int lower = balance - 1 - Math.max(pivot.balance, 0);
            final int upper = pivot.balance - 1 + Math.min(lower, 0);
            pivot.balance = lower;
            balance = upper;
        }

        private void singleRotateToBigger() {
            final Node<E> pivot = smaller;
            swapContent(pivot);

            final Node<E> outer = bigger;
            smaller = pivot.smaller;
            pivot.smaller = pivot.bigger;
            pivot.bigger = outer;
            bigger = pivot;
            if (outer != null) outer.parent = pivot;
            if (smaller != null) smaller.parent = this;

            final int lower = balance + 1 - Math.min(pivot.balance, 0);
            final int upper = pivot.balance + 1 + Math.max(lower, 0);
            pivot.balance = lower;
            balance = upper;
        }

        private void swapContent(final Node<E> other) {
            final E v = value;
            value = other.value;
            other.value = v;
            final int c = count;
            count = other.count;
            other.count = c;
        }

        @Override
        public String toString() {
            return "NODE(" + value + " x" + count + ", " + balance + ")";
        }
    }

    //--------------------------------------------------------------------------------
    // TREE
    //--------------------------------------------------------------------------------

    Node<T> root;

    public AvlTree() {
        root = null;
    }

    /** PRECONDITION: value CANNOT BE NULL **/
    public AvlTree(final T initialValue) {
        Objects.requireNonNull(initialValue, "value");
        root = new Node<>(initialValue, null);
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - add      : void
// - remove   : RemoveStatus
// - contains : boolean
// - count    : int
//--------------------------------------------------------------------------------

    /** PRECONDITION: value CANNOT BE NULL **/
    public void add(final T value) {
        Objects.requireNonNull(value, "value");
        if (root == null) {
            root = new Node<>(value, null);
            return;
        }

        final Node<T> found = root.locate(value);
        if (found.holds(value)) {
            // multiplicity does not change the shape
            found.count++;
            return;
        }

        final int side = (value.compareTo(found.value) < 0) ? SMALLER : BIGGER;
        found.setChild(side, new Node<>(value, found));
        found.grew(side);
    }

    /** PRECONDITION: value CANNOT BE NULL **/
    public RemoveStatus remove(final T value) {
        Objects.requireNonNull(value, "value");
        if (root == null) return RemoveStatus.VALUE_NOT_FOUND;

        Node<T> target = root.locate(value);
        if (!target.holds(value)) return RemoveStatus.VALUE_NOT_FOUND;

        if (target.count > 1) {
            target.count--;
            return RemoveStatus.SUCCESS;
        }

        if (target.smaller != null && target.bigger != null) {
            // successor has no smaller child, so removing it is a <= 1 child splice
            final Node<T> successor = target.bigger.min();
            target.value = successor.value;
            target.count = successor.count;
            target = successor;
        }

        final Node<T> replacement = (target.smaller != null) ? target.smaller : target.bigger;
        final Node<T> parent = target.parent;
        if (parent == null) {
            root = replacement;
            if (replacement != null) replacement.parent = null;
        } else {
            final int side = target.side();
            parent.setChild(side, replacement);
            parent.shrank(side);
        }
        target.parent = null;
        target.smaller = null;
        target.bigger = null;
        return RemoveStatus.SUCCESS;
    }

    /** PRECONDITION: value CANNOT BE NULL **/
    public boolean contains(final T value) {
        return count(value) > 0;
    }

    /** Number of times {@code value} was added and not yet removed. */
    public int count(final T value) {
        Objects.requireNonNull(value, "value");
        if (root == null) return 0;
        final Node<T> found = root.locate(value);
        return found.holds(value) ? found.count : 0;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public void clear() {
        root = null;
    }
}
