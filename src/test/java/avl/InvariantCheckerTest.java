package avl;

import avl.InvariantViolationException.Invariant;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The checker must notice hand-made corruption of an otherwise valid tree.
 */
class InvariantCheckerTest {

    // 4 (2 (1, 3), 6 (5, 7))
    private static AvlTree<Integer> perfectTree() {
        AvlTree<Integer> tree = new AvlTree<>();
        for (int v : new int[]{4, 2, 6, 1, 3, 5, 7}) tree.add(v);
        assertEquals("", InvariantChecker.diagnose(tree));
        assertEquals(3, InvariantChecker.verifiedHeight(tree));
        return tree;
    }

    private static InvariantViolationException violation(AvlTree<Integer> tree) {
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> InvariantChecker.verify(tree));
        assertEquals(e.getMessage(), InvariantChecker.diagnose(tree));
        assertFalse(e.getMessage().isEmpty());
        return e;
    }

    @Test
    void wrongStoredBalance_isReported() {
        AvlTree<Integer> tree = perfectTree();
        tree.root.smaller.balance = 1;

        InvariantViolationException e = violation(tree);
        assertEquals(Invariant.BALANCE_HEIGHT, e.getInvariant());
        assertEquals(2, e.getValue());
    }

    @Test
    void balanceOutOfRange_isReported() {
        AvlTree<Integer> tree = perfectTree();
        tree.root.bigger.bigger.balance = -2;

        InvariantViolationException e = violation(tree);
        assertEquals(Invariant.BALANCE_RANGE, e.getInvariant());
        assertEquals(7, e.getValue());
    }

    @Test
    void orderingAgainstChild_isReported() {
        AvlTree<Integer> tree = perfectTree();
        tree.root.smaller.smaller.value = 2;

        InvariantViolationException e = violation(tree);
        assertEquals(Invariant.ORDERING, e.getInvariant());
    }

    @Test
    void orderingAgainstDistantAncestor_isReported() {
        AvlTree<Integer> tree = perfectTree();
        // still bigger than its parent 2, but not smaller than the root 4
        tree.root.smaller.bigger.value = 9;

        InvariantViolationException e = violation(tree);
        assertEquals(Invariant.ORDERING, e.getInvariant());
        assertEquals(9, e.getValue());
        assertTrue(e.getMessage().contains("4"), e.getMessage());
    }

    @Test
    void staleParentLink_isReported() {
        AvlTree<Integer> tree = perfectTree();
        tree.root.bigger.smaller.parent = tree.root;

        InvariantViolationException e = violation(tree);
        assertEquals(Invariant.PARENT_LINK, e.getInvariant());
        assertEquals(5, e.getValue());
    }

    @Test
    void rootWithParent_isReported() {
        AvlTree<Integer> tree = perfectTree();
        tree.root.parent = tree.root.smaller;

        assertEquals(Invariant.PARENT_LINK, violation(tree).getInvariant());
    }

    @Test
    void zeroCount_isReported() {
        AvlTree<Integer> tree = perfectTree();
        tree.root.bigger.count = 0;

        InvariantViolationException e = violation(tree);
        assertEquals(Invariant.COUNT, e.getInvariant());
        assertEquals(6, e.getValue());
    }
}
