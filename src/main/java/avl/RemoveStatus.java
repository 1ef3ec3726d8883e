package avl;

/**
 * Outcome of {@link AvlTree#remove(Comparable)}.
 */
public enum RemoveStatus {
    SUCCESS,
    VALUE_NOT_FOUND,
}
