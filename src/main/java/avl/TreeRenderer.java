package avl;

import avl.AvlTree.Node;

import java.io.PrintStream;

/**
 * Fixed-width ASCII picture of a tree's shape, one line per depth.
 *
 * Every line is {@code 2^height - 1} characters wide. Values are expected to print as a
 * single character, longer ones shift the rest of their line.
 */
public final class TreeRenderer {
    private static final char FILLER_CHAR = ' ';
    private static final char BRANCH_CHAR = '_';

    private TreeRenderer() {
    }

    public static <T extends Comparable<? super T>> String render(final AvlTree<T> tree) {
        final int height = height(tree.root);
        final StringBuilder out = new StringBuilder();
        for (int depth = 0; depth < height; depth++) {
            row(tree.root, depth, height, out);
            out.append('\n');
        }
        return out.toString();
    }

    public static <T extends Comparable<? super T>> void print(final AvlTree<T> tree, final PrintStream out) {
        out.print(render(tree));
    }

    // null node renders as blank space of the same width
    private static <T extends Comparable<? super T>> void row(final Node<T> node, final int depth,
                                                            final int height, final StringBuilder out) {
        if (depth == 0) {
            if (node == null) {
                repeat(out, FILLER_CHAR, (1 << height) - 1);
                return;
            }
            if (height == 1) {
                out.append(node.value);
                return;
            }
            final int half = 1 << (height - 2);
            repeat(out, FILLER_CHAR, half);
            repeat(out, node.smaller == null ? FILLER_CHAR : BRANCH_CHAR, half - 1);
            out.append(node.value);
            repeat(out, node.bigger == null ? FILLER_CHAR : BRANCH_CHAR, half - 1);
            repeat(out, FILLER_CHAR, half);
            return;
        }
        row(node == null ? null : node.smaller, depth - 1, height - 1, out);
        out.append(FILLER_CHAR);
        row(node == null ? null : node.bigger, depth - 1, height - 1, out);
    }

    private static void repeat(final StringBuilder out, final char c, final int times) {
        for (int i = 0; i < times; i++) out.append(c);
    }

    private static <T extends Comparable<? super T>> int height(final Node<T> node) {
        if (node == null) return 0;
        return 1 + Math.max(height(node.smaller), height(node.bigger));
    }
}
