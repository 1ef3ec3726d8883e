package bench;

import avl.AvlTree;
import avl.InvariantChecker;
import avl.RemoveStatus;
import avl.TreeRenderer;

import java.io.PrintStream;

/**
 * Replays a fixed sequence of letters, drawing the tree after every add and remove so
 * the rotations can be followed by eye.
 */
public class Walkthrough {

    static final char[] LETTERS = {
        'k', 'd', 'r', 'd', 'e', 'f', 'z', 's', 'e', 'i', 'w', 'l', 'm', 'n', 'b', 'a'
    };
    static final char[] ABSENT = {'A', 'N', '8', 'Y'};

    private static final String SEPARATOR = "~".repeat(100);

    /** Returns false as soon as the tree misbehaves; details go to {@code out}. */
    static boolean run(PrintStream out) {
        AvlTree<Character> tree = new AvlTree<>(LETTERS[0]);

        for (int i = 1; i < LETTERS.length; i++) {
            out.println("adding " + LETTERS[i]);
            tree.add(LETTERS[i]);
            if (!step(tree, out)) return false;
        }

        for (char c : LETTERS) {
            if (!tree.contains(c)) {
                out.println("character " + c + " was not found!");
                return false;
            }
        }
        for (char c : ABSENT) {
            if (tree.contains(c)) {
                out.println("character " + c + " was found!");
                return false;
            }
        }
        if (tree.remove('.') != RemoveStatus.VALUE_NOT_FOUND) {
            out.println("remove function didnt fail correctly!");
            return false;
        }

        for (char c : LETTERS) {
            out.println("removing " + c);
            tree.remove(c);
            if (!step(tree, out)) return false;
        }
        return tree.isEmpty();
    }

    private static boolean step(AvlTree<Character> tree, PrintStream out) {
        TreeRenderer.print(tree, out);
        out.println(SEPARATOR);
        String diagnostic = InvariantChecker.diagnose(tree);
        if (!diagnostic.isEmpty()) {
            out.println("invariant violated: " + diagnostic);
            return false;
        }
        return true;
    }

    public static void main(String[] args) {
        if (run(System.out)) {
            System.out.println("SUCCESS: walkthrough");
        } else {
            System.err.println("FAILED: walkthrough");
        }
    }
}
