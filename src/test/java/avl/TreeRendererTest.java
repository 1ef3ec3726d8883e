package avl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TreeRendererTest {

    private static AvlTree<Character> treeOf(String letters) {
        AvlTree<Character> tree = new AvlTree<>();
        for (char c : letters.toCharArray()) tree.add(c);
        return tree;
    }

    @Test
    void emptyTree_rendersNothing() {
        assertEquals("", TreeRenderer.render(new AvlTree<Character>()));
    }

    @Test
    void singleNode() {
        assertEquals("k\n", TreeRenderer.render(new AvlTree<>('k')));
    }

    @Test
    void missingChild_leavesBlank() {
        assertEquals(" b \na  \n", TreeRenderer.render(treeOf("ba")));
    }

    @Test
    void perfectTree_drawsBranches() {
        String expected =
                "  _d_  \n" +
                " b   f \n" +
                "a c e g\n";
        assertEquals(expected, TreeRenderer.render(treeOf("dbfaceg")));
    }

    @Test
    void everyLine_hasFixedWidth() {
        AvlTree<Character> tree = treeOf("kdrdefzseiwlmnba");
        int height = InvariantChecker.verifiedHeight(tree);
        String[] lines = TreeRenderer.render(tree).split("\n");

        assertEquals(height, lines.length);
        for (String line : lines) {
            assertEquals((1 << height) - 1, line.length(), "line '" + line + "'");
        }
    }

    @Test
    void print_writesRenderedText() {
        AvlTree<Character> tree = treeOf("dbfaceg");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

        TreeRenderer.print(tree, out);

        assertEquals(TreeRenderer.render(tree), bytes.toString(StandardCharsets.UTF_8));
    }
}
