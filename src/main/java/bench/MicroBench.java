package bench;

import avl.AvlTree;
import avl.InvariantChecker;
import avl.RemoveStatus;

import java.util.Random;

/**
 * Single-threaded mixed workload over {@link AvlTree}.
 *
 * Usage: MicroBench [ops] [keyRange] [seed]
 */
public class MicroBench {

    static final class Result {
        long adds;
        long removes;
        long misses;
        long hits;
        long elapsedNanos;

        double mopsPerSec() {
            long total = adds + removes + misses + hits;
            return elapsedNanos == 0 ? 0 : total / (elapsedNanos / 1e9) / 1_000_000.0;
        }
    }

    static Result run(AvlTree<Integer> tree, int ops, int keyRange, long seed) {
        Result res = new Result();
        Random rnd = new Random(seed);

        // Preload a bit
        for (int i = 0; i < keyRange / 2; i++) tree.add(rnd.nextInt(keyRange));

        long start = System.nanoTime();
        for (int i = 0; i < ops; i++) {
            int k = rnd.nextInt(keyRange);
            int r = rnd.nextInt(100);
            // 80% contains, 10% adds, 10% removes
            if (r < 80) {
                if (tree.contains(k)) res.hits++;
                else res.misses++;
            } else if (r < 90) {
                tree.add(k);
                res.adds++;
            } else {
                if (tree.remove(k) == RemoveStatus.SUCCESS) res.removes++;
                else res.misses++;
            }
        }
        res.elapsedNanos = System.nanoTime() - start;
        return res;
    }

    public static void main(String[] args) {
        int ops = (args.length >= 1) ? Integer.parseInt(args[0]) : 5_000_000;
        int keyRange = (args.length >= 2) ? Integer.parseInt(args[1]) : 200_000;
        long seed = (args.length >= 3) ? Long.parseLong(args[2]) : 12345L;

        AvlTree<Integer> tree = new AvlTree<>();
        Result res = run(tree, ops, keyRange, seed);

        String diagnostic = InvariantChecker.diagnose(tree);
        if (!diagnostic.isEmpty()) {
            System.err.println("❌ Invariant violated after workload: " + diagnostic);
        }

        System.out.printf("Ops=%d, KeyRange=%d, Height=%d, Adds=%d, Removes=%d, Hits=%d, Misses=%d, Throughput=%.2f Mops/s%n",
                ops, keyRange, InvariantChecker.verifiedHeight(tree),
                res.adds, res.removes, res.hits, res.misses, res.mopsPerSec());
    }
}
