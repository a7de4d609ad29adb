// file: bench/src/main/java/io/bimcollab/bench/ZipfianElementGenerator.java
package io.bimcollab.bench;

import java.util.Arrays;
import java.util.Random;

/**
 * Picks model element ids with Zipfian skew: element 0 is the hottest.
 * A few hot elements are what makes concurrent edits collide.
 * <p>
 * The CDF over ranks 1..n is precomputed once; sampling is a binary search.
 * Safe for concurrent use ({@link Random} is).
 */
public final class ZipfianElementGenerator {

    private final String prefix;
    private final double[] cdf;
    private final Random rnd;

    public ZipfianElementGenerator(String prefix, int elements, double skew, long seed) {
        if (elements <= 0) throw new IllegalArgumentException("elements must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.prefix = prefix;
        this.rnd = new Random(seed);
        this.cdf = new double[elements];

        double norm = 0.0;
        for (int rank = 1; rank <= elements; rank++) {
            norm += Math.pow(rank, -skew);
        }
        double acc = 0.0;
        for (int rank = 1; rank <= elements; rank++) {
            acc += Math.pow(rank, -skew) / norm;
            cdf[rank - 1] = acc;
        }
        // rounding can leave the tail just under 1.0
        cdf[elements - 1] = 1.0;
    }

    public int size() {
        return cdf.length;
    }

    /** Index in [0, size()). */
    public int nextIndex() {
        int pos = Arrays.binarySearch(cdf, rnd.nextDouble());
        return pos >= 0 ? pos : -pos - 1;
    }

    public String nextElementId() {
        return prefix + nextIndex();
    }
}
