package com.flowmable.mosaicify;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Randomized visiting order over the grid cells.
 * <p>
 * A raster sweep would let the top-left cells claim scarce tiles first when
 * duplicates are avoided; shuffling spreads that advantage uniformly.
 */
public final class GridTraversal {

    private GridTraversal() {}

    /** Every cell exactly once, uniformly shuffled. */
    public static List<Cell> order(BlockGeometry geometry, Random random) {
        List<Cell> cells = geometry.cells();
        Collections.shuffle(cells, random);
        return cells;
    }
}
