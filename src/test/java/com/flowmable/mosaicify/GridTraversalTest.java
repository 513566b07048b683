package com.flowmable.mosaicify;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GridTraversalTest {

    private final BlockGeometry geometry = BlockGeometry.of(60, 40, 6, 4);

    @Test
    void order_visitsEveryCellOnce() {
        List<Cell> order = GridTraversal.order(geometry, new Random());
        assertEquals(24, order.size());
        assertEquals(new HashSet<>(geometry.cells()), new HashSet<>(order));
    }

    @Test
    void order_isReproducibleWithSeed() {
        assertEquals(GridTraversal.order(geometry, new Random(7)), GridTraversal.order(geometry, new Random(7)));
    }

    @Test
    void order_isNotAlwaysRaster() {
        List<Cell> raster = geometry.cells();
        boolean shuffled = false;
        for (long seed = 0; seed < 10 && !shuffled; seed++) {
            shuffled = !GridTraversal.order(geometry, new Random(seed)).equals(raster);
        }
        assertTrue(shuffled, "Traversal should not follow raster order for every seed");
    }
}
