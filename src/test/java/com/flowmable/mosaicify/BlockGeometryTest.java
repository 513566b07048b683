package com.flowmable.mosaicify;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BlockGeometryTest {

    @Test
    void of_usesIntegerDivision() {
        BlockGeometry g = BlockGeometry.of(103, 59, 10, 5);
        assertEquals(10, g.blockWidth());
        assertEquals(11, g.blockHeight());
        assertEquals(100, g.canvasWidth());
        assertEquals(55, g.canvasHeight());
        assertEquals(50, g.cellCount());
    }

    @Test
    void zeroGridCount_isConfigError() {
        assertThrows(MosaicConfigException.class, () -> BlockGeometry.of(100, 100, 0, 4));
        assertThrows(MosaicConfigException.class, () -> BlockGeometry.of(100, 100, 4, 0));
    }

    @Test
    void blockRoundingToZero_isConfigError() {
        MosaicConfigException e = assertThrows(MosaicConfigException.class,
                () -> BlockGeometry.of(10, 100, 11, 4));
        assertEquals(Stage.CONFIGURATION, e.stage());
    }

    @Test
    void cells_partitionCanvasWithoutGapOrOverlap() {
        BlockGeometry g = BlockGeometry.of(35, 24, 7, 3);
        List<Cell> cells = g.cells();
        assertEquals(21, cells.size());

        int[][] cover = new int[g.canvasHeight()][g.canvasWidth()];
        for (Cell c : cells) {
            for (int y = g.offsetY(c); y < g.offsetY(c) + g.blockHeight(); y++) {
                for (int x = g.offsetX(c); x < g.offsetX(c) + g.blockWidth(); x++) {
                    cover[y][x]++;
                }
            }
        }
        for (int[] row : cover) {
            for (int count : row) {
                assertEquals(1, count, "Every canvas pixel belongs to exactly one cell");
            }
        }
    }

    @Test
    void cells_rowCountsAlongVerticalAxis() {
        BlockGeometry g = BlockGeometry.of(40, 10, 4, 2);
        Set<Cell> cells = new HashSet<>(g.cells());
        assertTrue(cells.contains(new Cell(1, 3)));
        assertFalse(cells.contains(new Cell(3, 1)));
        assertEquals(30, g.offsetX(new Cell(1, 3)));
        assertEquals(5, g.offsetY(new Cell(1, 3)));
    }
}
