package com.flowmable.mosaicify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MosaicCanvasTest {

    private final BlockGeometry geometry = BlockGeometry.of(30, 20, 3, 2); // 10x10 blocks

    @Test
    void paste_leavesUnvisitedBlocksUntouched() {
        RgbRaster target = FeatureMapTest.noise(30, 20, 77);
        RgbRaster original = target.copy();
        MosaicCanvas canvas = new MosaicCanvas(target, geometry);
        Tile tile = TileLibrary.preprocess(0, RgbRaster.filled(10, 10, 1, 2, 3), geometry, ColorSpace.RGB);

        canvas.paste(new Cell(1, 1), tile);

        assertEquals(tile.image(), canvas.block(new Cell(1, 1)));
        for (Cell other : geometry.cells()) {
            if (other.equals(new Cell(1, 1))) continue;
            int x = geometry.offsetX(other);
            int y = geometry.offsetY(other);
            assertEquals(original.crop(x, y, 10, 10), canvas.block(other), other.toString());
        }
    }

    @Test
    void wrongCanvasSize_isInvariantViolation() {
        assertThrows(InvariantViolationException.class,
                () -> new MosaicCanvas(RgbRaster.filled(31, 20, 0, 0, 0), geometry));
    }

    @Test
    void wrongTileSize_isInvariantViolation() {
        MosaicCanvas canvas = new MosaicCanvas(RgbRaster.filled(30, 20, 0, 0, 0), geometry);
        RgbRaster small = RgbRaster.filled(5, 5, 0, 0, 0);
        Tile bad = new Tile(0, small, FeatureMap.of(small, ColorSpace.RGB));
        assertThrows(InvariantViolationException.class, () -> canvas.paste(new Cell(0, 0), bad));
    }
}
