package com.flowmable.mosaicify;

import java.util.List;

/**
 * Output of a mosaic run.
 *
 * @param image      Composited canvas, {@code blockWidth·rowSize × blockHeight·colSize}
 * @param geometry   Grid layout used
 * @param placements One entry per cell, in visiting order
 * @param resetCount How many times the used-tile set was cleared
 */
public record MosaicResult(RgbRaster image, BlockGeometry geometry, List<Placement> placements, int resetCount) {

    public long distinctTiles() {
        return placements.stream().mapToInt(Placement::tileIndex).distinct().count();
    }
}
