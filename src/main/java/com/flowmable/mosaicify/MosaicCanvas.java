package com.flowmable.mosaicify;

/**
 * The mutable output image, partitioned into disjoint grid cells.
 * <p>
 * Owned by the traversal loop. Cells do not overlap, so reading a block that
 * has not been visited yet always returns the original target pixels.
 */
public final class MosaicCanvas {

    private final RgbRaster raster;
    private final BlockGeometry geometry;

    public MosaicCanvas(RgbRaster target, BlockGeometry geometry) {
        if (target.width() != geometry.canvasWidth() || target.height() != geometry.canvasHeight()) {
            throw new InvariantViolationException(Stage.PREPROCESSING_TARGET, String.format(
                    "canvas is %dx%d but the grid needs %dx%d", target.width(), target.height(),
                    geometry.canvasWidth(), geometry.canvasHeight()));
        }
        this.raster = target;
        this.geometry = geometry;
    }

    /** Current pixels of {@code cell}, copied. */
    public RgbRaster block(Cell cell) {
        return raster.crop(geometry.offsetX(cell), geometry.offsetY(cell),
                geometry.blockWidth(), geometry.blockHeight());
    }

    /** Overwrite {@code cell} with the tile's pixels. */
    public void paste(Cell cell, Tile tile) {
        RgbRaster image = tile.image();
        if (image.width() != geometry.blockWidth() || image.height() != geometry.blockHeight()) {
            throw new InvariantViolationException(String.format("tile %d is %dx%d, cell is %dx%d",
                    tile.index(), image.width(), image.height(), geometry.blockWidth(), geometry.blockHeight()));
        }
        raster.paste(image, geometry.offsetX(cell), geometry.offsetY(cell));
    }

    public BlockGeometry geometry() {
        return geometry;
    }

    public RgbRaster raster() {
        return raster;
    }
}
