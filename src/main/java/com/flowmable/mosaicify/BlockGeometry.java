package com.flowmable.mosaicify;

import java.util.ArrayList;
import java.util.List;

/**
 * Grid layout of the mosaic canvas.
 *
 * @param blockWidth  Width of one cell in pixels
 * @param blockHeight Height of one cell in pixels
 * @param rowSize     Number of cells along the horizontal axis
 * @param colSize     Number of cells along the vertical axis
 */
public record BlockGeometry(int blockWidth, int blockHeight, int rowSize, int colSize) {

    public BlockGeometry {
        if (rowSize <= 0 || colSize <= 0) {
            throw new MosaicConfigException(String.format(
                    "grid must have at least one cell per axis, got row_size=%d col_size=%d", rowSize, colSize));
        }
        if (blockWidth <= 0 || blockHeight <= 0) {
            throw new MosaicConfigException(String.format(
                    "block size %dx%d is degenerate; the target is too small for a %dx%d grid",
                    blockWidth, blockHeight, rowSize, colSize));
        }
    }

    /**
     * Derive cell size from the target dimensions by integer division.
     * Remainder pixels are not part of the canvas.
     */
    public static BlockGeometry of(int targetWidth, int targetHeight, int rowSize, int colSize) {
        if (rowSize <= 0 || colSize <= 0) {
            throw new MosaicConfigException(String.format(
                    "grid must have at least one cell per axis, got row_size=%d col_size=%d", rowSize, colSize));
        }
        return new BlockGeometry(targetWidth / rowSize, targetHeight / colSize, rowSize, colSize);
    }

    public int canvasWidth() {
        return blockWidth * rowSize;
    }

    public int canvasHeight() {
        return blockHeight * colSize;
    }

    public int cellCount() {
        return rowSize * colSize;
    }

    /** All cells in raster order: {@code row} in [0, colSize), {@code col} in [0, rowSize). */
    public List<Cell> cells() {
        List<Cell> cells = new ArrayList<>(cellCount());
        for (int row = 0; row < colSize; row++) {
            for (int col = 0; col < rowSize; col++) {
                cells.add(new Cell(row, col));
            }
        }
        return cells;
    }

    public int offsetX(Cell cell) {
        return cell.col() * blockWidth;
    }

    public int offsetY(Cell cell) {
        return cell.row() * blockHeight;
    }
}
