package com.flowmable.mosaicify;

/**
 * One grid position. {@code row} counts along the vertical axis, {@code col} along the horizontal.
 */
public record Cell(int row, int col) {}
