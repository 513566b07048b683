package com.flowmable.mosaicify;

/**
 * The tile chosen for one cell.
 *
 * @param cell      Grid position
 * @param tileIndex Library index of the placed tile
 * @param score     Distance between the original block and the tile
 */
public record Placement(Cell cell, int tileIndex, double score) {}
