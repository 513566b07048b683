package com.flowmable.mosaicify;

/**
 * A source image resized to the block size, with its precomputed features.
 *
 * @param index    Position in the library; the identity used by duplicate avoidance
 * @param image    Resized pixels, exactly block width × block height
 * @param features Feature map of {@code image} under the run's color space
 */
public record Tile(int index, RgbRaster image, FeatureMap features) {}
