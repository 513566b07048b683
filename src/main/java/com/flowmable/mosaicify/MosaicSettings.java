package com.flowmable.mosaicify;

/**
 * Parameters of one mosaic run.
 *
 * @param rowSize         Number of cells along the horizontal axis
 * @param colSize         Number of cells along the vertical axis
 * @param colorSpace      Feature space used for matching
 * @param avoidDuplicates Do not reuse a tile until every tile has been placed once
 * @param seed            Seed for the traversal order; null for a fresh random order
 * @param parallelism     Worker threads for preprocessing and matching
 */
public record MosaicSettings(
        int rowSize,
        int colSize,
        ColorSpace colorSpace,
        boolean avoidDuplicates,
        Long seed,
        int parallelism
) {
    public static final ColorSpace DEFAULT_COLOR_SPACE = ColorSpace.LAB;

    /** Defaults of the command line: Lab matching, duplicates allowed, all cores. */
    public static MosaicSettings of(int rowSize, int colSize) {
        return new MosaicSettings(rowSize, colSize, DEFAULT_COLOR_SPACE, false, null,
                Runtime.getRuntime().availableProcessors());
    }

    public MosaicSettings withColorSpace(ColorSpace colorSpace) {
        return new MosaicSettings(rowSize, colSize, colorSpace, avoidDuplicates, seed, parallelism);
    }

    public MosaicSettings withAvoidDuplicates(boolean avoidDuplicates) {
        return new MosaicSettings(rowSize, colSize, colorSpace, avoidDuplicates, seed, parallelism);
    }

    public MosaicSettings withSeed(Long seed) {
        return new MosaicSettings(rowSize, colSize, colorSpace, avoidDuplicates, seed, parallelism);
    }

    public MosaicSettings withParallelism(int parallelism) {
        return new MosaicSettings(rowSize, colSize, colorSpace, avoidDuplicates, seed, parallelism);
    }

    /**
     * @throws MosaicConfigException if any parameter is out of range
     */
    public void validate() {
        if (rowSize <= 0 || colSize <= 0) {
            throw new MosaicConfigException(String.format(
                    "row_size and col_size must be positive, got %d and %d", rowSize, colSize));
        }
        if (colorSpace == null) {
            throw new MosaicConfigException("color space is required");
        }
        if (parallelism <= 0) {
            throw new MosaicConfigException("thread count must be positive, got " + parallelism);
        }
    }
}
