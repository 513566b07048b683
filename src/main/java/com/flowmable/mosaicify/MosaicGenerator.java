package com.flowmable.mosaicify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Top-level entry point for mosaic generation.
 * <p>
 * PIPELINE
 * 1. Target: derive the block size, resample the target to the canvas size.
 * 2. Sources: build the tile library (parallel, order preserving).
 * 3. Mosaic: visit cells in shuffled order, one at a time; each cell is
 *    matched against the library in parallel, then pasted.
 */
public class MosaicGenerator {

    private static final Logger logger = LoggerFactory.getLogger(MosaicGenerator.class);

    private final MosaicSettings settings;
    private final ProgressListener progress;

    public MosaicGenerator(MosaicSettings settings) {
        this(settings, ProgressListener.NONE);
    }

    public MosaicGenerator(MosaicSettings settings, ProgressListener progress) {
        settings.validate();
        this.settings = settings;
        this.progress = progress;
    }

    /**
     * Read the target and every file of {@code imagesDir}, compose the mosaic and write it to {@code output}.
     */
    public MosaicResult generate(Path target, Path imagesDir, Path output) {
        MosaicResult result = generate(target, imagesDir);
        try {
            ImageFiles.write(result.image(), output);
        } catch (IOException e) {
            throw new MosaicException(Stage.GENERATING_MOSAIC, output, "failed to save the mosaic image", e);
        }
        logger.info("Saved mosaic to {}", output);
        return result;
    }

    /** Read the target and every file of {@code imagesDir} and compose the mosaic. */
    public MosaicResult generate(Path target, Path imagesDir) {
        List<Path> sourceFiles;
        try {
            sourceFiles = ImageFiles.listSourceImages(imagesDir);
        } catch (IOException e) {
            throw new MosaicException(Stage.PREPROCESSING_SOURCES, imagesDir, "failed to list source images", e);
        }
        if (sourceFiles.isEmpty()) {
            throw new MosaicConfigException("no source images in " + imagesDir);
        }

        RgbRaster targetImage;
        try {
            targetImage = ImageFiles.read(target);
        } catch (ImageDecodeException e) {
            throw new MosaicException(Stage.PREPROCESSING_TARGET, target, e.getMessage(), e);
        }

        ExecutorService executor = Executors.newFixedThreadPool(settings.parallelism());
        try {
            MosaicCanvas canvas = prepareTarget(targetImage);
            logger.info("[2/3] Preprocessing the source images.");
            TileLibrary library = TileLibrary.load(sourceFiles, canvas.geometry(), settings.colorSpace(),
                    executor, progress);
            logger.info("[2/3] Finished preprocessing the source images.");
            return compose(canvas, library, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    /** Compose a mosaic from decoded images. */
    public MosaicResult generate(RgbRaster target, List<RgbRaster> sources) {
        if (sources.isEmpty()) {
            throw new MosaicConfigException("the source image library is empty");
        }
        ExecutorService executor = Executors.newFixedThreadPool(settings.parallelism());
        try {
            MosaicCanvas canvas = prepareTarget(target);
            logger.info("[2/3] Preprocessing the source images.");
            TileLibrary library = TileLibrary.build(sources, canvas.geometry(), settings.colorSpace(),
                    executor, progress);
            logger.info("[2/3] Finished preprocessing the source images.");
            return compose(canvas, library, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private MosaicCanvas prepareTarget(RgbRaster target) {
        logger.info("[1/3] Preprocessing the target image.");
        progress.onProgress(Stage.PREPROCESSING_TARGET, 0, 1);
        BlockGeometry geometry = BlockGeometry.of(
                target.width(), target.height(), settings.rowSize(), settings.colSize());
        if (geometry.canvasWidth() != target.width() || geometry.canvasHeight() != target.height()) {
            logger.warn("Target {}x{} is not divisible by a {}x{} grid; resampling to {}x{}",
                    target.width(), target.height(), settings.rowSize(), settings.colSize(),
                    geometry.canvasWidth(), geometry.canvasHeight());
        }
        RgbRaster canvas = LanczosResampler.resize(target, geometry.canvasWidth(), geometry.canvasHeight());
        progress.onProgress(Stage.PREPROCESSING_TARGET, 1, 1);
        logger.info("[1/3] Finished preprocessing the target image ({} cells of {}x{}).",
                geometry.cellCount(), geometry.blockWidth(), geometry.blockHeight());
        return new MosaicCanvas(canvas, geometry);
    }

    /**
     * Sequential traversal. Each cell is scored, recorded and pasted before
     * the next one is read.
     */
    MosaicResult compose(MosaicCanvas canvas, TileLibrary library, ExecutorService executor) {
        logger.info("[3/3] Generating the mosaic image.");
        BlockGeometry geometry = canvas.geometry();
        Random random = settings.seed() == null ? new Random() : new Random(settings.seed());
        List<Cell> order = GridTraversal.order(geometry, random);

        TileMatcher matcher = new TileMatcher(library, executor, settings.parallelism());
        UsedTileTracker used = settings.avoidDuplicates() ? new UsedTileTracker(library.size()) : null;
        List<Placement> placements = new ArrayList<>(order.size());

        int done = 0;
        progress.onProgress(Stage.GENERATING_MOSAIC, 0, order.size());
        for (Cell cell : order) {
            if (used != null && used.resetIfExhausted()) {
                logger.debug("All {} tiles used; reset before cell {}", library.size(), cell);
            }
            FeatureMap block = FeatureMap.of(canvas.block(cell), settings.colorSpace());
            TileMatcher.Match match = matcher.findBest(block, used);
            if (used != null) {
                used.markUsed(match.tileIndex());
            }
            canvas.paste(cell, library.get(match.tileIndex()));
            placements.add(new Placement(cell, match.tileIndex(), match.score()));
            if (logger.isDebugEnabled()) {
                logger.debug("Cell ({}, {}) -> tile {} (score {})",
                        cell.row(), cell.col(), match.tileIndex(), match.score());
            }
            progress.onProgress(Stage.GENERATING_MOSAIC, ++done, order.size());
        }

        int resets = used == null ? 0 : used.resetCount();
        MosaicResult result = new MosaicResult(canvas.raster(), geometry, List.copyOf(placements), resets);
        logger.info("[3/3] Finished generating the mosaic image: {} cells, {} distinct tiles, {} resets.",
                placements.size(), result.distinctTiles(), resets);
        return result;
    }
}
