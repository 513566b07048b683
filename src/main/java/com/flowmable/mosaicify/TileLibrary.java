package com.flowmable.mosaicify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ordered, immutable list of preprocessed tiles.
 * <p>
 * Each source is decoded, resized to the block size and transformed in its own
 * task; results are collected back in source order so that a tile's index
 * equals the position of its source in the input list.
 */
public final class TileLibrary {

    private static final Logger logger = LoggerFactory.getLogger(TileLibrary.class);

    private final List<Tile> tiles;
    private final BlockGeometry geometry;
    private final ColorSpace colorSpace;

    private TileLibrary(List<Tile> tiles, BlockGeometry geometry, ColorSpace colorSpace) {
        this.tiles = Collections.unmodifiableList(tiles);
        this.geometry = geometry;
        this.colorSpace = colorSpace;
    }

    /** Build from already decoded images. */
    public static TileLibrary build(List<RgbRaster> sources, BlockGeometry geometry, ColorSpace colorSpace,
                                    ExecutorService executor, ProgressListener progress) {
        List<SourceTask> tasks = new ArrayList<>(sources.size());
        for (RgbRaster source : sources) {
            tasks.add(new SourceTask(null, () -> source));
        }
        return buildAll(tasks, geometry, colorSpace, executor, progress);
    }

    /**
     * Build from image files; decoding happens on the worker threads.
     * Any file that cannot be decoded aborts the whole build.
     */
    public static TileLibrary load(List<Path> files, BlockGeometry geometry, ColorSpace colorSpace,
                                   ExecutorService executor, ProgressListener progress) {
        List<SourceTask> tasks = new ArrayList<>(files.size());
        for (Path file : files) {
            tasks.add(new SourceTask(file, () -> ImageFiles.read(file)));
        }
        return buildAll(tasks, geometry, colorSpace, executor, progress);
    }

    private static TileLibrary buildAll(List<SourceTask> tasks, BlockGeometry geometry, ColorSpace colorSpace,
                                        ExecutorService executor, ProgressListener progress) {
        if (tasks.isEmpty()) {
            throw new MosaicConfigException("the source image library is empty");
        }
        int total = tasks.size();
        AtomicInteger done = new AtomicInteger();
        progress.onProgress(Stage.PREPROCESSING_SOURCES, 0, total);

        List<Future<Tile>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            final int index = i;
            final SourceTask task = tasks.get(i);
            futures.add(executor.submit(() -> {
                Tile tile = preprocess(index, task.decoder().call(), geometry, colorSpace);
                progress.onProgress(Stage.PREPROCESSING_SOURCES, done.incrementAndGet(), total);
                return tile;
            }));
        }

        List<Tile> tiles = new ArrayList<>(total);
        try {
            for (int i = 0; i < total; i++) {
                tiles.add(await(futures.get(i), tasks.get(i).path));
            }
        } finally {
            for (Future<Tile> f : futures) {
                f.cancel(true);
            }
        }
        logger.info("Prepared {} tiles of {}x{} in {} space",
                tiles.size(), geometry.blockWidth(), geometry.blockHeight(), colorSpace);
        return new TileLibrary(tiles, geometry, colorSpace);
    }

    private static Tile await(Future<Tile> future, Path path) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MosaicException(Stage.PREPROCESSING_SOURCES, path, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MosaicException me) {
                throw me;
            }
            if (cause instanceof ImageDecodeException de) {
                throw new MosaicException(Stage.PREPROCESSING_SOURCES, de.path(), de.getMessage(), de);
            }
            throw new MosaicException(Stage.PREPROCESSING_SOURCES, path, String.valueOf(cause.getMessage()), cause);
        }
    }

    /** Resize one source to the block size and compute its feature map. */
    static Tile preprocess(int index, RgbRaster source, BlockGeometry geometry, ColorSpace colorSpace) {
        RgbRaster resized = LanczosResampler.resize(source, geometry.blockWidth(), geometry.blockHeight());
        if (resized.width() != geometry.blockWidth() || resized.height() != geometry.blockHeight()) {
            throw new InvariantViolationException(Stage.PREPROCESSING_SOURCES,
                    "tile " + index + " resized to " + resized.width() + "x" + resized.height());
        }
        return new Tile(index, resized, FeatureMap.of(resized, colorSpace));
    }

    public int size() {
        return tiles.size();
    }

    public Tile get(int index) {
        return tiles.get(index);
    }

    public List<Tile> tiles() {
        return tiles;
    }

    public BlockGeometry geometry() {
        return geometry;
    }

    public ColorSpace colorSpace() {
        return colorSpace;
    }

    private record SourceTask(Path path, Callable<RgbRaster> decoder) {}
}
