package com.flowmable.mosaicify;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Nearest-neighbor search of one block against the tile library.
 * <p>
 * The library is split into contiguous index ranges that are scored in
 * parallel against the same block feature map. Workers only read; the
 * winner is chosen on the calling thread. Equal scores resolve to the lowest
 * tile index, so the result does not depend on the number of workers.
 */
public final class TileMatcher {

    /** Smaller libraries are scanned on the calling thread. */
    private static final int MIN_TILES_PER_TASK = 8;

    static final Comparator<Match> BEST_FIRST =
            Comparator.comparingDouble(Match::score).thenComparingInt(Match::tileIndex);

    private final TileLibrary library;
    private final ExecutorService executor;
    private final int parallelism;

    public TileMatcher(TileLibrary library, ExecutorService executor, int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.library = library;
        this.executor = executor;
        this.parallelism = parallelism;
    }

    /**
     * Best tile for {@code block} among tiles not marked in {@code used}.
     *
     * @param used tiles to skip, or null to consider every tile
     * @throws InvariantViolationException if no tile is eligible
     */
    public Match findBest(FeatureMap block, UsedTileTracker used) {
        int n = library.size();
        int tasks = Math.min(parallelism, Math.max(1, n / MIN_TILES_PER_TASK));
        Match best;
        if (tasks == 1) {
            best = scan(block, used, 0, n);
        } else {
            best = scanParallel(block, used, n, tasks);
        }
        if (best == null) {
            throw new InvariantViolationException("no eligible tile among " + n + " candidates");
        }
        return best;
    }

    private Match scanParallel(FeatureMap block, UsedTileTracker used, int n, int tasks) {
        int chunk = (n + tasks - 1) / tasks;
        List<Callable<Match>> jobs = new ArrayList<>(tasks);
        for (int from = 0; from < n; from += chunk) {
            final int start = from;
            final int end = Math.min(n, from + chunk);
            jobs.add(() -> scan(block, used, start, end));
        }
        Match best = null;
        try {
            for (Future<Match> f : executor.invokeAll(jobs)) {
                best = better(best, f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MosaicException(Stage.GENERATING_MOSAIC, null, "interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new MosaicException(Stage.GENERATING_MOSAIC, null, String.valueOf(e.getCause()), e.getCause());
        }
        return best;
    }

    private Match scan(FeatureMap block, UsedTileTracker used, int from, int to) {
        Match best = null;
        for (int i = from; i < to; i++) {
            if (used != null && used.isUsed(i)) continue;
            Tile tile = library.get(i);
            best = better(best, new Match(i, block.distance(tile.features())));
        }
        return best;
    }

    private static Match better(Match a, Match b) {
        if (a == null) return b;
        if (b == null) return a;
        return BEST_FIRST.compare(a, b) <= 0 ? a : b;
    }

    /**
     * Winning tile of one search.
     *
     * @param tileIndex Library index of the tile
     * @param score     Sum of per-pixel feature distances; 0 for an exact match
     */
    public record Match(int tileIndex, double score) {}
}
