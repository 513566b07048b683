package com.flowmable.mosaicify;

/**
 * Receives progress updates. May be called from worker threads while the
 * tile library is being built.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (stage, done, total) -> {};

    void onProgress(Stage stage, int done, int total);
}
