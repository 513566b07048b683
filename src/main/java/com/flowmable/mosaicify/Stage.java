package com.flowmable.mosaicify;

/**
 * Pipeline stages, used for progress reporting and error diagnostics.
 */
public enum Stage {
    CONFIGURATION("validating configuration"),
    PREPROCESSING_TARGET("preprocessing target"),
    PREPROCESSING_SOURCES("preprocessing sources"),
    GENERATING_MOSAIC("generating mosaic");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
