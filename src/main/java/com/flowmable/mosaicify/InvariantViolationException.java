package com.flowmable.mosaicify;

/**
 * Internal consistency check failed (mismatched feature maps, no eligible tile).
 * Unreachable for well-formed input; raised instead of producing wrong output.
 */
public class InvariantViolationException extends MosaicException {

    public InvariantViolationException(String message) {
        this(Stage.GENERATING_MOSAIC, message);
    }

    public InvariantViolationException(Stage stage, String message) {
        super(stage, "internal error: " + message);
    }
}
