package com.flowmable.mosaicify;

/**
 * Invalid run parameters: degenerate grid, empty tile library, unknown color space.
 */
public class MosaicConfigException extends MosaicException {

    public MosaicConfigException(String message) {
        super(Stage.CONFIGURATION, message);
    }
}
