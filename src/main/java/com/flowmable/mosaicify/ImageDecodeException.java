package com.flowmable.mosaicify;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An image file could not be read or decoded.
 */
public class ImageDecodeException extends IOException {

    private final Path path;

    public ImageDecodeException(Path path, String message) {
        this(path, message, null);
    }

    public ImageDecodeException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
