package com.flowmable.mosaicify;

import java.nio.file.Path;

/**
 * Fatal failure of a mosaic run. The message is prefixed with the stage
 * and, when known, the offending file.
 */
public class MosaicException extends RuntimeException {

    private final Stage stage;
    private final Path path;

    public MosaicException(Stage stage, String message) {
        this(stage, null, message, null);
    }

    public MosaicException(Stage stage, Path path, String message, Throwable cause) {
        super(format(stage, path, message), cause);
        this.stage = stage;
        this.path = path;
    }

    public Stage stage() {
        return stage;
    }

    /** The file that caused the failure, or null. */
    public Path path() {
        return path;
    }

    private static String format(Stage stage, Path path, String message) {
        StringBuilder sb = new StringBuilder("Failed while ").append(stage.label());
        if (path != null) {
            sb.append(" (").append(path).append(')');
        }
        return sb.append(": ").append(message).toString();
    }
}
