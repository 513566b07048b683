package com.flowmable.mosaicify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reading and writing image files.
 */
public final class ImageFiles {

    private static final Logger logger = LoggerFactory.getLogger(ImageFiles.class);

    private static final Set<String> WRITABLE_FORMATS = Set.of("jpg", "png", "bmp", "gif");
    private static final String DEFAULT_FORMAT = "jpg";

    private ImageFiles() {}

    /**
     * Decode an image file into an RGB raster.
     *
     * @throws ImageDecodeException if the file cannot be read or is not a supported image
     */
    public static RgbRaster read(Path file) throws ImageDecodeException {
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new ImageDecodeException(file, "Failed to read image", e);
        }
        if (image == null) {
            throw new ImageDecodeException(file, "Failed to decode image");
        }
        logger.debug("Decoded {} ({}x{})", file, image.getWidth(), image.getHeight());
        return RgbRaster.fromImage(image);
    }

    /**
     * Regular files in {@code directory}, sorted by file name. The order is the tile library order.
     */
    public static List<Path> listSourceImages(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        }
    }

    /**
     * Encode as 8-bit RGB. The format follows the file extension; unknown or
     * missing extensions are written as JPEG.
     */
    public static void write(RgbRaster raster, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String format = formatFor(file);
        if (!ImageIO.write(raster.toImage(), format, file.toFile())) {
            throw new IOException("No image writer for format " + format + ": " + file);
        }
        logger.debug("Wrote {} as {}", file, format);
    }

    static String formatFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_FORMAT;
        }
        String ext = name.substring(dot + 1);
        if (ext.equals("jpeg")) {
            return "jpg";
        }
        return WRITABLE_FORMATS.contains(ext) ? ext : DEFAULT_FORMAT;
    }
}
