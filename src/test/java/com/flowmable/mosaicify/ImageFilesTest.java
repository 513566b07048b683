package com.flowmable.mosaicify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageFilesTest {

    @Test
    void writeThenRead_png(@TempDir Path dir) throws IOException {
        RgbRaster raster = FeatureMapTest.noise(9, 7, 3);
        Path file = dir.resolve("nested/out.png");
        ImageFiles.write(raster, file);

        RgbRaster back = ImageFiles.read(file);
        assertEquals(9, back.width());
        assertEquals(7, back.height());
        assertEquals(raster.getRgb(4, 4), back.getRgb(4, 4));
    }

    @Test
    void read_garbageIsDecodeError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.jpg");
        Files.write(file, new byte[]{1, 2, 3, 4});
        ImageDecodeException e = assertThrows(ImageDecodeException.class, () -> ImageFiles.read(file));
        assertEquals(file, e.path());
        assertTrue(e.getMessage().contains("broken.jpg"));
    }

    @Test
    void read_missingFileIsDecodeError(@TempDir Path dir) {
        Path file = dir.resolve("missing.png");
        ImageDecodeException e = assertThrows(ImageDecodeException.class, () -> ImageFiles.read(file));
        assertEquals(file, e.path());
    }

    @Test
    void listSourceImages_sortedRegularFilesOnly(@TempDir Path dir) throws IOException {
        Files.createDirectory(dir.resolve("sub"));
        Files.writeString(dir.resolve("c.png"), "");
        Files.writeString(dir.resolve("a.png"), "");
        Files.writeString(dir.resolve("b.jpg"), "");

        List<Path> files = ImageFiles.listSourceImages(dir);
        assertEquals(List.of(dir.resolve("a.png"), dir.resolve("b.jpg"), dir.resolve("c.png")), files);
    }

    @Test
    void listSourceImages_missingDirectory(@TempDir Path dir) {
        assertThrows(IOException.class, () -> ImageFiles.listSourceImages(dir.resolve("nope")));
    }

    @Test
    void formatFor_followsExtension() {
        assertEquals("jpg", ImageFiles.formatFor(Path.of("mosaic.jpg")));
        assertEquals("jpg", ImageFiles.formatFor(Path.of("mosaic.JPEG")));
        assertEquals("png", ImageFiles.formatFor(Path.of("out/mosaic.png")));
        assertEquals("jpg", ImageFiles.formatFor(Path.of("mosaic")));
        assertEquals("jpg", ImageFiles.formatFor(Path.of("mosaic.webp")));
    }

    @Test
    void write_jpegIsReadable(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("m.jpg");
        ImageFiles.write(RgbRaster.filled(16, 16, 200, 10, 10), file);
        BufferedImage img = ImageIO.read(file.toFile());
        assertNotNull(img);
        assertEquals(16, img.getWidth());
    }
}
