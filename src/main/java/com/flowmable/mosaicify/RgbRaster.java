package com.flowmable.mosaicify;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Width×height RGB pixel buffer with float channels in the 0–255 range.
 * <p>
 * Pixels are stored interleaved, row-major: {@code [r, g, b, r, g, b, ...]}.
 * Rasters produced by decoding or resampling are treated as immutable; only
 * the mosaic canvas is written to, through {@link #paste}.
 */
public final class RgbRaster {

    private final int width;
    private final int height;
    private final float[] data;

    public RgbRaster(int width, int height) {
        this(width, height, new float[checkedSize(width, height)]);
    }

    RgbRaster(int width, int height, float[] data) {
        if (data.length != checkedSize(width, height)) {
            throw new IllegalArgumentException("Expected " + (width * height * 3) + " samples, got " + data.length);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    private static int checkedSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        return Math.multiplyExact(Math.multiplyExact(width, height), 3);
    }

    /** Copy the RGB channels of an image; alpha is dropped. */
    public static RgbRaster fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        float[] data = new float[checkedSize(w, h)];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                int i = (y * w + x) * 3;
                data[i] = (rgb >> 16) & 0xFF;
                data[i + 1] = (rgb >> 8) & 0xFF;
                data[i + 2] = rgb & 0xFF;
            }
        }
        return new RgbRaster(w, h, data);
    }

    /** Uniformly colored raster. */
    public static RgbRaster filled(int width, int height, int r, int g, int b) {
        RgbRaster raster = new RgbRaster(width, height);
        for (int i = 0; i < raster.data.length; i += 3) {
            raster.data[i] = r;
            raster.data[i + 1] = g;
            raster.data[i + 2] = b;
        }
        return raster;
    }

    /** 8-bit RGB image; channels are rounded and clamped to 0–255. */
    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * 3;
                row[x] = (toByte(data[i]) << 16) | (toByte(data[i + 1]) << 8) | toByte(data[i + 2]);
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    private static int toByte(float v) {
        return Math.max(0, Math.min(255, Math.round(v)));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float red(int x, int y) {
        return data[(y * width + x) * 3];
    }

    public float green(int x, int y) {
        return data[(y * width + x) * 3 + 1];
    }

    public float blue(int x, int y) {
        return data[(y * width + x) * 3 + 2];
    }

    /** Packed 0xRRGGBB value of a pixel after rounding. */
    public int getRgb(int x, int y) {
        int i = (y * width + x) * 3;
        return (toByte(data[i]) << 16) | (toByte(data[i + 1]) << 8) | toByte(data[i + 2]);
    }

    public void setRgb(int x, int y, float r, float g, float b) {
        int i = (y * width + x) * 3;
        data[i] = r;
        data[i + 1] = g;
        data[i + 2] = b;
    }

    /** Interleaved sample array, shared with this raster. */
    float[] samples() {
        return data;
    }

    /**
     * Copy of the rectangle {@code [x, x+w) × [y, y+h)}.
     */
    public RgbRaster crop(int x, int y, int w, int h) {
        checkRegion(x, y, w, h);
        float[] out = new float[checkedSize(w, h)];
        for (int row = 0; row < h; row++) {
            System.arraycopy(data, ((y + row) * width + x) * 3, out, row * w * 3, w * 3);
        }
        return new RgbRaster(w, h, out);
    }

    /**
     * Overwrite the rectangle at {@code (x, y)} with the pixels of {@code src}.
     * The whole source must fit inside this raster.
     */
    public void paste(RgbRaster src, int x, int y) {
        checkRegion(x, y, src.width, src.height);
        for (int row = 0; row < src.height; row++) {
            System.arraycopy(src.data, row * src.width * 3, data, ((y + row) * width + x) * 3, src.width * 3);
        }
    }

    private void checkRegion(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height) {
            throw new IndexOutOfBoundsException(String.format(
                    "Region [%d,%d %dx%d] outside raster %dx%d", x, y, w, h, width, height));
        }
    }

    public RgbRaster copy() {
        return new RgbRaster(width, height, data.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbRaster other)) return false;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RgbRaster[" + width + "x" + height + "]";
    }
}
