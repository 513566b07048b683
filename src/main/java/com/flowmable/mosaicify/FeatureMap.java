package com.flowmable.mosaicify;

/**
 * Per-pixel feature vectors of a raster under one {@link ColorSpace}.
 * <p>
 * Dimensions always equal those of the source raster; each pixel holds
 * {@code colorSpace.arity()} components.
 */
public final class FeatureMap {

    private final int width;
    private final int height;
    private final ColorSpace colorSpace;
    private final float[] values;

    private FeatureMap(int width, int height, ColorSpace colorSpace, float[] values) {
        this.width = width;
        this.height = height;
        this.colorSpace = colorSpace;
        this.values = values;
    }

    /** Transform every pixel of {@code raster}. */
    public static FeatureMap of(RgbRaster raster, ColorSpace colorSpace) {
        int w = raster.width();
        int h = raster.height();
        int arity = colorSpace.arity();
        float[] src = raster.samples();
        float[] values = new float[w * h * arity];
        for (int p = 0, n = w * h; p < n; p++) {
            colorSpace.transform(src[p * 3], src[p * 3 + 1], src[p * 3 + 2], values, p * arity);
        }
        return new FeatureMap(w, h, colorSpace, values);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public ColorSpace colorSpace() {
        return colorSpace;
    }

    public int arity() {
        return colorSpace.arity();
    }

    /** Feature vector at {@code (x, y)}. */
    public float[] get(int x, int y) {
        int arity = arity();
        float[] out = new float[arity];
        System.arraycopy(values, (y * width + x) * arity, out, 0, arity);
        return out;
    }

    /**
     * Sum over all pixel positions of the Euclidean norm of the per-pixel
     * feature difference. Not averaged.
     *
     * @throws InvariantViolationException if dimensions or arity differ
     */
    public double distance(FeatureMap other) {
        if (width != other.width || height != other.height) {
            throw new InvariantViolationException(String.format(
                    "feature map size mismatch: %dx%d vs %dx%d", width, height, other.width, other.height));
        }
        if (arity() != other.arity()) {
            throw new InvariantViolationException(String.format(
                    "feature arity mismatch: %s(%d) vs %s(%d)",
                    colorSpace, arity(), other.colorSpace, other.arity()));
        }
        int arity = arity();
        float[] a = values;
        float[] b = other.values;
        double sum = 0;
        for (int i = 0; i < a.length; i += arity) {
            double sq = 0;
            for (int c = 0; c < arity; c++) {
                double d = a[i + c] - b[i + c];
                sq += d * d;
            }
            sum += Math.sqrt(sq);
        }
        return sum;
    }
}
