package com.flowmable.mosaicify;

/**
 * Separable 3-lobe Lanczos resampling.
 * <p>
 * Both axes are scaled independently to the requested size, so aspect ratio
 * is not preserved. When downscaling, the kernel is stretched by the scale
 * factor so every source pixel contributes. Samples beyond the edge are
 * clamped to the border pixel and results are clamped to 0–255.
 */
public final class LanczosResampler {

    private static final int LOBES = 3;

    private LanczosResampler() {}

    public static RgbRaster resize(RgbRaster src, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }
        if (src.width() == width && src.height() == height) {
            return src.copy();
        }
        float[] horizontal = resampleRows(src.samples(), src.width(), src.height(), width);
        float[] out = resampleColumns(horizontal, width, src.height(), height);
        return new RgbRaster(width, height, out);
    }

    private static float[] resampleRows(float[] in, int inW, int h, int outW) {
        Contributions c = Contributions.compute(inW, outW);
        float[] out = new float[outW * h * 3];
        for (int y = 0; y < h; y++) {
            int rowIn = y * inW * 3;
            int rowOut = y * outW * 3;
            for (int x = 0; x < outW; x++) {
                double r = 0, g = 0, b = 0;
                int start = c.first[x];
                double[] w = c.weights[x];
                for (int k = 0; k < w.length; k++) {
                    int i = rowIn + clamp(start + k, inW) * 3;
                    r += w[k] * in[i];
                    g += w[k] * in[i + 1];
                    b += w[k] * in[i + 2];
                }
                int o = rowOut + x * 3;
                out[o] = clampChannel(r);
                out[o + 1] = clampChannel(g);
                out[o + 2] = clampChannel(b);
            }
        }
        return out;
    }

    private static float[] resampleColumns(float[] in, int w, int inH, int outH) {
        Contributions c = Contributions.compute(inH, outH);
        float[] out = new float[w * outH * 3];
        for (int y = 0; y < outH; y++) {
            int start = c.first[y];
            double[] weights = c.weights[y];
            for (int x = 0; x < w; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = 0; k < weights.length; k++) {
                    int i = (clamp(start + k, inH) * w + x) * 3;
                    r += weights[k] * in[i];
                    g += weights[k] * in[i + 1];
                    b += weights[k] * in[i + 2];
                }
                int o = (y * w + x) * 3;
                out[o] = clampChannel(r);
                out[o + 1] = clampChannel(g);
                out[o + 2] = clampChannel(b);
            }
        }
        return out;
    }

    private static int clamp(int i, int n) {
        return i < 0 ? 0 : (i >= n ? n - 1 : i);
    }

    private static float clampChannel(double v) {
        return (float) Math.max(0.0, Math.min(255.0, v));
    }

    static double lanczos(double x) {
        if (x == 0.0) return 1.0;
        if (x <= -LOBES || x >= LOBES) return 0.0;
        double px = Math.PI * x;
        return LOBES * Math.sin(px) * Math.sin(px / LOBES) / (px * px);
    }

    /** Normalized kernel weights for each output position along one axis. */
    private static final class Contributions {
        final int[] first;
        final double[][] weights;

        private Contributions(int[] first, double[][] weights) {
            this.first = first;
            this.weights = weights;
        }

        static Contributions compute(int inSize, int outSize) {
            double ratio = (double) inSize / outSize;
            double scale = Math.max(1.0, ratio);
            double support = LOBES * scale;
            int[] first = new int[outSize];
            double[][] weights = new double[outSize][];
            for (int o = 0; o < outSize; o++) {
                double center = (o + 0.5) * ratio;
                int left = (int) Math.floor(center - support);
                int right = (int) Math.ceil(center + support);
                double[] w = new double[right - left];
                double total = 0;
                for (int k = 0; k < w.length; k++) {
                    double v = lanczos((left + k + 0.5 - center) / scale);
                    w[k] = v;
                    total += v;
                }
                if (total != 0) {
                    for (int k = 0; k < w.length; k++) {
                        w[k] /= total;
                    }
                }
                first[o] = left;
                weights[o] = w;
            }
            return new Contributions(first, weights);
        }
    }
}
