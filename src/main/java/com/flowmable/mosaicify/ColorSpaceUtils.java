package com.flowmable.mosaicify;

/**
 * Per-pixel color conversions used to build feature maps.
 * <p>
 * All inputs are sRGB channel values in the 0–255 range. The Lab conversion
 * uses the D65 illuminant and returns lightness doubled, so that lightness
 * differences weigh twice as much as chroma differences when tiles are scored.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    /** Weight applied to L* in {@link #srgbToLab}. */
    public static final double LIGHTNESS_WEIGHT = 2.0;

    /**
     * Convert sRGB (0–255 per channel) to weighted CIELAB [2·L*, a*, b*].
     * White maps to roughly [200, 0, 0], black to [0, 0, 0].
     */
    public static double[] srgbToLab(double r, double g, double b) {
        // 1. sRGB → linear RGB
        double rl = gammaExpand(r / 255.0);
        double gl = gammaExpand(g / 255.0);
        double bl = gammaExpand(b / 255.0);

        // 2. Linear RGB → XYZ (D65 illuminant)
        double x = 0.4124 * rl + 0.3576 * gl + 0.1805 * bl;
        double y = 0.2126 * rl + 0.7152 * gl + 0.0722 * bl;
        double z = 0.0193 * rl + 0.1192 * gl + 0.9505 * bl;

        // 3. XYZ → Lab
        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        double L = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double bStar = 200.0 * (fy - fz);
        return new double[]{LIGHTNESS_WEIGHT * L, a, bStar};
    }

    /**
     * Perceptual luma (0.3 R + 0.59 G + 0.11 B), same scale as the input.
     */
    public static double luma(double r, double g, double b) {
        return 0.3 * r + 0.59 * g + 0.11 * b;
    }

    private static double gammaExpand(double c) {
        return c > 0.04045 ? Math.pow((c + 0.055) / 1.055, 2.4) : c / 12.92;
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : 7.787 * t + 16.0 / 116.0;
    }
}
