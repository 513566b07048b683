package com.flowmable.mosaicify;

import java.util.Locale;

/**
 * Feature space in which target blocks and tiles are compared.
 */
public enum ColorSpace {
    /** Raw channel values. */
    RGB("rgb", 3, "Use RGB color space for matching tiles.") {
        @Override
        void transform(float r, float g, float b, float[] out, int offset) {
            out[offset] = r;
            out[offset + 1] = g;
            out[offset + 2] = b;
        }
    },
    /** CIELAB with doubled lightness. */
    LAB("lab", 3, "Use L*a*b* color space for more perceptually uniform matching.") {
        @Override
        void transform(float r, float g, float b, float[] out, int offset) {
            double[] lab = ColorSpaceUtils.srgbToLab(r, g, b);
            out[offset] = (float) lab[0];
            out[offset + 1] = (float) lab[1];
            out[offset + 2] = (float) lab[2];
        }
    },
    /** Single luma component. */
    GRAY("gray", 1, "Use grayscale for matching tiles based on intensity.") {
        @Override
        void transform(float r, float g, float b, float[] out, int offset) {
            out[offset] = (float) ColorSpaceUtils.luma(r, g, b);
        }
    };

    private final String id;
    private final int arity;
    private final String description;

    ColorSpace(String id, int arity, String description) {
        this.id = id;
        this.arity = arity;
        this.description = description;
    }

    /**
     * Writes the feature vector of one pixel into {@code out} starting at {@code offset}.
     * Exactly {@link #arity()} components are written.
     */
    abstract void transform(float r, float g, float b, float[] out, int offset);

    /** Feature vector of a single pixel. */
    public float[] transform(float r, float g, float b) {
        float[] out = new float[arity];
        transform(r, g, b, out, 0);
        return out;
    }

    /** Number of components per pixel. */
    public int arity() {
        return arity;
    }

    /** Name used on the command line. */
    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    /**
     * Resolve a command-line name (case-insensitive).
     *
     * @throws MosaicConfigException for an unknown name
     */
    public static ColorSpace fromId(String id) {
        if (id != null) {
            String key = id.trim().toLowerCase(Locale.ROOT);
            for (ColorSpace cs : values()) {
                if (cs.id.equals(key)) {
                    return cs;
                }
            }
        }
        throw new MosaicConfigException("unknown color space '" + id + "', expected one of rgb, lab, gray");
    }

    @Override
    public String toString() {
        return id;
    }
}
