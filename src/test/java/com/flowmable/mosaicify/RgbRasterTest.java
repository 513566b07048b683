package com.flowmable.mosaicify;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class RgbRasterTest {

    @Test
    void fromImage_dropsAlphaAndKeepsChannels() {
        BufferedImage img = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(2, 1, 0x80123456);
        RgbRaster r = RgbRaster.fromImage(img);
        assertEquals(0x12, r.red(2, 1), 0f);
        assertEquals(0x34, r.green(2, 1), 0f);
        assertEquals(0x56, r.blue(2, 1), 0f);
        assertEquals(0x123456, r.getRgb(2, 1));
    }

    @Test
    void toImage_roundsAndClamps() {
        RgbRaster r = new RgbRaster(1, 1);
        r.setRgb(0, 0, 300.2f, -4f, 127.6f);
        BufferedImage img = r.toImage();
        assertEquals(BufferedImage.TYPE_INT_RGB, img.getType());
        assertEquals(0xFF0080, img.getRGB(0, 0) & 0xFFFFFF);
    }

    @Test
    void cropAndPaste_touchOnlyTheirRectangle() {
        RgbRaster canvas = RgbRaster.filled(6, 4, 0, 0, 0);
        canvas.paste(RgbRaster.filled(2, 2, 9, 9, 9), 3, 1);

        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 6; x++) {
                boolean inside = x >= 3 && x < 5 && y >= 1 && y < 3;
                assertEquals(inside ? 9f : 0f, canvas.red(x, y), 0f, "(" + x + "," + y + ")");
            }
        }
        assertEquals(RgbRaster.filled(2, 2, 9, 9, 9), canvas.crop(3, 1, 2, 2));
    }

    @Test
    void crop_isIndependentCopy() {
        RgbRaster canvas = RgbRaster.filled(4, 4, 1, 2, 3);
        RgbRaster part = canvas.crop(0, 0, 2, 2);
        canvas.setRgb(0, 0, 100, 100, 100);
        assertEquals(1f, part.red(0, 0), 0f);
    }

    @Test
    void outOfBounds_rejected() {
        RgbRaster canvas = RgbRaster.filled(4, 4, 0, 0, 0);
        assertThrows(IndexOutOfBoundsException.class, () -> canvas.crop(3, 3, 2, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> canvas.paste(RgbRaster.filled(5, 1, 0, 0, 0), 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new RgbRaster(0, 3));
    }
}
