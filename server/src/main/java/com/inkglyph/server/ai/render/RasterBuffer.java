package com.inkglyph.server.ai.render;

import java.awt.image.BufferedImage;

/**
 * Fixed-size RGB pixel grid. pixels[y * width + x] holds a packed 0xRRGGBB
 * value.
 */
public class RasterBuffer {
    private final int width;
    private final int height;
    private final int[] pixels;

    public RasterBuffer(int width, int height, int[] pixels) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative raster size " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Pixel array does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public static RasterBuffer fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < argb.length; i++) {
            argb[i] &= 0x00ffffff;
        }
        return new RasterBuffer(w, h, argb);
    }

    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getRgb(int x, int y) {
        return pixels[y * width + x];
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Number of pixels that differ from the given background color.
     */
    public int countInk(int backgroundRgb) {
        int count = 0;
        for (int p : pixels) {
            if (p != (backgroundRgb & 0x00ffffff)) {
                count++;
            }
        }
        return count;
    }
}
