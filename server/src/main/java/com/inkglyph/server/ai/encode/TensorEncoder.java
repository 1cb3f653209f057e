package com.inkglyph.server.ai.encode;

import com.inkglyph.server.ai.InvalidInputException;
import com.inkglyph.server.ai.render.RasterBuffer;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Turns a rendered raster into the model input: bicubic resize to the model
 * size, luma grayscale, scale to [0, 1], invert.
 *
 * <p>
 * The model was trained on bright strokes over a dark background, so white
 * paper becomes ~0.0 and black ink ~1.0.
 */
public class TensorEncoder {

    // ITU-R BT.601 luma
    public static final double LUMA_R = 0.299;
    public static final double LUMA_G = 0.587;
    public static final double LUMA_B = 0.114;

    private static final double MAX_CHANNEL = 255.0;

    private final int modelInputSize;

    public TensorEncoder(int modelInputSize) {
        if (modelInputSize <= 0) {
            throw new IllegalArgumentException("modelInputSize must be positive");
        }
        this.modelInputSize = modelInputSize;
    }

    public InputTensor encode(RasterBuffer raster) {
        if (raster == null || raster.isEmpty()) {
            throw new InvalidInputException("Cannot encode an empty raster");
        }

        BufferedImage resized = resize(raster.toImage(), modelInputSize);

        float[] data = new float[modelInputSize * modelInputSize];
        for (int y = 0; y < modelInputSize; y++) {
            for (int x = 0; x < modelInputSize; x++) {
                int rgb = resized.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                data[y * modelInputSize + x] = (float) (1.0 - luminance(r, g, b) / MAX_CHANNEL);
            }
        }
        return new InputTensor(modelInputSize, data);
    }

    /**
     * Weighted luma of one pixel, each channel clamped to [0, 255] first.
     */
    public static double luminance(double r, double g, double b) {
        return LUMA_R * clampChannel(r) + LUMA_G * clampChannel(g) + LUMA_B * clampChannel(b);
    }

    static double clampChannel(double v) {
        if (v < 0.0)
            return 0.0;
        if (v > MAX_CHANNEL)
            return MAX_CHANNEL;
        return v;
    }

    static BufferedImage resize(BufferedImage source, int size) {
        if (source.getWidth() == size && source.getHeight() == size) {
            return source;
        }
        BufferedImage target = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, size, size, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    public int getModelInputSize() {
        return modelInputSize;
    }
}
