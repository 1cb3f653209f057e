package com.inkglyph.server.ai.encode;

import com.inkglyph.server.ai.InvalidInputException;
import com.inkglyph.server.ai.render.RasterBuffer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class TensorEncoderTest {

    private final TensorEncoder encoder = new TensorEncoder(64);

    private static RasterBuffer filled(int size, int rgb) {
        int[] pixels = new int[size * size];
        Arrays.fill(pixels, rgb);
        return new RasterBuffer(size, size, pixels);
    }

    @Test
    public void testLumaWeightsSumToOne() {
        assertEquals(1.0, TensorEncoder.LUMA_R + TensorEncoder.LUMA_G + TensorEncoder.LUMA_B, 1e-12);
    }

    @Test
    public void testWhitePaperMapsToZero() {
        InputTensor tensor = encoder.encode(filled(300, 0xffffff));
        assertArrayEquals(new long[] { 1, 64, 64, 1 }, tensor.shape());
        for (float v : tensor.data()) {
            assertEquals(0.0f, v, 0.02f);
        }
    }

    @Test
    public void testBlackInkMapsToOne() {
        InputTensor tensor = encoder.encode(filled(300, 0x000000));
        for (float v : tensor.data()) {
            assertEquals(1.0f, v, 0.02f);
        }
    }

    @Test
    public void testValuesStayInUnitRangeAndInkLandsInTheMiddle() {
        int size = 300;
        int[] pixels = new int[size * size];
        Arrays.fill(pixels, 0xffffff);
        for (int y = 120; y < 180; y++) {
            for (int x = 120; x < 180; x++) {
                pixels[y * size + x] = 0x000000;
            }
        }

        InputTensor tensor = encoder.encode(new RasterBuffer(size, size, pixels));
        for (float v : tensor.data()) {
            assertTrue(v >= 0.0f && v <= 1.0f, "value out of range: " + v);
        }
        assertTrue(tensor.get(32, 32) > 0.9f);
        assertTrue(tensor.get(2, 2) < 0.05f);
        assertEquals(tensor.get(32, 32), tensor.toNhwc()[0][32][32][0], 0.0f);
    }

    @Test
    public void testPureColorsUseLumaWeights() {
        // Same-size raster: no resampling, exact values.
        TensorEncoder sameSize = new TensorEncoder(4);
        InputTensor red = sameSize.encode(filled(4, 0xff0000));
        assertEquals(1.0 - 0.299, red.get(1, 1), 1e-6);

        InputTensor green = sameSize.encode(filled(4, 0x00ff00));
        assertEquals(1.0 - 0.587, green.get(1, 1), 1e-6);
    }

    @Test
    public void testChannelsAreClampedBeforeLuminance() {
        double expected = TensorEncoder.LUMA_R * 255.0 + TensorEncoder.LUMA_B * 255.0;
        assertEquals(expected, TensorEncoder.luminance(300.0, -5.0, 255.0), 1e-9);
        assertEquals(255.0, TensorEncoder.luminance(1000, 1000, 1000), 1e-9);
        assertEquals(0.0, TensorEncoder.luminance(-1, -1, -1), 0.0);
    }

    @Test
    public void testZeroSizeRasterFailsFast() {
        assertThrows(InvalidInputException.class, () -> encoder.encode(new RasterBuffer(0, 0, new int[0])));
        assertThrows(InvalidInputException.class, () -> encoder.encode(null));
    }
}
