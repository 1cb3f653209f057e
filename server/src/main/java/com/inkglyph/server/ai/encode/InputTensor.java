package com.inkglyph.server.ai.encode;

/**
 * Dense model input of shape [1, size, size, 1], values in [0, 1].
 */
public class InputTensor {
    private final int size;
    // row-major, data[y * size + x]
    private final float[] data;

    public InputTensor(int size, float[] data) {
        if (data == null || data.length != size * size) {
            throw new IllegalArgumentException("Tensor data must hold " + size + "x" + size + " values");
        }
        this.size = size;
        this.data = data;
    }

    public int getSize() {
        return size;
    }

    public long[] shape() {
        return new long[] { 1, size, size, 1 };
    }

    public float get(int y, int x) {
        return data[y * size + x];
    }

    /**
     * Flat row-major view. Callers must not modify the returned array.
     */
    public float[] data() {
        return data;
    }

    public float[][][][] toNhwc() {
        float[][][][] out = new float[1][size][size][1];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                out[0][y][x][0] = data[y * size + x];
            }
        }
        return out;
    }
}
