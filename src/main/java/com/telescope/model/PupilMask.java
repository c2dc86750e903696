package com.telescope.model;

/**
 * Read-only N x N aperture indicator grid (1 = clear aperture, 0 = blocked).
 */
public final class PupilMask {

    private final int size;
    private final boolean[] cells; // row-major
    private final int onPixels;

    public PupilMask(int size, boolean[] cells) {
        if (cells.length != size * size) {
            throw new IllegalArgumentException("Expected " + size * size + " cells, got " + cells.length);
        }
        this.size = size;
        this.cells = cells.clone();
        int count = 0;
        for (boolean c : cells) if (c) count++;
        this.onPixels = count;
    }

    public int size() {
        return size;
    }

    public boolean get(int row, int col) {
        return cells[row * size + col];
    }

    public int value(int row, int col) {
        return get(row, col) ? 1 : 0;
    }

    public int onPixelCount() {
        return onPixels;
    }

    public double fillFraction() {
        return (double) onPixels / cells.length;
    }

    public float[][] toFloatArray() {
        float[][] out = new float[size][size];
        for (int y = 0; y < size; y++)
            for (int x = 0; x < size; x++)
                out[y][x] = cells[y * size + x] ? 1f : 0f;
        return out;
    }
}
