package com.telescope.service;

import com.telescope.model.PupilMask;

import java.util.Optional;

public class PupilService {

    // Disk of `resolution` pixels minus a concentric disk of round(resolution * obstructionRatio)
    public Optional<PupilMask> generatePupil(Integer resolution, double obstructionRatio) {
        if (resolution == null) return Optional.empty();

        final int n = resolution;
        boolean[] cells = disk(n, n);
        if (obstructionRatio > 0) {
            boolean[] obstruction = disk((int) Math.round(n * obstructionRatio), n);
            for (int i = 0; i < cells.length; i++) {
                if (obstruction[i]) cells[i] = false;
            }
        }
        return Optional.of(new PupilMask(n, cells));
    }

    // Pixel centres measured from the grid centre; inside when radius <= diameter/2
    private boolean[] disk(int diameter, int gridSize) {
        boolean[] out = new boolean[gridSize * gridSize];
        if (diameter <= 0) return out;

        double centre = (gridSize - 1) / 2.0;
        double radius = diameter / 2.0;
        for (int y = 0; y < gridSize; y++) {
            double dy = y - centre;
            for (int x = 0; x < gridSize; x++) {
                double dx = x - centre;
                out[y * gridSize + x] = Math.hypot(dx, dy) <= radius;
            }
        }
        return out;
    }
}
