package com.telescope.service;

import org.apache.commons.math3.util.FastMath;

/**
 * Overlap areas of circular apertures as a function of their separation.
 */
public class ApertureCorrelationService {

    // Two disks of diameter d, centres r apart
    public double autoCorr(double d, double r) {
        if (d <= 0 || r > d) return 0.0;
        double red = clamp(r / d);
        return d * d * (FastMath.acos(red) - red * FastMath.sqrt(1 - red * red)) / 2;
    }

    public double[] autoCorr(double d, double[] r) {
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) out[i] = autoCorr(d, r[i]);
        return out;
    }

    public double crossCorr(double r1, double r2, double r) {
        double inner = FastMath.abs(r1 - r2);
        double outer = r1 + r2;

        // One disk inside the other
        if (r <= inner) {
            double rMin = FastMath.min(r1, r2);
            return Math.PI * rMin * rMin;
        }
        // Disjoint
        if (r >= outer) return 0.0;

        // Lens: sum of the two circular segments
        double red1 = clamp((r1 * r1 - r2 * r2 + r * r) / (2 * r * r1));
        double red2 = clamp((r2 * r2 - r1 * r1 + r * r) / (2 * r * r2));
        return r1 * r1 * (FastMath.acos(red1) - red1 * FastMath.sqrt(1 - red1 * red1))
                + r2 * r2 * (FastMath.acos(red2) - red2 * FastMath.sqrt(1 - red2 * red2));
    }

    public double[] crossCorr(double r1, double r2, double[] r) {
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) out[i] = crossCorr(r1, r2, r[i]);
        return out;
    }

    // acos/sqrt domain guard against round-off
    private static double clamp(double v) {
        return FastMath.max(-1.0, FastMath.min(1.0, v));
    }
}
