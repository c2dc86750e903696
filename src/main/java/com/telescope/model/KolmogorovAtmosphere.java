package com.telescope.model;

import com.telescope.exception.ConfigurationException;
import org.apache.commons.math3.util.FastMath;

/**
 * Long-exposure Kolmogorov turbulence: OTF = exp(-0.5 * 6.88 * (r/r0)^(5/3)).
 * An infinite r0 is a turbulence-free atmosphere (OTF identically 1).
 */
public class KolmogorovAtmosphere implements AtmosphereModel {

    // Phase structure function coefficient: D(r) = 6.88 (r/r0)^(5/3)
    private static final double STRUCTURE_COEFF = 6.88;
    private static final double EXPONENT = 5.0 / 3.0;

    private final double r0;

    public KolmogorovAtmosphere(double r0) {
        if (!(r0 > 0)) {
            throw new ConfigurationException("Coherence length r0 must be > 0, got " + r0);
        }
        this.r0 = r0;
    }

    public static KolmogorovAtmosphere none() {
        return new KolmogorovAtmosphere(Double.POSITIVE_INFINITY);
    }

    public double structureFunction(double r) {
        if (Double.isInfinite(r0)) return 0.0;
        return STRUCTURE_COEFF * FastMath.pow(FastMath.abs(r) / r0, EXPONENT);
    }

    @Override
    public double longExposureOtf(double r) {
        return FastMath.exp(-0.5 * structureFunction(r));
    }

    @Override
    public double r0() {
        return r0;
    }

    @Override
    public String toString() {
        return "KolmogorovAtmosphere[r0=" + r0 + " m]";
    }
}
