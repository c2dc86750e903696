package com.telescope.model;

/**
 * Turbulence descriptor attached to a telescope as an optical aberration.
 * <p>
 * Implementations are owned by the caller; the optics code only reads them and
 * may call them concurrently from several PSF workers, so they must be thread-safe.
 */
public interface AtmosphereModel {

    /**
     * Long-exposure turbulence OTF at a pupil separation.
     *
     * @param r separation in metres, {@code r >= 0}
     * @return attenuation in [0, 1]
     */
    double longExposureOtf(double r);

    /**
     * Coherence length (Fried parameter) in metres. May be {@link Double#POSITIVE_INFINITY}.
     */
    double r0();

    default double[] longExposureOtf(double[] r) {
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) out[i] = longExposureOtf(r[i]);
        return out;
    }
}
