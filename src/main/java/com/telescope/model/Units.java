package com.telescope.model;

/**
 * Angle conversion constants.
 */
public final class Units {

    public static final double RADIAN_TO_ARCSEC = 180.0 * 3600.0 / Math.PI;
    public static final double RADIAN_TO_ARCMIN = 180.0 * 60.0 / Math.PI;
    public static final double ARCSEC_TO_RADIAN = 1.0 / RADIAN_TO_ARCSEC;
    public static final double ARCMIN_TO_RADIAN = 1.0 / RADIAN_TO_ARCMIN;

    private Units() {
    }
}
