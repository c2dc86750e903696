package com.telescope.model;

import java.util.prefs.Preferences;

public class OpticsSettings {
    private static final Preferences prefs = Preferences.userNodeForPackage(OpticsSettings.class);

    // Quadrature (aberrated PSF)
    private static final String KEY_QUAD_REL = "quadrature_relative_accuracy";
    private static final String KEY_QUAD_ABS = "quadrature_absolute_accuracy";
    private static final String KEY_QUAD_POINTS = "quadrature_points";
    private static final String KEY_QUAD_MAX_ITER = "quadrature_max_iterations";
    private static final String KEY_QUAD_MAX_EVAL = "quadrature_max_evaluations";
    private static final String KEY_PSF_THREADS = "psf_worker_threads";

    // FWHM root search
    private static final String KEY_FWHM_TOL = "fwhm_absolute_tolerance";
    private static final String KEY_FWHM_MAX_EVAL = "fwhm_max_evaluations";

    // --- QUADRATURE ---
    public static double getQuadratureRelativeAccuracy() { return prefs.getDouble(KEY_QUAD_REL, 1e-8); }
    public static void setQuadratureRelativeAccuracy(double v) { prefs.putDouble(KEY_QUAD_REL, v); }

    public static double getQuadratureAbsoluteAccuracy() { return prefs.getDouble(KEY_QUAD_ABS, 1e-9); }
    public static void setQuadratureAbsoluteAccuracy(double v) { prefs.putDouble(KEY_QUAD_ABS, v); }

    public static int getQuadraturePoints() { return prefs.getInt(KEY_QUAD_POINTS, 5); }
    public static void setQuadraturePoints(int v) { prefs.putInt(KEY_QUAD_POINTS, v); }

    public static int getQuadratureMaxIterations() { return prefs.getInt(KEY_QUAD_MAX_ITER, 64); }
    public static void setQuadratureMaxIterations(int v) { prefs.putInt(KEY_QUAD_MAX_ITER, v); }

    public static int getQuadratureMaxEvaluations() { return prefs.getInt(KEY_QUAD_MAX_EVAL, 10_000_000); }
    public static void setQuadratureMaxEvaluations(int v) { prefs.putInt(KEY_QUAD_MAX_EVAL, v); }

    public static int getPsfWorkerThreads() {
        // Default: one worker per core
        return prefs.getInt(KEY_PSF_THREADS, Runtime.getRuntime().availableProcessors());
    }
    public static void setPsfWorkerThreads(int v) { prefs.putInt(KEY_PSF_THREADS, v); }

    // --- FWHM ---
    public static double getFwhmAbsoluteTolerance() { return prefs.getDouble(KEY_FWHM_TOL, 1e-9); }
    public static void setFwhmAbsoluteTolerance(double v) { prefs.putDouble(KEY_FWHM_TOL, v); }

    public static int getFwhmMaxEvaluations() { return prefs.getInt(KEY_FWHM_MAX_EVAL, 200); }
    public static void setFwhmMaxEvaluations(int v) { prefs.putInt(KEY_FWHM_MAX_EVAL, v); }
}
