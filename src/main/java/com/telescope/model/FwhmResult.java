package com.telescope.model;

import java.util.Optional;

public class FwhmResult {

    public final double value;       // 1/m, always >= 0
    public final boolean converged;
    public final String diagnostic;  // null when converged

    public FwhmResult(double value, boolean converged, String diagnostic) {
        this.value = Math.abs(value);
        this.converged = converged;
        this.diagnostic = diagnostic;
    }

    public static FwhmResult converged(double value) {
        return new FwhmResult(value, true, null);
    }

    public Optional<String> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    // wavelength in metres
    public double toArcsec(double wavelength) {
        return value * wavelength * Units.RADIAN_TO_ARCSEC;
    }

    @Override
    public String toString() {
        return converged
                ? String.format("FWHM %.6g 1/m", value)
                : String.format("FWHM %.6g 1/m (not converged: %s)", value, diagnostic);
    }
}
