package com.telescope.exception;

/**
 * Raised when the numerical PSF integral cannot be evaluated for a frequency sample.
 */
public class IntegrationException extends RuntimeException {

    private final double frequency;

    public IntegrationException(double frequency, String message, Throwable cause) {
        super(message, cause);
        this.frequency = frequency;
    }

    /** Spatial frequency (1/m) of the sample that failed. */
    public double getFrequency() {
        return frequency;
    }
}
