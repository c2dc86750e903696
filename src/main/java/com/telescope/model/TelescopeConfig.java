package com.telescope.model;

import com.telescope.exception.ConfigurationException;
import com.telescope.service.PupilService;

import java.util.Optional;

/**
 * Telescope aperture description: diameter, central obstruction, pupil sampling,
 * field of view and an optional attached turbulence model.
 * <p>
 * Instances are immutable apart from the pupil mask, which is computed on first
 * request and kept for the lifetime of the instance. The {@code with...} methods
 * return new instances with their own, empty pupil cache.
 */
public class TelescopeConfig {

    private static final PupilService PUPIL_SERVICE = new PupilService();

    private final double diameter;
    private final double obstructionRatio;
    private final Integer resolution;
    private final double fieldOfView;      // radian, 0 when unset
    private final Double samplingTime;     // second
    private final AtmosphereModel opticalAberration;

    // guarded by this
    private PupilMask pupil;

    private TelescopeConfig(Builder b) {
        this.diameter = b.diameter;
        this.obstructionRatio = b.obstructionRatio;
        this.resolution = b.resolution;
        this.fieldOfView = b.fieldOfView;
        this.samplingTime = b.samplingTime;
        this.opticalAberration = b.opticalAberration;
    }

    public static Builder builder(double diameter) {
        return new Builder(diameter);
    }

    public double getDiameter() { return diameter; }
    public double getObstructionRatio() { return obstructionRatio; }
    public Optional<Integer> getResolution() { return Optional.ofNullable(resolution); }
    public double getFieldOfView() { return fieldOfView; }
    public double getFieldOfViewInArcmin() { return fieldOfView * Units.RADIAN_TO_ARCMIN; }
    public Optional<Double> getSamplingTime() { return Optional.ofNullable(samplingTime); }
    public Optional<AtmosphereModel> getOpticalAberration() { return Optional.ofNullable(opticalAberration); }

    public double getObstructionDiameter() {
        return obstructionRatio * diameter;
    }

    public double area() {
        return Math.PI * diameter * diameter * (1 - obstructionRatio * obstructionRatio) / 4;
    }

    // Built on first call, empty without a resolution
    public synchronized Optional<PupilMask> pupil() {
        if (pupil == null && resolution != null) {
            pupil = PUPIL_SERVICE.generatePupil(resolution, obstructionRatio).orElse(null);
        }
        return Optional.ofNullable(pupil);
    }

    // --- DERIVED COPIES ---
    public TelescopeConfig withAberration(AtmosphereModel atmosphere) {
        if (atmosphere == null) throw new ConfigurationException("Atmosphere must not be null");
        return toBuilder().opticalAberration(atmosphere).build();
    }

    public TelescopeConfig withoutAberration() {
        return toBuilder().opticalAberration(null).build();
    }

    public TelescopeConfig withResolution(int resolution) {
        return toBuilder().resolution(resolution).build();
    }

    public TelescopeConfig withObstructionRatio(double obstructionRatio) {
        return toBuilder().obstructionRatio(obstructionRatio).build();
    }

    private Builder toBuilder() {
        Builder b = new Builder(diameter);
        b.obstructionRatio = obstructionRatio;
        b.resolution = resolution;
        b.fieldOfView = fieldOfView;
        b.samplingTime = samplingTime;
        b.opticalAberration = opticalAberration;
        return b;
    }

    @Override
    public String toString() {
        return String.format("TelescopeConfig[D=%.2fm, obstruction=%.2f%%, area=%.2fm2, resolution=%s, aberration=%s]",
                diameter, obstructionRatio * 100, area(), resolution, opticalAberration);
    }

    public static class Builder {
        private final double diameter;
        private double obstructionRatio = 0;
        private Integer resolution;
        private double fieldOfView = 0;
        private Double fovArcsec;
        private Double fovArcmin;
        private Double samplingTime;
        private AtmosphereModel opticalAberration;

        private Builder(double diameter) {
            this.diameter = diameter;
        }

        public Builder obstructionRatio(double v) { this.obstructionRatio = v; return this; }
        public Builder resolution(int v) { this.resolution = v; return this; }
        public Builder fieldOfViewInArcsec(double v) { this.fovArcsec = v; return this; }
        public Builder fieldOfViewInArcmin(double v) { this.fovArcmin = v; return this; }
        public Builder samplingTime(double v) { this.samplingTime = v; return this; }
        public Builder opticalAberration(AtmosphereModel v) { this.opticalAberration = v; return this; }

        public TelescopeConfig build() {
            if (!(diameter > 0) || Double.isInfinite(diameter)) {
                throw new ConfigurationException("Diameter must be a finite value > 0, got " + diameter);
            }
            if (!(obstructionRatio >= 0 && obstructionRatio < 1)) {
                throw new ConfigurationException("Obstruction ratio must be in [0,1), got " + obstructionRatio);
            }
            if (resolution != null && resolution <= 0) {
                throw new ConfigurationException("Resolution must be a positive pixel count, got " + resolution);
            }
            if (fovArcsec != null && fovArcmin != null) {
                throw new ConfigurationException("Give the field of view in arcsec or in arcmin, not both");
            }
            if (fovArcsec != null) fieldOfView = checkFov(fovArcsec) * Units.ARCSEC_TO_RADIAN;
            if (fovArcmin != null) fieldOfView = checkFov(fovArcmin) * Units.ARCMIN_TO_RADIAN;
            if (samplingTime != null && !(samplingTime > 0)) {
                throw new ConfigurationException("Sampling time must be > 0, got " + samplingTime);
            }
            return new TelescopeConfig(this);
        }

        private static double checkFov(double v) {
            if (!(v >= 0) || Double.isInfinite(v)) {
                throw new ConfigurationException("Field of view must be a finite value >= 0, got " + v);
            }
            return v;
        }
    }
}
