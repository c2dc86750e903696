package com.telescope.service;

import com.telescope.model.AtmosphereModel;
import com.telescope.model.TelescopeConfig;

import java.util.Optional;

/**
 * Normalized telescope OTF: aperture autocorrelation over the collecting area,
 * times the long-exposure turbulence OTF when an atmosphere is attached.
 */
public class OpticalTransferService {

    private final ApertureCorrelationService correlation;

    public OpticalTransferService() {
        this(new ApertureCorrelationService());
    }

    public OpticalTransferService(ApertureCorrelationService correlation) {
        this.correlation = correlation;
    }

    public double otf(TelescopeConfig config, double r) {
        double out = diffraction(config, r);
        Optional<AtmosphereModel> aberration = config.getOpticalAberration();
        if (aberration.isPresent()) {
            out *= aberration.get().longExposureOtf(r);
        }
        return out;
    }

    public double[] otf(TelescopeConfig config, double[] r) {
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) out[i] = diffraction(config, r[i]);

        Optional<AtmosphereModel> aberration = config.getOpticalAberration();
        if (aberration.isPresent()) {
            double[] turbulence = aberration.get().longExposureOtf(r);
            for (int i = 0; i < out.length; i++) out[i] *= turbulence[i];
        }
        return out;
    }

    public double diffraction(TelescopeConfig config, double r) {
        double d = config.getDiameter();
        double out;
        if (config.getObstructionRatio() != 0) {
            double dObs = config.getObstructionDiameter();
            out = correlation.autoCorr(d, r)
                    + correlation.autoCorr(dObs, r)
                    - 2 * correlation.crossCorr(d / 2, dObs / 2, r);
        } else {
            out = correlation.autoCorr(d, r);
        }
        return out / config.area();
    }
}
