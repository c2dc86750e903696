package com.telescope.service;

import com.telescope.model.AtmosphereModel;
import com.telescope.model.FwhmResult;
import com.telescope.model.KolmogorovAtmosphere;
import com.telescope.model.TelescopeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class FwhmSolverServiceTest {

    // Airy pattern FWHM: 1.02899 lambda / D
    private static final double AIRY_FWHM = 1.02899;

    private PointSpreadService psf;
    private FwhmSolverService solver;

    @BeforeEach
    void setUp() {
        psf = new PointSpreadService(new OpticalTransferService(), new PointSpreadService.QuadratureSettings(), 4);
        solver = new FwhmSolverService(psf, 1e-9, 200);
    }

    @AfterEach
    void tearDown() {
        psf.close();
    }

    @Test
    void diffractionLimitedFwhmMatchesAiryPattern() {
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        FwhmResult fwhm = solver.fullWidthHalfMax(tel);

        assertThat(fwhm.converged).isTrue();
        assertThat(fwhm.getDiagnostic()).isEmpty();
        assertThat(fwhm.value).isCloseTo(AIRY_FWHM / 8, withinPercentage(1));
        assertThat(psf.psf(tel, fwhm.value / 2) - psf.psf(tel, 0) / 2).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void obstructionNarrowsTheCore() {
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        FwhmResult clear = solver.fullWidthHalfMax(tel);
        FwhmResult obstructed = solver.fullWidthHalfMax(tel.withObstructionRatio(0.3));

        assertThat(obstructed.converged).isTrue();
        assertThat(obstructed.value).isLessThan(clear.value);
    }

    @Test
    void transparentAtmosphereKeepsDiffractionFwhm() {
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        FwhmResult direct = solver.fullWidthHalfMax(tel);
        FwhmResult numerical = solver.fullWidthHalfMax(tel.withAberration(KolmogorovAtmosphere.none()));

        assertThat(numerical.converged).isTrue();
        assertThat(numerical.value).isCloseTo(direct.value, withinPercentage(0.1));
    }

    @Test
    void seeingLimitedFwhmFollowsR0() {
        double r0 = 0.1;
        TelescopeConfig tel = TelescopeConfig.builder(8).opticalAberration(new KolmogorovAtmosphere(r0)).build();

        FwhmResult fwhm = solver.fullWidthHalfMax(tel);

        assertThat(fwhm.converged).isTrue();
        assertThat(fwhm.value).isCloseTo(0.976 / r0, withinPercentage(5));
    }

    @Test
    void seeingLimitedFwhmForSmallCoherenceLength() {
        double r0 = 0.03;
        TelescopeConfig tel = TelescopeConfig.builder(8).opticalAberration(new KolmogorovAtmosphere(r0)).build();

        FwhmResult fwhm = solver.fullWidthHalfMax(tel);

        assertThat(fwhm.converged).isTrue();
        assertThat(fwhm.value).isCloseTo(0.976 / r0, withinPercentage(2));
    }

    @Test
    void bracketUsesTheSmallerOfDiameterAndR0() {
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        assertThat(solver.upperBracket(tel)).isEqualTo(0.25);
        assertThat(solver.upperBracket(tel.withAberration(new KolmogorovAtmosphere(0.2)))).isCloseTo(10.0, within(1e-12));
        assertThat(solver.upperBracket(tel.withAberration(KolmogorovAtmosphere.none()))).isEqualTo(0.25);
    }

    @Test
    void missingSignChangeDegradesGracefully() {
        PointSpreadService flat = new PointSpreadService(new OpticalTransferService(), new PointSpreadService.QuadratureSettings(), 1) {
            @Override
            public double psf(TelescopeConfig config, double f) {
                return 1.0;
            }
        };
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        FwhmResult fwhm = new FwhmSolverService(flat, 1e-9, 200).fullWidthHalfMax(tel);
        flat.close();

        assertThat(fwhm.converged).isFalse();
        assertThat(fwhm.value).isGreaterThanOrEqualTo(0.0).isLessThanOrEqualTo(0.25);
        assertThat(fwhm.getDiagnostic()).hasValueSatisfying(d -> assertThat(d).contains("sign change"));
    }

    @Test
    void nonFiniteValuesDegradeGracefully() {
        AtmosphereModel broken = new AtmosphereModel() {
            @Override
            public double longExposureOtf(double r) {
                return Double.NaN;
            }

            @Override
            public double r0() {
                return 0.5;
            }
        };
        PointSpreadService.QuadratureSettings quick = new PointSpreadService.QuadratureSettings();
        quick.maxIterations = 8;
        TelescopeConfig tel = TelescopeConfig.builder(8).opticalAberration(broken).build();

        try (PointSpreadService service = new PointSpreadService(new OpticalTransferService(), quick, 1)) {
            FwhmResult fwhm = new FwhmSolverService(service, 1e-9, 200).fullWidthHalfMax(tel);

            assertThat(fwhm.converged).isFalse();
            assertThat(fwhm.value).isNotNaN().isGreaterThanOrEqualTo(0.0);
            assertThat(fwhm.getDiagnostic()).isPresent();
        }
    }
}
