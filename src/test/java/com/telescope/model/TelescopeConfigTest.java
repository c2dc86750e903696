package com.telescope.model;

import com.telescope.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TelescopeConfigTest {

    @Test
    void defaultsToFullApertureWithoutOptionalFields() {
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        assertThat(tel.getDiameter()).isEqualTo(8.0);
        assertThat(tel.getObstructionRatio()).isZero();
        assertThat(tel.getResolution()).isEmpty();
        assertThat(tel.getSamplingTime()).isEmpty();
        assertThat(tel.getOpticalAberration()).isEmpty();
        assertThat(tel.getFieldOfView()).isZero();
        assertThat(tel.pupil()).isEmpty();
    }

    @Test
    void areaAccountsForCentralObstruction() {
        TelescopeConfig tel = TelescopeConfig.builder(8).obstructionRatio(0.14).build();

        assertThat(tel.area()).isCloseTo(Math.PI * 64 * (1 - 0.14 * 0.14) / 4, within(1e-12));
        assertThat(tel.getObstructionDiameter()).isCloseTo(1.12, within(1e-12));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    void rejectsInvalidDiameter(double d) {
        assertThatThrownBy(() -> TelescopeConfig.builder(d).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Diameter");
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.0, 1.5, Double.NaN})
    void rejectsObstructionOutsideUnitInterval(double rho) {
        assertThatThrownBy(() -> TelescopeConfig.builder(8).obstructionRatio(rho).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Obstruction");
    }

    @Test
    void rejectsNonPositiveResolutionAndSamplingTime() {
        assertThatThrownBy(() -> TelescopeConfig.builder(8).resolution(0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TelescopeConfig.builder(8).samplingTime(0).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fieldOfViewAcceptsOneUnitOnly() {
        TelescopeConfig arcmin = TelescopeConfig.builder(8).fieldOfViewInArcmin(2).build();
        TelescopeConfig arcsec = TelescopeConfig.builder(8).fieldOfViewInArcsec(120).build();

        assertThat(arcmin.getFieldOfView()).isCloseTo(arcsec.getFieldOfView(), within(1e-15));
        assertThat(arcmin.getFieldOfViewInArcmin()).isCloseTo(2.0, within(1e-12));
        assertThatThrownBy(() -> TelescopeConfig.builder(8).fieldOfViewInArcmin(2).fieldOfViewInArcsec(120).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TelescopeConfig.builder(8).fieldOfViewInArcsec(-1).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void pupilIsComputedOnceAndReused() {
        TelescopeConfig tel = TelescopeConfig.builder(1).obstructionRatio(0.14).resolution(64).build();

        PupilMask first = tel.pupil().orElseThrow();
        PupilMask second = tel.pupil().orElseThrow();

        assertThat(second).isSameAs(first);
        assertThat(first.size()).isEqualTo(64);
    }

    @Test
    void derivedCopiesGetTheirOwnPupil() {
        TelescopeConfig tel = TelescopeConfig.builder(1).resolution(64).build();
        PupilMask full = tel.pupil().orElseThrow();

        TelescopeConfig obstructed = tel.withObstructionRatio(0.3);
        TelescopeConfig finer = tel.withResolution(128);
        TelescopeConfig turbulent = tel.withAberration(new KolmogorovAtmosphere(0.15));

        assertThat(obstructed.pupil().orElseThrow().onPixelCount()).isLessThan(full.onPixelCount());
        assertThat(finer.pupil().orElseThrow().size()).isEqualTo(128);
        assertThat(turbulent.pupil().orElseThrow()).isNotSameAs(full);
        assertThat(tel.getOpticalAberration()).isEmpty();
    }

    @Test
    void aberrationCanBeAttachedAndDetached() {
        KolmogorovAtmosphere atm = new KolmogorovAtmosphere(0.15);
        TelescopeConfig tel = TelescopeConfig.builder(8).build().withAberration(atm);

        assertThat(tel.getOpticalAberration()).containsSame(atm);
        assertThat(tel.withoutAberration().getOpticalAberration()).isEmpty();
        assertThatThrownBy(() -> tel.withAberration(null)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void derivedCopiesAreValidatedToo() {
        TelescopeConfig tel = TelescopeConfig.builder(8).build();

        assertThatThrownBy(() -> tel.withObstructionRatio(1.0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> tel.withResolution(-4)).isInstanceOf(ConfigurationException.class);
    }
}
