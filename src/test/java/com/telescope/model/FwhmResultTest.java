package com.telescope.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FwhmResultTest {

    @Test
    void valueIsAlwaysNonNegative() {
        FwhmResult r = new FwhmResult(-0.25, false, "no sign change");

        assertThat(r.value).isEqualTo(0.25);
        assertThat(r.converged).isFalse();
        assertThat(r.getDiagnostic()).contains("no sign change");
    }

    @Test
    void convertsToArcsec() {
        // 1.029 lambda/D for an 8 m telescope at 500 nm is about 13.26 mas
        FwhmResult r = FwhmResult.converged(1.029 / 8);

        assertThat(r.getDiagnostic()).isEmpty();
        assertThat(r.toArcsec(500e-9)).isCloseTo(0.01327, within(1e-4));
    }
}
