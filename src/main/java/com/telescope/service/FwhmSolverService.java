package com.telescope.service;

import com.telescope.exception.IntegrationException;
import com.telescope.model.AtmosphereModel;
import com.telescope.model.FwhmResult;
import com.telescope.model.OpticsSettings;
import com.telescope.model.TelescopeConfig;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * FWHM of the telescope PSF in 1/m. Search failures never throw.
 */
public class FwhmSolverService {

    private static final Logger log = LoggerFactory.getLogger(FwhmSolverService.class);

    private final PointSpreadService psfService;
    private final double absoluteTolerance;
    private final int maxEvaluations;

    public FwhmSolverService(PointSpreadService psfService) {
        this(psfService, OpticsSettings.getFwhmAbsoluteTolerance(), OpticsSettings.getFwhmMaxEvaluations());
    }

    public FwhmSolverService(PointSpreadService psfService, double absoluteTolerance, int maxEvaluations) {
        this.psfService = psfService;
        this.absoluteTolerance = absoluteTolerance;
        this.maxEvaluations = maxEvaluations;
    }

    public FwhmResult fullWidthHalfMax(TelescopeConfig config) {
        double upper = upperBracket(config);
        BestCandidate best = new BestCandidate();

        String diagnostic;
        try {
            final double halfPeak = psfService.psf(config, 0) / 2;
            UnivariateFunction residual = x -> {
                double v = psfService.psf(config, FastMath.abs(x) / 2) - halfPeak;
                if (!Double.isFinite(v)) throw new NonFiniteResidual(x, v);
                best.offer(x, v);
                return v;
            };

            log.debug("FWHM search on [0, {}] for {}", upper, config);
            double x = new BrentSolver(absoluteTolerance).solve(maxEvaluations, residual, 0, upper);
            return FwhmResult.converged(x);

        } catch (NoBracketingException e) {
            diagnostic = String.format("No sign change of psf(x/2) - psf(0)/2 on [0, %g]", upper);
        } catch (TooManyEvaluationsException e) {
            diagnostic = "Root search exceeded " + maxEvaluations + " evaluations";
        } catch (NonFiniteResidual e) {
            diagnostic = String.format("Non-finite PSF value %s at x=%g", e.value, e.x);
        } catch (IntegrationException e) {
            diagnostic = "PSF evaluation failed: " + e.getMessage();
        }

        log.warn("FWHM search did not converge ({}); returning best candidate {}", diagnostic, FastMath.abs(best.x));
        return new FwhmResult(best.x, false, diagnostic);
    }

    double upperBracket(TelescopeConfig config) {
        double scale = config.getDiameter();
        Optional<AtmosphereModel> aberration = config.getOpticalAberration();
        if (aberration.isPresent()) {
            double r0 = aberration.get().r0();
            if (r0 > 0) {
                scale = FastMath.min(scale, r0);
            } else {
                log.debug("Ignoring unusable r0={} for the FWHM bracket", r0);
            }
        }
        return 2 / scale;
    }

    private static class BestCandidate {
        double x = 0;
        double residual = Double.POSITIVE_INFINITY;

        void offer(double x, double v) {
            if (FastMath.abs(v) < residual) {
                this.x = x;
                this.residual = FastMath.abs(v);
            }
        }
    }

    private static class NonFiniteResidual extends RuntimeException {
        final double x;
        final double value;

        NonFiniteResidual(double x, double value) {
            super(null, null, false, false);
            this.x = x;
            this.value = value;
        }
    }
}
