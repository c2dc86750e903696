package com.telescope.service;

import com.telescope.exception.ConfigurationException;
import com.telescope.exception.IntegrationException;
import com.telescope.model.AtmosphereModel;
import com.telescope.model.OpticsSettings;
import com.telescope.model.TelescopeConfig;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.special.BesselJ;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telescope point spread function as a function of spatial frequency (1/m).
 * <p>
 * Without an attached atmosphere the PSF of the annular aperture is evaluated in
 * closed form. With one, it is the zeroth-order Hankel transform of the OTF over
 * the aperture, {@code 2 pi * int_0^D v J0(2 pi v f) otf(v) dv}, integrated numerically;
 * arrays of frequencies are integrated concurrently, one integral per sample.
 */
public class PointSpreadService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PointSpreadService.class);

    // BesselJ only covers arguments up to 1e4; the Hankel asymptotic expansion takes over
    private static final double BESSEL_ASYMPTOTIC_THRESHOLD = 1e4;
    private static final int MIN_QUADRATURE_ITERATIONS = 3;
    private static final int MAX_OSCILLATION_SEGMENTS = 4096;

    public static class QuadratureSettings {
        public double relativeAccuracy = 1e-8;
        public double absoluteAccuracy = 1e-9;
        public int points = 5;
        public int maxIterations = 64;
        public int maxEvaluations = 10_000_000;

        public static QuadratureSettings fromPreferences() {
            QuadratureSettings s = new QuadratureSettings();
            s.relativeAccuracy = OpticsSettings.getQuadratureRelativeAccuracy();
            s.absoluteAccuracy = OpticsSettings.getQuadratureAbsoluteAccuracy();
            s.points = OpticsSettings.getQuadraturePoints();
            s.maxIterations = OpticsSettings.getQuadratureMaxIterations();
            s.maxEvaluations = OpticsSettings.getQuadratureMaxEvaluations();
            return s;
        }

        void validate() {
            if (points < 1) throw new ConfigurationException("Quadrature needs at least 1 point, got " + points);
            if (maxIterations <= MIN_QUADRATURE_ITERATIONS) {
                throw new ConfigurationException("Quadrature max iterations must exceed "
                        + MIN_QUADRATURE_ITERATIONS + ", got " + maxIterations);
            }
            if (!(relativeAccuracy > 0) || !(absoluteAccuracy > 0)) {
                throw new ConfigurationException("Quadrature accuracies must be > 0");
            }
            if (maxEvaluations <= 0) {
                throw new ConfigurationException("Quadrature max evaluations must be > 0, got " + maxEvaluations);
            }
        }
    }

    private final OpticalTransferService otfService;
    private final QuadratureSettings quadrature;
    private final ExecutorService exec;

    public PointSpreadService() {
        this(new OpticalTransferService(), QuadratureSettings.fromPreferences(), OpticsSettings.getPsfWorkerThreads());
    }

    public PointSpreadService(OpticalTransferService otfService, QuadratureSettings quadrature, int workerThreads) {
        quadrature.validate();
        this.otfService = otfService;
        this.quadrature = quadrature;
        AtomicInteger threadCount = new AtomicInteger();
        this.exec = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            Thread t = new Thread(r, "psf-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public double psf(TelescopeConfig config, double f) {
        Optional<AtmosphereModel> aberration = config.getOpticalAberration();
        return aberration.isPresent() ? hankel(config, f) : closedForm(config, f);
    }

    public double[] psf(TelescopeConfig config, double[] f) {
        double[] out = new double[f.length];
        if (config.getOpticalAberration().isEmpty()) {
            for (int i = 0; i < f.length; i++) out[i] = closedForm(config, f[i]);
            return out;
        }

        List<Future<Double>> futures = new ArrayList<>(f.length);
        for (double freq : f) {
            futures.add(exec.submit(() -> hankel(config, freq)));
        }
        try {
            for (int i = 0; i < out.length; i++) out[i] = futures.get(i).get();
        } catch (ExecutionException e) {
            futures.forEach(fut -> fut.cancel(true));
            if (e.getCause() instanceof IntegrationException) throw (IntegrationException) e.getCause();
            throw new IntegrationException(Double.NaN, "PSF worker failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            futures.forEach(fut -> fut.cancel(true));
            Thread.currentThread().interrupt();
            throw new IntegrationException(Double.NaN, "Interrupted while integrating the PSF", e);
        }
        return out;
    }

    // --- CLOSED FORM (no aberration) ---
    double closedForm(TelescopeConfig config, double f) {
        double area = config.area();
        if (f == 0) return area;

        double d = config.getDiameter();
        double rho = config.getObstructionRatio();
        double surface = Math.PI * d * d / 4;

        double amplitude = surface * airy(Math.PI * d * FastMath.abs(f));
        if (rho > 0) {
            amplitude -= surface * rho * rho * airy(Math.PI * d * rho * FastMath.abs(f));
        }
        return amplitude * amplitude / area;
    }

    // 2 J1(u) / u
    private static double airy(double u) {
        return 2 * besselJ(1, u) / u;
    }

    // --- HANKEL TRANSFORM (aberration attached) ---
    double hankel(TelescopeConfig config, double f) {
        final double freq = FastMath.abs(f);
        UnivariateFunction integrand = v -> v * besselJ(0, 2 * Math.PI * v * freq) * otfService.otf(config, v);

        double[] edges = segments(config, freq);
        double sum = 0;
        int evaluations = 0;
        try {
            for (int i = 0; i + 1 < edges.length; i++) {
                // Integrators count evaluations, so one per segment
                IterativeLegendreGaussIntegrator integrator = new IterativeLegendreGaussIntegrator(
                        quadrature.points,
                        quadrature.relativeAccuracy,
                        quadrature.absoluteAccuracy / (edges.length - 1),
                        MIN_QUADRATURE_ITERATIONS,
                        quadrature.maxIterations);
                sum += integrator.integrate(quadrature.maxEvaluations - evaluations, integrand, edges[i], edges[i + 1]);
                evaluations += integrator.getEvaluations();
            }
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new IntegrationException(f,
                    String.format("PSF integral did not converge at f=%g 1/m: %s", f, e.getMessage()), e);
        }

        double value = 2 * Math.PI * sum;
        if (!Double.isFinite(value)) {
            throw new IntegrationException(f, String.format("PSF integral is not finite at f=%g 1/m", f), null);
        }
        log.debug("PSF f={} -> {} ({} segments, {} evaluations)", f, value, edges.length - 1, evaluations);
        return value;
    }

    /**
     * Integration breakpoints on [0, D]: geometric steps r0/4, r0/2, r0... where the
     * turbulence OTF decays, the kinks of the annular OTF, and at most one J0 period per segment.
     */
    double[] segments(TelescopeConfig config, double freq) {
        double d = config.getDiameter();
        TreeSet<Double> edges = new TreeSet<>();
        edges.add(0.0);
        edges.add(d);

        Optional<AtmosphereModel> aberration = config.getOpticalAberration();
        if (aberration.isPresent()) {
            double r0 = aberration.get().r0();
            if (r0 > 0 && Double.isFinite(r0)) {
                for (double v = r0 / 4; v < d; v *= 2) edges.add(v);
            }
        }

        double rho = config.getObstructionRatio();
        if (rho > 0) {
            edges.add(rho * d);
            edges.add(d * (1 - rho) / 2);
            edges.add(d * (1 + rho) / 2);
        }

        if (freq > 0) {
            double step = FastMath.max(1 / freq, d / MAX_OSCILLATION_SEGMENTS);
            for (double v = step; v < d; v += step) edges.add(v);
        }

        return edges.stream()
                .filter(v -> v >= 0 && v <= d)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    static double besselJ(int order, double x) {
        double ax = FastMath.abs(x);
        double sign = (order % 2 == 1 && x < 0) ? -1 : 1;
        if (ax > BESSEL_ASYMPTOTIC_THRESHOLD) {
            double mu = 4.0 * order * order;
            double z = 8 * ax;
            double p = 1 - (mu - 1) * (mu - 9) / (2 * z * z);
            double q = (mu - 1) / z - (mu - 1) * (mu - 9) * (mu - 25) / (6 * z * z * z);
            double chi = ax - order * Math.PI / 2 - Math.PI / 4;
            return sign * FastMath.sqrt(2 / (Math.PI * ax)) * (p * FastMath.cos(chi) - q * FastMath.sin(chi));
        }
        return sign * BesselJ.value(order, ax);
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
