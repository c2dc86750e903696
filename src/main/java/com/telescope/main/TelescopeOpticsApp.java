package com.telescope.main;

import com.telescope.exception.ConfigurationException;
import com.telescope.model.FwhmResult;
import com.telescope.model.KolmogorovAtmosphere;
import com.telescope.model.TelescopeConfig;
import com.telescope.service.FitsExportService;
import com.telescope.service.FwhmSolverService;
import com.telescope.service.PointSpreadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "telescope-optics",
        mixinStandardHelpOptions = true,
        description = {
                "Computes the collecting area and the PSF full width at half maximum of a telescope,",
                "optionally seen through Kolmogorov turbulence, and exports pupil/PSF FITS images."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Execution error (FITS output, numerical failure)",
                "2:Invalid command line arguments"
        })
public class TelescopeOpticsApp implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TelescopeOpticsApp.class);

    private static final int PSF_IMAGE_SIZE = 128;
    private static final double PSF_SAMPLES_PER_FWHM = 8;

    @Option(names = {"-D", "--diameter"}, required = true, description = "Telescope diameter [m]")
    double diameter;

    @Option(names = "--obstruction", defaultValue = "0", description = "Central obstruction ratio in [0,1). Default: ${DEFAULT-VALUE}")
    double obstructionRatio;

    @Option(names = "--resolution", description = "Pupil sampling [pixel], needed for --pupil-fits")
    Integer resolution;

    @Option(names = "--r0", description = "Attach Kolmogorov turbulence with this coherence length [m]")
    Double r0;

    @Option(names = "--wavelength", defaultValue = "500e-9", description = "Wavelength [m] for the angular FWHM. Default: ${DEFAULT-VALUE}")
    double wavelength;

    @Option(names = "--pupil-fits", description = "Write the pupil mask to this FITS file")
    File pupilFits;

    @Option(names = "--psf-fits", description = "Write a sampled PSF image to this FITS file")
    File psfFits;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TelescopeOpticsApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        TelescopeConfig config;
        try {
            TelescopeConfig.Builder builder = TelescopeConfig.builder(diameter).obstructionRatio(obstructionRatio);
            if (resolution != null) builder.resolution(resolution);
            if (r0 != null) builder.opticalAberration(new KolmogorovAtmosphere(r0));
            config = builder.build();
        } catch (ConfigurationException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
        if (pupilFits != null && resolution == null) {
            throw new ParameterException(spec.commandLine(), "--pupil-fits needs --resolution");
        }

        try (PointSpreadService psf = new PointSpreadService()) {
            FwhmResult fwhm = new FwhmSolverService(psf).fullWidthHalfMax(config);
            log.info("{}", config);
            log.info("FWHM: {} 1/m = {} arcsec at {} m{}",
                    String.format("%.6g", fwhm.value),
                    String.format("%.4f", fwhm.toArcsec(wavelength)),
                    wavelength,
                    fwhm.converged ? "" : " (not converged: " + fwhm.diagnostic + ")");

            FitsExportService export = new FitsExportService(psf);
            if (pupilFits != null) {
                export.writePupil(config, pupilFits);
                log.info("Pupil written: {}", pupilFits);
            }
            if (psfFits != null) {
                double step = fwhm.value > 0 ? fwhm.value / PSF_SAMPLES_PER_FWHM : 0.25 / diameter;
                export.writePsfImage(config, PSF_IMAGE_SIZE, step, psfFits);
                log.info("PSF written: {}", psfFits);
            }
        } catch (Exception e) {
            log.error("FAILED: {}", e.getMessage());
            return 1;
        }
        return 0;
    }
}
