package com.telescope.service;

import com.telescope.exception.ConfigurationException;
import com.telescope.model.PupilMask;
import com.telescope.model.TelescopeConfig;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes pupil masks and sampled PSF images as FITS primary images, and reads
 * the telescope cards back.
 */
public class FitsExportService {

    private static final Logger log = LoggerFactory.getLogger(FitsExportService.class);

    public static final String KEY_DIAMETER = "TELDIAM";
    public static final String KEY_OBSTRUCTION = "OBSRATIO";
    public static final String KEY_PIXELS = "NPIX";
    public static final String KEY_AREA = "AREA";
    public static final String KEY_FREQ_STEP = "FSTEP";
    public static final String KEY_PSF_PEAK = "PSFPEAK";

    public static class TelescopeFitsMetadata {
        public double diameter = 0;
        public double obstructionRatio = 0;
        public int pixels = 0;
    }

    private final PointSpreadService psfService;

    public FitsExportService(PointSpreadService psfService) {
        this.psfService = psfService;
    }

    public void writePupil(TelescopeConfig config, File out) throws IOException, FitsException {
        PupilMask pupil = config.pupil()
                .orElseThrow(() -> new ConfigurationException("Pupil export needs a resolution"));

        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(pupil.toFloatArray());
            addTelescopeCards(hdu, config);
            hdu.addValue(KEY_PIXELS, pupil.size(), "pupil sampling [pixel]");
            hdu.addValue(KEY_AREA, config.area(), "collecting area [m2]");
            fits.addHDU(hdu);
            fits.write(out);
        }
        log.debug("Pupil {}x{} written to {}", pupil.size(), pupil.size(), out);
    }

    // Peak at pixel (size/2, size/2)
    public void writePsfImage(TelescopeConfig config, int size, double frequencyStep, File out)
            throws IOException, FitsException {
        if (size <= 0) throw new ConfigurationException("PSF image size must be > 0, got " + size);
        if (!(frequencyStep > 0)) throw new ConfigurationException("Frequency step must be > 0, got " + frequencyStep);

        float[][] image = samplePsf(config, size, frequencyStep);
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(image);
            addTelescopeCards(hdu, config);
            hdu.addValue(KEY_FREQ_STEP, frequencyStep, "frequency per pixel [1/m]");
            hdu.addValue(KEY_PSF_PEAK, (double) image[size / 2][size / 2], "psf at f=0");
            fits.addHDU(hdu);
            fits.write(out);
        }
        log.debug("PSF {}x{} written to {}", size, size, out);
    }

    float[][] samplePsf(TelescopeConfig config, int size, double frequencyStep) {
        int c = size / 2;

        // One PSF evaluation per distinct squared pixel radius
        Map<Integer, Integer> radiusIndex = new TreeMap<>();
        for (int y = 0; y < size; y++)
            for (int x = 0; x < size; x++)
                radiusIndex.putIfAbsent((x - c) * (x - c) + (y - c) * (y - c), 0);

        double[] freqs = new double[radiusIndex.size()];
        int i = 0;
        for (Map.Entry<Integer, Integer> e : radiusIndex.entrySet()) {
            e.setValue(i);
            freqs[i++] = Math.sqrt(e.getKey()) * frequencyStep;
        }
        double[] values = psfService.psf(config, freqs);

        float[][] image = new float[size][size];
        for (int y = 0; y < size; y++)
            for (int x = 0; x < size; x++)
                image[y][x] = (float) values[radiusIndex.get((x - c) * (x - c) + (y - c) * (y - c))];
        return image;
    }

    public TelescopeFitsMetadata readMetadata(File f) throws IOException, FitsException {
        TelescopeFitsMetadata meta = new TelescopeFitsMetadata();
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            Header header = hdu.getHeader();

            meta.diameter = header.getDoubleValue(KEY_DIAMETER, 0);
            meta.obstructionRatio = header.getDoubleValue(KEY_OBSTRUCTION, 0);
            meta.pixels = header.getIntValue(KEY_PIXELS, 0);
            if (meta.pixels == 0) meta.pixels = header.getIntValue("NAXIS1", 0);
        }
        return meta;
    }

    private void addTelescopeCards(BasicHDU<?> hdu, TelescopeConfig config) throws FitsException {
        hdu.addValue(KEY_DIAMETER, config.getDiameter(), "telescope diameter [m]");
        hdu.addValue(KEY_OBSTRUCTION, config.getObstructionRatio(), "central obstruction ratio");
    }
}
