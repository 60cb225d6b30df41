package com.sampling.service;

import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ImageStatistics;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estima el seeing de una sesión a partir del FWHM mediano de las estrellas de un FITS.
 * Seeing (") = FWHM (px) * escala de píxel ("/px).
 */
public class SeeingEstimationService {

    private static final Logger log = LoggerFactory.getLogger(SeeingEstimationService.class);

    private static final double GAUSSIAN_CORRECTION_FACTOR = 1.7;
    private static final double DETECTION_SIGMA = 5.0;

    // Filtros de estrellas válidas
    private static final double MIN_FWHM_PX = 0.8;
    private static final double MAX_FWHM_PX = 20.0;
    private static final double MIN_ROUNDNESS = 0.4;

    public Optional<SeeingEstimate> estimate(File fitsFile, double pixelScale) {
        double[][] data;
        try (Fits fits = new Fits(fitsFile)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new FitsReadException("El archivo no tiene HDU primario: " + fitsFile.getName(), null);
            data = toDouble(hdu.getKernel());
        } catch (FitsException | IOException e) {
            throw new FitsReadException("No se pudo leer la imagen FITS " + fitsFile.getName(), e);
        }
        if (data.length == 0) {
            log.warn("{}: formato de imagen no soportado", fitsFile.getName());
            return Optional.empty();
        }
        return estimate(data, pixelScale);
    }

    Optional<SeeingEstimate> estimate(double[][] data, double pixelScale) {
        int h = data.length, w = data[0].length;
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();

        // --- CORRECCIÓN PEDESTAL (BZERO mal aplicado) ---
        double sampleSum = 0;
        int samples = 0;
        int startY = Math.max(0, h / 2 - 100);
        int startX = Math.max(0, w / 2 - 100);
        for (int y = startY; y < startY + 200 && y < h; y++) {
            for (int x = startX; x < startX + 200 && x < w; x++) {
                sampleSum += data[y][x];
                samples++;
            }
        }
        double estimateMean = (samples > 0) ? sampleSum / samples : 0;
        double pedestal = (estimateMean > 20000) ? 32768.0 : 0.0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double val = data[y][x] - pedestal;
                px[y * w + x] = (float) Math.max(0, val);
            }
        }

        // --- DETECCIÓN ---
        ImageStatistics stats = ip.getStatistics();
        double skyLevel = stats.dmode;
        if (skyLevel == 0) skyLevel = stats.mean;
        double noise = stats.stdDev;
        if (noise <= 0) {
            // Imagen plana: no hay estrellas que medir
            return Optional.empty();
        }
        ip.setThreshold(skyLevel + DETECTION_SIGMA * noise, Float.MAX_VALUE, ImageProcessor.NO_LUT_UPDATE);

        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE,
                Measurements.AREA | Measurements.ELLIPSE, rt, 3, 99999);
        pa.analyze(new ImagePlus("", ip));

        List<Double> fwhmList = new ArrayList<>();
        for (int i = 0; i < rt.getCounter(); i++) {
            double major = rt.getValue("Major", i);
            double minor = rt.getValue("Minor", i);
            double roundness = (major > 0) ? Math.min(1.0, minor / major) : 0.0;

            double area = rt.getValue("Area", i);
            double fwhm = 2 * Math.sqrt(area / Math.PI) / GAUSSIAN_CORRECTION_FACTOR;
            if (fwhm > MIN_FWHM_PX && fwhm < MAX_FWHM_PX && roundness > MIN_ROUNDNESS) fwhmList.add(fwhm);
        }

        log.debug("Detectadas {} fuentes, {} estrellas válidas", rt.getCounter(), fwhmList.size());
        if (fwhmList.isEmpty()) return Optional.empty();

        double fwhm = median(fwhmList);
        return Optional.of(new SeeingEstimate(fwhmList.size(), fwhm, fwhm * pixelScale));
    }

    /**
     * Escala real del frame. El FWHM se mide en píxeles del frame, que pueden venir con
     * otro binning que el del formulario. Sin XBINNING (0) se asume el del formulario.
     */
    public static double frameScale(double pixelScale, int formBinning, int frameBinning) {
        if (frameBinning <= 0 || formBinning <= 0 || frameBinning == formBinning) return pixelScale;
        return pixelScale / formBinning * frameBinning;
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 0) return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
        return sorted.get(mid);
    }

    private double[][] toDouble(Object k) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j] & 0xFFFF;
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = f[i][j];
            return d;
        }
        return new double[0][0];
    }
}
