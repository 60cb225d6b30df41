package com.sampling.service;

import com.sampling.model.CalculatorInput;
import java.io.File;
import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lee del header FITS los datos de equipo que escriben NINA / SGP / ASIAIR
 * para rellenar la calculadora.
 */
public class FitsHeaderService {

    private static final Logger log = LoggerFactory.getLogger(FitsHeaderService.class);

    public static class FitsMetadata {
        // 0 = clave no encontrada
        public double focalLength = 0;
        public double apertureDiameter = 0;
        public double pixelSize = 0;      // tal como viene (incluye binning)
        public int binning = 0;
        public int widthPx = 0;           // dimensiones de la imagen (ya binneada)
        public int heightPx = 0;
        public String cameraName = null;
    }

    public FitsMetadata readHeader(File f) {
        FitsMetadata meta = new FitsMetadata();
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new FitsReadException("El archivo no tiene HDU primario: " + f.getName(), null);
            Header header = hdu.getHeader();

            meta.focalLength = header.getDoubleValue("FOCALLEN", 0);

            meta.apertureDiameter = header.getDoubleValue("APTDIA", 0);

            // Intentar clave estándar y variante
            meta.pixelSize = header.getDoubleValue("XPIXSZ", 0);
            if (meta.pixelSize == 0) meta.pixelSize = header.getDoubleValue("PIXSIZE1", 0);

            meta.binning = header.getIntValue("XBINNING", 0);
            meta.widthPx = header.getIntValue("NAXIS1", 0);
            meta.heightPx = header.getIntValue("NAXIS2", 0);

            String instrument = header.getStringValue("INSTRUME");
            meta.cameraName = (instrument == null || instrument.trim().isEmpty()) ? null : instrument.trim();

        } catch (FitsException | IOException e) {
            throw new FitsReadException("No se pudo leer el header FITS de " + f.getName(), e);
        }
        log.info("Header {}: focal={} px={} bin={} {}x{} cam={}",
                f.getName(), meta.focalLength, meta.pixelSize, meta.binning, meta.widthPx, meta.heightPx, meta.cameraName);
        return meta;
    }

    /**
     * Copia sobre {@code input} lo que trae el header. Las claves que faltan dejan el valor actual.
     * El header guarda el tamaño de píxel y las dimensiones ya binneados: se deshace el binning.
     */
    public CalculatorInput applyTo(FitsMetadata meta, CalculatorInput input) {
        CalculatorInput out = input;
        int bin = meta.binning > 0 ? meta.binning : 1;

        if (meta.focalLength > 0) out = out.withBaseFocalLength(meta.focalLength);
        if (meta.apertureDiameter > 0) out = out.withApertureDiameter(meta.apertureDiameter);
        if (meta.pixelSize > 0) out = out.withPixelSize(meta.pixelSize / bin);
        if (meta.binning > 0) out = out.withBinning(meta.binning);
        if (meta.widthPx > 0 && meta.heightPx > 0) out = out.withSensorSize(meta.widthPx * bin, meta.heightPx * bin);
        if (meta.cameraName != null) out = out.withCameraName(meta.cameraName);
        return out;
    }
}
