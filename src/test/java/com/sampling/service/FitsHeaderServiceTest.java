package com.sampling.service;

import com.sampling.model.CalculatorInput;
import java.io.File;
import java.nio.file.Path;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.util.FitsFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class FitsHeaderServiceTest {

    @TempDir
    Path tmp;

    private final FitsHeaderService service = new FitsHeaderService();

    private File writeFits(String name, boolean withEquipment) throws Exception {
        File file = tmp.resolve(name).toFile();
        BasicHDU<?> hdu = Fits.makeHDU(new short[20][30]);
        if (withEquipment) {
            hdu.addValue("FOCALLEN", 530.0, "mm");
            hdu.addValue("APTDIA", 106.0, "mm");
            hdu.addValue("XPIXSZ", 7.52, "um, binned");
            hdu.addValue("XBINNING", 2, "");
            hdu.addValue("INSTRUME", "ZWO ASI2600MM Pro", "");
        }
        try (Fits fits = new Fits(); FitsFile out = new FitsFile(file, "rw")) {
            fits.addHDU(hdu);
            fits.write(out);
        }
        return file;
    }

    @Test
    void readHeader_equipmentKeys() throws Exception {
        FitsHeaderService.FitsMetadata meta = service.readHeader(writeFits("light.fits", true));

        assertEquals(530.0, meta.focalLength);
        assertEquals(106.0, meta.apertureDiameter);
        assertEquals(7.52, meta.pixelSize);
        assertEquals(2, meta.binning);
        assertEquals(30, meta.widthPx);
        assertEquals(20, meta.heightPx);
        assertEquals("ZWO ASI2600MM Pro", meta.cameraName);
    }

    @Test
    void applyTo_undoesBinning() throws Exception {
        FitsHeaderService.FitsMetadata meta = service.readHeader(writeFits("light.fits", true));
        CalculatorInput in = service.applyTo(meta, CalculatorInput.defaults());

        assertEquals(530.0, in.baseFocalLength);
        assertEquals(106.0, in.apertureDiameter().getAsDouble());
        assertEquals(3.76, in.pixelSize, 1e-9);
        assertEquals(2, in.binning);
        assertEquals(60, in.sensorWidthPx);
        assertEquals(40, in.sensorHeightPx);
        assertEquals("ZWO ASI2600MM Pro", in.cameraName);
    }

    @Test
    void applyTo_missingKeysKeepCurrentValues() throws Exception {
        FitsHeaderService.FitsMetadata meta = service.readHeader(writeFits("bare.fits", false));
        CalculatorInput in = service.applyTo(meta, CalculatorInput.defaults());

        CalculatorInput expected = CalculatorInput.defaults().withSensorSize(30, 20);
        assertEquals(expected, in);
    }

    @Test
    void readHeader_missingFileFails() {
        File missing = tmp.resolve("nope.fits").toFile();
        assertThrows(FitsReadException.class, () -> service.readHeader(missing));
    }
}
