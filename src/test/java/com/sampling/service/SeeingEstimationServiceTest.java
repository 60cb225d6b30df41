package com.sampling.service;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class SeeingEstimationServiceTest {

    @TempDir
    Path tmp;

    private final SeeingEstimationService service = new SeeingEstimationService();

    @Test
    void median_oddAndEven() {
        assertEquals(2.0, SeeingEstimationService.median(Arrays.asList(3.0, 1.0, 2.0)));
        assertEquals(2.5, SeeingEstimationService.median(Arrays.asList(4.0, 1.0, 3.0, 2.0)));
    }

    @Test
    void flatFrame_hasNoStars() {
        double[][] flat = new double[50][50];
        for (double[] row : flat) Arrays.fill(row, 1000);
        assertTrue(service.estimate(flat, 1.0).isEmpty());
    }

    @Test
    void syntheticStars_giveSeeingFromFwhm() {
        Random rnd = new Random(42);
        double[][] img = new double[200][200];
        for (int y = 0; y < 200; y++) {
            for (int x = 0; x < 200; x++) img[y][x] = 1000 + rnd.nextGaussian() * 10;
        }
        // Rejilla de 3x3 estrellas gaussianas (sigma 2 px)
        for (int sy = 40; sy <= 160; sy += 60) {
            for (int sx = 40; sx <= 160; sx += 60) {
                for (int y = sy - 12; y <= sy + 12; y++) {
                    for (int x = sx - 12; x <= sx + 12; x++) {
                        double r2 = (x - sx) * (x - sx) + (y - sy) * (y - sy);
                        img[y][x] += 5000 * Math.exp(-r2 / 8.0);
                    }
                }
            }
        }

        Optional<SeeingEstimate> est = service.estimate(img, 1.5);
        assertTrue(est.isPresent());
        assertTrue(est.get().starCount >= 1);
        assertTrue(est.get().fwhmPx > 0.8 && est.get().fwhmPx < 20);
        assertEquals(est.get().fwhmPx * 1.5, est.get().seeingArcsec, 1e-9);
    }

    @Test
    void missingFileFails() {
        File missing = tmp.resolve("nope.fits").toFile();
        assertThrows(FitsReadException.class, () -> service.estimate(missing, 1.0));
    }

    @Test
    void frameScale_followsFrameBinning() {
        // Formulario en 1x1 a 0.5"/px, frame tomado en 2x2
        assertEquals(1.0, SeeingEstimationService.frameScale(0.5, 1, 2), 1e-12);
        // Formulario en 2x2 a 1.0"/px, frame sin binning
        assertEquals(0.5, SeeingEstimationService.frameScale(1.0, 2, 1), 1e-12);
        assertEquals(0.75, SeeingEstimationService.frameScale(0.75, 3, 3));
    }

    @Test
    void frameScale_withoutBinningKeywordKeepsFormScale() {
        assertEquals(0.8, SeeingEstimationService.frameScale(0.8, 2, 0));
    }
}
