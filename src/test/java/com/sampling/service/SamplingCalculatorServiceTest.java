package com.sampling.service;

import com.sampling.model.BinningRecommendation;
import com.sampling.model.CalculatorInput;
import com.sampling.model.CalculatorResult;
import com.sampling.model.CorrectorRecommendation;
import com.sampling.model.SamplingStatus;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SamplingCalculatorServiceTest {

    private final SamplingCalculatorService calculator = new SamplingCalculatorService();

    private static CalculatorInput rig(double focal, double pixel, int binning, double seeing) {
        return CalculatorInput.defaults()
                .withBaseFocalLength(focal)
                .withPixelSize(pixel)
                .withBinning(binning)
                .withSeeing(seeing);
    }

    // --- Escala y focal ---

    @Test
    void pixelScale_defaultRig() {
        CalculatorResult r = calculator.calculate(rig(800, 3.76, 1, 2.0));
        assertEquals(0.97, r.pixelScale, 0.005);
    }

    @ParameterizedTest
    @CsvSource({"2, 1.94", "3, 2.91", "4, 3.88"})
    void pixelScale_growsWithBinning(int binning, double expected) {
        CalculatorResult r = calculator.calculate(rig(800, 3.76, binning, 2.0));
        assertEquals(expected, r.pixelScale, 0.005);
    }

    @Test
    void pixelScale_isLinearInBinning() {
        double base = calculator.calculate(rig(1200, 4.63, 1, 2.5)).pixelScale;
        for (int k = 2; k <= 4; k++) {
            assertEquals(k * base, calculator.calculate(rig(1200, 4.63, k, 2.5)).pixelScale, 1e-12);
        }
    }

    @Test
    void effectiveFocalLength_reducerDividesFocal() {
        // Un reductor < 1 alarga la focal efectiva con esta fórmula
        CalculatorResult r = calculator.calculate(rig(1000, 3.76, 1, 2.0).withReducerFactor(0.7));
        assertEquals(1000.0 / 0.7, r.effectiveFocalLength, 0.05);
        assertEquals(206.265 * 3.76 / (1000.0 / 0.7), r.pixelScale, 1e-3);
    }

    @Test
    void effectiveFocalLength_barlowMultipliesFocal() {
        CalculatorResult r = calculator.calculate(rig(1000, 3.76, 1, 2.0).withBarlowFactor(2.0));
        assertEquals(2000.0, r.effectiveFocalLength, 0.05);
    }

    @Test
    void effectiveFocalLength_reducerAndBarlowCombined() {
        CalculatorResult r = calculator.calculate(rig(1000, 3.76, 1, 2.0).withReducerFactor(0.8).withBarlowFactor(2.0));
        assertEquals(2500.0, r.effectiveFocalLength, 0.05);
    }

    // --- Campo ---

    @Test
    void fov_fromSensorSize() {
        CalculatorResult r = calculator.calculate(rig(800, 3.76, 1, 2.0).withSensorSize(6248, 4176));
        double scale = 206.265 * 3.76 / 800;
        assertEquals(scale * 6248 / 3600.0, r.fovWidthDeg, 1e-3);
        assertEquals(scale * 4176 / 3600.0, r.fovHeightDeg, 1e-3);
    }

    @Test
    void fov_arcminIsSixtyTimesDegrees() {
        CalculatorResult r = calculator.calculate(rig(530, 2.4, 2, 3.1).withSensorSize(5496, 3672));
        assertEquals(r.fovWidthDeg * 60.0, r.fovWidthArcmin, 1e-9);
        assertEquals(r.fovHeightDeg * 60.0, r.fovHeightArcmin, 1e-9);
    }

    @Test
    void fov_unchangedByBinning() {
        CalculatorResult bin1 = calculator.calculate(rig(800, 3.76, 1, 2.0));
        CalculatorResult bin3 = calculator.calculate(rig(800, 3.76, 3, 2.0));
        assertEquals(bin1.fovWidthDeg, bin3.fovWidthDeg, 1e-9);
        assertEquals(bin1.fovHeightDeg, bin3.fovHeightDeg, 1e-9);
    }

    // --- Clasificación ---

    @Test
    void status_optimalWhenInRange() {
        // 0.97"/px con rango 0.67 - 1.0
        assertEquals(SamplingStatus.OPTIMAL, calculator.calculate(rig(800, 3.76, 1, 2.0)).status);
    }

    @Test
    void status_undersampledWhenScaleTooLarge() {
        assertEquals(SamplingStatus.UNDERSAMPLED, calculator.calculate(rig(500, 5.0, 1, 2.0)).status);
    }

    @Test
    void status_oversampledWhenScaleTooSmall() {
        CalculatorResult r = calculator.calculate(rig(2000, 2.0, 1, 2.0));
        assertEquals(0.206, r.pixelScale, 0.001);
        assertEquals(SamplingStatus.OVERSAMPLED, r.status);
    }

    // Focal = 206.265 y píxel = 1 dan exactamente 1.0"/px
    @Test
    void status_exactlyAtOptimalMax_isOptimal() {
        CalculatorResult r = calculator.calculate(rig(206.265, 1.0, 1, 2.0));
        assertEquals(1.0, r.pixelScale);
        assertEquals(1.0, r.optimalRangeMax);
        assertEquals(SamplingStatus.OPTIMAL, r.status);
    }

    @Test
    void status_exactlyAtOptimalMin_isOptimal() {
        CalculatorResult r = calculator.calculate(rig(206.265, 1.0, 1, 3.0));
        assertEquals(1.0, r.optimalRangeMin);
        assertEquals(SamplingStatus.OPTIMAL, r.status);
    }

    @Test
    void status_justAboveOptimalMax_isUndersampled() {
        assertEquals(SamplingStatus.UNDERSAMPLED, calculator.calculate(rig(206.265, 1.01, 1, 2.0)).status);
    }

    @Test
    void status_justBelowOptimalMin_isOversampled() {
        assertEquals(SamplingStatus.OVERSAMPLED, calculator.calculate(rig(206.265, 0.99, 1, 3.0)).status);
    }

    @ParameterizedTest
    @CsvSource({"1.0, 0.333, 0.5", "2.0, 0.667, 1.0", "3.0, 1.0, 1.5", "4.0, 1.333, 2.0"})
    void optimalRange_scalesWithSeeing(double seeing, double expectedMin, double expectedMax) {
        CalculatorResult r = calculator.calculate(CalculatorInput.defaults().withSeeing(seeing));
        assertEquals(expectedMin, r.optimalRangeMin, 0.001);
        assertEquals(expectedMax, r.optimalRangeMax, 0.001);
    }

    // --- Apertura ---

    @Test
    void dawesAndFRatio_whenApertureProvided() {
        CalculatorResult r = calculator.calculate(rig(800, 3.76, 1, 2.0).withApertureDiameter(200.0));
        assertTrue(r.dawesLimitArcsec.isPresent());
        assertEquals(0.58, r.dawesLimitArcsec.getAsDouble(), 0.005);
        assertTrue(r.fRatio.isPresent());
        assertEquals(4.0, r.fRatio.getAsDouble(), 0.05);
    }

    @Test
    void dawesAndFRatio_absentWithoutAperture() {
        CalculatorResult r = calculator.calculate(CalculatorInput.defaults().withoutAperture());
        assertTrue(r.dawesLimitArcsec.isEmpty());
        assertTrue(r.fRatio.isEmpty());
    }

    @Test
    void dawesAndFRatio_absentForZeroAperture() {
        CalculatorResult r = calculator.calculate(CalculatorInput.defaults().withApertureDiameter(0.0));
        assertTrue(r.dawesLimitArcsec.isEmpty());
        assertTrue(r.fRatio.isEmpty());
    }

    @Test
    void fRatio_usesEffectiveFocalLength() {
        CalculatorInput in = rig(800, 3.76, 1, 2.0).withApertureDiameter(200.0).withReducerFactor(0.8).withBarlowFactor(1.5);
        assertEquals(7.5, calculator.calculate(in).fRatio.getAsDouble(), 0.05);
    }

    // --- Mensajes ---

    @Test
    void statusMessage_optimal() {
        String msg = calculator.calculate(rig(800, 3.76, 1, 2.0)).statusMessage;
        assertTrue(msg.contains("well-matched"), msg);
        assertTrue(msg.contains("2.0"), msg);
    }

    @Test
    void statusMessage_undersampled() {
        String msg = calculator.calculate(rig(500, 5.0, 1, 2.0)).statusMessage;
        assertTrue(msg.contains("undersampled"), msg);
    }

    @Test
    void statusMessage_oversampled() {
        String msg = calculator.calculate(rig(2000, 2.0, 1, 2.0)).statusMessage;
        assertTrue(msg.contains("oversampled"), msg);
    }

    @Test
    void statusMessage_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            CalculatorResult r = calculator.calculate(rig(1600, 3.76, 1, 2.5));
            assertTrue(r.statusMessage.contains("2.5"), r.statusMessage);
            assertFalse(r.statusMessage.contains("2,5"), r.statusMessage);
            assertTrue(r.binningRecommendation.get().message.contains("."), r.binningRecommendation.get().message);
        } finally {
            Locale.setDefault(previous);
        }
    }

    // --- Binning ---

    @Test
    void binning_oversampled_suggestsHigherBinning() {
        CalculatorResult r = calculator.calculate(rig(2000, 2.0, 1, 2.0));
        assertTrue(r.binningRecommendation.isPresent());
        BinningRecommendation b = r.binningRecommendation.get();
        assertTrue(b.binning > 1);
        assertTrue(b.message.toLowerCase(Locale.ROOT).contains("binning"), b.message);
    }

    @Test
    void binning_clampedToFour() {
        // Haría falta 5x5: se limita a 4x4
        BinningRecommendation b = calculator.calculate(rig(2000, 2.0, 1, 2.0)).binningRecommendation.get();
        assertEquals(4, b.binning);
        assertEquals(206.265 * 8 / 2000, b.resultingPixelScale, 1e-9);
        assertTrue(b.message.contains("4×4"), b.message);
        assertTrue(b.message.contains("0.83"), b.message);
    }

    @Test
    void binning_smallestBinningThatReachesTarget() {
        // 0.485"/px, objetivo 0.833 -> 2x2 da 0.97
        BinningRecommendation b = calculator.calculate(rig(1600, 3.76, 1, 2.0)).binningRecommendation.get();
        assertEquals(2, b.binning);
        assertEquals(0.969, b.resultingPixelScale, 0.001);
    }

    @Test
    void binning_noneWhenOptimal() {
        assertTrue(calculator.calculate(rig(800, 3.76, 1, 2.0)).binningRecommendation.isEmpty());
    }

    @Test
    void binning_noneWhenUndersampled() {
        CalculatorResult r = calculator.calculate(rig(500, 5.0, 1, 2.0));
        assertEquals(SamplingStatus.UNDERSAMPLED, r.status);
        assertTrue(r.binningRecommendation.isEmpty());
    }

    @Test
    void binning_noneWhenAlreadyAtFour() {
        CalculatorResult r = calculator.calculate(rig(4000, 2.0, 4, 2.0));
        assertEquals(SamplingStatus.OVERSAMPLED, r.status);
        assertTrue(r.binningRecommendation.isEmpty());
    }

    // --- Reductor / Barlow ---

    @Test
    void corrector_oversampled_suggestsReducer() {
        // 0.485"/px, objetivo 0.833 -> ratio 0.58
        CalculatorResult r = calculator.calculate(rig(1600, 3.76, 1, 2.0));
        assertEquals(SamplingStatus.OVERSAMPLED, r.status);
        CorrectorRecommendation c = r.correctorRecommendation.get();
        assertEquals(CorrectorRecommendation.Kind.REDUCER, c.kind);
        assertEquals(0.58, c.factor, 1e-9);
        assertEquals(931, c.projectedFocalLength().getAsLong());
        assertEquals(0.8333, c.resultingPixelScale, 1e-3);
        assertTrue(c.message.toLowerCase(Locale.ROOT).contains("reducer"), c.message);
        assertTrue(c.message.contains("0.58×"), c.message);
        assertTrue(c.message.contains("931 mm"), c.message);
    }

    @Test
    void corrector_oversampledTooFar_noReducer() {
        // ratio ~0.25: ningún reductor llega
        assertTrue(calculator.calculate(rig(2000, 2.0, 1, 2.0)).correctorRecommendation.isEmpty());
    }

    @Test
    void corrector_undersampled_suggestsBarlow() {
        CalculatorResult r = calculator.calculate(rig(500, 5.0, 1, 2.0));
        CorrectorRecommendation c = r.correctorRecommendation.get();
        assertEquals(CorrectorRecommendation.Kind.BARLOW, c.kind);
        assertEquals(2.5, c.factor, 1e-9);
        assertTrue(c.projectedFocalLength().isEmpty());
        assertTrue(c.message.toLowerCase(Locale.ROOT).contains("barlow"), c.message);
        assertTrue(c.message.contains("2.5×"), c.message);
    }

    @Test
    void corrector_undersampledByLittle_noBarlow() {
        // Barlow necesaria ~1.24x, por debajo de 1.5x
        CalculatorResult r = calculator.calculate(rig(1000, 5.0, 1, 2.0));
        assertEquals(SamplingStatus.UNDERSAMPLED, r.status);
        assertTrue(r.correctorRecommendation.isEmpty());
    }

    @Test
    void corrector_noneWhenOptimal() {
        assertTrue(calculator.calculate(rig(800, 3.76, 1, 2.0)).correctorRecommendation.isEmpty());
    }

    // --- Avisos extremos ---

    @Test
    void extremeWarning_whenScaleAboveFour() {
        CalculatorResult r = calculator.calculate(rig(200, 5.0, 1, 2.0));
        assertEquals(Optional.of("Pixel scale is extremely large (>4″/px). Stars will be undersampled and blocky; "
                + "consider a longer focal length or smaller pixels."), r.extremeWarning);
    }

    @Test
    void extremeWarning_whenScaleBelowPointTwo() {
        CalculatorResult r = calculator.calculate(rig(5000, 1.0, 1, 2.0));
        assertEquals(Optional.of("Pixel scale is extremely small (<0.2″/px). Guiding must be very precise and signal "
                + "per pixel will be low; consider binning or a reducer."), r.extremeWarning);
    }

    @Test
    void extremeWarning_absentAtExactlyFour() {
        // 206.265 * 4.0 / 206.265 == 4.0 exacto
        CalculatorResult r = calculator.calculate(rig(206.265, 4.0, 1, 2.0));
        assertEquals(4.0, r.pixelScale);
        assertTrue(r.extremeWarning.isEmpty());
    }

    @Test
    void extremeWarning_absentAtExactlyPointTwo() {
        CalculatorResult r = calculator.calculate(rig(206.265, 0.2, 1, 2.0));
        assertEquals(0.2, r.pixelScale);
        assertTrue(r.extremeWarning.isEmpty());
    }

    @Test
    void extremeWarning_absentForNormalScale() {
        assertTrue(calculator.calculate(CalculatorInput.defaults()).extremeWarning.isEmpty());
        // 0.206"/px: sobremuestreado pero no extremo
        assertTrue(calculator.calculate(rig(2000, 2.0, 1, 2.0)).extremeWarning.isEmpty());
    }

    // --- Entradas fuera de dominio ---

    @Test
    void zeroReducer_propagatesInfinityWithoutThrowing() {
        CalculatorResult r = assertDoesNotThrow(() -> calculator.calculate(CalculatorInput.defaults().withReducerFactor(0)));
        assertTrue(Double.isInfinite(r.effectiveFocalLength));
        assertEquals(0.0, r.pixelScale);
    }

    @Test
    void zeroBinning_propagatesNaNWithoutThrowing() {
        CalculatorResult r = assertDoesNotThrow(() -> calculator.calculate(CalculatorInput.defaults().withBinning(0)));
        assertTrue(Double.isNaN(r.fovWidthDeg));
    }

    @Test
    void calculate_isSafeFromManyThreads() {
        CalculatorInput in = rig(1600, 3.76, 1, 2.0);
        CalculatorResult expected = calculator.calculate(in);
        List<Double> scales = IntStream.range(0, 1000).parallel()
                .mapToObj(i -> calculator.calculate(in).pixelScale)
                .collect(Collectors.toList());
        scales.forEach(s -> assertEquals(expected.pixelScale, s.doubleValue()));
    }
}
