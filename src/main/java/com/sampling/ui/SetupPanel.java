package com.sampling.ui;

import com.sampling.model.CalculatorInput;
import com.sampling.model.CalculatorResult;
import com.sampling.service.InputValidationService;
import com.sampling.service.SamplingCalculatorService;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

/**
 * Formulario de un equipo + tarjeta de resultados. Se usa en la calculadora
 * y dos veces en la pestaña de comparación.
 */
public class SetupPanel {

    private final SamplingCalculatorService calculator = new SamplingCalculatorService();

    private final String title;
    private Runnable onChange = () -> {};

    // Campos
    private TextField txtFocal, txtAperture, txtReducer, txtBarlow;
    private TextField txtPixel, txtSensorW, txtSensorH, txtSeeing;
    private ComboBox<Integer> cmbBinning;
    private String cameraName;
    private final Map<String, Label> errorLabels = new LinkedHashMap<>();

    // Resultados
    private Label valScale, valFov, valFocal, valFRatio, valDawes, valRange;
    private Label lblStatus, lblBinning, lblCorrector, lblWarning;
    private Pane pnlStatus;
    private VBox resultsBox, invalidBox;

    private CalculatorResult lastResult;

    public SetupPanel(String title) {
        this.title = title;
    }

    public VBox create() {
        VBox box = new VBox(15);
        box.setPadding(new Insets(10));

        Label lblTitle = new Label(title);
        lblTitle.setFont(Font.font("System", FontWeight.BOLD, 16));

        // --- 1. ÓPTICA ---
        GridPane gridOpt = section();
        txtFocal = addField(gridOpt, 0, "Focal (mm):", InputValidationService.FIELD_FOCAL);
        txtAperture = addField(gridOpt, 1, "Apertura (mm, opcional):", InputValidationService.FIELD_APERTURE);
        txtReducer = addField(gridOpt, 2, "Reductor (×):", InputValidationService.FIELD_REDUCER);
        txtBarlow = addField(gridOpt, 3, "Barlow (×):", InputValidationService.FIELD_BARLOW);

        // --- 2. CÁMARA ---
        GridPane gridCam = section();
        txtPixel = addField(gridCam, 0, "Pixel Size (μm):", InputValidationService.FIELD_PIXEL);
        txtSensorW = addField(gridCam, 1, "Sensor ancho (px):", InputValidationService.FIELD_SENSOR_WIDTH);
        txtSensorH = addField(gridCam, 2, "Sensor alto (px):", InputValidationService.FIELD_SENSOR_HEIGHT);
        cmbBinning = new ComboBox<>();
        cmbBinning.getItems().addAll(1, 2, 3, 4);
        cmbBinning.setOnAction(e -> recalculate());
        gridCam.add(new Label("Binning:"), 0, 3);
        gridCam.add(cmbBinning, 1, 3);

        // --- 3. CIELO ---
        GridPane gridSky = section();
        txtSeeing = addField(gridSky, 0, "Seeing FWHM (\"):", InputValidationService.FIELD_SEEING);

        box.getChildren().addAll(lblTitle, gridOpt, gridCam, gridSky, createResults());
        setInput(CalculatorInput.defaults());
        return box;
    }

    public void setOnChange(Runnable onChange) {
        this.onChange = onChange;
    }

    public void setInput(CalculatorInput in) {
        txtFocal.setText(fmt(in.baseFocalLength));
        txtAperture.setText(in.hasAperture() ? fmt(in.apertureDiameter().getAsDouble()) : "");
        txtReducer.setText(fmt(in.reducerFactor));
        txtBarlow.setText(fmt(in.barlowFactor));
        txtPixel.setText(fmt(in.pixelSize));
        txtSensorW.setText(String.valueOf(in.sensorWidthPx));
        txtSensorH.setText(String.valueOf(in.sensorHeightPx));
        cmbBinning.setValue(in.binning);
        txtSeeing.setText(fmt(in.seeing));
        cameraName = in.cameraName;
        recalculate();
    }

    /** Entrada actual si todos los campos son válidos. */
    public Optional<CalculatorInput> currentInput() {
        errorLabels.values().forEach(l -> l.setText(""));
        Map<String, String> parseErrors = new LinkedHashMap<>();

        OptionalDouble focal = number(txtFocal, InputValidationService.FIELD_FOCAL, parseErrors);
        OptionalDouble reducer = number(txtReducer, InputValidationService.FIELD_REDUCER, parseErrors);
        OptionalDouble barlow = number(txtBarlow, InputValidationService.FIELD_BARLOW, parseErrors);
        OptionalDouble pixel = number(txtPixel, InputValidationService.FIELD_PIXEL, parseErrors);
        OptionalDouble seeing = number(txtSeeing, InputValidationService.FIELD_SEEING, parseErrors);
        OptionalInt width = integer(txtSensorW, InputValidationService.FIELD_SENSOR_WIDTH, parseErrors);
        OptionalInt height = integer(txtSensorH, InputValidationService.FIELD_SENSOR_HEIGHT, parseErrors);

        // Apertura vacía = sin apertura
        Double aperture = null;
        if (!txtAperture.getText().trim().isEmpty()) {
            OptionalDouble ap = number(txtAperture, InputValidationService.FIELD_APERTURE, parseErrors);
            if (ap.isPresent()) aperture = ap.getAsDouble();
        }

        if (!parseErrors.isEmpty()) {
            showErrors(parseErrors);
            return Optional.empty();
        }

        int binning = cmbBinning.getValue() == null ? 1 : cmbBinning.getValue();
        CalculatorInput in = new CalculatorInput(focal.getAsDouble(), aperture, reducer.getAsDouble(), barlow.getAsDouble(),
                pixel.getAsDouble(), width.getAsInt(), height.getAsInt(), binning, seeing.getAsDouble(), cameraName);

        Map<String, String> errors = InputValidationService.validate(in);
        if (!errors.isEmpty()) {
            showErrors(errors);
            return Optional.empty();
        }
        return Optional.of(in);
    }

    public Optional<CalculatorResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    public void recalculate() {
        Optional<CalculatorInput> in = currentInput();
        if (in.isEmpty()) {
            lastResult = null;
            resultsBox.setVisible(false);
            invalidBox.setVisible(true);
        } else {
            lastResult = calculator.calculate(in.get());
            showResult(lastResult);
            resultsBox.setVisible(true);
            invalidBox.setVisible(false);
        }
        onChange.run();
    }

    // --- RESULTADOS ---

    private StackPane createResults() {
        GridPane grid = new GridPane();
        grid.setHgap(20); grid.setVgap(10);
        valScale = addStat(grid, "Escala (\"/px)", 0, 0);
        valFov = addStat(grid, "Campo", 1, 0);
        valFocal = addStat(grid, "Focal efectiva", 2, 0);
        valFRatio = addStat(grid, "Relación focal", 0, 1);
        valDawes = addStat(grid, "Dawes (\")", 1, 1);
        valRange = addStat(grid, "Rango óptimo (\"/px)", 2, 1);

        lblStatus = new Label();
        lblStatus.setWrapText(true);
        lblStatus.setFont(Font.font("System", FontWeight.BOLD, 13));
        pnlStatus = new VBox(lblStatus);
        pnlStatus.setPadding(new Insets(10));

        lblBinning = new Label();
        lblCorrector = new Label();
        lblWarning = new Label();
        lblWarning.setStyle("-fx-text-fill: #E65100; -fx-font-weight: bold;");
        for (Label l : new Label[]{lblBinning, lblCorrector, lblWarning}) {
            l.setWrapText(true);
            l.managedProperty().bind(l.visibleProperty());
        }

        resultsBox = new VBox(10, grid, pnlStatus, lblBinning, lblCorrector, lblWarning);
        resultsBox.setPadding(new Insets(15));
        resultsBox.setStyle("-fx-border-color: #DDD; -fx-border-radius: 8; -fx-background-color: #FAFAFA;");

        Label lblInvalid = new Label("⚠️ Corrige los campos marcados para ver los resultados.");
        lblInvalid.setStyle("-fx-text-fill: #C62828; -fx-font-weight: bold;");
        invalidBox = new VBox(lblInvalid);
        invalidBox.setAlignment(Pos.CENTER);
        invalidBox.setPadding(new Insets(15));
        invalidBox.setStyle("-fx-border-color: #EF9A9A; -fx-border-radius: 8; -fx-background-color: #FFEBEE;");
        invalidBox.setVisible(false);

        return new StackPane(resultsBox, invalidBox);
    }

    private void showResult(CalculatorResult r) {
        valScale.setText(String.format(Locale.ROOT, "%.2f", r.pixelScale));
        valFov.setText(String.format(Locale.ROOT, "%.1f' × %.1f'", r.fovWidthArcmin, r.fovHeightArcmin));
        valFocal.setText(String.format(Locale.ROOT, "%.0f mm", r.effectiveFocalLength));
        valFRatio.setText(r.fRatio.isPresent() ? String.format(Locale.ROOT, "f/%.1f", r.fRatio.getAsDouble()) : "--");
        valDawes.setText(r.dawesLimitArcsec.isPresent() ? String.format(Locale.ROOT, "%.2f", r.dawesLimitArcsec.getAsDouble()) : "--");
        valRange.setText(String.format(Locale.ROOT, "%.2f – %.2f", r.optimalRangeMin, r.optimalRangeMax));

        lblStatus.setText(r.statusMessage);
        switch (r.status) {
            case OPTIMAL: pnlStatus.setStyle("-fx-background-color: #C8E6C9; -fx-background-radius: 5;"); break;
            case OVERSAMPLED: pnlStatus.setStyle("-fx-background-color: #BBDEFB; -fx-background-radius: 5;"); break;
            default: pnlStatus.setStyle("-fx-background-color: #FFE0B2; -fx-background-radius: 5;"); break;
        }

        show(lblBinning, r.binningRecommendation.map(b -> "🔲 " + b.message));
        show(lblCorrector, r.correctorRecommendation.map(c -> "🔭 " + c.message));
        show(lblWarning, r.extremeWarning.map(w -> "⚠️ " + w));
    }

    private void show(Label l, Optional<String> text) {
        l.setText(text.orElse(""));
        l.setVisible(text.isPresent());
    }

    // --- HELPERS ---

    private GridPane section() {
        GridPane grid = new GridPane();
        grid.setHgap(15); grid.setVgap(10);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");
        return grid;
    }

    private TextField addField(GridPane grid, int row, String label, String field) {
        TextField tf = new TextField();
        tf.textProperty().addListener((obs, o, n) -> recalculateIfReady());
        Label err = new Label();
        err.setStyle("-fx-text-fill: #C62828; -fx-font-size: 11px;");
        errorLabels.put(field, err);
        grid.add(new Label(label), 0, row);
        grid.add(tf, 1, row);
        grid.add(err, 2, row);
        return tf;
    }

    // Durante create() los campos se van creando de a uno
    private void recalculateIfReady() {
        if (txtSeeing != null && cmbBinning != null && resultsBox != null) recalculate();
    }

    private Label addStat(GridPane grid, String title, int col, int row) {
        VBox card = new VBox(3);
        card.setAlignment(Pos.CENTER);
        Label t = new Label(title);
        t.setStyle("-fx-font-size: 10px; -fx-text-fill: #666;");
        Label v = new Label("--");
        v.setFont(Font.font("System", FontWeight.BOLD, 16));
        card.getChildren().addAll(t, v);
        grid.add(card, col, row);
        return v;
    }

    private OptionalDouble number(TextField tf, String field, Map<String, String> errors) {
        OptionalDouble v = InputValidationService.parseDouble(tf.getText());
        if (v.isEmpty()) errors.put(field, "Must be a number.");
        return v;
    }

    private OptionalInt integer(TextField tf, String field, Map<String, String> errors) {
        OptionalInt v = InputValidationService.parseInt(tf.getText());
        if (v.isEmpty()) errors.put(field, "Must be a whole number.");
        return v;
    }

    private void showErrors(Map<String, String> errors) {
        errors.forEach((field, msg) -> {
            Label l = errorLabels.get(field);
            if (l != null) l.setText(msg);
        });
    }

    private static String fmt(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
