package com.sampling.ui;

import com.sampling.model.AppConfig;
import com.sampling.model.CalculatorInput;
import com.sampling.model.CameraPreset;
import com.sampling.model.FullRigPreset;
import com.sampling.model.Preset;
import com.sampling.model.TelescopePreset;
import com.sampling.service.FitsHeaderService;
import com.sampling.service.FitsHeaderService.FitsMetadata;
import com.sampling.service.PresetService;
import com.sampling.service.SeeingEstimate;
import com.sampling.service.SeeingEstimationService;
import com.sampling.service.UrlStateService;
import java.io.File;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.input.Clipboard;
import javafx.scene.input.ClipboardContent;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CalculatorTab {

    private static final Logger log = LoggerFactory.getLogger(CalculatorTab.class);

    private final PresetService presetService;
    private final FitsHeaderService headerService = new FitsHeaderService();
    private final SeeingEstimationService seeingService = new SeeingEstimationService();

    private final SetupPanel setup = new SetupPanel("🔭 Mi Equipo");

    private ComboBox<Preset> cmbPresets;
    private ComboBox<String> cmbPresetType;
    private TextField txtPresetName, txtShareUrl;
    private Label lblInfo;
    private ProgressBar progress;

    public CalculatorTab(PresetService presetService) {
        this.presetService = presetService;
    }

    public Tab create() {
        Tab tab = new Tab("🧮 Calculadora");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(800);

        Label title = new Label("Calculadora de Muestreo");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        VBox setupBox = setup.create();
        setup.setInput(AppConfig.getLastInput());
        setup.setOnChange(this::onSetupChanged);

        lblInfo = new Label("");
        lblInfo.setWrapText(true);
        lblInfo.setStyle("-fx-font-size: 11px;");
        progress = new ProgressBar(-1);
        progress.setVisible(false);
        progress.setMaxWidth(Double.MAX_VALUE);

        content.getChildren().addAll(title, createImportBox(root), setupBox, createPresetBox(), createShareBox(), progress, lblInfo);

        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        scroll.setStyle("-fx-background-color:transparent;");

        root.setCenter(scroll);
        tab.setContent(root);
        onSetupChanged();
        return tab;
    }

    private void onSetupChanged() {
        Optional<CalculatorInput> in = setup.currentInput();
        if (in.isEmpty()) return;
        AppConfig.setLastInput(in.get());
        if (txtShareUrl != null) txtShareUrl.setText(UrlStateService.buildShareableUrl(AppConfig.getShareBaseUrl(), in.get(), null, false));
    }

    // --- 1. IMPORTAR DESDE FITS ---

    private VBox createImportBox(Pane root) {
        VBox box = new VBox(10);
        box.setAlignment(Pos.CENTER);
        box.setStyle("-fx-border-color: #2196F3; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #E3F2FD;");

        Label lbl = new Label("📂 Rellenar desde un FITS");
        lbl.setFont(Font.font("System", FontWeight.BOLD, 13));

        Button btnHeader = new Button("📄 Leer Header");
        btnHeader.setOnAction(e -> importHeader(root));
        Button btnSeeing = new Button("⭐ Medir Seeing");
        btnSeeing.setOnAction(e -> measureSeeing(root));

        HBox buttons = new HBox(10, btnHeader, btnSeeing);
        buttons.setAlignment(Pos.CENTER);
        box.getChildren().addAll(lbl, buttons);
        return box;
    }

    private File chooseFits(Pane root) {
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("FITS", "*.fits", "*.fit", "*.fts"));
        File dir = new File(AppConfig.getLastFitsDir());
        if (dir.isDirectory()) fc.setInitialDirectory(dir);
        File f = fc.showOpenDialog(root.getScene().getWindow());
        if (f != null && f.getParentFile() != null) AppConfig.setLastFitsDir(f.getParentFile().getAbsolutePath());
        return f;
    }

    private void importHeader(Pane root) {
        File f = chooseFits(root);
        if (f == null) return;
        Optional<CalculatorInput> current = setup.currentInput();
        CalculatorInput base = current.orElse(CalculatorInput.defaults());

        runInBackground(() -> {
            FitsMetadata meta = headerService.readHeader(f);
            CalculatorInput in = headerService.applyTo(meta, base);
            Platform.runLater(() -> {
                setup.setInput(in);
                lblInfo.setText("✅ Equipo leído de " + f.getName());
            });
        });
    }

    private void measureSeeing(Pane root) {
        File f = chooseFits(root);
        if (f == null) return;
        Optional<CalculatorInput> current = setup.currentInput();
        if (current.isEmpty() || setup.lastResult().isEmpty()) {
            lblInfo.setText("❌ Completa el equipo antes de medir: hace falta la escala de píxel.");
            return;
        }
        CalculatorInput base = current.get();
        double scale = setup.lastResult().get().pixelScale;

        runInBackground(() -> {
            int frameBinning = headerService.readHeader(f).binning;
            double frameScale = SeeingEstimationService.frameScale(scale, base.binning, frameBinning);
            if (frameScale != scale) {
                log.info("{} tomado con binning {} (formulario {}): escala {}\"/px", f.getName(), frameBinning, base.binning, frameScale);
            }
            Optional<SeeingEstimate> est = seeingService.estimate(f, frameScale);
            Platform.runLater(() -> {
                if (est.isEmpty()) {
                    lblInfo.setText("❌ No se detectaron estrellas válidas en " + f.getName());
                    return;
                }
                SeeingEstimate s = est.get();
                setup.setInput(base.withSeeing(Math.round(s.seeingArcsec * 10) / 10.0));
                String binNote = frameScale != scale ? String.format(Locale.ROOT, ", frame en bin %d", frameBinning) : "";
                lblInfo.setText(String.format(Locale.ROOT, "✅ Seeing %.2f\" (FWHM %.2f px, %d estrellas%s)",
                        s.seeingArcsec, s.fwhmPx, s.starCount, binNote));
            });
        });
    }

    private void runInBackground(Runnable work) {
        progress.setVisible(true);
        lblInfo.setText("Analizando...");
        new Thread(() -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.warn("Fallo al procesar el FITS", e);
                Platform.runLater(() -> lblInfo.setText("❌ Error: " + e.getMessage()));
            } finally {
                Platform.runLater(() -> progress.setVisible(false));
            }
        }).start();
    }

    // --- 2. PRESETS ---

    private VBox createPresetBox() {
        VBox box = new VBox(10);
        box.setStyle("-fx-border-color: #FF9800; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #FFF3E0;");
        Label lbl = new Label("💾 Presets");
        lbl.setFont(Font.font("System", FontWeight.BOLD, 13));

        cmbPresetType = new ComboBox<>();
        cmbPresetType.getItems().addAll("Telescopio", "Cámara", "Equipo completo");
        cmbPresetType.getSelectionModel().select(2);
        cmbPresetType.setOnAction(e -> refreshPresets());

        cmbPresets = new ComboBox<>();
        cmbPresets.setPrefWidth(250);
        Button btnApply = new Button("Aplicar");
        btnApply.setOnAction(e -> applyPreset());
        Button btnDelete = new Button("🗑️");
        btnDelete.setOnAction(e -> deletePreset());

        txtPresetName = new TextField();
        txtPresetName.setPromptText("Nombre del preset");
        Button btnSave = new Button("💾 Guardar");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold;");
        btnSave.setOnAction(e -> savePreset());

        GridPane grid = new GridPane();
        grid.setHgap(10); grid.setVgap(10);
        grid.add(new Label("Tipo:"), 0, 0); grid.add(cmbPresetType, 1, 0);
        grid.add(new Label("Guardados:"), 0, 1); grid.add(cmbPresets, 1, 1); grid.add(new HBox(5, btnApply, btnDelete), 2, 1);
        grid.add(new Label("Nuevo:"), 0, 2); grid.add(txtPresetName, 1, 2); grid.add(btnSave, 2, 2);

        box.getChildren().addAll(lbl, grid);
        refreshPresets();
        return box;
    }

    private List<? extends Preset> presetsOfSelectedType() {
        switch (cmbPresetType.getSelectionModel().getSelectedIndex()) {
            case 0: return presetService.getTelescopePresets();
            case 1: return presetService.getCameraPresets();
            default: return presetService.getFullRigPresets();
        }
    }

    private void refreshPresets() {
        cmbPresets.getItems().setAll(presetsOfSelectedType());
        if (!cmbPresets.getItems().isEmpty()) cmbPresets.getSelectionModel().select(0);
    }

    private void applyPreset() {
        Preset p = cmbPresets.getValue();
        if (p == null) return;
        CalculatorInput base = setup.currentInput().orElse(CalculatorInput.defaults());
        setup.setInput(p.applyTo(base));
        lblInfo.setText("✅ Preset aplicado: " + p.getName());
    }

    private void savePreset() {
        String name = txtPresetName.getText().trim();
        Optional<CalculatorInput> in = setup.currentInput();
        if (name.isEmpty() || in.isEmpty()) {
            lblInfo.setText("❌ Hace falta un nombre y un equipo válido.");
            return;
        }
        try {
            switch (cmbPresetType.getSelectionModel().getSelectedIndex()) {
                case 0: presetService.saveTelescopePreset(TelescopePreset.fromInput(in.get(), name)); break;
                case 1: presetService.saveCameraPreset(CameraPreset.fromInput(in.get(), name)); break;
                default: presetService.saveFullRigPreset(FullRigPreset.fromInput(in.get(), name)); break;
            }
            txtPresetName.clear();
            refreshPresets();
            lblInfo.setText("✅ Preset guardado: " + name);
        } catch (RuntimeException e) {
            log.warn("No se pudo guardar el preset '{}'", name, e);
            lblInfo.setText("❌ " + e.getMessage());
        }
    }

    private void deletePreset() {
        Preset p = cmbPresets.getValue();
        if (p == null) return;
        try {
            switch (p.getType()) {
                case TELESCOPE: presetService.deleteTelescopePreset(p.getId()); break;
                case CAMERA: presetService.deleteCameraPreset(p.getId()); break;
                default: presetService.deleteFullRigPreset(p.getId()); break;
            }
            refreshPresets();
        } catch (RuntimeException e) {
            log.warn("No se pudo borrar el preset '{}'", p.getName(), e);
            lblInfo.setText("❌ " + e.getMessage());
        }
    }

    // --- 3. COMPARTIR ---

    private VBox createShareBox() {
        VBox box = new VBox(10);
        box.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");
        Label lbl = new Label("🔗 Enlace");
        lbl.setFont(Font.font("System", FontWeight.BOLD, 13));

        txtShareUrl = new TextField();
        HBox.setHgrow(txtShareUrl, Priority.ALWAYS);
        Button btnCopy = new Button("📋 Copiar");
        btnCopy.setOnAction(e -> {
            ClipboardContent cc = new ClipboardContent();
            cc.putString(txtShareUrl.getText());
            Clipboard.getSystemClipboard().setContent(cc);
            lblInfo.setText("✅ Enlace copiado");
        });
        Button btnLoad = new Button("⬇️ Cargar");
        btnLoad.setOnAction(e -> loadFromUrl());

        box.getChildren().addAll(lbl, new HBox(10, txtShareUrl, btnCopy, btnLoad));
        return box;
    }

    private void loadFromUrl() {
        String query = UrlStateService.queryOf(txtShareUrl.getText());
        setup.setInput(UrlStateService.decodeState(query).inputA);
        lblInfo.setText("✅ Equipo cargado desde el enlace");
    }
}
