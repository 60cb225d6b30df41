package com.sampling.ui;

import com.sampling.model.AppConfig;
import com.sampling.model.CalculatorInput;
import com.sampling.model.CalculatorResult;
import com.sampling.service.UrlState;
import com.sampling.service.UrlStateService;
import java.util.Locale;
import java.util.Optional;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

/** Dos equipos lado a lado (A / B). */
public class CompareTab {

    private final SetupPanel setupA = new SetupPanel("🅰️ Equipo A");
    private final SetupPanel setupB = new SetupPanel("🅱️ Equipo B");

    private Label lblSummary;
    private TextField txtShareUrl;

    public Tab create() {
        Tab tab = new Tab("⚖️ Comparar");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        Label title = new Label("Comparar Equipos");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        HBox panels = new HBox(20, setupA.create(), setupB.create());
        panels.setAlignment(Pos.TOP_CENTER);
        setupA.setInput(AppConfig.getLastInput());

        lblSummary = new Label("");
        lblSummary.setWrapText(true);
        lblSummary.setStyle("-fx-font-weight: bold; -fx-text-fill: #2E7D32;");

        txtShareUrl = new TextField();
        HBox.setHgrow(txtShareUrl, Priority.ALWAYS);
        Button btnLoad = new Button("⬇️ Cargar");
        btnLoad.setOnAction(e -> loadFromUrl());
        HBox shareBox = new HBox(10, new Label("🔗"), txtShareUrl, btnLoad);
        shareBox.setAlignment(Pos.CENTER_LEFT);

        VBox content = new VBox(20, title, panels, lblSummary, shareBox);
        content.setAlignment(Pos.TOP_CENTER);

        setupA.setOnChange(this::refresh);
        setupB.setOnChange(this::refresh);

        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        root.setCenter(scroll);
        tab.setContent(root);
        refresh();
        return tab;
    }

    private void refresh() {
        if (lblSummary == null) return;
        Optional<CalculatorInput> a = setupA.currentInput();
        Optional<CalculatorInput> b = setupB.currentInput();
        if (a.isPresent() && b.isPresent()) {
            txtShareUrl.setText(UrlStateService.buildShareableUrl(AppConfig.getShareBaseUrl(), a.get(), b.get(), true));
        }

        Optional<CalculatorResult> ra = setupA.lastResult();
        Optional<CalculatorResult> rb = setupB.lastResult();
        if (ra.isEmpty() || rb.isEmpty()) {
            lblSummary.setText("");
            return;
        }
        double ratio = rb.get().pixelScale / ra.get().pixelScale;
        double fovRatio = (rb.get().fovWidthDeg * rb.get().fovHeightDeg) / (ra.get().fovWidthDeg * ra.get().fovHeightDeg);
        lblSummary.setText(String.format(Locale.ROOT,
                "B tiene una escala %.2f× la de A y cubre %.2f× su área de cielo.", ratio, fovRatio));
    }

    private void loadFromUrl() {
        UrlState state = UrlStateService.decodeState(UrlStateService.queryOf(txtShareUrl.getText()));
        setupA.setInput(state.inputA);
        setupB.setInput(state.inputB);
    }
}
