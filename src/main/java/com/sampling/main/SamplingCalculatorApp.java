package com.sampling.main;

import com.sampling.model.AppConfig;
import com.sampling.service.PresetService;
import com.sampling.ui.CalculatorTab;
import com.sampling.ui.CompareTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class SamplingCalculatorApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🔭 Sampling Calculator");

        PresetService presets = new PresetService(AppConfig.presetsNode());

        TabPane tabPane = new TabPane();
        tabPane.setTabClosingPolicy(TabPane.TabClosingPolicy.UNAVAILABLE);
        tabPane.getTabs().add(new CalculatorTab(presets).create()); // 1. Un equipo
        tabPane.getTabs().add(new CompareTab().create());           // 2. A vs B

        Scene scene = new Scene(tabPane, 1100, 900);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
