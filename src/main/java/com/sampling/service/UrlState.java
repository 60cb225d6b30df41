package com.sampling.service;

import com.sampling.model.CalculatorInput;

/** Estado decodificado de un enlace: setup A, setup B y modo comparación. */
public class UrlState {
    public final CalculatorInput inputA;
    public final CalculatorInput inputB;
    public final boolean compareMode;

    public UrlState(CalculatorInput inputA, CalculatorInput inputB, boolean compareMode) {
        this.inputA = inputA;
        this.inputB = inputB;
        this.compareMode = compareMode;
    }
}
