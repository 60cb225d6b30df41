package com.sampling.model;

public enum SamplingStatus { UNDERSAMPLED, OPTIMAL, OVERSAMPLED }
