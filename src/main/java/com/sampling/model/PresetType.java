package com.sampling.model;

public enum PresetType { TELESCOPE, CAMERA, FULL_RIG }
