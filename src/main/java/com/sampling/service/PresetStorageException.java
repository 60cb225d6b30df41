package com.sampling.service;

public class PresetStorageException extends RuntimeException {
    public PresetStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
