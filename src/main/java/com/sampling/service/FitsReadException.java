package com.sampling.service;

public class FitsReadException extends RuntimeException {
    public FitsReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
