package com.example.importer.processor;

public class ValueConversionException extends RuntimeException {

    public ValueConversionException(String message) {
        super(message);
    }
}
