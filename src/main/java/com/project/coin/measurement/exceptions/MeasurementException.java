package com.project.coin.measurement.exceptions;

/** Domain-specific exception for image processing errors. */
public class MeasurementException extends RuntimeException {
    public MeasurementException(String message) { super(message); }
    public MeasurementException(String message, Throwable cause) { super(message, cause); }
}
