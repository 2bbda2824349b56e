package com.project.coin.measurement.exceptions;

/** Raised when an image cannot be located in, or safely resolved against, the input directory. */
public class ImageSourceException extends RuntimeException {
    public ImageSourceException(String message) { super(message); }
    public ImageSourceException(String message, Throwable cause) { super(message, cause); }
}
