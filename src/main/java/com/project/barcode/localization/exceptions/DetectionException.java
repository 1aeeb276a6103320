package com.project.barcode.localization.exceptions;

/** Domain-specific exception for detection errors. */
public class DetectionException extends RuntimeException {
    public DetectionException(String message) { super(message); }
    public DetectionException(String message, Throwable cause) { super(message, cause); }
}
