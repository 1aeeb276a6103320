package com.project.barcode.localization.exceptions;

/** Raised when uploads or report artifacts cannot be written. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
