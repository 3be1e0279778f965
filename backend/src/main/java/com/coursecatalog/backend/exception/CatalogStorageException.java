package com.coursecatalog.backend.exception;

public class CatalogStorageException extends RuntimeException {
    public CatalogStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
