package com.coursecatalog.backend.exception;

import java.util.List;

public class BadRequestException extends RuntimeException {

    private final List<String> fields;

    public BadRequestException(String message) {
        this(message, List.of());
    }

    public BadRequestException(String message, List<String> fields) {
        super(message);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }
}
